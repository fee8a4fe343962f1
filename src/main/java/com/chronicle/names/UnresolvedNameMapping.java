package com.chronicle.names;

/**
 * Answer for a name that could not be resolved; {@code resolvedTo} is null
 * when the user declined to map it.
 */
public record UnresolvedNameMapping(String unresolvedName, String resolvedTo) {

    public boolean isMapped() {
        return resolvedTo != null && !resolvedTo.isBlank();
    }
}
