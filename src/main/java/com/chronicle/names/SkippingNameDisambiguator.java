package com.chronicle.names;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Declines every name, leaving surface forms in place.
 */
public class SkippingNameDisambiguator implements NameDisambiguator {

    @Override
    public List<UnresolvedNameMapping> resolve(List<String> unresolvedNames, List<String> canonicalNames) {
        return unresolvedNames.stream()
            .map(name -> new UnresolvedNameMapping(name, null))
            .collect(Collectors.toList());
    }
}
