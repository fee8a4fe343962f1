package com.chronicle.names;

import java.util.Map;
import java.util.Optional;

/**
 * Maps a surface name to a canonical name: direct alias lookup, then
 * title-stripped lookup, then fuzzy match against canonical names, then
 * fuzzy match against aliases.
 */
public final class CharacterNameResolver {

    private CharacterNameResolver() {
    }

    public static Optional<String> resolve(String name, AkaLookup lookup) {
        Optional<String> direct = lookup.get(name);
        if (direct.isPresent()) {
            return direct;
        }
        Optional<String> normalized = lookup.get(NameMatching.normalizeName(name));
        if (normalized.isPresent()) {
            return normalized;
        }
        for (String canonical : lookup.canonicalNames()) {
            if (NameMatching.namesMatch(canonical, name)) {
                return Optional.of(canonical);
            }
        }
        for (Map.Entry<String, String> alias : lookup.aliases().entrySet()) {
            if (NameMatching.namesMatch(alias.getKey(), name)) {
                return Optional.of(alias.getValue());
            }
        }
        return Optional.empty();
    }
}
