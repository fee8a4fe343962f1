package com.chronicle.event;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Unordered pair of characters. Members are always held in lexicographic order,
 * so {@code of("B", "A")} and {@code of("A", "B")} are equal.
 */
public record CharacterPair(String first, String second) {

    public CharacterPair {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        if (first.compareTo(second) > 0) {
            String swap = first;
            first = second;
            second = swap;
        }
    }

    public static CharacterPair of(String a, String b) {
        return new CharacterPair(a, b);
    }

    public boolean contains(String name) {
        return first.equals(name) || second.equals(name);
    }

    public String key() {
        return first + "|" + second;
    }

    /** Display form used in qualified error names, e.g. {@code Alice/Bob}. */
    public String label() {
        return first + "/" + second;
    }

    /**
     * All unique pairs of distinct names, sorted by key so the result does not
     * depend on the order of {@code characters}.
     */
    public static List<CharacterPair> uniquePairs(List<String> characters) {
        Set<String> seen = new LinkedHashSet<>();
        List<CharacterPair> pairs = new ArrayList<>();
        for (int i = 0; i < characters.size(); i++) {
            for (int j = i + 1; j < characters.size(); j++) {
                if (characters.get(i).equals(characters.get(j))) {
                    continue;
                }
                CharacterPair pair = of(characters.get(i), characters.get(j));
                if (seen.add(pair.key())) {
                    pairs.add(pair);
                }
            }
        }
        pairs.sort(Comparator.comparing(CharacterPair::first).thenComparing(CharacterPair::second));
        return pairs;
    }
}
