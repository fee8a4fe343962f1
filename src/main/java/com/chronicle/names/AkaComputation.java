package com.chronicle.names;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Alternate names for a character from extracted nicknames and from a full
 * name that differs from the tracked one.
 */
public final class AkaComputation {

    private AkaComputation() {
    }

    /**
     * True when {@code part} is a name word of more than one of {@code names}.
     */
    public static boolean isAmbiguousNamePart(String part, List<String> names) {
        String lower = part.toLowerCase(Locale.ROOT);
        int count = 0;
        for (String name : names) {
            if (NameMatching.nameParts(name).contains(lower)) {
                count++;
                if (count > 1) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * @param canonicalName tracked name of the character
     * @param fullName longer name if known, may be null
     * @param nicknames names the model reported for the character
     * @param allCharacterNames every canonical name, used to drop shared name parts
     * @return alternate names, deduplicated case-insensitively, never the canonical name
     */
    public static List<String> computeAkas(String canonicalName,
                                           String fullName,
                                           List<String> nicknames,
                                           List<String> allCharacterNames) {
        Set<String> akas = new LinkedHashSet<>();
        String canonicalLower = canonicalName.toLowerCase(Locale.ROOT);

        for (String nickname : nicknames) {
            String trimmed = nickname == null ? "" : nickname.trim();
            if (!trimmed.isEmpty() && !trimmed.toLowerCase(Locale.ROOT).equals(canonicalLower)) {
                akas.add(trimmed);
            }
        }

        if (fullName != null && !fullName.isBlank()) {
            String full = fullName.trim();
            if (!full.toLowerCase(Locale.ROOT).equals(canonicalLower)) {
                akas.add(full);
            }

            String titleStripped = NameMatching.stripTitles(full);
            List<String> words = Arrays.asList(full.split("\\s+"));
            List<String> parts = NameMatching.nameParts(full);
            if (!titleStripped.equals(full.toLowerCase(Locale.ROOT))
                && !titleStripped.equals(canonicalLower)
                && !titleStripped.isEmpty()) {
                String strippedName = String.join(" ", words.subList(words.size() - parts.size(), words.size()));
                if (!strippedName.toLowerCase(Locale.ROOT).equals(canonicalLower)) {
                    akas.add(strippedName);
                }
            }

            List<String> canonicalParts = NameMatching.nameParts(canonicalName);
            List<String> disambiguation = new ArrayList<>(allCharacterNames);
            if (!disambiguation.contains(full)) {
                disambiguation.add(full);
            }
            if (parts.size() > 1) {
                for (String part : parts) {
                    if (part.equals(canonicalLower)
                        || canonicalParts.contains(part)
                        || NameMatching.TITLES.contains(part)
                        || isAmbiguousNamePart(part, disambiguation)) {
                        continue;
                    }
                    words.stream()
                        .filter(w -> w.toLowerCase(Locale.ROOT).equals(part))
                        .findFirst()
                        .ifPresent(akas::add);
                }
            }
        }

        Set<String> seen = new HashSet<>();
        List<String> result = new ArrayList<>();
        for (String aka : akas) {
            String lower = aka.toLowerCase(Locale.ROOT);
            if (!lower.equals(canonicalLower) && seen.add(lower)) {
                result.add(aka);
            }
        }
        return result;
    }
}
