package com.chronicle.names;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Title stripping and loose comparison of character names.
 */
public final class NameMatching {

    /** Leading honorifics removed before comparing, lowercase. */
    public static final List<String> TITLES = List.of(
        "mr.", "mr", "mrs.", "mrs", "ms.", "ms", "miss", "mister", "madam", "madame",
        "dr.", "dr", "doctor", "prof.", "prof", "professor",
        "sir", "dame", "lady", "lord", "captain", "capt.", "capt",
        "king", "queen", "prince", "princess");

    private NameMatching() {
    }

    /**
     * Lowercases and removes leading titles repeatedly, so
     * {@code "Prof. Dr. John Smith"} becomes {@code "john smith"}.
     */
    public static String stripTitles(String name) {
        String normalized = name == null ? "" : name.toLowerCase(Locale.ROOT).trim();
        boolean stripped = true;
        while (stripped) {
            stripped = false;
            for (String title : TITLES) {
                if (normalized.startsWith(title + " ")) {
                    normalized = normalized.substring(title.length() + 1).trim();
                    stripped = true;
                    break;
                }
            }
        }
        return normalized;
    }

    public static String normalizeName(String name) {
        return stripTitles(name).replaceAll("\\s+", " ");
    }

    public static List<String> nameParts(String name) {
        String stripped = stripTitles(name);
        if (stripped.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(stripped.split("\\s+"));
    }

    /**
     * True when both names are equal after normalization, or when the words
     * of one are a leading run of the words of the other
     * ({@code "Luna"} matches {@code "Luna Moonwhisper"}).
     */
    public static boolean namesMatch(String a, String b) {
        List<String> left = nameParts(a);
        List<String> right = nameParts(b);
        if (left.isEmpty() || right.isEmpty()) {
            return false;
        }
        List<String> shorter = left.size() <= right.size() ? left : right;
        List<String> longer = left.size() <= right.size() ? right : left;
        return longer.subList(0, shorter.size()).equals(shorter);
    }
}
