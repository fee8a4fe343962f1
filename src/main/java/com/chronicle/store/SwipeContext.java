package com.chronicle.store;

import com.chronicle.event.MessageAndSwipe;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Which swipe is active for each message. Messages without an entry use swipe 0.
 */
public record SwipeContext(Map<Integer, Integer> activeSwipes) {

    private static final SwipeContext DEFAULTS = new SwipeContext(Map.of());

    public SwipeContext {
        activeSwipes = activeSwipes == null
            ? Map.of()
            : Collections.unmodifiableMap(new TreeMap<>(activeSwipes));
    }

    public static SwipeContext defaults() {
        return DEFAULTS;
    }

    public int activeSwipe(int messageId) {
        return activeSwipes.getOrDefault(messageId, 0);
    }

    public boolean isActive(MessageAndSwipe source) {
        return activeSwipe(source.messageId()) == source.swipeId();
    }

    public SwipeContext with(int messageId, int swipeId) {
        Map<Integer, Integer> copy = new TreeMap<>(activeSwipes);
        copy.put(messageId, swipeId);
        return new SwipeContext(copy);
    }

    /**
     * Parses {@code "3:1,4:0"} into message 3 on swipe 1 and message 4 on swipe 0.
     */
    public static SwipeContext parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULTS;
        }
        Map<Integer, Integer> swipes = new TreeMap<>();
        for (String part : raw.split(",")) {
            String trimmed = part.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            String[] pieces = trimmed.split(":");
            if (pieces.length != 2) {
                throw new IllegalArgumentException("swipes must look like messageId:swipeId, got: " + trimmed);
            }
            try {
                swipes.put(Integer.parseInt(pieces[0].trim()), Integer.parseInt(pieces[1].trim()));
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("swipes must contain integers, got: " + trimmed);
            }
        }
        return new SwipeContext(swipes);
    }
}
