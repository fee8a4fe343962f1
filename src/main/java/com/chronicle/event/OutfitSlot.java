package com.chronicle.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum OutfitSlot {
    HEAD, NECK, JACKET, BACK, TORSO, LEGS, FOOTWEAR, SOCKS, UNDERWEAR;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static OutfitSlot fromValue(String raw) {
        return parse(raw).orElseThrow(() -> new IllegalArgumentException("Unknown outfit slot: " + raw));
    }

    /** Lenient lookup for model output; unknown slot names are empty. */
    public static Optional<OutfitSlot> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String trimmed = raw.trim();
        return Arrays.stream(values())
            .filter(v -> v.name().equalsIgnoreCase(trimmed))
            .findFirst();
    }
}
