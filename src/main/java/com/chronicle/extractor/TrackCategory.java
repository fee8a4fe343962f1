package com.chronicle.extractor;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * What a user can switch tracking on or off for; every extractor belongs to one.
 */
public enum TrackCategory {
    TIME,
    LOCATION,
    PROPS,
    CHARACTERS,
    RELATIONSHIPS,
    SCENE,
    NARRATIVE,
    CHAPTERS;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TrackCategory fromValue(String raw) {
        return Arrays.stream(values())
            .filter(v -> v.name().equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown track category: " + raw));
    }
}
