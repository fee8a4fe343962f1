package com.chronicle.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum EventKind {
    TIME("time"),
    LOCATION("location"),
    CHARACTER("character"),
    RELATIONSHIP("relationship"),
    SCENE("scene"),
    CHAPTER("chapter");

    private final String value;

    EventKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static EventKind fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown event kind: " + raw));
    }
}
