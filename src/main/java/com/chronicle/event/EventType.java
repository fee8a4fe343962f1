package com.chronicle.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Discriminant of the event union: one constant per (kind, subkind) pair.
 * Every site that branches on event types switches over this enum.
 */
public enum EventType {
    TIME_DELTA(EventKind.TIME, "delta"),
    LOCATION_MOVED(EventKind.LOCATION, "moved"),
    LOCATION_PROP_ADDED(EventKind.LOCATION, "prop_added"),
    LOCATION_PROP_REMOVED(EventKind.LOCATION, "prop_removed"),
    CHARACTER_APPEARED(EventKind.CHARACTER, "appeared"),
    CHARACTER_DEPARTED(EventKind.CHARACTER, "departed"),
    CHARACTER_POSITION_CHANGED(EventKind.CHARACTER, "position_changed"),
    CHARACTER_ACTIVITY_CHANGED(EventKind.CHARACTER, "activity_changed"),
    CHARACTER_MOOD_ADDED(EventKind.CHARACTER, "mood_added"),
    CHARACTER_MOOD_REMOVED(EventKind.CHARACTER, "mood_removed"),
    CHARACTER_OUTFIT_CHANGED(EventKind.CHARACTER, "outfit_changed"),
    CHARACTER_AKAS_ADD(EventKind.CHARACTER, "akas_add"),
    RELATIONSHIP_STATUS_CHANGED(EventKind.RELATIONSHIP, "status_changed"),
    RELATIONSHIP_SUBJECT(EventKind.RELATIONSHIP, "subject"),
    RELATIONSHIP_FEELING_ADDED(EventKind.RELATIONSHIP, "feeling_added"),
    RELATIONSHIP_FEELING_REMOVED(EventKind.RELATIONSHIP, "feeling_removed"),
    SCENE_TENSION_CHANGED(EventKind.SCENE, "tension_changed"),
    CHAPTER_ENDED(EventKind.CHAPTER, "ended"),
    CHAPTER_DESCRIBED(EventKind.CHAPTER, "described");

    private final EventKind kind;
    private final String subkind;

    EventType(EventKind kind, String subkind) {
        this.kind = kind;
        this.subkind = subkind;
    }

    public EventKind kind() {
        return kind;
    }

    public String subkind() {
        return subkind;
    }

    @JsonValue
    public String wireName() {
        return kind.getValue() + "." + subkind;
    }

    @JsonCreator
    public static EventType fromWireName(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.wireName().equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown event type: " + raw));
    }

    public static EventType of(EventKind kind, String subkind) {
        return Arrays.stream(values())
            .filter(v -> v.kind == kind && v.subkind.equals(subkind))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException(
                "Unknown event type: " + kind.getValue() + "." + subkind));
    }
}
