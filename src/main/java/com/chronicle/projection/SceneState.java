package com.chronicle.projection;

public record SceneState(String topic, String tone, Tension tension) {

    public static final SceneState EMPTY = new SceneState(null, null, null);

    public record Tension(String level, String type, String direction) {
    }

    public SceneState withTension(Tension tension) {
        return new SceneState(topic, tone, tension);
    }
}
