package com.chronicle.projection;

import com.chronicle.event.CharacterPair;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable story state at a point of the chat. Produced by
 * {@link ProjectionReducer}; equal inputs always yield an equal state.
 */
public record NarrativeState(LocalDateTime time,
                             long elapsedMinutes,
                             LocationState location,
                             Map<String, CharacterState> characters,
                             List<String> charactersPresent,
                             Map<String, RelationshipState> relationships,
                             SceneState scene,
                             int currentChapter,
                             List<ChapterState> chapters) {

    public static final NarrativeState EMPTY = new NarrativeState(
        null, 0L, LocationState.UNKNOWN, Map.of(), List.of(), Map.of(), SceneState.EMPTY, 0, List.of());

    public NarrativeState {
        location = location == null ? LocationState.UNKNOWN : location;
        characters = characters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(characters));
        charactersPresent = charactersPresent == null ? List.of() : List.copyOf(charactersPresent);
        relationships = relationships == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(relationships));
        scene = scene == null ? SceneState.EMPTY : scene;
        chapters = chapters == null ? List.of() : List.copyOf(chapters);
    }

    public Optional<CharacterState> character(String name) {
        return Optional.ofNullable(characters.get(name));
    }

    public Optional<RelationshipState> relationship(CharacterPair pair) {
        return Optional.ofNullable(relationships.get(pair.key()));
    }
}
