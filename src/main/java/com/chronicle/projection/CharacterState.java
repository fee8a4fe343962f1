package com.chronicle.projection;

import com.chronicle.event.OutfitSlot;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record CharacterState(String name,
                             String position,
                             String activity,
                             List<String> mood,
                             String physicalState,
                             Map<OutfitSlot, String> outfit,
                             List<String> akas) {

    public CharacterState {
        mood = mood == null ? List.of() : List.copyOf(mood);
        outfit = outfit == null || outfit.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(outfit));
        akas = akas == null ? List.of() : List.copyOf(akas);
    }

    public static CharacterState named(String name) {
        return new CharacterState(name, null, null, List.of(), null, Map.of(), List.of());
    }
}
