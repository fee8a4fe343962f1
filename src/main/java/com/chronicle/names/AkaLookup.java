package com.chronicle.names;

import com.chronicle.event.NarrativeEvent;
import com.chronicle.projection.CharacterState;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Lowercased alias to canonical name, plus the ordered list of canonical names.
 */
public class AkaLookup {

    private final Map<String, String> aliases = new LinkedHashMap<>();
    private final List<String> canonicalNames = new ArrayList<>();

    public static AkaLookup fromCharacters(Collection<CharacterState> characters) {
        AkaLookup lookup = new AkaLookup();
        for (CharacterState character : characters) {
            lookup.addCanonical(character.name());
            character.akas().forEach(aka -> lookup.addAlias(aka, character.name()));
        }
        return lookup;
    }

    /**
     * Adds aliases from this turn's {@code akas_add} events and names of
     * characters who appeared this turn.
     */
    public void extendWithTurnEvents(List<? extends NarrativeEvent> turnEvents) {
        for (NarrativeEvent event : turnEvents) {
            if (event instanceof NarrativeEvent.AkasAdded akas) {
                akas.akas().forEach(aka -> addAlias(aka, akas.character()));
                addAlias(akas.character(), akas.character());
            }
        }
        for (NarrativeEvent event : turnEvents) {
            if (event instanceof NarrativeEvent.CharacterAppeared appeared) {
                addCanonical(appeared.character());
            }
        }
    }

    public void addCanonical(String name) {
        if (!canonicalNames.contains(name)) {
            canonicalNames.add(name);
        }
        aliases.put(name.toLowerCase(Locale.ROOT), name);
    }

    public void addAlias(String alias, String canonical) {
        aliases.put(alias.toLowerCase(Locale.ROOT), canonical);
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(aliases.get(key.toLowerCase(Locale.ROOT)));
    }

    public Map<String, String> aliases() {
        return Collections.unmodifiableMap(aliases);
    }

    public List<String> canonicalNames() {
        return Collections.unmodifiableList(canonicalNames);
    }
}
