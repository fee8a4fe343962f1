package com.chronicle.names;

import com.chronicle.event.CharacterPair;
import com.chronicle.event.NarrativeEvent;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.HashMap;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Rewrites character references in events to canonical names. Events are
 * immutable, so rewritten events are new copies; {@code akas_add} events are
 * left alone because they define aliases rather than use them.
 */
public final class EventNameResolver {

    private EventNameResolver() {
    }

    public static NameResolutionResult resolveNames(List<? extends NarrativeEvent> events, AkaLookup lookup) {
        Set<String> unresolved = new LinkedHashSet<>();
        Function<String, String> resolver = name -> {
            Optional<String> canonical = CharacterNameResolver.resolve(name, lookup);
            if (canonical.isEmpty()) {
                unresolved.add(name);
            }
            return canonical.orElse(name);
        };

        List<NarrativeEvent> rewritten = new ArrayList<>(events.size());
        for (NarrativeEvent event : events) {
            rewritten.add(rewrite(event, resolver));
        }
        return new NameResolutionResult(rewritten, new ArrayList<>(unresolved));
    }

    public static List<NarrativeEvent> applyUserMappings(List<? extends NarrativeEvent> events,
                                                         List<UnresolvedNameMapping> mappings) {
        Map<String, String> byName = new HashMap<>();
        for (UnresolvedNameMapping mapping : mappings) {
            if (mapping.isMapped()) {
                byName.put(mapping.unresolvedName().toLowerCase(Locale.ROOT), mapping.resolvedTo());
            }
        }
        if (byName.isEmpty()) {
            return new ArrayList<>(events);
        }

        Function<String, String> resolver = name -> byName.getOrDefault(name.toLowerCase(Locale.ROOT), name);
        List<NarrativeEvent> rewritten = new ArrayList<>(events.size());
        for (NarrativeEvent event : events) {
            rewritten.add(rewrite(event, resolver));
        }
        return rewritten;
    }

    private static NarrativeEvent rewrite(NarrativeEvent event, Function<String, String> resolver) {
        if (event instanceof NarrativeEvent.AkasAdded) {
            return event;
        }
        if (event instanceof NarrativeEvent.CharacterEvent character) {
            String resolved = resolver.apply(character.character());
            return resolved.equals(character.character()) ? event : character.withCharacter(resolved);
        }
        if (event instanceof NarrativeEvent.DirectionalRelationshipEvent directional) {
            String from = resolver.apply(directional.fromCharacter());
            String toward = resolver.apply(directional.towardCharacter());
            if (from.equals(directional.fromCharacter()) && toward.equals(directional.towardCharacter())) {
                return event;
            }
            return directional.withCharacters(from, toward);
        }
        if (event instanceof NarrativeEvent.PairRelationshipEvent pairEvent) {
            String first = resolver.apply(pairEvent.pair().first());
            String second = resolver.apply(pairEvent.pair().second());
            CharacterPair resolved = CharacterPair.of(first, second);
            return resolved.equals(pairEvent.pair()) ? event : pairEvent.withPair(resolved);
        }
        return event;
    }

    /**
     * True when a relationship event points at one character from both sides,
     * which happens when two aliases of the same person were extracted as a pair.
     */
    public static boolean isSelfRelationship(NarrativeEvent event) {
        if (event instanceof NarrativeEvent.DirectionalRelationshipEvent directional) {
            return directional.fromCharacter().equals(directional.towardCharacter());
        }
        if (event instanceof NarrativeEvent.PairRelationshipEvent pairEvent) {
            return pairEvent.pair().first().equals(pairEvent.pair().second());
        }
        return false;
    }
}
