package com.chronicle.names;

import com.chronicle.event.MessageAndSwipe;
import com.chronicle.event.NarrativeEvent;
import com.chronicle.projection.CharacterState;
import com.chronicle.projection.NarrativeState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Name resolution for a whole turn: builds the alias lookup from the state
 * before the turn plus the turn's own events, canonicalizes every reference,
 * asks the disambiguator about leftovers and records accepted answers as
 * {@code akas_add} events.
 */
public class TurnNameResolver {

    private static final Logger log = LoggerFactory.getLogger(TurnNameResolver.class);

    private final NameDisambiguator disambiguator;

    public TurnNameResolver(NameDisambiguator disambiguator) {
        this.disambiguator = disambiguator;
    }

    public List<NarrativeEvent> resolve(NarrativeState stateBeforeTurn,
                                        List<NarrativeEvent> turnEvents,
                                        MessageAndSwipe currentMessage,
                                        long timestamp) {
        if (turnEvents.isEmpty()) {
            return turnEvents;
        }
        AkaLookup lookup = AkaLookup.fromCharacters(stateBeforeTurn.characters().values());
        lookup.extendWithTurnEvents(turnEvents);

        NameResolutionResult result = EventNameResolver.resolveNames(turnEvents, lookup);
        List<NarrativeEvent> events = new ArrayList<>(result.events());

        if (!result.unresolvedNames().isEmpty()) {
            log.info("Unresolved character names at message={}: {}",
                currentMessage.messageId(), result.unresolvedNames());
            List<UnresolvedNameMapping> mappings =
                disambiguator.resolve(result.unresolvedNames(), lookup.canonicalNames());
            events = EventNameResolver.applyUserMappings(events, mappings);

            for (UnresolvedNameMapping mapping : mappings) {
                if (!mapping.isMapped()) {
                    continue;
                }
                Set<String> akas = new LinkedHashSet<>(stateBeforeTurn.character(mapping.resolvedTo())
                    .map(CharacterState::akas)
                    .orElse(List.of()));
                akas.add(mapping.unresolvedName());
                events.add(new NarrativeEvent.AkasAdded(
                    NarrativeEvent.newId(), currentMessage, timestamp,
                    mapping.resolvedTo(), new ArrayList<>(akas)));
            }
        }

        List<NarrativeEvent> kept = new ArrayList<>(events.size());
        for (NarrativeEvent event : events) {
            if (EventNameResolver.isSelfRelationship(event)) {
                log.warn("Dropping {} {}: both sides resolved to the same character",
                    event.type().wireName(), event.id());
                continue;
            }
            kept.add(event);
        }
        return kept;
    }
}
