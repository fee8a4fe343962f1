package com.chronicle.extractor.events;

import com.chronicle.event.EventType;
import com.chronicle.event.NarrativeEvent;
import com.chronicle.event.OutfitSlot;
import com.chronicle.extractor.AbstractLlmExtractor;
import com.chronicle.extractor.EventKindFilter;
import com.chronicle.extractor.ExtractionPhase;
import com.chronicle.extractor.ExtractionRequest;
import com.chronicle.extractor.GlobalExtractor;
import com.chronicle.extractor.MessageWindowStrategy;
import com.chronicle.extractor.RunStrategy;
import com.chronicle.extractor.TrackCategory;
import com.chronicle.prompt.JsonPromptTemplate;
import com.chronicle.prompt.JsonResponses;
import com.chronicle.prompt.Reasoned;
import com.chronicle.projection.CharacterState;
import com.chronicle.projection.NarrativeState;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Notable objects appearing in or vanishing from the current place. Reads
 * every message since props last changed.
 */
public class PropsChangeExtractor extends AbstractLlmExtractor implements GlobalExtractor {

    record PropsChange(String reasoning, List<String> added, List<String> removed) implements Reasoned {
    }

    static final JsonPromptTemplate<PropsChange> PROMPT = JsonPromptTemplate.of(
        "props_change",
        """
            You track notable objects in the current place of a roleplay scene: furniture, items someone \
            picks up or puts down, things that matter to the story. Report objects that appear and listed \
            objects that are gone. Clothing being worn is not a prop, but clothing someone took off and \
            left in the place is; clothing someone picked up and put on is no longer one.

            Return strict JSON:
            {"reasoning": "short explanation", "added": ["object"], "removed": ["object"]}""",
        """
            Location: {{location}}
            Current props: {{props}}
            Clothing changed this turn: {{clothing}}

            Messages:
            {{messages}}

            Return JSON only.""",
        0.5,
        json -> json.has("added") || json.has("removed")
            ? new PropsChange(JsonResponses.text(json, "reasoning"),
                JsonResponses.strings(json, "added"), JsonResponses.strings(json, "removed"))
            : null);

    public PropsChangeExtractor() {
        super("propsChange", "props", TrackCategory.PROPS, ExtractionPhase.PROPS, RunStrategy.everyMessage(),
            MessageWindowStrategy.sinceLastEventOfKind(
                EventKindFilter.of(EventType.LOCATION_PROP_ADDED),
                EventKindFilter.of(EventType.LOCATION_PROP_REMOVED)),
            0.5);
    }

    @Override
    public List<NarrativeEvent> run(ExtractionRequest request) {
        NarrativeState state = request.currentState();
        List<String> props = state.location().props();
        Map<String, String> values = baseValues(request, state);
        values.put("props", props.isEmpty() ? "none" : String.join(", ", props));
        List<String> clothing = clothingChanges(request);
        values.put("clothing", clothing.isEmpty() ? "none" : String.join("; ", clothing));

        PropsChange change = prompt(request, name(), PROMPT, values).orElse(null);
        if (change == null) {
            return List.of();
        }
        List<NarrativeEvent> events = new ArrayList<>();
        for (String prop : change.removed()) {
            if (containsIgnoreCase(props, prop)) {
                events.add(new NarrativeEvent.PropRemoved(NarrativeEvent.newId(), request.currentMessage(),
                    request.timestamp(), prop));
            }
        }
        List<String> seen = new ArrayList<>();
        for (String prop : change.added()) {
            if (!containsIgnoreCase(props, prop) && !containsIgnoreCase(seen, prop)) {
                seen.add(prop);
                events.add(new NarrativeEvent.PropAdded(NarrativeEvent.newId(), request.currentMessage(),
                    request.timestamp(), prop));
            }
        }
        return events;
    }

    /**
     * Outfit changes earlier in this turn as candidate props, e.g.
     * {@code Luna took off hood (head)}. Old values come from replaying the
     * turn's outfit events over the state before the turn.
     */
    static List<String> clothingChanges(ExtractionRequest request) {
        List<NarrativeEvent.OutfitChanged> changes = new ArrayList<>();
        for (NarrativeEvent event : request.turnEvents()) {
            if (event instanceof NarrativeEvent.OutfitChanged outfit) {
                changes.add(outfit);
            }
        }
        if (changes.isEmpty()) {
            return List.of();
        }
        Map<String, Map<OutfitSlot, String>> worn = new HashMap<>();
        NarrativeState before = request.stateBeforeTurn();
        List<String> lines = new ArrayList<>();
        for (NarrativeEvent.OutfitChanged change : changes) {
            Map<OutfitSlot, String> outfit = worn.computeIfAbsent(change.character(), c -> {
                Map<OutfitSlot, String> copy = new EnumMap<>(OutfitSlot.class);
                before.character(c).map(CharacterState::outfit).ifPresent(copy::putAll);
                return copy;
            });
            String previous = outfit.get(change.slot());
            String slot = " (" + change.slot().getValue() + ")";
            if (previous != null && !previous.isBlank() && !previous.equalsIgnoreCase(change.newValue())) {
                lines.add(change.character() + " took off " + previous + slot);
            }
            if (change.newValue() != null) {
                lines.add(change.character() + " put on " + change.newValue() + slot);
                outfit.put(change.slot(), change.newValue());
            } else {
                outfit.remove(change.slot());
            }
        }
        return lines;
    }
}
