package com.chronicle.extractor.events;

import com.chronicle.event.NarrativeEvent;
import com.chronicle.event.OutfitSlot;
import com.chronicle.extractor.AbstractLlmExtractor;
import com.chronicle.extractor.BatchAttempt;
import com.chronicle.extractor.BatchCapable;
import com.chronicle.extractor.ExtractionPhase;
import com.chronicle.extractor.ExtractionRequest;
import com.chronicle.extractor.MessageWindowStrategy;
import com.chronicle.extractor.RunStrategy;
import com.chronicle.extractor.TrackCategory;
import com.chronicle.prompt.JsonPromptTemplate;
import com.chronicle.prompt.JsonResponses;
import com.chronicle.prompt.Reasoned;
import com.chronicle.projection.CharacterState;
import com.chronicle.projection.NarrativeState;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Detects clothing put on or taken off. Covers all present characters in one
 * batched call when possible and falls back to one call per character.
 */
public class OutfitChangeExtractor extends AbstractLlmExtractor implements BatchCapable {

    static final List<String> REMOVAL_MARKERS = List.of(
        "(removed)", "(taken off)", "(undressed)", "(off)", "(discarded)", "(shed)",
        "(stripped)", "(gone)", "(pulled off)", "(slipped off)", "(tossed aside)");

    record OutfitChange(String character, List<String> removed, Map<String, String> added) {
    }

    record OutfitResult(String reasoning, OutfitChange change) implements Reasoned {
    }

    record BatchOutfitResult(String reasoning, List<OutfitChange> characters) implements Reasoned {
    }

    private static final String SLOT_RULES = """
        Slots: head, neck, jacket, back, torso, legs, footwear, socks, underwear.
        "removed" lists slots that are now empty. "added" maps a slot to the item now worn there.
        Only report changes that happen in the messages; do not restate what is already worn.
        """;

    static final JsonPromptTemplate<OutfitResult> PROMPT = JsonPromptTemplate.of(
        "outfit_change",
        """
            You track what one character of a roleplay is wearing. Decide which clothing items the target \
            character puts on or takes off in the latest messages.
            """ + SLOT_RULES + """

            Return strict JSON:
            {"reasoning": "short explanation", "removed": ["slot"], "added": {"slot": "item"}}""",
        """
            Target character: {{targetCharacter}}
            Current outfit: {{currentOutfit}}

            Messages:
            {{messages}}

            Return JSON only.""",
        0.5,
        json -> json.has("removed") || json.has("added")
            ? new OutfitResult(JsonResponses.text(json, "reasoning"), readChange(json, null))
            : null);

    static final JsonPromptTemplate<BatchOutfitResult> BATCH_PROMPT = JsonPromptTemplate.of(
        "outfit_change_batch",
        """
            You track what several characters of a roleplay are wearing. For every target character decide \
            which clothing items they put on or take off in the latest messages.
            """ + SLOT_RULES + """
            Include one object per target character and no other characters.

            Return strict JSON:
            {"reasoning": "short explanation",
             "characters": [{"character": "Name", "removed": ["slot"], "added": {"slot": "item"}}]}""",
        """
            Target characters: {{targetCharacters}}

            Current outfits:
            {{targetCharacterStates}}

            Messages:
            {{messages}}

            Return JSON only.""",
        0.5,
        json -> {
            JsonNode characters = json.get("characters");
            if (characters == null || !characters.isArray()) {
                return null;
            }
            List<OutfitChange> changes = new ArrayList<>();
            for (JsonNode item : JsonResponses.objects(json, "characters")) {
                String character = JsonResponses.text(item, "character");
                if (character != null) {
                    changes.add(readChange(item, character));
                }
            }
            return new BatchOutfitResult(JsonResponses.text(json, "reasoning"), changes);
        });

    public OutfitChangeExtractor() {
        super("outfitChange", "outfit", TrackCategory.CHARACTERS, ExtractionPhase.PER_CHARACTER,
            RunStrategy.everyMessage(), MessageWindowStrategy.fixedNumber(2), 0.5);
    }

    @Override
    public List<NarrativeEvent> run(ExtractionRequest request, String character) {
        NarrativeState state = request.currentState();
        Map<String, String> values = baseValues(request, state);
        values.put("targetCharacter", character);
        values.put("currentOutfit", describeOutfit(outfitOf(state, character)));

        return prompt(request, name() + ":" + character, PROMPT, values)
            .map(result -> toEvents(request, character, result.change(), outfitOf(state, character)))
            .orElse(List.of());
    }

    @Override
    public BatchAttempt runBatch(ExtractionRequest request, List<String> characters) {
        if (hasCustomPromptText(request, PROMPT.name()) || hasCustomPromptText(request, BATCH_PROMPT.name())) {
            return new BatchAttempt.NotApplicable("custom outfit prompt configured");
        }
        NarrativeState state = request.currentState();
        Map<String, String> values = baseValues(request, state);
        values.put("targetCharacters", String.join(", ", characters));
        StringBuilder states = new StringBuilder();
        for (String character : characters) {
            states.append("## ").append(character).append('\n')
                .append(describeOutfit(outfitOf(state, character))).append("\n\n");
        }
        values.put("targetCharacterStates", states.toString().trim());

        Optional<BatchOutfitResult> result = prompt(request, name() + ":batch", BATCH_PROMPT, values);
        if (result.isEmpty()) {
            return new BatchAttempt.Failed("batch response unusable");
        }

        List<NarrativeEvent> events = new ArrayList<>();
        Set<String> handled = new LinkedHashSet<>();
        for (OutfitChange change : result.get().characters()) {
            Optional<String> target = characters.stream()
                .filter(c -> c.equalsIgnoreCase(change.character()))
                .findFirst();
            if (target.isEmpty() || !handled.add(target.get())) {
                continue;
            }
            events.addAll(toEvents(request, target.get(), change, outfitOf(state, target.get())));
        }
        return new BatchAttempt.Success(events);
    }

    private static OutfitChange readChange(JsonNode json, String character) {
        Map<String, String> added = new LinkedHashMap<>();
        JsonNode addedNode = json.get("added");
        if (addedNode != null && addedNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = addedNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getValue().isTextual() && !field.getValue().asText().isBlank()) {
                    added.put(field.getKey(), field.getValue().asText().trim());
                }
            }
        }
        return new OutfitChange(character, JsonResponses.strings(json, "removed"), added);
    }

    List<NarrativeEvent> toEvents(ExtractionRequest request,
                                  String character,
                                  OutfitChange change,
                                  Map<OutfitSlot, String> current) {
        Map<OutfitSlot, String> added = new EnumMap<>(OutfitSlot.class);
        Set<OutfitSlot> removed = new LinkedHashSet<>();
        for (String slot : change.removed()) {
            OutfitSlot.parse(slot).ifPresent(removed::add);
        }
        change.added().forEach((slotName, item) -> OutfitSlot.parse(slotName).ifPresent(slot -> {
            if (isRemoval(item)) {
                removed.add(slot);
            } else {
                added.put(slot, item);
            }
        }));
        removed.removeAll(added.keySet());

        List<NarrativeEvent> events = new ArrayList<>();
        for (OutfitSlot slot : slotsToRemove(removed, current)) {
            events.add(new NarrativeEvent.OutfitChanged(NarrativeEvent.newId(), request.currentMessage(),
                request.timestamp(), character, slot, null));
        }
        slotsToAdd(added, current).forEach((slot, item) -> events.add(new NarrativeEvent.OutfitChanged(
            NarrativeEvent.newId(), request.currentMessage(), request.timestamp(), character, slot, item)));
        return events;
    }

    static boolean isRemoval(String item) {
        String lower = item.toLowerCase(Locale.ROOT);
        return REMOVAL_MARKERS.stream().anyMatch(lower::contains);
    }

    /** Only slots that currently hold something can be emptied. */
    static List<OutfitSlot> slotsToRemove(Set<OutfitSlot> removed, Map<OutfitSlot, String> current) {
        List<OutfitSlot> result = new ArrayList<>();
        for (OutfitSlot slot : removed) {
            String worn = current.get(slot);
            if (worn != null && !worn.isBlank()) {
                result.add(slot);
            }
        }
        return result;
    }

    /** Drops items identical to what is already worn in the slot. */
    static Map<OutfitSlot, String> slotsToAdd(Map<OutfitSlot, String> added, Map<OutfitSlot, String> current) {
        Map<OutfitSlot, String> result = new EnumMap<>(OutfitSlot.class);
        added.forEach((slot, item) -> {
            if (!item.equalsIgnoreCase(current.get(slot))) {
                result.put(slot, item);
            }
        });
        return result;
    }

    private static Map<OutfitSlot, String> outfitOf(NarrativeState state, String character) {
        return state.character(character).map(CharacterState::outfit).orElse(Map.of());
    }

    private static String describeOutfit(Map<OutfitSlot, String> outfit) {
        if (outfit.isEmpty()) {
            return "unknown";
        }
        StringBuilder out = new StringBuilder();
        outfit.forEach((slot, item) -> out.append(slot.getValue()).append(": ").append(item).append('\n'));
        return out.toString().trim();
    }
}
