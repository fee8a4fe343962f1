package com.chronicle.extractor.events;

import com.chronicle.event.NarrativeEvent;
import com.chronicle.extractor.AbstractLlmExtractor;
import com.chronicle.extractor.ExtractionPhase;
import com.chronicle.extractor.ExtractionRequest;
import com.chronicle.extractor.GlobalExtractor;
import com.chronicle.extractor.MessageWindowStrategy;
import com.chronicle.extractor.RunStrategy;
import com.chronicle.extractor.TrackCategory;
import com.chronicle.names.AkaComputation;
import com.chronicle.prompt.JsonPromptTemplate;
import com.chronicle.prompt.JsonResponses;
import com.chronicle.prompt.Reasoned;
import com.chronicle.projection.NarrativeState;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Detects characters entering or leaving the scene. A new character reported
 * with a longer full name also gets that name and its unambiguous parts as
 * alternate names.
 */
public class PresenceChangeExtractor extends AbstractLlmExtractor implements GlobalExtractor {

    record Arrival(String character, String fullName, String position, String activity, List<String> mood) {
    }

    record PresenceChange(String reasoning, List<Arrival> appeared, List<String> departed) implements Reasoned {
    }

    static final JsonPromptTemplate<PresenceChange> PROMPT = JsonPromptTemplate.of(
        "presence_change",
        """
            You track which characters are physically present in a roleplay scene. Report characters who \
            arrive in the latest messages and characters who leave. Use the short name the story uses for \
            the character; put a longer full name in fullName when the text gives one. Characters who are \
            only talked about are not present.

            Return strict JSON:
            {"reasoning": "short explanation",
             "appeared": [{"character": "Name", "fullName": null, "position": "...", "activity": "...", "mood": []}],
             "departed": ["Name"]}""",
        """
            Characters present: {{characters}}
            Location: {{location}}

            Messages:
            {{messages}}

            Return JSON only.""",
        0.5,
        json -> {
            if (!json.has("appeared") && !json.has("departed")) {
                return null;
            }
            List<Arrival> appeared = new ArrayList<>();
            for (JsonNode item : JsonResponses.objects(json, "appeared")) {
                String character = JsonResponses.text(item, "character");
                if (character != null) {
                    appeared.add(new Arrival(character, JsonResponses.text(item, "fullName"),
                        JsonResponses.text(item, "position"), JsonResponses.text(item, "activity"),
                        JsonResponses.strings(item, "mood")));
                }
            }
            return new PresenceChange(JsonResponses.text(json, "reasoning"), appeared,
                JsonResponses.strings(json, "departed"));
        });

    public PresenceChangeExtractor() {
        super("presenceChange", "presence", TrackCategory.CHARACTERS, ExtractionPhase.CHARACTER_PRESENCE,
            RunStrategy.everyMessage(), MessageWindowStrategy.fixedNumber(2), 0.5);
    }

    @Override
    public List<NarrativeEvent> run(ExtractionRequest request) {
        NarrativeState state = request.currentState();
        PresenceChange change = prompt(request, name(), PROMPT, baseValues(request, state)).orElse(null);
        if (change == null) {
            return List.of();
        }
        List<String> present = state.charactersPresent();
        List<String> allNames = new ArrayList<>(state.characters().keySet());
        change.appeared().forEach(arrival -> allNames.add(arrival.character()));

        List<NarrativeEvent> events = new ArrayList<>();
        List<String> arrived = new ArrayList<>();
        for (Arrival arrival : change.appeared()) {
            if (containsIgnoreCase(present, arrival.character()) || containsIgnoreCase(arrived, arrival.character())) {
                continue;
            }
            arrived.add(arrival.character());
            events.add(new NarrativeEvent.CharacterAppeared(NarrativeEvent.newId(), request.currentMessage(),
                request.timestamp(), arrival.character(), arrival.position(), arrival.activity(), arrival.mood()));

            if (arrival.fullName() != null) {
                List<String> akas = AkaComputation.computeAkas(arrival.character(), arrival.fullName(),
                    List.of(), allNames);
                if (!akas.isEmpty()) {
                    events.add(new NarrativeEvent.AkasAdded(NarrativeEvent.newId(), request.currentMessage(),
                        request.timestamp(), arrival.character(), akas));
                }
            }
        }
        for (String departed : change.departed()) {
            present.stream()
                .filter(name -> name.equalsIgnoreCase(departed))
                .findFirst()
                .ifPresent(name -> events.add(new NarrativeEvent.CharacterDeparted(NarrativeEvent.newId(),
                    request.currentMessage(), request.timestamp(), name)));
        }
        return events;
    }
}
