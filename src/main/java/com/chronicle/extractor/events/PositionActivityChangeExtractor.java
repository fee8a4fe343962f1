package com.chronicle.extractor.events;

import com.chronicle.event.NarrativeEvent;
import com.chronicle.extractor.AbstractLlmExtractor;
import com.chronicle.extractor.ExtractionPhase;
import com.chronicle.extractor.ExtractionRequest;
import com.chronicle.extractor.MessageWindowStrategy;
import com.chronicle.extractor.PerCharacterExtractor;
import com.chronicle.extractor.RunStrategy;
import com.chronicle.extractor.TrackCategory;
import com.chronicle.prompt.JsonPromptTemplate;
import com.chronicle.prompt.JsonResponses;
import com.chronicle.prompt.Reasoned;
import com.chronicle.projection.CharacterState;
import com.chronicle.projection.NarrativeState;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Position and activity of one character, extracted together in one call.
 */
public class PositionActivityChangeExtractor extends AbstractLlmExtractor implements PerCharacterExtractor {

    record PositionActivityChange(String reasoning,
                                  boolean positionChanged,
                                  String newPosition,
                                  boolean activityChanged,
                                  String newActivity) implements Reasoned {
    }

    static final JsonPromptTemplate<PositionActivityChange> PROMPT = JsonPromptTemplate.of(
        "position_activity_change",
        """
            You track the body position (standing, sitting on the bed, leaning on the counter) and the \
            current activity (cooking, reading, nothing in particular) of one roleplay character. Decide \
            whether either changed in the latest messages.

            Return strict JSON:
            {"reasoning": "short explanation", "positionChanged": true/false, "newPosition": null,
             "activityChanged": true/false, "newActivity": null}""",
        """
            Target character: {{targetCharacter}}
            {{characterState}}

            Messages:
            {{messages}}

            Return JSON only.""",
        0.5,
        json -> json.has("positionChanged") || json.has("activityChanged")
            ? new PositionActivityChange(JsonResponses.text(json, "reasoning"),
                JsonResponses.bool(json, "positionChanged", false), JsonResponses.text(json, "newPosition"),
                JsonResponses.bool(json, "activityChanged", false), JsonResponses.text(json, "newActivity"))
            : null);

    public PositionActivityChangeExtractor() {
        super("positionActivityChange", "position & activity", TrackCategory.CHARACTERS,
            ExtractionPhase.PER_CHARACTER, RunStrategy.everyNMessages(2, 1), MessageWindowStrategy.fixedNumber(2),
            0.5);
    }

    @Override
    public List<NarrativeEvent> run(ExtractionRequest request, String character) {
        NarrativeState state = request.currentState();
        CharacterState current = state.character(character).orElse(null);
        if (current == null) {
            return List.of();
        }
        Map<String, String> values = baseValues(request, state);
        values.put("targetCharacter", character);
        values.put("characterState", formatCharacter(state, character));

        PositionActivityChange change = prompt(request, name() + ":" + character, PROMPT, values).orElse(null);
        if (change == null) {
            return List.of();
        }
        List<NarrativeEvent> events = new ArrayList<>();
        if (change.positionChanged() && change.newPosition() != null
            && !change.newPosition().equalsIgnoreCase(current.position())) {
            events.add(new NarrativeEvent.PositionChanged(NarrativeEvent.newId(), request.currentMessage(),
                request.timestamp(), character, change.newPosition()));
        }
        if (change.activityChanged() && !equalsIgnoreCase(change.newActivity(), current.activity())) {
            events.add(new NarrativeEvent.ActivityChanged(NarrativeEvent.newId(), request.currentMessage(),
                request.timestamp(), character, change.newActivity()));
        }
        return events;
    }

    private static boolean equalsIgnoreCase(String a, String b) {
        return a == null ? b == null : a.equalsIgnoreCase(b);
    }
}
