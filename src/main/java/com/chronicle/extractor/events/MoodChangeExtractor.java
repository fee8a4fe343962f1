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
 * Moods a character gains or loses.
 */
public class MoodChangeExtractor extends AbstractLlmExtractor implements PerCharacterExtractor {

    record MoodChange(String reasoning, List<String> added, List<String> removed) implements Reasoned {
    }

    static final JsonPromptTemplate<MoodChange> PROMPT = JsonPromptTemplate.of(
        "mood_change",
        """
            You track the moods of one roleplay character as short adjectives (nervous, amused, tired). \
            Report moods the character starts showing in the latest messages and current moods that no \
            longer apply.

            Return strict JSON:
            {"reasoning": "short explanation", "added": ["mood"], "removed": ["mood"]}""",
        """
            Target character: {{targetCharacter}}
            {{characterState}}

            Messages:
            {{messages}}

            Return JSON only.""",
        0.5,
        json -> json.has("added") || json.has("removed")
            ? new MoodChange(JsonResponses.text(json, "reasoning"),
                JsonResponses.strings(json, "added"), JsonResponses.strings(json, "removed"))
            : null);

    public MoodChangeExtractor() {
        super("moodChange", "mood", TrackCategory.CHARACTERS, ExtractionPhase.PER_CHARACTER,
            RunStrategy.everyNMessages(3), MessageWindowStrategy.fixedNumber(3), 0.5);
    }

    @Override
    public List<NarrativeEvent> run(ExtractionRequest request, String character) {
        NarrativeState state = request.currentState();
        List<String> moods = state.character(character).map(CharacterState::mood).orElse(List.of());
        Map<String, String> values = baseValues(request, state);
        values.put("targetCharacter", character);
        values.put("characterState", formatCharacter(state, character));

        MoodChange change = prompt(request, name() + ":" + character, PROMPT, values).orElse(null);
        if (change == null) {
            return List.of();
        }
        List<NarrativeEvent> events = new ArrayList<>();
        for (String mood : change.removed()) {
            if (containsIgnoreCase(moods, mood) && !containsIgnoreCase(change.added(), mood)) {
                events.add(new NarrativeEvent.MoodRemoved(NarrativeEvent.newId(), request.currentMessage(),
                    request.timestamp(), character, mood));
            }
        }
        List<String> seen = new ArrayList<>();
        for (String mood : change.added()) {
            if (!containsIgnoreCase(moods, mood) && !containsIgnoreCase(seen, mood)) {
                seen.add(mood);
                events.add(new NarrativeEvent.MoodAdded(NarrativeEvent.newId(), request.currentMessage(),
                    request.timestamp(), character, mood));
            }
        }
        return events;
    }
}
