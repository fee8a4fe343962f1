package com.chronicle.extractor.events;

import com.chronicle.event.NarrativeEvent;
import com.chronicle.extractor.AbstractLlmExtractor;
import com.chronicle.extractor.ExtractionPhase;
import com.chronicle.extractor.ExtractionRequest;
import com.chronicle.extractor.GlobalExtractor;
import com.chronicle.extractor.MessageWindowStrategy;
import com.chronicle.extractor.RunStrategy;
import com.chronicle.extractor.TrackCategory;
import com.chronicle.prompt.JsonPromptTemplate;
import com.chronicle.prompt.JsonResponses;
import com.chronicle.prompt.Reasoned;
import com.chronicle.projection.NarrativeState;
import com.chronicle.projection.SceneState;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Dramatic tension of the scene: level, type and direction.
 */
public class TensionChangeExtractor extends AbstractLlmExtractor implements GlobalExtractor {

    static final List<String> LEVELS = List.of("relaxed", "aware", "guarded", "tense", "charged", "volatile", "explosive");
    static final List<String> DIRECTIONS = List.of("escalating", "stable", "decreasing");

    record Tension(String reasoning, String level, String type, String direction) implements Reasoned {
    }

    static final JsonPromptTemplate<Tension> PROMPT = JsonPromptTemplate.of(
        "tension_change",
        """
            You rate the dramatic tension of a roleplay scene.
            level: relaxed, aware, guarded, tense, charged, volatile or explosive.
            type: conversation, confrontation, romantic, intimate, vulnerable, suspense or celebratory.
            direction: escalating, stable or decreasing, compared with the previous tension.

            Return strict JSON:
            {"reasoning": "short explanation", "level": "...", "type": "...", "direction": "..."}""",
        """
            Previous tension: {{tension}}

            Messages:
            {{messages}}

            Return JSON only.""",
        0.5,
        json -> {
            String level = lower(JsonResponses.text(json, "level"));
            String direction = lower(JsonResponses.text(json, "direction"));
            if (level == null || !LEVELS.contains(level) || (direction != null && !DIRECTIONS.contains(direction))) {
                return null;
            }
            return new Tension(JsonResponses.text(json, "reasoning"), level,
                lower(JsonResponses.text(json, "type")), direction);
        });

    public TensionChangeExtractor() {
        super("tensionChange", "tension", TrackCategory.SCENE, ExtractionPhase.NARRATIVE,
            RunStrategy.everyNMessages(2), MessageWindowStrategy.fixedNumber(4), 0.5);
    }

    @Override
    public List<NarrativeEvent> run(ExtractionRequest request) {
        NarrativeState state = request.currentState();
        SceneState.Tension current = state.scene().tension();
        Map<String, String> values = baseValues(request, state);
        values.put("tension", current == null
            ? "unknown"
            : current.level() + ", " + current.type() + ", " + current.direction());

        Tension tension = prompt(request, name(), PROMPT, values).orElse(null);
        if (tension == null || (current != null
            && Objects.equals(current.level(), tension.level())
            && Objects.equals(current.type(), tension.type())
            && Objects.equals(current.direction(), tension.direction()))) {
            return List.of();
        }
        return List.of(new NarrativeEvent.TensionChanged(NarrativeEvent.newId(), request.currentMessage(),
            request.timestamp(), tension.level(), tension.type(), tension.direction()));
    }

    private static String lower(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }
}
