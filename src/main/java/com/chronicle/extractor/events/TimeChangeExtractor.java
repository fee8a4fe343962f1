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
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Detects how much in-story time passed in the latest messages.
 */
public class TimeChangeExtractor extends AbstractLlmExtractor implements GlobalExtractor {

    record TimeChange(String reasoning, boolean changed, int days, int hours, int minutes) implements Reasoned {
        long totalMinutes() {
            return days * 24L * 60L + hours * 60L + minutes;
        }
    }

    static final JsonPromptTemplate<TimeChange> PROMPT = JsonPromptTemplate.of(
        "time_change",
        """
            You track the passage of time in a roleplay. Read the latest messages and decide how much \
            in-story time elapsed during them. Count only time that visibly passes: a conversation of a few \
            lines is a few minutes, "the next morning" is the hours until then. Never count time that is only \
            mentioned in memories or plans.

            Return strict JSON:
            {"reasoning": "short explanation", "changed": true/false, "delta": {"days": 0, "hours": 0, "minutes": 0}}""",
        """
            Current time: {{time}}

            Messages:
            {{messages}}

            Return JSON only.""",
        0.3,
        json -> {
            if (!json.has("changed")) {
                return null;
            }
            JsonNode delta = json.path("delta");
            int days = JsonResponses.integer(delta, "days", 0);
            int hours = JsonResponses.integer(delta, "hours", 0);
            int minutes = JsonResponses.integer(delta, "minutes", 0);
            if (days < 0 || hours < 0 || minutes < 0) {
                return null;
            }
            return new TimeChange(JsonResponses.text(json, "reasoning"),
                JsonResponses.bool(json, "changed", false), days, hours, minutes);
        });

    public TimeChangeExtractor() {
        super("timeChange", "time", TrackCategory.TIME, ExtractionPhase.CORE,
            RunStrategy.everyMessage(), MessageWindowStrategy.fixedNumber(2), 0.3);
    }

    @Override
    public List<NarrativeEvent> run(ExtractionRequest request) {
        NarrativeState state = request.currentState();
        Map<String, String> values = baseValues(request, state);
        values.put("time", state.time() != null ? state.time().toString() : "unknown");

        return prompt(request, name(), PROMPT, values)
            .filter(change -> change.changed() && change.totalMinutes() > 0)
            .<List<NarrativeEvent>>map(change -> List.of(new NarrativeEvent.TimeDelta(
                NarrativeEvent.newId(), request.currentMessage(), request.timestamp(),
                change.days(), change.hours(), change.minutes())))
            .orElse(List.of());
    }
}
