package com.chronicle.extractor.events;

import com.chronicle.event.CharacterPair;
import com.chronicle.event.NarrativeEvent;
import com.chronicle.extractor.AbstractLlmExtractor;
import com.chronicle.extractor.ExtractionPhase;
import com.chronicle.extractor.ExtractionRequest;
import com.chronicle.extractor.MessageWindowStrategy;
import com.chronicle.extractor.PerPairExtractor;
import com.chronicle.extractor.RunStrategy;
import com.chronicle.extractor.TrackCategory;
import com.chronicle.prompt.JsonPromptTemplate;
import com.chronicle.prompt.JsonResponses;
import com.chronicle.prompt.Reasoned;
import com.chronicle.projection.NarrativeState;
import com.chronicle.projection.RelationshipState;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Overall status of a pair, such as strangers, friendly or romantic.
 */
public class RelationshipStatusExtractor extends AbstractLlmExtractor implements PerPairExtractor {

    static final List<String> STATUSES = List.of(
        "strangers", "acquaintances", "friendly", "close", "intimate", "strained", "hostile", "complicated");

    record StatusChange(String reasoning, boolean changed, String newStatus) implements Reasoned {
    }

    static final JsonPromptTemplate<StatusChange> PROMPT = JsonPromptTemplate.of(
        "relationship_status",
        """
            You track the overall relationship status between two roleplay characters. Allowed statuses: \
            strangers, acquaintances, friendly, close, intimate, strained, hostile, complicated. Decide \
            whether the latest messages move the relationship to a different status.

            Return strict JSON:
            {"reasoning": "short explanation", "changed": true/false, "newStatus": null}""",
        """
            Pair: {{pair}}
            Current status: {{status}}

            Messages:
            {{messages}}

            Return JSON only.""",
        0.5,
        json -> {
            if (!json.has("changed")) {
                return null;
            }
            boolean changed = JsonResponses.bool(json, "changed", false);
            String status = JsonResponses.text(json, "newStatus");
            if (changed && (status == null || !STATUSES.contains(status.toLowerCase(Locale.ROOT)))) {
                return null;
            }
            return new StatusChange(JsonResponses.text(json, "reasoning"), changed,
                status == null ? null : status.toLowerCase(Locale.ROOT));
        });

    public RelationshipStatusExtractor() {
        super("relationshipStatus", "relationship status", TrackCategory.RELATIONSHIPS, ExtractionPhase.PER_PAIR,
            RunStrategy.everyNMessages(4), MessageWindowStrategy.fixedNumber(4), 0.5);
    }

    @Override
    public List<NarrativeEvent> run(ExtractionRequest request, CharacterPair pair) {
        NarrativeState state = request.currentState();
        String current = state.relationship(pair).map(RelationshipState::status).orElse(null);
        Map<String, String> values = baseValues(request, state);
        values.put("pair", pair.first() + " and " + pair.second());
        values.put("status", current == null ? "unknown" : current);

        return prompt(request, name() + ":" + pair.label(), PROMPT, values)
            .filter(change -> change.changed() && !change.newStatus().equals(current))
            .<List<NarrativeEvent>>map(change -> List.of(new NarrativeEvent.StatusChanged(NarrativeEvent.newId(),
                request.currentMessage(), request.timestamp(), pair, change.newStatus())))
            .orElse(List.of());
    }
}
