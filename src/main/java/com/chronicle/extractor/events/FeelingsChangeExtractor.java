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
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Feelings each member of a pair holds toward the other. Directional: Alice
 * can trust Bob while Bob resents Alice.
 */
public class FeelingsChangeExtractor extends AbstractLlmExtractor implements PerPairExtractor {

    record DirectedChange(String from, String toward, List<String> added, List<String> removed) {
    }

    record FeelingsResult(String reasoning, List<DirectedChange> changes) implements Reasoned {
    }

    static final JsonPromptTemplate<FeelingsResult> PROMPT = JsonPromptTemplate.of(
        "feelings_change",
        """
            You track how two roleplay characters feel about each other, separately for each direction. \
            Use short words (trust, jealousy, attraction, resentment). Report feelings that appear in the \
            latest messages and current feelings that no longer hold.

            Return strict JSON:
            {"reasoning": "short explanation",
             "changes": [{"from": "Name", "toward": "Name", "added": ["feeling"], "removed": ["feeling"]}]}""",
        """
            Pair: {{pair}}
            Current feelings:
            {{feelings}}

            Messages:
            {{messages}}

            Return JSON only.""",
        0.5,
        json -> {
            if (!json.has("changes")) {
                return null;
            }
            List<DirectedChange> changes = new ArrayList<>();
            for (JsonNode item : JsonResponses.objects(json, "changes")) {
                String from = JsonResponses.text(item, "from");
                String toward = JsonResponses.text(item, "toward");
                if (from != null && toward != null) {
                    changes.add(new DirectedChange(from, toward,
                        JsonResponses.strings(item, "added"), JsonResponses.strings(item, "removed")));
                }
            }
            return new FeelingsResult(JsonResponses.text(json, "reasoning"), changes);
        });

    public FeelingsChangeExtractor() {
        super("feelingsChange", "feelings", TrackCategory.RELATIONSHIPS, ExtractionPhase.PER_PAIR,
            RunStrategy.everyNMessages(4), MessageWindowStrategy.fixedNumber(4), 0.5);
    }

    @Override
    public List<NarrativeEvent> run(ExtractionRequest request, CharacterPair pair) {
        NarrativeState state = request.currentState();
        RelationshipState relationship = state.relationship(pair).orElse(RelationshipState.of(pair));
        Map<String, String> values = baseValues(request, state);
        values.put("pair", pair.first() + " and " + pair.second());
        values.put("feelings", describe(relationship, pair.first(), pair.second()) + "\n"
            + describe(relationship, pair.second(), pair.first()));

        FeelingsResult result = prompt(request, name() + ":" + pair.label(), PROMPT, values).orElse(null);
        if (result == null) {
            return List.of();
        }
        List<NarrativeEvent> events = new ArrayList<>();
        for (DirectedChange change : result.changes()) {
            String from = memberMatching(pair, change.from());
            String toward = memberMatching(pair, change.toward());
            if (from == null || toward == null || from.equals(toward)) {
                continue;
            }
            List<String> current = relationship.feelingsOf(from);
            for (String feeling : change.removed()) {
                if (containsIgnoreCase(current, feeling)) {
                    events.add(new NarrativeEvent.FeelingRemoved(NarrativeEvent.newId(), request.currentMessage(),
                        request.timestamp(), from, toward, feeling));
                }
            }
            for (String feeling : change.added()) {
                if (!containsIgnoreCase(current, feeling)) {
                    events.add(new NarrativeEvent.FeelingAdded(NarrativeEvent.newId(), request.currentMessage(),
                        request.timestamp(), from, toward, feeling));
                }
            }
        }
        return events;
    }

    private static String memberMatching(CharacterPair pair, String name) {
        if (pair.first().equalsIgnoreCase(name)) {
            return pair.first();
        }
        return pair.second().equalsIgnoreCase(name) ? pair.second() : null;
    }

    private static String describe(RelationshipState relationship, String from, String toward) {
        List<String> feelings = relationship.feelingsOf(from);
        return from + " toward " + toward + ": " + (feelings.isEmpty() ? "unknown" : String.join(", ", feelings));
    }
}
