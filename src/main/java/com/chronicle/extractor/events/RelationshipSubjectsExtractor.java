package com.chronicle.extractor.events;

import com.chronicle.event.CharacterPair;
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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Significant interactions between two characters (a first kiss, a fight, a
 * confession) across all present pairs in one call.
 */
public class RelationshipSubjectsExtractor extends AbstractLlmExtractor implements GlobalExtractor {

    record Subject(String first, String second, String subject) {
    }

    record SubjectsResult(String reasoning, List<Subject> subjects) implements Reasoned {
    }

    static final JsonPromptTemplate<SubjectsResult> PROMPT = JsonPromptTemplate.of(
        "relationship_subjects",
        """
            You record significant interactions between pairs of roleplay characters: conversation, \
            flirting, conflict, intimacy, secret shared, promise, betrayal, apology, gift, and similar. \
            Only report interactions that happen in the latest messages, between two of the present \
            characters.

            Return strict JSON:
            {"reasoning": "short explanation", "subjects": [{"pair": ["Name", "Name"], "subject": "conflict"}]}""",
        """
            Characters present: {{characters}}

            Messages:
            {{messages}}

            Return JSON only.""",
        0.5,
        json -> {
            if (!json.has("subjects")) {
                return null;
            }
            List<Subject> subjects = new ArrayList<>();
            for (JsonNode item : JsonResponses.objects(json, "subjects")) {
                List<String> pair = JsonResponses.strings(item, "pair");
                String subject = JsonResponses.text(item, "subject");
                if (pair.size() == 2 && subject != null) {
                    subjects.add(new Subject(pair.get(0), pair.get(1), subject));
                }
            }
            return new SubjectsResult(JsonResponses.text(json, "reasoning"), subjects);
        });

    public RelationshipSubjectsExtractor() {
        super("relationshipSubjects", "relationship subjects", TrackCategory.RELATIONSHIPS,
            ExtractionPhase.RELATIONSHIP_SUBJECTS, RunStrategy.everyNMessages(2, 1),
            MessageWindowStrategy.fixedNumber(2), 0.5);
    }

    @Override
    public List<NarrativeEvent> run(ExtractionRequest request) {
        NarrativeState state = request.currentState();
        if (state.charactersPresent().size() < 2) {
            return List.of();
        }
        SubjectsResult result = prompt(request, name(), PROMPT, baseValues(request, state)).orElse(null);
        if (result == null) {
            return List.of();
        }
        List<NarrativeEvent> events = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Subject subject : result.subjects()) {
            if (subject.first().equalsIgnoreCase(subject.second())) {
                continue;
            }
            CharacterPair pair = CharacterPair.of(subject.first(), subject.second());
            String value = subject.subject().toLowerCase(Locale.ROOT);
            if (seen.add(pair.key() + "|" + value)) {
                events.add(new NarrativeEvent.SubjectOccurred(NarrativeEvent.newId(), request.currentMessage(),
                    request.timestamp(), pair, value));
            }
        }
        return events;
    }
}
