package com.chronicle.extractor.events;

import com.chronicle.event.EventType;
import com.chronicle.event.NarrativeEvent;
import com.chronicle.extractor.AbstractLlmExtractor;
import com.chronicle.extractor.EventKindFilter;
import com.chronicle.extractor.ExtractionPhase;
import com.chronicle.extractor.ExtractionRequest;
import com.chronicle.extractor.ExtractionSettings;
import com.chronicle.extractor.GlobalExtractor;
import com.chronicle.extractor.MessageWindowStrategy;
import com.chronicle.extractor.RunStrategy;
import com.chronicle.extractor.TrackCategory;
import com.chronicle.prompt.JsonPromptTemplate;
import com.chronicle.prompt.JsonResponses;
import com.chronicle.prompt.Reasoned;
import com.chronicle.projection.NarrativeState;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Titles and summarizes a chapter right after it ended, reading everything
 * since the previous chapter ended.
 */
public class ChapterDescriptionExtractor extends AbstractLlmExtractor implements GlobalExtractor {

    record ChapterDescription(String reasoning, String title, String summary) implements Reasoned {
    }

    static final JsonPromptTemplate<ChapterDescription> PROMPT = JsonPromptTemplate.of(
        "chapter_description",
        """
            You name and summarize a finished chapter of a roleplay story. The title is a few evocative \
            words. The summary is two to four sentences covering what happened and how the characters' \
            situation changed.

            Return strict JSON:
            {"reasoning": "short explanation", "title": "...", "summary": "..."}""",
        """
            Characters: {{characters}}

            Chapter messages:
            {{messages}}

            Return JSON only.""",
        0.5,
        json -> {
            String title = JsonResponses.text(json, "title");
            return title == null
                ? null
                : new ChapterDescription(JsonResponses.text(json, "reasoning"), title,
                    JsonResponses.text(json, "summary"));
        });

    public ChapterDescriptionExtractor() {
        super("chapterDescription", "chapter description", TrackCategory.CHAPTERS, ExtractionPhase.CHAPTER,
            RunStrategy.newEventsOfKind(EventKindFilter.of(EventType.CHAPTER_ENDED)),
            MessageWindowStrategy.sinceLastEventOfKind(EventKindFilter.of(EventType.CHAPTER_ENDED)), 0.5);
    }

    @Override
    protected Integer maxMessages(ExtractionSettings settings) {
        return settings.maxChapterMessagesToSend();
    }

    @Override
    public List<NarrativeEvent> run(ExtractionRequest request) {
        List<NarrativeEvent.ChapterEnded> ended = new ArrayList<>();
        for (NarrativeEvent event : request.turnEvents()) {
            if (event instanceof NarrativeEvent.ChapterEnded chapterEnded) {
                ended.add(chapterEnded);
            }
        }
        if (ended.isEmpty()) {
            return List.of();
        }
        NarrativeState state = request.currentState();
        Map<String, String> values = baseValues(request, state);
        int chapterIndex = ended.get(ended.size() - 1).chapterIndex();

        return prompt(request, name(), PROMPT, values)
            .<List<NarrativeEvent>>map(description -> List.of(new NarrativeEvent.ChapterDescribed(
                NarrativeEvent.newId(), request.currentMessage(), request.timestamp(), chapterIndex,
                description.title(), description.summary())))
            .orElse(List.of());
    }
}
