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

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Closes the current chapter at a natural break. Only considered when this
 * turn moved the scene or jumped at least six hours ahead.
 */
public class ChapterEndedExtractor extends AbstractLlmExtractor implements GlobalExtractor {

    static final long TIME_JUMP_MINUTES = 6 * 60;

    static final String REASON_LOCATION = "location_change";
    static final String REASON_TIME = "time_jump";
    static final String REASON_BOTH = "both";

    record ChapterDecision(String reasoning, boolean shouldEnd) implements Reasoned {
    }

    static final JsonPromptTemplate<ChapterDecision> PROMPT = JsonPromptTemplate.of(
        "chapter_ended",
        """
            You decide whether a roleplay story has reached the end of a chapter. The scene just changed \
            ({{trigger}}). End the chapter when this starts a new scene in the story, not when characters \
            only step into the next room or a few hours pass inside the same scene.

            Return strict JSON:
            {"reasoning": "short explanation", "shouldEnd": true/false}""",
        """
            Location: {{location}}

            Messages:
            {{messages}}

            Return JSON only.""",
        0.3,
        json -> json.has("shouldEnd")
            ? new ChapterDecision(JsonResponses.text(json, "reasoning"), JsonResponses.bool(json, "shouldEnd", false))
            : null);

    public ChapterEndedExtractor() {
        super("chapterEnded", "chapter end", TrackCategory.CHAPTERS, ExtractionPhase.CHAPTER,
            RunStrategy.custom("location moved or time jump", context -> trigger(context.request()) != null),
            MessageWindowStrategy.fixedNumber(3), 0.3);
    }

    @Override
    public List<NarrativeEvent> run(ExtractionRequest request) {
        String trigger = trigger(request);
        if (trigger == null) {
            return List.of();
        }
        NarrativeState state = request.currentState();
        Map<String, String> values = baseValues(request, state);
        values.put("trigger", REASON_LOCATION.equals(trigger)
            ? "the location changed"
            : REASON_TIME.equals(trigger) ? "a lot of time passed" : "the location changed and a lot of time passed");

        return prompt(request, name(), PROMPT, values)
            .filter(ChapterDecision::shouldEnd)
            .<List<NarrativeEvent>>map(decision -> List.of(new NarrativeEvent.ChapterEnded(NarrativeEvent.newId(),
                request.currentMessage(), request.timestamp(), state.currentChapter(), trigger)))
            .orElse(List.of());
    }

    /**
     * What in this turn could end the chapter, or null when nothing does. A
     * time jump is six hours or more, or any jump past midnight.
     */
    static String trigger(ExtractionRequest request) {
        boolean moved = false;
        long minutes = 0;
        for (NarrativeEvent event : request.turnEvents()) {
            if (event instanceof NarrativeEvent.LocationMoved) {
                moved = true;
            } else if (event instanceof NarrativeEvent.TimeDelta delta) {
                minutes += delta.totalMinutes();
            }
        }
        boolean timeJump = minutes >= TIME_JUMP_MINUTES || (minutes > 0 && crossesMidnight(request, minutes));
        if (moved && timeJump) {
            return REASON_BOTH;
        }
        if (moved) {
            return REASON_LOCATION;
        }
        return timeJump ? REASON_TIME : null;
    }

    private static boolean crossesMidnight(ExtractionRequest request, long minutes) {
        LocalDateTime before = request.stateBeforeTurn().time();
        return before != null && !before.toLocalDate().equals(before.plusMinutes(minutes).toLocalDate());
    }
}
