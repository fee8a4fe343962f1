package com.chronicle.orchestration;

import com.chronicle.event.NarrativeEvent;
import com.chronicle.extractor.ExtractionError;

import java.util.List;

/**
 * What a turn produced. When {@code aborted} is true nothing was appended and
 * {@code newEvents} is empty.
 */
public record ExtractionResult(List<NarrativeEvent> newEvents,
                               boolean chapterEnded,
                               List<ExtractionError> errors,
                               boolean aborted) {

    public ExtractionResult {
        newEvents = List.copyOf(newEvents);
        errors = List.copyOf(errors);
    }

    public static ExtractionResult aborted(List<ExtractionError> errors) {
        return new ExtractionResult(List.of(), false, errors, true);
    }
}
