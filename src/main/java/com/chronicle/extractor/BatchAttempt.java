package com.chronicle.extractor;

import com.chronicle.event.NarrativeEvent;

import java.util.List;

/**
 * Outcome of a batched call covering several targets at once.
 */
public sealed interface BatchAttempt {

    record Success(List<NarrativeEvent> events) implements BatchAttempt {
        public Success {
            events = List.copyOf(events);
        }
    }

    /** The batch call ran but its result cannot be used; targets run individually. */
    record Failed(String reason) implements BatchAttempt {
    }

    /** Batching is not possible for this turn, e.g. a custom prompt is set. */
    record NotApplicable(String reason) implements BatchAttempt {
    }
}
