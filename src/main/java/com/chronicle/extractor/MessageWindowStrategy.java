package com.chronicle.extractor;

import com.chronicle.event.NarrativeEvent;

import java.util.List;

/**
 * Which messages an extractor reads.
 */
public sealed interface MessageWindowStrategy {

    MessageRange resolve(ExtractionRequest request);

    static MessageWindowStrategy fixedNumber(int n) {
        return new FixedNumber(n);
    }

    static MessageWindowStrategy sinceLastEventOfKind(EventKindFilter... filters) {
        return new SinceLastEventOfKind(List.of(filters));
    }

    /** The last {@code n} messages up to the current one. */
    record FixedNumber(int n) implements MessageWindowStrategy {
        @Override
        public MessageRange resolve(ExtractionRequest request) {
            int end = request.currentMessage().messageId();
            return new MessageRange(end - Math.max(1, n) + 1, end);
        }
    }

    /**
     * From the message of the latest earlier matching event (or the start of
     * the chat) up to the current message.
     */
    record SinceLastEventOfKind(List<EventKindFilter> filters) implements MessageWindowStrategy {
        public SinceLastEventOfKind {
            filters = List.copyOf(filters);
        }

        @Override
        public MessageRange resolve(ExtractionRequest request) {
            int current = request.currentMessage().messageId();
            int start = request.store()
                .findLatestEventMatching(current - 1, request.swipes(), this::matches)
                .map(NarrativeEvent::source)
                .map(source -> source.messageId())
                .orElse(0);
            return new MessageRange(start, current);
        }

        private boolean matches(NarrativeEvent event) {
            return filters.stream().anyMatch(f -> f.matches(event));
        }
    }
}
