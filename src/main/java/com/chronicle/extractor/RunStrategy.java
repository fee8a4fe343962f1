package com.chronicle.extractor;

import com.chronicle.event.MessageAndSwipe;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Decides whether an extractor runs on the current turn.
 */
public sealed interface RunStrategy {

    boolean shouldFire(RunStrategyContext context);

    static RunStrategy everyMessage() {
        return new EveryMessage();
    }

    static RunStrategy everyNMessages(int n) {
        return new EveryNMessages(n, 0);
    }

    static RunStrategy everyNMessages(int n, int offset) {
        return new EveryNMessages(n, offset);
    }

    static RunStrategy newEventsOfKind(EventKindFilter... filters) {
        return new NewEventsOfKind(List.of(filters));
    }

    static RunStrategy everyNMessagesSinceLastRun(int n) {
        return new EveryNMessagesSinceLastRun(n);
    }

    static RunStrategy custom(String description, Predicate<RunStrategyContext> predicate) {
        return new Custom(description, predicate);
    }

    record EveryMessage() implements RunStrategy {
        @Override
        public boolean shouldFire(RunStrategyContext context) {
            return true;
        }
    }

    /** Fires when {@code (messageId + offset + 1) mod n == 0}. */
    record EveryNMessages(int n, int offset) implements RunStrategy {
        public EveryNMessages {
            if (n < 1) {
                throw new IllegalArgumentException("n must be >= 1");
            }
        }

        @Override
        public boolean shouldFire(RunStrategyContext context) {
            return Math.floorMod(context.messageId() + offset + 1, n) == 0;
        }
    }

    /** Fires when the turn has already produced a matching event. */
    record NewEventsOfKind(List<EventKindFilter> filters) implements RunStrategy {
        public NewEventsOfKind {
            filters = List.copyOf(filters);
        }

        @Override
        public boolean shouldFire(RunStrategyContext context) {
            return context.request().turnEvents().stream()
                .anyMatch(event -> filters.stream().anyMatch(f -> f.matches(event)));
        }
    }

    /** Fires on the first run and then once at least {@code n} messages have passed. */
    record EveryNMessagesSinceLastRun(int n) implements RunStrategy {
        @Override
        public boolean shouldFire(RunStrategyContext context) {
            Optional<MessageAndSwipe> last = context.state().lastRanAt();
            return last.isEmpty() || context.messageId() - last.get().messageId() >= n;
        }
    }

    record Custom(String description, Predicate<RunStrategyContext> predicate) implements RunStrategy {
        @Override
        public boolean shouldFire(RunStrategyContext context) {
            return predicate.test(context);
        }

        @Override
        public String toString() {
            return "Custom[" + description + "]";
        }
    }
}
