package com.chronicle.extractor;

import com.chronicle.contract.EventContractValidator;
import com.chronicle.event.EventType;
import com.chronicle.event.MessageAndSwipe;
import com.chronicle.event.NarrativeEvent;
import com.chronicle.generation.CancellationToken;
import com.chronicle.store.InMemoryEventStore;
import com.chronicle.store.SwipeContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class RunStrategyTest {

    private static RunStrategyContext context(int messageId, List<NarrativeEvent> turnEvents, ExtractorState state) {
        ExtractionRequest request = new ExtractionRequest(
            new InMemoryEventStore(new EventContractValidator()),
            new ExtractionContext(List.of(), "User", "Narrator", null, null),
            ExtractionSettings.defaults(),
            MessageAndSwipe.of(messageId, 0),
            SwipeContext.defaults(),
            turnEvents,
            CancellationToken.none(),
            null,
            new ExtractionDiagnostics(),
            0L);
        return new RunStrategyContext(request, state);
    }

    private static List<Integer> firingMessages(RunStrategy strategy, int upTo) {
        return IntStream.rangeClosed(0, upTo)
            .filter(m -> strategy.shouldFire(context(m, List.of(), new ExtractorState())))
            .boxed()
            .collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Cadence")
    class Cadence {

        @Test
        void everyMessage_alwaysFires() {
            assertEquals(List.of(0, 1, 2, 3), firingMessages(RunStrategy.everyMessage(), 3));
        }

        @Test
        void everyN_firesOnTheNthMessage() {
            assertEquals(List.of(3, 7, 11), firingMessages(RunStrategy.everyNMessages(4), 11));
        }

        @Test
        void everyN_withOffset_shiftsTheCadence() {
            assertEquals(List.of(0, 2, 4, 6), firingMessages(RunStrategy.everyNMessages(2, 1), 6));
        }

        @Test
        void everyN_rejectsZero() {
            assertThrows(IllegalArgumentException.class, () -> RunStrategy.everyNMessages(0));
        }

        @Test
        void sinceLastRun_countsFromPreviousRun() {
            RunStrategy strategy = RunStrategy.everyNMessagesSinceLastRun(3);
            ExtractorState state = new ExtractorState();

            assertTrue(strategy.shouldFire(context(2, List.of(), state)), "first run always fires");
            state.recordRun(MessageAndSwipe.of(2, 0), false);
            assertFalse(strategy.shouldFire(context(4, List.of(), state)));
            assertTrue(strategy.shouldFire(context(5, List.of(), state)));
        }
    }

    @Test
    void newEventsOfKind_firesOnMatchingTurnEvent() {
        RunStrategy strategy = RunStrategy.newEventsOfKind(EventKindFilter.of(EventType.CHAPTER_ENDED));
        NarrativeEvent ended = new NarrativeEvent.ChapterEnded(
            NarrativeEvent.newId(), MessageAndSwipe.of(5, 0), 0L, 0, "time_jump");
        NarrativeEvent described = new NarrativeEvent.ChapterDescribed(
            NarrativeEvent.newId(), MessageAndSwipe.of(5, 0), 0L, 0, "Title", "Summary");

        assertTrue(strategy.shouldFire(context(5, List.of(ended), new ExtractorState())));
        assertFalse(strategy.shouldFire(context(5, List.of(described), new ExtractorState())));
        assertFalse(strategy.shouldFire(context(5, List.of(), new ExtractorState())));
    }

    @Test
    void custom_usesPredicate_andDescribesItself() {
        RunStrategy strategy = RunStrategy.custom("odd messages", c -> c.messageId() % 2 == 1);

        assertEquals(List.of(1, 3), firingMessages(strategy, 4));
        assertEquals("Custom[odd messages]", strategy.toString());
    }

    @Test
    void untrackedCategory_neverRuns() {
        Extractor extractor = new Extractor() {
            @Override
            public String name() {
                return "timeChange";
            }

            @Override
            public String displayName() {
                return "time";
            }

            @Override
            public TrackCategory category() {
                return TrackCategory.TIME;
            }

            @Override
            public ExtractionPhase phase() {
                return ExtractionPhase.CORE;
            }

            @Override
            public RunStrategy runStrategy() {
                return RunStrategy.everyMessage();
            }

            @Override
            public MessageWindowStrategy messageStrategy() {
                return MessageWindowStrategy.fixedNumber(2);
            }

            @Override
            public double defaultTemperature() {
                return 0.3;
            }
        };
        RunStrategyContext tracked = context(1, List.of(), new ExtractorState());
        ExtractionRequest request = tracked.request();
        ExtractionRequest disabled = new ExtractionRequest(request.store(), request.context(),
            request.settings().withTrack(Map.of(TrackCategory.TIME, false)), request.currentMessage(),
            request.swipes(), request.turnEvents(), request.cancellation(), request.promptExecutor(),
            request.diagnostics(), request.timestamp());

        assertTrue(extractor.shouldRun(tracked));
        assertFalse(extractor.shouldRun(new RunStrategyContext(disabled, tracked.state())));
    }
}
