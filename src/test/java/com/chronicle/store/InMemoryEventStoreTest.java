package com.chronicle.store;

import com.chronicle.contract.ContractViolationException;
import com.chronicle.contract.EventContractValidator;
import com.chronicle.event.EventKind;
import com.chronicle.event.MessageAndSwipe;
import com.chronicle.event.NarrativeEvent;
import com.chronicle.projection.NarrativeState;
import com.chronicle.projection.Projection;
import com.chronicle.projection.ProjectionReducer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryEventStoreTest {

    private InMemoryEventStore store;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
        store = new InMemoryEventStore(new EventContractValidator(), NarrativeState.EMPTY, clock);
    }

    @Nested
    @DisplayName("Swipe filtering")
    class Swipes {

        @Test
        void inactiveSwipe_isInvisible() {
            store.appendTurn(MessageAndSwipe.of(1, 0), List.of(prop(1, 0, "lamp")));
            store.appendTurn(MessageAndSwipe.of(1, 1), List.of(prop(1, 1, "candle")));

            assertEquals(List.of("lamp"), props(store.projectStateAtMessage(1, SwipeContext.defaults())));
            assertEquals(List.of("candle"),
                props(store.projectStateAtMessage(1, SwipeContext.defaults().with(1, 1))));
        }

        @Test
        void laterMessages_areNotReplayed() {
            store.appendTurn(MessageAndSwipe.of(1, 0), List.of(prop(1, 0, "lamp")));
            store.appendTurn(MessageAndSwipe.of(2, 0), List.of(prop(2, 0, "candle")));

            assertEquals(List.of("lamp"), props(store.projectStateAtMessage(1, SwipeContext.defaults())));
            assertEquals(1, store.getActiveEvents(1, SwipeContext.defaults()).size());
        }

        @Test
        void activeEventsOfKind_filtersByKind() {
            store.appendTurn(MessageAndSwipe.of(0, 0), List.of(
                prop(0, 0, "lamp"),
                new NarrativeEvent.TimeDelta(NarrativeEvent.newId(), MessageAndSwipe.of(0, 0), 0L, 0, 1, 0)));

            List<NarrativeEvent> time = store.getActiveEventsOfKind(0, SwipeContext.defaults(), EventKind.TIME);
            assertEquals(1, time.size());
            assertInstanceOf(NarrativeEvent.TimeDelta.class, time.get(0));
        }
    }

    @Nested
    @DisplayName("Re-extraction")
    class Reextraction {

        @Test
        void newTurnBatch_supersedesOlderOne() {
            MessageAndSwipe turn = MessageAndSwipe.of(2, 0);
            store.appendTurn(turn, List.of(prop(2, 0, "lamp")));
            store.appendTurn(turn, List.of(prop(2, 0, "candle")));

            assertEquals(List.of("candle"), props(store.projectStateAtMessage(2, SwipeContext.defaults())));
            assertEquals(2, store.eventCount(), "superseded events stay in the log");
        }

        @Test
        void emptyTurnBatch_supersedesToo() {
            MessageAndSwipe turn = MessageAndSwipe.of(2, 0);
            store.appendTurn(turn, List.of(prop(2, 0, "lamp")));
            store.appendTurn(turn, List.of());

            assertTrue(store.getActiveEvents(2, SwipeContext.defaults()).isEmpty());
        }

        @Test
        void turnBatch_withForeignSource_isRejected() {
            assertThrows(ContractViolationException.class,
                () -> store.appendTurn(MessageAndSwipe.of(2, 0), List.of(prop(3, 0, "lamp"))));
            assertEquals(0, store.eventCount());
        }
    }

    @Nested
    @DisplayName("Plain appends")
    class PlainAppends {

        @Test
        void secondAppend_forSameMessage_keepsEarlierEvents() {
            store.appendEvents(List.of(prop(1, 0, "lamp")));
            store.appendEvents(List.of(prop(1, 0, "candle")));

            assertEquals(List.of("lamp", "candle"), props(store.projectStateAtMessage(1, SwipeContext.defaults())));
            assertEquals(2, store.getActiveEvents(1, SwipeContext.defaults()).size());
        }

        @Test
        void plainAppend_survivesReextraction() {
            store.appendEvents(List.of(prop(1, 0, "lamp")));
            store.appendTurn(MessageAndSwipe.of(1, 0), List.of(prop(1, 0, "candle")));
            store.appendTurn(MessageAndSwipe.of(1, 0), List.of(prop(1, 0, "rope")));

            assertEquals(List.of("lamp", "rope"), props(store.projectStateAtMessage(1, SwipeContext.defaults())));
        }

        @Test
        void appendAfterTurn_staysVisible() {
            store.appendTurn(MessageAndSwipe.of(1, 0), List.of(prop(1, 0, "lamp")));
            store.appendEvents(List.of(prop(1, 0, "candle")));

            assertEquals(List.of("lamp", "candle"), props(store.projectStateAtMessage(1, SwipeContext.defaults())));
        }
    }

    @Test
    void invalidEvent_rejectsWholeBatch() {
        List<NarrativeEvent> batch = List.of(
            prop(0, 0, "lamp"),
            new NarrativeEvent.PropAdded("not-a-uuid", MessageAndSwipe.of(0, 0), 0L, "candle"));

        assertThrows(ContractViolationException.class, () -> store.appendEvents(batch));
        assertEquals(0, store.eventCount());
        assertTrue(store.getActiveEvents(0, SwipeContext.defaults()).isEmpty());
    }

    @Nested
    @DisplayName("Checkpoints")
    class Checkpoints {

        @BeforeEach
        void seed() {
            for (int message = 0; message < 3; message++) {
                store.appendTurn(MessageAndSwipe.of(message, 0), List.of(prop(message, 0, "prop-" + message)));
            }
        }

        @Test
        void checkpoint_isUsedAsReplayBase() {
            store.addCheckpoint(2, SwipeContext.defaults());
            store.appendTurn(MessageAndSwipe.of(3, 0), List.of(prop(3, 0, "prop-3")));

            Projection projection = store.projectStateAtMessage(3, SwipeContext.defaults());

            assertEquals(2, projection.baseSnapshotMessageId());
            assertEquals(1, projection.eventsApplied());
            assertEquals(List.of("prop-0", "prop-1", "prop-2", "prop-3"), props(projection));
        }

        @Test
        void checkpoint_isIgnoredOnceEarlierTurnIsReextracted() {
            store.addCheckpoint(2, SwipeContext.defaults());
            store.appendTurn(MessageAndSwipe.of(1, 0), List.of(prop(1, 0, "replacement")));

            Projection projection = store.projectStateAtMessage(2, SwipeContext.defaults());

            assertEquals(Snapshot.BEFORE_FIRST_MESSAGE, projection.baseSnapshotMessageId());
            assertEquals(List.of("prop-0", "replacement", "prop-2"), props(projection));
        }

        @Test
        void checkpoint_onOtherSwipe_isIgnored() {
            store.addCheckpoint(2, SwipeContext.defaults());
            store.appendTurn(MessageAndSwipe.of(2, 1), List.of(prop(2, 1, "alternate")));

            Projection projection = store.projectStateAtMessage(2, SwipeContext.defaults().with(2, 1));

            assertEquals(Snapshot.BEFORE_FIRST_MESSAGE, projection.baseSnapshotMessageId());
            assertEquals(List.of("prop-0", "prop-1", "alternate"), props(projection));
        }

        @Test
        void replacingInitialSnapshot_discardsCheckpoints() {
            store.addCheckpoint(2, SwipeContext.defaults());
            store.replaceInitialSnapshot(NarrativeState.EMPTY);

            assertEquals(1, store.snapshots().size());
            assertEquals(Snapshot.BEFORE_FIRST_MESSAGE,
                store.projectStateAtMessage(2, SwipeContext.defaults()).baseSnapshotMessageId());
        }

        @Test
        @DisplayName("Replay consistency: checkpointed projection matches a full replay")
        void checkpointedProjection_matchesFullReplay() {
            store.addCheckpoint(1, SwipeContext.defaults());
            store.appendTurn(MessageAndSwipe.of(3, 0), List.of(
                new NarrativeEvent.CharacterAppeared(NarrativeEvent.newId(), MessageAndSwipe.of(3, 0), 0L,
                    "Luna", "by the door", null, List.of("curious"))));

            NarrativeState fromCheckpoint = store.projectStateAtMessage(3, SwipeContext.defaults()).state();
            NarrativeState fullReplay = ProjectionReducer.apply(
                store.initialSnapshot().state(), store.getActiveEvents(3, SwipeContext.defaults()));

            assertEquals(fullReplay, fromCheckpoint);
        }
    }

    private static NarrativeEvent prop(int message, int swipe, String name) {
        return new NarrativeEvent.PropAdded(NarrativeEvent.newId(), MessageAndSwipe.of(message, swipe), 0L, name);
    }

    private static List<String> props(Projection projection) {
        return projection.state().location().props().stream().collect(Collectors.toList());
    }
}
