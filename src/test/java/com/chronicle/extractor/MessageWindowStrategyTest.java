package com.chronicle.extractor;

import com.chronicle.contract.EventContractValidator;
import com.chronicle.event.EventType;
import com.chronicle.event.MessageAndSwipe;
import com.chronicle.event.NarrativeEvent;
import com.chronicle.generation.CancellationToken;
import com.chronicle.store.InMemoryEventStore;
import com.chronicle.store.SwipeContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MessageWindowStrategyTest {

    private static final MessageWindowStrategy SINCE_PROPS = MessageWindowStrategy.sinceLastEventOfKind(
        EventKindFilter.of(EventType.LOCATION_PROP_ADDED),
        EventKindFilter.of(EventType.LOCATION_PROP_REMOVED));

    private InMemoryEventStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryEventStore(new EventContractValidator());
    }

    private ExtractionRequest requestAt(int messageId, SwipeContext swipes) {
        return new ExtractionRequest(store, new ExtractionContext(List.of(), null, null, null, null),
            ExtractionSettings.defaults(), MessageAndSwipe.of(messageId, swipes.activeSwipe(messageId)), swipes,
            List.of(), CancellationToken.none(), null, new ExtractionDiagnostics(), 0L);
    }

    @Test
    void fixedNumber_endsAtCurrentMessage() {
        assertEquals(new MessageRange(4, 5), MessageWindowStrategy.fixedNumber(2).resolve(requestAt(5, SwipeContext.defaults())));
        assertEquals(new MessageRange(0, 0), MessageWindowStrategy.fixedNumber(4).resolve(requestAt(0, SwipeContext.defaults())));
    }

    @Test
    void sinceLastEvent_startsAtThatEventsMessage() {
        store.appendTurn(MessageAndSwipe.of(3, 0), List.of(
            new NarrativeEvent.PropAdded(NarrativeEvent.newId(), MessageAndSwipe.of(3, 0), 0L, "lantern")));
        store.appendTurn(MessageAndSwipe.of(5, 0), List.of(
            new NarrativeEvent.TimeDelta(NarrativeEvent.newId(), MessageAndSwipe.of(5, 0), 0L, 0, 1, 0)));

        assertEquals(new MessageRange(3, 7), SINCE_PROPS.resolve(requestAt(7, SwipeContext.defaults())));
    }

    @Test
    void sinceLastEvent_withoutMatch_startsAtChatStart() {
        assertEquals(new MessageRange(0, 6), SINCE_PROPS.resolve(requestAt(6, SwipeContext.defaults())));
    }

    @Test
    void sinceLastEvent_ignoresCurrentMessageAndInactiveSwipes() {
        store.appendTurn(MessageAndSwipe.of(2, 1), List.of(
            new NarrativeEvent.PropAdded(NarrativeEvent.newId(), MessageAndSwipe.of(2, 1), 0L, "lantern")));
        store.appendTurn(MessageAndSwipe.of(6, 0), List.of(
            new NarrativeEvent.PropRemoved(NarrativeEvent.newId(), MessageAndSwipe.of(6, 0), 0L, "lantern")));

        assertEquals(new MessageRange(0, 6), SINCE_PROPS.resolve(requestAt(6, SwipeContext.defaults())));
        assertEquals(new MessageRange(2, 6), SINCE_PROPS.resolve(requestAt(6, SwipeContext.defaults().with(2, 1))));
    }

    @Test
    void limit_keepsMostRecentMessages() {
        MessageRange range = new MessageRange(0, 7);

        assertEquals(new MessageRange(5, 7), range.limit(3));
        assertEquals(range, range.limit(null));
        assertEquals(range, range.limit(0));
        assertEquals(3, range.limit(3).size());
    }

    @Test
    void range_isClampedToChatStart() {
        assertEquals(new MessageRange(0, 2), new MessageRange(-3, 2));
        assertEquals(new MessageRange(4, 4), new MessageRange(4, 1));
    }
}
