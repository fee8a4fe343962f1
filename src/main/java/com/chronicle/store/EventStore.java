package com.chronicle.store;

import com.chronicle.event.EventKind;
import com.chronicle.event.MessageAndSwipe;
import com.chronicle.event.NarrativeEvent;
import com.chronicle.projection.NarrativeState;
import com.chronicle.projection.Projection;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Append-only event log of one chat plus its snapshots.
 *
 * Only the most recent append batch of each (message, swipe) is active;
 * older batches are superseded, never deleted.
 */
public interface EventStore {

    Projection projectStateAtMessage(int messageId, SwipeContext swipeContext);

    /**
     * Validates and appends events as one batch. A contract violation in any
     * event rejects the whole batch. Appended events are never hidden by later
     * appends, only {@link #appendTurn} batches are superseded.
     *
     * @return the batch number
     */
    long appendEvents(List<? extends NarrativeEvent> events);

    /**
     * Appends the events extracted for {@code turn} as one batch. The batch
     * supersedes earlier batches for the same turn even when empty.
     */
    long appendTurn(MessageAndSwipe turn, List<? extends NarrativeEvent> events);

    List<NarrativeEvent> getActiveEvents(int upToMessageId, SwipeContext swipeContext);

    List<NarrativeEvent> getActiveEventsMatching(int upToMessageId,
                                                 SwipeContext swipeContext,
                                                 Predicate<NarrativeEvent> filter);

    default List<NarrativeEvent> getActiveEventsOfKind(int upToMessageId, SwipeContext swipeContext, EventKind kind) {
        return getActiveEventsMatching(upToMessageId, swipeContext, e -> e.kind() == kind);
    }

    Optional<NarrativeEvent> findLatestEventMatching(int upToMessageId,
                                                     SwipeContext swipeContext,
                                                     Predicate<NarrativeEvent> filter);

    List<StoredEvent> allEvents();

    List<Snapshot> snapshots();

    Snapshot initialSnapshot();

    void replaceInitialSnapshot(NarrativeState state);

    /**
     * Materializes the projection at {@code messageId} as a checkpoint.
     */
    Snapshot addCheckpoint(int messageId, SwipeContext swipeContext);

    long eventCount();
}
