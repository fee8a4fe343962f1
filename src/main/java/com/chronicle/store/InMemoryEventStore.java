package com.chronicle.store;

import com.chronicle.contract.ContractViolationException;
import com.chronicle.contract.EventContractValidator;
import com.chronicle.event.MessageAndSwipe;
import com.chronicle.event.NarrativeEvent;
import com.chronicle.projection.NarrativeState;
import com.chronicle.projection.Projection;
import com.chronicle.projection.ProjectionReducer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Event store of a single chat kept in memory. Appends are serialized; reads
 * work on copy-on-write lists and never block.
 */
public class InMemoryEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private static final Comparator<StoredEvent> LOG_ORDER = Comparator
        .comparing((StoredEvent e) -> e.event().source())
        .thenComparingLong(StoredEvent::sequence);

    private final EventContractValidator validator;
    private final Clock clock;
    private final CopyOnWriteArrayList<StoredEvent> events = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<Snapshot> checkpoints = new CopyOnWriteArrayList<>();
    private final Map<MessageAndSwipe, Long> latestTurn = new ConcurrentHashMap<>();
    private final Set<Long> turnBatches = ConcurrentHashMap.newKeySet();
    private final AtomicLong sequence = new AtomicLong(0);
    private final AtomicLong batches = new AtomicLong(0);
    private volatile Snapshot initial;

    public InMemoryEventStore(EventContractValidator validator, NarrativeState initialState, Clock clock) {
        this.validator = validator;
        this.clock = clock;
        this.initial = Snapshot.initial(initialState, clock.millis());
    }

    public InMemoryEventStore(EventContractValidator validator) {
        this(validator, NarrativeState.EMPTY, Clock.systemUTC());
    }

    @Override
    public Projection projectStateAtMessage(int messageId, SwipeContext swipeContext) {
        List<StoredEvent> active = activeStoredEvents(messageId, swipeContext);
        Snapshot base = initial;
        for (Snapshot checkpoint : checkpoints) {
            if (checkpoint.messageId() > messageId || checkpoint.messageId() < base.messageId()) {
                continue;
            }
            if (!swipeContext.isActive(MessageAndSwipe.of(checkpoint.messageId(), checkpoint.swipeId()))) {
                continue;
            }
            List<StoredEvent> basis = upTo(active, checkpoint.messageId());
            if (basis.size() == checkpoint.basisSize() && fingerprint(basis) == checkpoint.basisHash()) {
                base = checkpoint;
            }
        }

        final int baseMessage = base.messageId();
        List<NarrativeEvent> replay = active.stream()
            .filter(e -> e.event().source().messageId() > baseMessage)
            .map(StoredEvent::event)
            .collect(Collectors.toList());
        NarrativeState state = ProjectionReducer.apply(base.state(), replay);
        return new Projection(messageId, state, baseMessage, replay.size());
    }

    @Override
    public synchronized long appendEvents(List<? extends NarrativeEvent> batch) {
        validator.validateAll(batch);
        long batchId = batches.incrementAndGet();
        for (NarrativeEvent event : batch) {
            events.add(new StoredEvent(sequence.incrementAndGet(), batchId, event));
        }
        log.debug("Appended batch={} events={}", batchId, batch.size());
        return batchId;
    }

    @Override
    public synchronized long appendTurn(MessageAndSwipe turn, List<? extends NarrativeEvent> batch) {
        validator.validateAll(batch);
        for (NarrativeEvent event : batch) {
            if (!turn.equals(event.source())) {
                throw new ContractViolationException(
                    "event " + event.id() + " source " + event.source() + " does not match turn " + turn);
            }
        }
        long batchId = batches.incrementAndGet();
        turnBatches.add(batchId);
        for (NarrativeEvent event : batch) {
            events.add(new StoredEvent(sequence.incrementAndGet(), batchId, event));
        }
        Long previous = latestTurn.put(turn, batchId);
        if (previous != null) {
            log.info("Turn message={} swipe={} re-extracted, batch={} supersedes batch={}",
                turn.messageId(), turn.swipeId(), batchId, previous);
        }
        return batchId;
    }

    @Override
    public List<NarrativeEvent> getActiveEvents(int upToMessageId, SwipeContext swipeContext) {
        return activeStoredEvents(upToMessageId, swipeContext).stream()
            .map(StoredEvent::event)
            .collect(Collectors.toList());
    }

    @Override
    public List<NarrativeEvent> getActiveEventsMatching(int upToMessageId,
                                                        SwipeContext swipeContext,
                                                        Predicate<NarrativeEvent> filter) {
        return activeStoredEvents(upToMessageId, swipeContext).stream()
            .map(StoredEvent::event)
            .filter(filter)
            .collect(Collectors.toList());
    }

    @Override
    public Optional<NarrativeEvent> findLatestEventMatching(int upToMessageId,
                                                            SwipeContext swipeContext,
                                                            Predicate<NarrativeEvent> filter) {
        List<NarrativeEvent> matching = getActiveEventsMatching(upToMessageId, swipeContext, filter);
        return matching.isEmpty() ? Optional.empty() : Optional.of(matching.get(matching.size() - 1));
    }

    @Override
    public List<StoredEvent> allEvents() {
        return List.copyOf(events);
    }

    @Override
    public List<Snapshot> snapshots() {
        List<Snapshot> all = new ArrayList<>();
        all.add(initial);
        all.addAll(checkpoints);
        return all;
    }

    @Override
    public Snapshot initialSnapshot() {
        return initial;
    }

    @Override
    public synchronized void replaceInitialSnapshot(NarrativeState state) {
        initial = Snapshot.initial(state, clock.millis());
        // checkpoints were built on top of the old initial state
        checkpoints.clear();
        log.info("Initial snapshot replaced, checkpoints discarded");
    }

    @Override
    public synchronized Snapshot addCheckpoint(int messageId, SwipeContext swipeContext) {
        List<StoredEvent> basis = activeStoredEvents(messageId, swipeContext);
        Projection projection = projectStateAtMessage(messageId, swipeContext);
        Snapshot checkpoint = new Snapshot(
            SnapshotType.CHECKPOINT,
            messageId,
            swipeContext.activeSwipe(messageId),
            projection.state(),
            fingerprint(basis),
            basis.size(),
            clock.millis()
        );
        checkpoints.add(checkpoint);
        log.debug("Checkpoint at message={} over {} events", messageId, basis.size());
        return checkpoint;
    }

    @Override
    public long eventCount() {
        return events.size();
    }

    private List<StoredEvent> activeStoredEvents(int upToMessageId, SwipeContext swipeContext) {
        return events.stream()
            .filter(e -> e.event().source().messageId() <= upToMessageId)
            .filter(e -> swipeContext.isActive(e.event().source()))
            .filter(this::isCurrent)
            .sorted(LOG_ORDER)
            .collect(Collectors.toList());
    }

    /** Plain appends stay visible; a turn batch only until the turn is re-extracted. */
    private boolean isCurrent(StoredEvent stored) {
        if (!turnBatches.contains(stored.batch())) {
            return true;
        }
        return latestTurn.getOrDefault(stored.event().source(), stored.batch()) == stored.batch();
    }

    private static List<StoredEvent> upTo(List<StoredEvent> ordered, int messageId) {
        return ordered.stream()
            .filter(e -> e.event().source().messageId() <= messageId)
            .collect(Collectors.toList());
    }

    private static long fingerprint(List<StoredEvent> basis) {
        long hash = 1125899906842597L;
        for (StoredEvent e : basis) {
            hash = 31 * hash + e.sequence();
        }
        return hash;
    }
}
