package com.chronicle.session;

import com.chronicle.generation.CancellationToken;
import com.chronicle.names.CachingNameDisambiguator;
import com.chronicle.orchestration.ExtractionOrchestrator;
import com.chronicle.store.EventStore;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One chat: its event store, its orchestrator with run history, and the name
 * answers given so far. At most one turn runs at a time.
 */
public class ChatSession {

    private final String id;
    private final EventStore store;
    private final ExtractionOrchestrator orchestrator;
    private final CachingNameDisambiguator disambiguator;
    private final long createdAt;
    private final AtomicReference<CancellationToken> runningTurn = new AtomicReference<>();
    private final AtomicInteger lastCheckpointMessage = new AtomicInteger(-1);

    public ChatSession(String id,
                       EventStore store,
                       ExtractionOrchestrator orchestrator,
                       CachingNameDisambiguator disambiguator,
                       long createdAt) {
        this.id = id;
        this.store = store;
        this.orchestrator = orchestrator;
        this.disambiguator = disambiguator;
        this.createdAt = createdAt;
    }

    public String id() {
        return id;
    }

    public EventStore store() {
        return store;
    }

    public ExtractionOrchestrator orchestrator() {
        return orchestrator;
    }

    public CachingNameDisambiguator disambiguator() {
        return disambiguator;
    }

    public long createdAt() {
        return createdAt;
    }

    /** Claims the session for a turn; false when one is already running. */
    boolean beginTurn(CancellationToken token) {
        return runningTurn.compareAndSet(null, token);
    }

    void endTurn(CancellationToken token) {
        runningTurn.compareAndSet(token, null);
    }

    public Optional<CancellationToken> runningTurn() {
        return Optional.ofNullable(runningTurn.get());
    }

    int lastCheckpointMessage() {
        return lastCheckpointMessage.get();
    }

    void checkpointTaken(int messageId) {
        lastCheckpointMessage.set(messageId);
    }
}
