package com.chronicle.extractor;

import com.chronicle.event.MessageAndSwipe;
import com.chronicle.event.NarrativeEvent;
import com.chronicle.generation.CancellationToken;
import com.chronicle.generation.PromptExecutor;
import com.chronicle.projection.NarrativeState;
import com.chronicle.projection.ProjectionReducer;
import com.chronicle.store.EventStore;
import com.chronicle.store.SwipeContext;

import java.util.List;

/**
 * Everything an extractor sees for one run. {@code turnEvents} is an immutable
 * copy of what earlier extractors produced this turn. {@code stateBeforeTurn}
 * is the projection at the previous message, replayed once per turn and
 * carried over by {@link #withTurnEvents}.
 */
public record ExtractionRequest(EventStore store,
                                ExtractionContext context,
                                ExtractionSettings settings,
                                MessageAndSwipe currentMessage,
                                SwipeContext swipes,
                                List<NarrativeEvent> turnEvents,
                                CancellationToken cancellation,
                                PromptExecutor promptExecutor,
                                ExtractionDiagnostics diagnostics,
                                long timestamp,
                                NarrativeState stateBeforeTurn) {

    public ExtractionRequest {
        turnEvents = List.copyOf(turnEvents);
    }

    /** Projects the state before the turn from {@code store}. */
    public ExtractionRequest(EventStore store,
                             ExtractionContext context,
                             ExtractionSettings settings,
                             MessageAndSwipe currentMessage,
                             SwipeContext swipes,
                             List<NarrativeEvent> turnEvents,
                             CancellationToken cancellation,
                             PromptExecutor promptExecutor,
                             ExtractionDiagnostics diagnostics,
                             long timestamp) {
        this(store, context, settings, currentMessage, swipes, turnEvents, cancellation, promptExecutor,
            diagnostics, timestamp, store.projectStateAtMessage(currentMessage.messageId() - 1, swipes).state());
    }

    public ExtractionRequest withTurnEvents(List<NarrativeEvent> events) {
        return new ExtractionRequest(store, context, settings, currentMessage, swipes, events,
            cancellation, promptExecutor, diagnostics, timestamp, stateBeforeTurn);
    }

    /** State before this turn with this turn's events so far applied. */
    public NarrativeState currentState() {
        return ProjectionReducer.apply(stateBeforeTurn(), turnEvents);
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }
}
