package com.chronicle.orchestration;

import com.chronicle.event.MessageAndSwipe;
import com.chronicle.extractor.ExtractionContext;
import com.chronicle.extractor.ExtractionSettings;
import com.chronicle.generation.CancellationToken;
import com.chronicle.names.NameDisambiguator;
import com.chronicle.store.EventStore;
import com.chronicle.store.SwipeContext;

/**
 * Inputs of one {@link ExtractionOrchestrator#extractEvents} call.
 */
public record ExtractionTurn(EventStore store,
                             ExtractionContext context,
                             ExtractionSettings settings,
                             MessageAndSwipe currentMessage,
                             SwipeContext swipes,
                             CancellationToken cancellation,
                             NameDisambiguator disambiguator,
                             ExtractionProgress progress) {

    public ExtractionTurn {
        swipes = (swipes == null ? SwipeContext.defaults() : swipes)
            .with(currentMessage.messageId(), currentMessage.swipeId());
        cancellation = cancellation == null ? new CancellationToken() : cancellation;
        progress = progress == null ? ExtractionProgress.logging() : progress;
    }
}
