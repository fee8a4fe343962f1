package com.chronicle.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared by everything working on one turn.
 * Listeners registered after cancellation run immediately.
 */
public class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private static final CancellationToken NONE = new CancellationToken() {
        @Override
        public void cancel() {
            throw new UnsupportedOperationException("the shared none() token cannot be cancelled");
        }
    };

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public static CancellationToken none() {
        return NONE;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            listeners.forEach(this::runListener);
        }
    }

    /**
     * Registers {@code listener} to run on cancellation.
     *
     * @return handle that unregisters the listener
     */
    public Runnable onCancel(Runnable listener) {
        listeners.add(listener);
        if (cancelled.get() && listeners.remove(listener)) {
            runListener(listener);
        }
        return () -> listeners.remove(listener);
    }

    private void runListener(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException ex) {
            log.warn("Cancellation listener failed: {}", ex.getMessage());
        }
    }
}
