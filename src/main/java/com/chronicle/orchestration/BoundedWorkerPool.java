package com.chronicle.orchestration;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.BiFunction;

/**
 * Maps items with at most {@code maxConcurrency} in flight while keeping
 * results in input order. Workers claim the next unclaimed index; the calling
 * thread is one of the workers.
 */
public class BoundedWorkerPool {

    private final ExecutorService executor;

    public BoundedWorkerPool(ExecutorService executor) {
        this.executor = executor;
    }

    public <T, R> List<R> map(List<T> items, int maxConcurrency, BiFunction<T, Integer, R> worker) {
        if (items.isEmpty()) {
            return List.of();
        }
        int concurrency = Math.min(Math.max(1, maxConcurrency), items.size());
        AtomicInteger nextIndex = new AtomicInteger(0);
        AtomicReferenceArray<R> results = new AtomicReferenceArray<>(items.size());

        Runnable loop = () -> {
            while (true) {
                int current = nextIndex.getAndIncrement();
                if (current >= items.size()) {
                    return;
                }
                results.set(current, worker.apply(items.get(current), current));
            }
        };

        List<Future<?>> helpers = new ArrayList<>(concurrency - 1);
        for (int i = 1; i < concurrency; i++) {
            helpers.add(executor.submit(loop));
        }

        RuntimeException failure = null;
        try {
            loop.run();
        } catch (RuntimeException ex) {
            failure = ex;
        }
        for (Future<?> helper : helpers) {
            try {
                helper.get();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                helpers.forEach(h -> h.cancel(true));
                throw new IllegalStateException("interrupted while waiting for workers", ex);
            } catch (ExecutionException ex) {
                if (failure == null) {
                    failure = ex.getCause() instanceof RuntimeException runtime
                        ? runtime
                        : new IllegalStateException(ex.getCause());
                }
            }
        }
        if (failure != null) {
            throw failure;
        }

        List<R> ordered = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            ordered.add(results.get(i));
        }
        return ordered;
    }
}
