package com.chronicle.orchestration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class BoundedWorkerPoolTest {

    private ExecutorService executor;
    private BoundedWorkerPool pool;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        pool = new BoundedWorkerPool(executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void results_keepInputOrder() {
        List<Integer> items = IntStream.range(0, 20).boxed().collect(Collectors.toList());

        List<String> results = pool.map(items, 3, (item, index) -> {
            sleep(20 - item);
            return item + "@" + index;
        });

        assertEquals(items.stream().map(i -> i + "@" + i).collect(Collectors.toList()), results);
    }

    @Test
    void inFlight_neverExceedsLimit() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        List<Integer> items = IntStream.range(0, 12).boxed().collect(Collectors.toList());

        pool.map(items, 2, (item, index) -> {
            int now = inFlight.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            sleep(10);
            inFlight.decrementAndGet();
            return item;
        });

        assertTrue(peak.get() <= 2, "peak concurrency was " + peak.get());
    }

    @Test
    void workerFailure_isRethrown_afterAllWorkersFinish() {
        AtomicInteger completed = new AtomicInteger();
        List<Integer> items = List.of(0, 1, 2, 3);

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> pool.map(items, 2, (item, index) -> {
            if (item == 1) {
                throw new IllegalStateException("unit 1 failed");
            }
            completed.incrementAndGet();
            return item;
        }));

        assertEquals("unit 1 failed", ex.getMessage());
        assertEquals(3, completed.get());
    }

    @Test
    void emptyInput_returnsEmpty() {
        assertTrue(pool.map(List.<Integer>of(), 4, (item, index) -> item).isEmpty());
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
