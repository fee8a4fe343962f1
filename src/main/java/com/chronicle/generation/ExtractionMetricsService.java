package com.chronicle.generation;

import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counters for LLM activity per prompt name.
 */
@Service
public class ExtractionMetricsService {

    private final ConcurrentHashMap<String, PromptCounters> prompts = new ConcurrentHashMap<>();
    private final LongAdder turnsCompleted = new LongAdder();
    private final LongAdder turnsAborted = new LongAdder();
    private final LongAdder eventsCommitted = new LongAdder();

    public void recordAttempt(String promptName, boolean retry) {
        PromptCounters counters = counters(promptName);
        counters.attempts.increment();
        if (retry) {
            counters.retries.increment();
        }
    }

    public void recordResult(String promptName, boolean success) {
        PromptCounters counters = counters(promptName);
        if (success) {
            counters.successes.increment();
        } else {
            counters.failures.increment();
        }
    }

    /**
     * Records a prompt that was not sent, e.g. {@code prompt-cache-hit} or
     * {@code prompt-cooldown}.
     */
    public void recordSkip(String promptName, String reason) {
        counters(promptName).skips.computeIfAbsent(reason, r -> new LongAdder()).increment();
    }

    public void recordTurn(boolean aborted, int committedEvents) {
        if (aborted) {
            turnsAborted.increment();
        } else {
            turnsCompleted.increment();
            eventsCommitted.add(committedEvents);
        }
    }

    public Map<String, Object> snapshot() {
        Map<String, Object> perPrompt = new TreeMap<>();
        prompts.forEach((name, counters) -> perPrompt.put(name, counters.snapshot()));

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("turnsCompleted", turnsCompleted.sum());
        metrics.put("turnsAborted", turnsAborted.sum());
        metrics.put("eventsCommitted", eventsCommitted.sum());
        metrics.put("prompts", perPrompt);
        return metrics;
    }

    private PromptCounters counters(String promptName) {
        return prompts.computeIfAbsent(promptName, n -> new PromptCounters());
    }

    private static final class PromptCounters {
        private final LongAdder attempts = new LongAdder();
        private final LongAdder retries = new LongAdder();
        private final LongAdder successes = new LongAdder();
        private final LongAdder failures = new LongAdder();
        private final ConcurrentHashMap<String, LongAdder> skips = new ConcurrentHashMap<>();

        Map<String, Object> snapshot() {
            Map<String, Object> skipCounts = new TreeMap<>();
            skips.forEach((reason, count) -> skipCounts.put(reason, count.sum()));

            Map<String, Object> metrics = new LinkedHashMap<>();
            metrics.put("attempts", attempts.sum());
            metrics.put("retries", retries.sum());
            metrics.put("successes", successes.sum());
            metrics.put("failures", failures.sum());
            metrics.put("skips", skipCounts);
            return metrics;
        }
    }
}
