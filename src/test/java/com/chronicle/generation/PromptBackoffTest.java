package com.chronicle.generation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PromptBackoffTest {

    private PromptBackoff backoff;

    @BeforeEach
    void setUp() {
        backoff = new PromptBackoff(Map.of(
            "tension_change", new BackoffPolicy(2, Duration.ofSeconds(30), Duration.ofMinutes(5))));
    }

    @Test
    void cooldownStartsAtThreshold_andSuccessClearsIt() {
        backoff.recordFailure("tension_change", 1000);
        assertFalse(backoff.shouldSkip("tension_change", 1001).skip(), "one failure is under the threshold");

        backoff.recordFailure("tension_change", 2000);
        PromptBackoff.Decision decision = backoff.shouldSkip("tension_change", 2001);
        assertTrue(decision.skip());
        assertEquals(29_999, decision.remainingMs());

        backoff.recordSuccess("tension_change");
        assertFalse(backoff.shouldSkip("tension_change", 2002).skip());
        assertEquals(0, backoff.consecutiveFailures("tension_change"));
    }

    @Test
    void cooldownExpires() {
        backoff.recordFailure("tension_change", 0);
        backoff.recordFailure("tension_change", 0);

        assertTrue(backoff.shouldSkip("tension_change", 29_999).skip());
        assertFalse(backoff.shouldSkip("tension_change", 30_000).skip());
    }

    @Test
    void cooldownDoubles_andIsCapped() {
        BackoffPolicy policy = new BackoffPolicy(2, Duration.ofSeconds(30), Duration.ofMinutes(5));

        assertEquals(30_000, policy.cooldownMillis(2));
        assertEquals(60_000, policy.cooldownMillis(3));
        assertEquals(120_000, policy.cooldownMillis(4));
        assertEquals(300_000, policy.cooldownMillis(10));
    }

    @Test
    void promptWithoutPolicy_isNeverSkipped() {
        for (int i = 0; i < 5; i++) {
            backoff.recordFailure("mood_change", 1000);
        }
        assertFalse(backoff.shouldSkip("mood_change", 1001).skip());
        assertEquals(0, backoff.consecutiveFailures("mood_change"));
    }

    @Test
    void invalidPolicy_isRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new BackoffPolicy(0, Duration.ofSeconds(1), Duration.ofSeconds(2)));
    }
}
