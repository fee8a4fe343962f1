package com.chronicle.generation;

import java.time.Duration;

/**
 * Cooldown policy for a prompt that keeps failing.
 */
public record BackoffPolicy(int failureThreshold, Duration baseCooldown, Duration maxCooldown) {

    public BackoffPolicy {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        if (baseCooldown == null || baseCooldown.isNegative() || maxCooldown == null || maxCooldown.isNegative()) {
            throw new IllegalArgumentException("cooldowns must be non-negative durations");
        }
    }

    /** {@code min(base * 2^(failures - threshold), max)} for failures at or over the threshold. */
    public long cooldownMillis(int consecutiveFailures) {
        int overThreshold = Math.max(0, consecutiveFailures - failureThreshold);
        long max = maxCooldown.toMillis();
        long cooldown = baseCooldown.toMillis();
        for (int i = 0; i < overThreshold && cooldown < max; i++) {
            cooldown *= 2;
        }
        return Math.min(cooldown, max);
    }
}
