package com.chronicle.generation;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-prompt cooldown after repeated failures. Prompts without a policy are
 * never skipped.
 */
public class PromptBackoff {

    private final Map<String, BackoffPolicy> policies;
    private final ConcurrentHashMap<String, BackoffState> states = new ConcurrentHashMap<>();

    public PromptBackoff(Map<String, BackoffPolicy> policies) {
        this.policies = Map.copyOf(policies);
    }

    public record Decision(boolean skip, long remainingMs) {
        static final Decision PROCEED = new Decision(false, 0);
    }

    public Decision shouldSkip(String promptName) {
        return shouldSkip(promptName, System.currentTimeMillis());
    }

    public Decision shouldSkip(String promptName, long now) {
        if (!policies.containsKey(promptName)) {
            return Decision.PROCEED;
        }
        return state(promptName).decide(now);
    }

    public void recordSuccess(String promptName) {
        if (policies.containsKey(promptName)) {
            state(promptName).reset();
        }
    }

    public void recordFailure(String promptName) {
        recordFailure(promptName, System.currentTimeMillis());
    }

    public void recordFailure(String promptName, long now) {
        BackoffPolicy policy = policies.get(promptName);
        if (policy != null) {
            state(promptName).fail(policy, now);
        }
    }

    public int consecutiveFailures(String promptName) {
        BackoffState state = states.get(promptName);
        return state == null ? 0 : state.failures();
    }

    public void reset() {
        states.clear();
    }

    private BackoffState state(String promptName) {
        return states.computeIfAbsent(promptName, ignored -> new BackoffState());
    }

    private static final class BackoffState {
        private int consecutiveFailures;
        private long cooldownUntil;

        private synchronized Decision decide(long now) {
            if (cooldownUntil > now) {
                return new Decision(true, cooldownUntil - now);
            }
            return Decision.PROCEED;
        }

        private synchronized void fail(BackoffPolicy policy, long now) {
            consecutiveFailures++;
            if (consecutiveFailures >= policy.failureThreshold()) {
                cooldownUntil = now + policy.cooldownMillis(consecutiveFailures);
            }
        }

        private synchronized void reset() {
            consecutiveFailures = 0;
            cooldownUntil = 0;
        }

        private synchronized int failures() {
            return consecutiveFailures;
        }
    }
}
