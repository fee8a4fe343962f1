package com.chronicle.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Caps calls to a delegate generator at {@code maxRequestsPerMinute} over a
 * sliding one-minute window. Callers wait for a free slot; waiting stops when
 * the call's token is cancelled.
 */
public class RateLimitedGenerator implements Generator {

    private static final Logger log = LoggerFactory.getLogger(RateLimitedGenerator.class);

    static final long WINDOW_MS = 60_000L;
    private static final long POLL_MS = 100L;

    private final Generator delegate;
    private final int maxRequestsPerMinute;
    private final Clock clock;
    private final Deque<Long> sent = new ArrayDeque<>();

    public RateLimitedGenerator(Generator delegate, int maxRequestsPerMinute, Clock clock) {
        this.delegate = delegate;
        this.maxRequestsPerMinute = maxRequestsPerMinute;
        this.clock = clock;
    }

    @Override
    public String generate(GeneratorPrompt prompt, GenerationOptions options) {
        if (maxRequestsPerMinute > 0) {
            waitForSlot(prompt, options.cancellation());
        }
        return delegate.generate(prompt, options);
    }

    private void waitForSlot(GeneratorPrompt prompt, CancellationToken cancellation) {
        boolean logged = false;
        while (true) {
            if (cancellation.isCancelled()) {
                throw new GeneratorException("generation cancelled while waiting for a rate-limit slot: "
                    + prompt.promptName());
            }
            long waitMs = tryAcquire(clock.millis());
            if (waitMs == 0) {
                return;
            }
            if (!logged) {
                log.debug("{} waiting {}ms for a rate-limit slot", prompt.promptName(), waitMs);
                logged = true;
            }
            try {
                Thread.sleep(Math.min(waitMs, POLL_MS));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new GeneratorException("interrupted while waiting for a rate-limit slot", e);
            }
        }
    }

    /** @return 0 when a slot was taken, otherwise how long until the oldest call leaves the window */
    synchronized long tryAcquire(long now) {
        while (!sent.isEmpty() && now - sent.peekFirst() >= WINDOW_MS) {
            sent.pollFirst();
        }
        if (sent.size() < maxRequestsPerMinute) {
            sent.addLast(now);
            return 0;
        }
        return Math.max(1, WINDOW_MS - (now - sent.peekFirst()));
    }
}
