package com.chronicle.generation;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RateLimitedGeneratorTest {

    private final Clock clock = Clock.fixed(Instant.EPOCH, ZoneOffset.UTC);

    @Test
    void slotsFreeUpAfterTheWindow() {
        RateLimitedGenerator limited = new RateLimitedGenerator(mock(Generator.class), 2, clock);

        assertEquals(0, limited.tryAcquire(0));
        assertEquals(0, limited.tryAcquire(10_000));
        assertEquals(RateLimitedGenerator.WINDOW_MS - 20_000, limited.tryAcquire(20_000));
        assertEquals(0, limited.tryAcquire(RateLimitedGenerator.WINDOW_MS));
    }

    @Test
    void cancelledCall_stopsWaiting() {
        Generator delegate = mock(Generator.class);
        RateLimitedGenerator limited = new RateLimitedGenerator(delegate, 1, clock);
        limited.tryAcquire(clock.millis());

        CancellationToken token = new CancellationToken();
        token.cancel();
        GeneratorPrompt prompt = new GeneratorPrompt("sys", "user", "mood_change");

        assertThrows(GeneratorException.class,
            () -> limited.generate(prompt, new GenerationOptions(0.5, null, token)));
        verify(delegate, never()).generate(any(), any());
    }

    @Test
    void disabledLimit_passesThrough() {
        Generator delegate = mock(Generator.class);
        when(delegate.generate(any(), any())).thenReturn("ok");
        RateLimitedGenerator limited = new RateLimitedGenerator(delegate, 0, clock);

        for (int i = 0; i < 5; i++) {
            assertEquals("ok", limited.generate(new GeneratorPrompt("s", "u", "p"),
                GenerationOptions.withTemperature(0.5)));
        }
        verify(delegate, times(5)).generate(any(), any());
    }
}
