package com.chronicle.generation;

/**
 * Options for a generator call.
 */
public record GenerationOptions(
    double temperature,
    Integer maxTokens,              // nullable
    CancellationToken cancellation  // never null
) {
    public GenerationOptions {
        cancellation = cancellation == null ? CancellationToken.none() : cancellation;
    }

    public static GenerationOptions withTemperature(double temperature) {
        return new GenerationOptions(temperature, null, CancellationToken.none());
    }
}
