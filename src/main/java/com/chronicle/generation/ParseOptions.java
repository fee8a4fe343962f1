package com.chronicle.generation;

/**
 * Retry and sampling settings for one {@link PromptExecutor} call.
 */
public record ParseOptions(int maxRetries,
                           double retryTemperature,
                           Integer maxTokens,
                           String profileId,
                           CancellationToken cancellation) {

    public static final int DEFAULT_MAX_RETRIES = 2;
    public static final double DEFAULT_RETRY_TEMPERATURE = 0.1;

    public ParseOptions {
        maxRetries = Math.max(0, maxRetries);
        cancellation = cancellation == null ? CancellationToken.none() : cancellation;
    }

    public static ParseOptions defaults() {
        return new ParseOptions(DEFAULT_MAX_RETRIES, DEFAULT_RETRY_TEMPERATURE, null, "default", CancellationToken.none());
    }

    public ParseOptions withCancellation(CancellationToken token) {
        return new ParseOptions(maxRetries, retryTemperature, maxTokens, profileId, token);
    }
}
