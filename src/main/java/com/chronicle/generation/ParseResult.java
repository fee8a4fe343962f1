package com.chronicle.generation;

/**
 * Outcome of {@link PromptExecutor#generateAndParse}.
 *
 * @param cooldown true when the prompt was skipped because it is in backoff
 * @param cached true when served from the result cache
 */
public record ParseResult<T>(boolean success,
                             T data,
                             String error,
                             boolean aborted,
                             boolean cooldown,
                             boolean cached,
                             String rawResponse,
                             String reasoning) {

    public static <T> ParseResult<T> success(T data, String rawResponse, String reasoning, boolean cached) {
        return new ParseResult<>(true, data, null, false, false, cached, rawResponse, reasoning);
    }

    public static <T> ParseResult<T> failure(String error, String rawResponse) {
        return new ParseResult<>(false, null, error, false, false, false, rawResponse, null);
    }

    public static <T> ParseResult<T> cooldown(long remainingMs) {
        return new ParseResult<>(false, null, "cooldown active (" + remainingMs + "ms remaining)",
            false, true, false, null, null);
    }

    public static <T> ParseResult<T> abortedResult() {
        return new ParseResult<>(false, null, null, true, false, false, null, null);
    }
}
