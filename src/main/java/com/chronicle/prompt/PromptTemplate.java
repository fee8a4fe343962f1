package com.chronicle.prompt;

/**
 * Named prompt plus the validator for its response.
 *
 * @param <T> typed result of a valid response
 */
public interface PromptTemplate<T> {

    String name();

    String systemPrompt();

    /** User message with {@code {{placeholder}}} markers. */
    String userTemplate();

    double defaultTemperature();

    /**
     * Maps a raw model response to a typed result.
     *
     * @return the result, or {@code null} when the response does not validate
     */
    T parseResponse(String rawResponse);
}
