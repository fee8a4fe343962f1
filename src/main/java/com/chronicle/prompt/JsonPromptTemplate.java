package com.chronicle.prompt;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.function.Function;

/**
 * Template whose response is a JSON object mapped by {@code mapper}. The mapper
 * returns {@code null} for responses that do not validate.
 */
public record JsonPromptTemplate<T>(String name,
                                    String systemPrompt,
                                    String userTemplate,
                                    double defaultTemperature,
                                    Function<JsonNode, T> mapper) implements PromptTemplate<T> {

    public static <T> JsonPromptTemplate<T> of(String name,
                                               String systemPrompt,
                                               String userTemplate,
                                               double defaultTemperature,
                                               Function<JsonNode, T> mapper) {
        return new JsonPromptTemplate<>(name, systemPrompt, userTemplate, defaultTemperature, mapper);
    }

    @Override
    public T parseResponse(String rawResponse) {
        return JsonResponses.readObject(rawResponse).map(mapper).orElse(null);
    }
}
