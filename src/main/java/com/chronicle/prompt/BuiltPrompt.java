package com.chronicle.prompt;

/**
 * A prompt with every placeholder filled, ready to send.
 */
public record BuiltPrompt(String system, String user) {
}
