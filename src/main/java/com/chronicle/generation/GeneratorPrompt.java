package com.chronicle.generation;

/**
 * What the generator sends: a system message, a user message and the prompt
 * name used for logging and metrics.
 */
public record GeneratorPrompt(String system, String user, String promptName) {
}
