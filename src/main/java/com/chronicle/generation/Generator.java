package com.chronicle.generation;

/**
 * The LLM call. Implementations block until the text is available.
 */
public interface Generator {

    /**
     * @throws GeneratorException when the call fails or is cancelled
     */
    String generate(GeneratorPrompt prompt, GenerationOptions options);
}
