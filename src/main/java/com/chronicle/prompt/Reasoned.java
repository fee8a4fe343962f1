package com.chronicle.prompt;

/**
 * Parsed responses that carry the model's own explanation.
 */
public interface Reasoned {

    String reasoning();
}
