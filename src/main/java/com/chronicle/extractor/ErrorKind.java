package com.chronicle.extractor;

public enum ErrorKind {
    /** Response never validated after all retries. */
    PARSE_FAILURE,
    /** Prompt skipped while in backoff. */
    COOLDOWN_ACTIVE,
    /** Exception thrown inside an extraction unit. */
    EXTRACTOR_EXCEPTION
}
