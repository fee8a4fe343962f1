package com.chronicle.extractor;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Collects the errors of one turn; safe to use from fan-out workers.
 */
public class ExtractionDiagnostics {

    private final CopyOnWriteArrayList<ExtractionError> errors = new CopyOnWriteArrayList<>();

    public void report(String unit, ErrorKind kind, String message) {
        errors.add(new ExtractionError(unit, kind, message));
    }

    public List<ExtractionError> errors() {
        return List.copyOf(errors);
    }
}
