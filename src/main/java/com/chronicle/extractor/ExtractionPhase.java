package com.chronicle.extractor;

/**
 * Phases of a turn, executed in declaration order.
 */
public enum ExtractionPhase {
    CORE("Extracting core state..."),
    CHARACTER_PRESENCE("Detecting character presence..."),
    PER_CHARACTER("Extracting character states..."),
    PROPS("Extracting props changes..."),
    RELATIONSHIP_SUBJECTS("Extracting relationship subjects..."),
    PER_PAIR("Extracting relationship details..."),
    NARRATIVE("Extracting narrative..."),
    CHAPTER("Checking chapter boundaries...");

    private final String label;

    ExtractionPhase(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
