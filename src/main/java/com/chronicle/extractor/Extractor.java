package com.chronicle.extractor;

/**
 * A unit of extraction work with its own cadence and message window.
 */
public interface Extractor {

    /** Stable identifier; keys the run history and qualifies error names. */
    String name();

    String displayName();

    TrackCategory category();

    ExtractionPhase phase();

    RunStrategy runStrategy();

    MessageWindowStrategy messageStrategy();

    double defaultTemperature();

    default boolean shouldRun(RunStrategyContext context) {
        return context.request().settings().isTracking(category()) && runStrategy().shouldFire(context);
    }
}
