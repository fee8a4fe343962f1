package com.chronicle.extractor;

import com.chronicle.event.NarrativeEvent;

import java.util.List;

/**
 * Runs once per turn over the whole scene.
 */
public interface GlobalExtractor extends Extractor {

    List<NarrativeEvent> run(ExtractionRequest request);
}
