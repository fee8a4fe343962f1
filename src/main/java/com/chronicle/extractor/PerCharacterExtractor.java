package com.chronicle.extractor;

import com.chronicle.event.NarrativeEvent;

import java.util.List;

/**
 * Runs once per present character.
 */
public interface PerCharacterExtractor extends Extractor {

    List<NarrativeEvent> run(ExtractionRequest request, String character);
}
