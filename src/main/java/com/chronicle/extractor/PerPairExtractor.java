package com.chronicle.extractor;

import com.chronicle.event.CharacterPair;
import com.chronicle.event.NarrativeEvent;

import java.util.List;

/**
 * Runs once per unordered pair of present characters.
 */
public interface PerPairExtractor extends Extractor {

    List<NarrativeEvent> run(ExtractionRequest request, CharacterPair pair);
}
