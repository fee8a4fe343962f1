package com.chronicle.extractor;

import java.util.List;

/**
 * Per-character extractor that can cover several characters in one call.
 */
public interface BatchCapable extends PerCharacterExtractor {

    BatchAttempt runBatch(ExtractionRequest request, List<String> characters);
}
