package com.chronicle.extractor;

/**
 * A failed unit of a turn. {@code extractor} is the extractor name, qualified
 * with the target for fan-out units ({@code outfitChange:Luna},
 * {@code feelingsChange:Alice/Bob}, {@code outfitChange:batch}).
 */
public record ExtractionError(String extractor, ErrorKind kind, String message) {
}
