package com.chronicle.orchestration;

import com.chronicle.extractor.ExtractionPhase;
import com.chronicle.extractor.Extractor;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Extractors in registration order. Names are unique.
 */
public class ExtractorRegistry {

    private final List<Extractor> extractors;

    public ExtractorRegistry(List<? extends Extractor> extractors) {
        Set<String> names = new HashSet<>();
        for (Extractor extractor : extractors) {
            if (!names.add(extractor.name())) {
                throw new IllegalArgumentException("duplicate extractor name: " + extractor.name());
            }
        }
        this.extractors = List.copyOf(extractors);
    }

    public List<Extractor> all() {
        return extractors;
    }

    public List<Extractor> inPhase(ExtractionPhase phase) {
        return extractors.stream()
            .filter(e -> e.phase() == phase)
            .collect(Collectors.toCollection(ArrayList::new));
    }

    public List<String> names() {
        return extractors.stream().map(Extractor::name).collect(Collectors.toList());
    }
}
