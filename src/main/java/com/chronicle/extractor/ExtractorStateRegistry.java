package com.chronicle.extractor;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Run history per extractor name, created lazily.
 */
public class ExtractorStateRegistry {

    private final ConcurrentHashMap<String, ExtractorState> states = new ConcurrentHashMap<>();

    public ExtractorState get(String extractorName) {
        return states.computeIfAbsent(extractorName, ignored -> new ExtractorState());
    }

    public Map<String, ExtractorState> snapshot() {
        Map<String, ExtractorState> copy = new TreeMap<>();
        states.forEach((name, state) -> copy.put(name, state.copy()));
        return copy;
    }

    public void reset() {
        states.clear();
    }
}
