package com.chronicle.extractor;

@FunctionalInterface
public interface SettingsProvider {

    ExtractionSettings current();
}
