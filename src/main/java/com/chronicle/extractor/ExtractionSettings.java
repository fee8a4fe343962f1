package com.chronicle.extractor;

import com.chronicle.generation.CancellationToken;
import com.chronicle.generation.ParseOptions;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-turn settings read from the {@link SettingsProvider}. Categories missing
 * from {@code track} are tracked.
 */
public record ExtractionSettings(String profileId,
                                 Map<TrackCategory, Boolean> track,
                                 Map<TrackCategory, Double> temperatures,
                                 Map<String, CustomPrompt> customPrompts,
                                 int maxConcurrentRequests,
                                 Integer maxMessagesToSend,
                                 Integer maxChapterMessagesToSend,
                                 Integer maxTokens,
                                 int maxRetries,
                                 double retryTemperature) {

    public static final int DEFAULT_MAX_MESSAGES = 10;
    public static final int DEFAULT_MAX_CHAPTER_MESSAGES = 24;

    public ExtractionSettings {
        profileId = profileId == null ? "default" : profileId;
        track = track == null || track.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(track));
        temperatures = temperatures == null || temperatures.isEmpty()
            ? Map.of()
            : Map.copyOf(new EnumMap<>(temperatures));
        customPrompts = customPrompts == null ? Map.of() : Map.copyOf(customPrompts);
        maxConcurrentRequests = Math.max(1, maxConcurrentRequests);
    }

    public static ExtractionSettings defaults() {
        return new ExtractionSettings("default", Map.of(), Map.of(), Map.of(), 1,
            DEFAULT_MAX_MESSAGES, DEFAULT_MAX_CHAPTER_MESSAGES, null,
            ParseOptions.DEFAULT_MAX_RETRIES, ParseOptions.DEFAULT_RETRY_TEMPERATURE);
    }

    public boolean isTracking(TrackCategory category) {
        return track.getOrDefault(category, Boolean.TRUE);
    }

    public Optional<CustomPrompt> customPrompt(String promptName) {
        return Optional.ofNullable(customPrompts.get(promptName));
    }

    /**
     * Custom prompt temperature, then the category temperature, then the default.
     */
    public double temperatureFor(String promptName, TrackCategory category, double defaultTemperature) {
        return customPrompt(promptName)
            .map(CustomPrompt::temperature)
            .or(() -> Optional.ofNullable(temperatures.get(category)))
            .orElse(defaultTemperature);
    }

    public ParseOptions parseOptions(CancellationToken cancellation) {
        return new ParseOptions(maxRetries, retryTemperature, maxTokens, profileId, cancellation);
    }

    public ExtractionSettings withMaxConcurrentRequests(int max) {
        return new ExtractionSettings(profileId, track, temperatures, customPrompts, max,
            maxMessagesToSend, maxChapterMessagesToSend, maxTokens, maxRetries, retryTemperature);
    }

    public ExtractionSettings withCustomPrompts(Map<String, CustomPrompt> prompts) {
        return new ExtractionSettings(profileId, track, temperatures, prompts, maxConcurrentRequests,
            maxMessagesToSend, maxChapterMessagesToSend, maxTokens, maxRetries, retryTemperature);
    }

    public ExtractionSettings withTrack(Map<TrackCategory, Boolean> tracking) {
        return new ExtractionSettings(profileId, tracking, temperatures, customPrompts, maxConcurrentRequests,
            maxMessagesToSend, maxChapterMessagesToSend, maxTokens, maxRetries, retryTemperature);
    }
}
