package com.chronicle.config;

import com.chronicle.extractor.CustomPrompt;
import com.chronicle.extractor.ExtractionSettings;
import com.chronicle.extractor.SettingsProvider;
import com.chronicle.extractor.TrackCategory;
import com.chronicle.generation.BackoffPolicy;
import com.chronicle.generation.ParseOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Extraction settings bound from {@code chronicle.extraction.*}. Serves as the
 * default {@link SettingsProvider}, so edits made at runtime apply from the
 * next turn on.
 */
@Component
@ConfigurationProperties(prefix = "chronicle.extraction")
public class ExtractionProperties implements SettingsProvider {

    private String profileId = "default";
    private Map<TrackCategory, Boolean> track = new EnumMap<>(TrackCategory.class);
    private Map<TrackCategory, Double> temperatures = new EnumMap<>(TrackCategory.class);
    private Map<String, Prompt> customPrompts = new LinkedHashMap<>();
    private int maxConcurrentRequests = 1;
    private Integer maxMessagesToSend = ExtractionSettings.DEFAULT_MAX_MESSAGES;
    private Integer maxChapterMessagesToSend = ExtractionSettings.DEFAULT_MAX_CHAPTER_MESSAGES;
    private Integer maxTokens;
    private int maxRetries = ParseOptions.DEFAULT_MAX_RETRIES;
    private double retryTemperature = ParseOptions.DEFAULT_RETRY_TEMPERATURE;
    private int workerThreads = 8;
    private int snapshotInterval = 20;
    private Cache cache = new Cache();
    private Map<String, Backoff> backoff = new LinkedHashMap<>();

    @Override
    public ExtractionSettings current() {
        Map<String, CustomPrompt> prompts = new HashMap<>();
        customPrompts.forEach((name, prompt) ->
            prompts.put(name, new CustomPrompt(prompt.getSystemPrompt(), prompt.getUserTemplate(),
                prompt.getTemperature())));
        return new ExtractionSettings(profileId, track, temperatures, prompts, maxConcurrentRequests,
            maxMessagesToSend, maxChapterMessagesToSend, maxTokens, maxRetries, retryTemperature);
    }

    public Map<String, BackoffPolicy> backoffPolicies() {
        Map<String, BackoffPolicy> policies = new LinkedHashMap<>();
        backoff.forEach((name, b) ->
            policies.put(name, new BackoffPolicy(b.getFailureThreshold(), b.getBaseCooldown(), b.getMaxCooldown())));
        return policies;
    }

    public String getProfileId() {
        return profileId;
    }

    public void setProfileId(String profileId) {
        this.profileId = profileId;
    }

    public Map<TrackCategory, Boolean> getTrack() {
        return track;
    }

    public void setTrack(Map<TrackCategory, Boolean> track) {
        this.track = track;
    }

    public Map<TrackCategory, Double> getTemperatures() {
        return temperatures;
    }

    public void setTemperatures(Map<TrackCategory, Double> temperatures) {
        this.temperatures = temperatures;
    }

    public Map<String, Prompt> getCustomPrompts() {
        return customPrompts;
    }

    public void setCustomPrompts(Map<String, Prompt> customPrompts) {
        this.customPrompts = customPrompts;
    }

    public int getMaxConcurrentRequests() {
        return maxConcurrentRequests;
    }

    public void setMaxConcurrentRequests(int maxConcurrentRequests) {
        this.maxConcurrentRequests = maxConcurrentRequests;
    }

    public Integer getMaxMessagesToSend() {
        return maxMessagesToSend;
    }

    public void setMaxMessagesToSend(Integer maxMessagesToSend) {
        this.maxMessagesToSend = maxMessagesToSend;
    }

    public Integer getMaxChapterMessagesToSend() {
        return maxChapterMessagesToSend;
    }

    public void setMaxChapterMessagesToSend(Integer maxChapterMessagesToSend) {
        this.maxChapterMessagesToSend = maxChapterMessagesToSend;
    }

    public Integer getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(Integer maxTokens) {
        this.maxTokens = maxTokens;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public double getRetryTemperature() {
        return retryTemperature;
    }

    public void setRetryTemperature(double retryTemperature) {
        this.retryTemperature = retryTemperature;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public int getSnapshotInterval() {
        return snapshotInterval;
    }

    public void setSnapshotInterval(int snapshotInterval) {
        this.snapshotInterval = snapshotInterval;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Map<String, Backoff> getBackoff() {
        return backoff;
    }

    public void setBackoff(Map<String, Backoff> backoff) {
        this.backoff = backoff;
    }

    public static class Prompt {
        private String systemPrompt;
        private String userTemplate;
        private Double temperature;

        public String getSystemPrompt() {
            return systemPrompt;
        }

        public void setSystemPrompt(String systemPrompt) {
            this.systemPrompt = systemPrompt;
        }

        public String getUserTemplate() {
            return userTemplate;
        }

        public void setUserTemplate(String userTemplate) {
            this.userTemplate = userTemplate;
        }

        public Double getTemperature() {
            return temperature;
        }

        public void setTemperature(Double temperature) {
            this.temperature = temperature;
        }
    }

    public static class Cache {
        private int maxEntries = 500;
        private Duration maxAge = Duration.ofMinutes(15);

        public int getMaxEntries() {
            return maxEntries;
        }

        public void setMaxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
        }

        public Duration getMaxAge() {
            return maxAge;
        }

        public void setMaxAge(Duration maxAge) {
            this.maxAge = maxAge;
        }
    }

    public static class Backoff {
        private int failureThreshold = 2;
        private Duration baseCooldown = Duration.ofSeconds(30);
        private Duration maxCooldown = Duration.ofMinutes(5);

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Duration getBaseCooldown() {
            return baseCooldown;
        }

        public void setBaseCooldown(Duration baseCooldown) {
            this.baseCooldown = baseCooldown;
        }

        public Duration getMaxCooldown() {
            return maxCooldown;
        }

        public void setMaxCooldown(Duration maxCooldown) {
            this.maxCooldown = maxCooldown;
        }
    }
}
