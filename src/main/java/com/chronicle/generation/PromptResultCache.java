package com.chronicle.generation;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Successful parses keyed by prompt payload and sampling settings, so an
 * unchanged window can be served without another generator call.
 */
public class PromptResultCache {

    public static final int DEFAULT_MAX_ENTRIES = 500;
    public static final long DEFAULT_MAX_AGE_MS = 15 * 60_000L;

    private final int maxEntries;
    private final long maxAgeMs;
    private final Map<String, Entry> entries = new LinkedHashMap<>();

    public PromptResultCache() {
        this(DEFAULT_MAX_ENTRIES, DEFAULT_MAX_AGE_MS);
    }

    public PromptResultCache(int maxEntries, long maxAgeMs) {
        this.maxEntries = Math.max(1, maxEntries);
        this.maxAgeMs = maxAgeMs;
    }

    public record CachedResult(Object data, String reasoning, String rawResponse) {
    }

    private static final class Entry {
        private final CachedResult result;
        private final long cachedAt;
        private int hits;

        private Entry(CachedResult result, long cachedAt) {
            this.result = result;
            this.cachedAt = cachedAt;
        }
    }

    public static String key(String promptName, String system, String user, double temperature, String profileId) {
        return String.join("|",
            promptName,
            String.valueOf(profileId),
            String.valueOf(temperature),
            hash(system),
            hash(user));
    }

    /** djb2 variant with xor, rendered as unsigned hex. */
    static String hash(String input) {
        int hash = 5381;
        String text = input == null ? "" : input;
        for (int i = 0; i < text.length(); i++) {
            hash = (hash * 33) ^ text.charAt(i);
        }
        return Integer.toHexString(hash);
    }

    public Optional<CachedResult> get(String key) {
        return get(key, System.currentTimeMillis());
    }

    public synchronized Optional<CachedResult> get(String key, long now) {
        prune(now);
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        entry.hits++;
        return Optional.of(entry.result);
    }

    public void put(String key, CachedResult result) {
        put(key, result, System.currentTimeMillis());
    }

    public synchronized void put(String key, CachedResult result, long now) {
        entries.remove(key);
        entries.put(key, new Entry(result, now));
        prune(now);
    }

    public synchronized int hits(String key) {
        Entry entry = entries.get(key);
        return entry == null ? 0 : entry.hits;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }

    private void prune(long now) {
        entries.values().removeIf(entry -> now - entry.cachedAt > maxAgeMs);
        if (entries.size() <= maxEntries) {
            return;
        }
        List<String> oldest = entries.entrySet().stream()
            .sorted(Comparator.comparingLong(e -> e.getValue().cachedAt))
            .limit(entries.size() - maxEntries)
            .map(Map.Entry::getKey)
            .collect(Collectors.toList());
        oldest.forEach(entries::remove);
    }
}
