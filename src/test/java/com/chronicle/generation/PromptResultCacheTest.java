package com.chronicle.generation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PromptResultCacheTest {

    private static final PromptResultCache.CachedResult RESULT =
        new PromptResultCache.CachedResult("data", "because", "{\"raw\":true}");

    @Test
    void key_changesWithEveryInput() {
        String base = PromptResultCache.key("mood_change", "sys", "user", 0.5, "default");

        assertEquals(base, PromptResultCache.key("mood_change", "sys", "user", 0.5, "default"));
        assertNotEquals(base, PromptResultCache.key("mood_change", "sys", "user!", 0.5, "default"));
        assertNotEquals(base, PromptResultCache.key("mood_change", "sys!", "user", 0.5, "default"));
        assertNotEquals(base, PromptResultCache.key("mood_change", "sys", "user", 0.1, "default"));
        assertNotEquals(base, PromptResultCache.key("mood_change", "sys", "user", 0.5, "other"));
        assertNotEquals(base, PromptResultCache.key("props_change", "sys", "user", 0.5, "default"));
    }

    @Test
    void get_countsHits() {
        PromptResultCache cache = new PromptResultCache(10, 1000);
        cache.put("k", RESULT, 0);

        assertEquals(RESULT, cache.get("k", 10).orElseThrow());
        cache.get("k", 20);

        assertEquals(2, cache.hits("k"));
        assertTrue(cache.get("missing", 20).isEmpty());
    }

    @Test
    void entriesExpire() {
        PromptResultCache cache = new PromptResultCache(10, 1000);
        cache.put("k", RESULT, 0);

        assertTrue(cache.get("k", 1000).isPresent());
        assertTrue(cache.get("k", 1001).isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void oldestEntriesAreEvicted_overCapacity() {
        PromptResultCache cache = new PromptResultCache(2, 60_000);
        cache.put("a", RESULT, 1);
        cache.put("b", RESULT, 2);
        cache.put("c", RESULT, 3);

        assertEquals(2, cache.size());
        assertTrue(cache.get("a", 4).isEmpty());
        assertTrue(cache.get("c", 4).isPresent());
    }
}
