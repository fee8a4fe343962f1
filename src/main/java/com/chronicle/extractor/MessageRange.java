package com.chronicle.extractor;

/**
 * Inclusive range of message ids.
 */
public record MessageRange(int start, int end) {

    public MessageRange {
        start = Math.max(0, start);
        if (end < start) {
            end = start;
        }
    }

    /**
     * Keeps the most recent {@code maxMessages}; null or non-positive means unlimited.
     */
    public MessageRange limit(Integer maxMessages) {
        if (maxMessages == null || maxMessages <= 0) {
            return this;
        }
        return new MessageRange(Math.max(start, end - maxMessages + 1), end);
    }

    public int size() {
        return end - start + 1;
    }
}
