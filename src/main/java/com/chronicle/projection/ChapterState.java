package com.chronicle.projection;

/**
 * A chapter of the story. {@code endedAtMessage} is null while the chapter is open.
 */
public record ChapterState(int index, String title, String summary, Integer endedAtMessage, String endReason) {

    public static ChapterState open(int index) {
        return new ChapterState(index, null, null, null, null);
    }

    public boolean isClosed() {
        return endedAtMessage != null;
    }
}
