package com.chronicle.event;

import java.util.Comparator;

/**
 * Position of a chat turn: the message index and which of its swipes (alternate
 * generations) is meant.
 */
public record MessageAndSwipe(int messageId, int swipeId) implements Comparable<MessageAndSwipe> {

    private static final Comparator<MessageAndSwipe> ORDER = Comparator
        .comparingInt(MessageAndSwipe::messageId)
        .thenComparingInt(MessageAndSwipe::swipeId);

    public static MessageAndSwipe of(int messageId, int swipeId) {
        return new MessageAndSwipe(messageId, swipeId);
    }

    @Override
    public int compareTo(MessageAndSwipe other) {
        return ORDER.compare(this, other);
    }
}
