package com.chronicle.session;

import com.chronicle.event.MessageAndSwipe;
import com.chronicle.extractor.ChatMessage;
import com.chronicle.extractor.ExtractionContext;
import com.chronicle.store.SwipeContext;

import java.util.List;
import java.util.Map;

/**
 * A turn to extract: the message that was just written plus the transcript it
 * belongs to. {@code swipes} maps message ids to their active swipe; messages
 * not listed use swipe 0.
 */
public record TurnRequest(int messageId,
                          int swipeId,
                          Map<Integer, Integer> swipes,
                          List<ChatMessage> messages,
                          String userName,
                          String characterName,
                          String persona,
                          String characterDescription) {

    public TurnRequest {
        swipes = swipes == null ? Map.of() : Map.copyOf(swipes);
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public MessageAndSwipe currentMessage() {
        return MessageAndSwipe.of(messageId, swipeId);
    }

    public SwipeContext swipeContext() {
        return new SwipeContext(swipes).with(messageId, swipeId);
    }

    public ExtractionContext context() {
        return new ExtractionContext(messages, userName, characterName, persona, characterDescription);
    }
}
