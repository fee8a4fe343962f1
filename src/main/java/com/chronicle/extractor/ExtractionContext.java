package com.chronicle.extractor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Chat transcript and the names/descriptions of the participants.
 */
public record ExtractionContext(List<ChatMessage> messages,
                                String userName,
                                String characterName,
                                String persona,
                                String characterDescription) {

    public ExtractionContext {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public List<ChatMessage> messagesIn(MessageRange range) {
        return messages.stream()
            .filter(m -> m.messageId() >= range.start() && m.messageId() <= range.end())
            .collect(Collectors.toList());
    }

    public String transcript(MessageRange range) {
        return messagesIn(range).stream()
            .map(m -> m.name() + ": " + m.text())
            .collect(Collectors.joining("\n\n"));
    }
}
