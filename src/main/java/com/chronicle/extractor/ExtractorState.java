package com.chronicle.extractor;

import com.chronicle.event.MessageAndSwipe;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Where an extractor ran and where it produced events, in run order.
 */
public class ExtractorState {

    private final List<MessageAndSwipe> ranAtMessages = new ArrayList<>();
    private final List<MessageAndSwipe> producedAtMessages = new ArrayList<>();

    public synchronized void recordRun(MessageAndSwipe message, boolean produced) {
        ranAtMessages.add(message);
        if (produced) {
            producedAtMessages.add(message);
        }
    }

    public synchronized List<MessageAndSwipe> ranAtMessages() {
        return List.copyOf(ranAtMessages);
    }

    public synchronized List<MessageAndSwipe> producedAtMessages() {
        return List.copyOf(producedAtMessages);
    }

    public synchronized Optional<MessageAndSwipe> lastRanAt() {
        return ranAtMessages.isEmpty()
            ? Optional.empty()
            : Optional.of(ranAtMessages.get(ranAtMessages.size() - 1));
    }

    synchronized ExtractorState copy() {
        ExtractorState copy = new ExtractorState();
        copy.ranAtMessages.addAll(new ArrayList<>(ranAtMessages));
        copy.producedAtMessages.addAll(new ArrayList<>(producedAtMessages));
        return copy;
    }
}
