package com.chronicle.store;

import com.chronicle.event.NarrativeEvent;

/**
 * An appended event with its position in the log: the global insertion
 * {@code sequence} and the append {@code batch} it arrived in.
 */
public record StoredEvent(long sequence, long batch, NarrativeEvent event) {
}
