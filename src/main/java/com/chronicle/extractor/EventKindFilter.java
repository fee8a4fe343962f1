package com.chronicle.extractor;

import com.chronicle.event.EventKind;
import com.chronicle.event.EventType;
import com.chronicle.event.NarrativeEvent;

/**
 * Matches events of a kind, optionally narrowed to one subkind.
 */
public record EventKindFilter(EventKind kind, String subkind) {

    public static EventKindFilter of(EventKind kind) {
        return new EventKindFilter(kind, null);
    }

    public static EventKindFilter of(EventType type) {
        return new EventKindFilter(type.kind(), type.subkind());
    }

    public boolean matches(NarrativeEvent event) {
        return event.kind() == kind && (subkind == null || subkind.equals(event.subkind()));
    }
}
