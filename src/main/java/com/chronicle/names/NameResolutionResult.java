package com.chronicle.names;

import com.chronicle.event.NarrativeEvent;

import java.util.List;

/**
 * Rewritten events plus the surface names no rule could resolve, in
 * first-seen order.
 */
public record NameResolutionResult(List<NarrativeEvent> events, List<String> unresolvedNames) {

    public NameResolutionResult {
        events = List.copyOf(events);
        unresolvedNames = List.copyOf(unresolvedNames);
    }
}
