package com.chronicle.projection;

import java.util.List;

/**
 * Read-only view of the story at {@code messageId}: a snapshot plus the
 * active events replayed on top of it.
 *
 * @param eventsApplied number of events replayed on top of the base snapshot
 */
public record Projection(int messageId, NarrativeState state, int baseSnapshotMessageId, int eventsApplied) {

    public List<String> charactersPresent() {
        return state.charactersPresent();
    }

    public List<String> canonicalNames() {
        return List.copyOf(state.characters().keySet());
    }
}
