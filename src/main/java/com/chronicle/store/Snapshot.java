package com.chronicle.store;

import com.chronicle.projection.NarrativeState;

/**
 * Materialized state used as a replay base.
 *
 * {@code basisHash} and {@code basisSize} fingerprint the active events the
 * state was built from; a checkpoint is reused only when the same events are
 * still active for the requested swipe context. The initial snapshot sits
 * before every message ({@code messageId == -1}).
 */
public record Snapshot(SnapshotType type,
                       int messageId,
                       int swipeId,
                       NarrativeState state,
                       long basisHash,
                       int basisSize,
                       long createdAt) {

    public static final int BEFORE_FIRST_MESSAGE = -1;

    public static Snapshot initial(NarrativeState state, long createdAt) {
        return new Snapshot(SnapshotType.INITIAL, BEFORE_FIRST_MESSAGE, 0, state, 0L, 0, createdAt);
    }
}
