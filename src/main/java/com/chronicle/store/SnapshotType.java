package com.chronicle.store;

public enum SnapshotType {
    INITIAL,
    CHECKPOINT
}
