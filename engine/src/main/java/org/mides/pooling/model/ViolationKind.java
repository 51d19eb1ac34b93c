package org.mides.pooling.model;

public enum ViolationKind {
    COVERAGE,
    ORDERING,
    CAPACITY,
    CONTINUITY,
    TIME_WINDOW,
    DETOUR
}
