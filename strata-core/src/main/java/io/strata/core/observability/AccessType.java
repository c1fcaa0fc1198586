package io.strata.core.observability;

public enum AccessType {
    HIT,
    MISS,
    WRITE,
    EVICTION
}
