package io.strata.core.memory;

public enum TransitionOutcome {
    PROMOTED_TO_WARM,
    ARCHIVED_TO_COLD,
    EVICTED
}
