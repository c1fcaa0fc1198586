package io.strata.core.memory;

public enum RecallDepth {
    SHALLOW,
    DEEP
}
