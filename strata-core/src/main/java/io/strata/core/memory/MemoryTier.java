package io.strata.core.memory;

public enum MemoryTier {
    HOT,
    WARM,
    COLD
}
