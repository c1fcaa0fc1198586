package io.strata.core.observability;

import io.strata.core.memory.MemoryTier;

public record TierLatency(
    MemoryTier tier,
    int hits,
    int misses,
    int writes,
    int evictions,
    double meanLatencyMs,
    double p50LatencyMs,
    double p95LatencyMs
) {
}
