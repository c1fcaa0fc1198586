package io.strata.core.memory;

import io.strata.core.archive.ArchiveStats;
import io.strata.core.observability.TierLatency;
import java.util.Map;

public record TierStats(
    String ownerId,
    int hotItems,
    int warmItems,
    int warmNodes,
    int warmEdges,
    int orphanedNodes,
    ArchiveStats cold,
    Map<MemoryTier, TierLatency> latency
) {
}
