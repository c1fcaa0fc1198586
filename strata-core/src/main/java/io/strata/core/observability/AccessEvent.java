package io.strata.core.observability;

import io.strata.core.memory.MemoryTier;
import java.time.Instant;

public record AccessEvent(
    String ownerId,
    MemoryTier tier,
    AccessType type,
    double latencyMs,
    Instant timestamp
) {
}
