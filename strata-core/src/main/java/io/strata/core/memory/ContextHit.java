package io.strata.core.memory;

/**
 * One recalled item. {@code viaNodeId} and {@code hops} describe the graph path for warm hits and
 * are {@code null} and {@code 0} otherwise.
 */
public record ContextHit(
    MemoryTier tier,
    MemoryItem item,
    double score,
    String viaNodeId,
    int hops
) {
}
