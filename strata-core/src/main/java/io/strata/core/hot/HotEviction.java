package io.strata.core.hot;

import io.strata.core.memory.MemoryItem;

/**
 * An item that left the hot cache. {@code aboveFloor} marks items whose importance exceeded the
 * hot floor; those must be promoted rather than dropped.
 */
public record HotEviction(MemoryItem item, Reason reason, boolean aboveFloor) {

    public enum Reason {
        OVERFLOW,
        EXPIRED
    }
}
