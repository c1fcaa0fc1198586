package io.strata.core.archive;

import java.time.Instant;

/**
 * A chunk's rehydrated payload, as returned by history replay.
 */
public record ArchivedPayload(
    String chunkId,
    long sequence,
    String itemId,
    Instant timestamp,
    double importance,
    boolean redacted,
    String payload
) {
}
