package io.strata.core.archive;

public record ArchiveStats(
    int chunks,
    int deltaChunks,
    int redactedChunks,
    long payloadChars,
    long storedChars
) {

    /**
     * Stored size relative to the rehydrated size; 1.0 means no savings.
     */
    public double compressionRatio() {
        if (payloadChars == 0) {
            return 1.0;
        }
        return Math.round((storedChars * 10_000.0) / payloadChars) / 10_000.0;
    }
}
