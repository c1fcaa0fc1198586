package io.strata.core.archive;

public record ChainReport(
    String ownerId,
    boolean intact,
    int chunks,
    String failedChunkId,
    String reason
) {

    static ChainReport intact(String ownerId, int chunks) {
        return new ChainReport(ownerId, true, chunks, "", "");
    }

    static ChainReport broken(String ownerId, int chunks, String chunkId, String reason) {
        return new ChainReport(ownerId, false, chunks, chunkId == null ? "" : chunkId, reason);
    }
}
