package io.strata.core.archive;

/**
 * A stored chunk no longer matches its recorded digests or its link to the previous chunk. Never
 * corrected automatically.
 */
public final class ChainIntegrityException extends IllegalStateException {
    private final String ownerId;
    private final String chunkId;

    public ChainIntegrityException(String ownerId, String chunkId, String reason) {
        super("Hash chain for owner " + ownerId + " is broken at chunk " + chunkId + ": " + reason);
        this.ownerId = ownerId;
        this.chunkId = chunkId;
    }

    public String ownerId() {
        return ownerId;
    }

    public String chunkId() {
        return chunkId;
    }
}
