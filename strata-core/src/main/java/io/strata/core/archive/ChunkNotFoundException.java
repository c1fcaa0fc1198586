package io.strata.core.archive;

public final class ChunkNotFoundException extends IllegalArgumentException {

    public ChunkNotFoundException(String ownerId, String chunkId) {
        super("No chunk " + chunkId + " in the archive of owner " + ownerId);
    }
}
