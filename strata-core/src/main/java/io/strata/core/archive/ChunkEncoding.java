package io.strata.core.archive;

public enum ChunkEncoding {
    FULL,
    DELTA
}
