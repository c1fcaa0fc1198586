package io.strata.core.archive;

import java.io.IOException;
import java.util.List;

public interface ArchiveStore {
    /**
     * Durably stores a new chunk. Writing a chunk id that is already stored is a no-op, so a
     * retried write never adds a second link.
     */
    void append(ArchiveChunk chunk) throws IOException;

    List<ArchiveChunk> list(String ownerId) throws IOException;

    /**
     * Replaces the stored body and redaction flag of the given chunks in one atomic step. Header
     * fields are never touched.
     */
    void rewriteBodies(String ownerId, List<ArchiveChunk> chunks) throws IOException;

    List<String> owners() throws IOException;
}
