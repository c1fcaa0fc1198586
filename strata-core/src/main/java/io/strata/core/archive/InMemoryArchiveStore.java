package io.strata.core.archive;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public final class InMemoryArchiveStore implements ArchiveStore {
    private final Map<String, List<ArchiveChunk>> chunksByOwner = new HashMap<>();

    @Override
    public synchronized void append(ArchiveChunk chunk) throws IOException {
        List<ArchiveChunk> chunks = chunksByOwner.computeIfAbsent(chunk.ownerId(), ignored -> new ArrayList<>());
        if (chunks.stream().anyMatch(existing -> existing.chunkId().equals(chunk.chunkId()))) {
            return;
        }
        chunks.add(chunk);
    }

    @Override
    public synchronized List<ArchiveChunk> list(String ownerId) {
        return chunksByOwner.getOrDefault(ownerId, List.of()).stream()
            .sorted(Comparator.comparingLong(ArchiveChunk::sequence))
            .toList();
    }

    @Override
    public synchronized void rewriteBodies(String ownerId, List<ArchiveChunk> rewritten) throws IOException {
        List<ArchiveChunk> chunks = chunksByOwner.get(ownerId);
        if (chunks == null) {
            throw new IOException("No archive for owner " + ownerId);
        }
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < chunks.size(); i++) {
            positions.put(chunks.get(i).chunkId(), i);
        }
        for (ArchiveChunk chunk : rewritten) {
            if (!positions.containsKey(chunk.chunkId())) {
                throw new IOException("Unknown chunk " + chunk.chunkId());
            }
        }
        for (ArchiveChunk chunk : rewritten) {
            int index = positions.get(chunk.chunkId());
            chunks.set(index, chunks.get(index).withBody(chunk.encoding(), chunk.deltaPayload(), chunk.redacted()));
        }
    }

    @Override
    public synchronized List<String> owners() {
        return List.copyOf(chunksByOwner.keySet());
    }

    /**
     * Overwrites a stored chunk wholesale, bypassing every check. Only meant for simulating
     * storage corruption.
     */
    public synchronized void overwrite(ArchiveChunk chunk) {
        List<ArchiveChunk> chunks = chunksByOwner.get(chunk.ownerId());
        if (chunks == null) {
            return;
        }
        for (int i = 0; i < chunks.size(); i++) {
            if (chunks.get(i).chunkId().equals(chunk.chunkId())) {
                chunks.set(i, chunk);
            }
        }
    }
}
