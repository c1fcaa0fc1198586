package io.strata.core.archive;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.strata.core.config.model.ArchiveConfig;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteArchiveStoreTest {

    @TempDir
    Path tempDir;

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00.123456Z"), ZoneOffset.UTC);

    @Test
    void shouldPersistChunksInSequenceOrder() throws Exception {
        SqliteArchiveStore store = new SqliteArchiveStore(tempDir.resolve("data/archive.db"));
        ColdArchive archive = new ColdArchive(store, ArchiveConfig.defaults(), clock);

        archive.append("alice", "item-1", "first turn about the launch plan", 4.25);
        archive.append("alice", "item-2", "first turn about the launch plan, revised", 5.5);
        archive.append("bob", "hello", 1.0);

        List<ArchiveChunk> chunks = store.list("alice");
        assertThat(chunks).extracting(ArchiveChunk::sequence).containsExactly(1L, 2L);
        assertThat(chunks.get(0).itemId()).isEqualTo("item-1");
        assertThat(chunks.get(0).importance()).isEqualTo(4.25);
        assertThat(chunks.get(0).timestamp()).isEqualTo(clock.instant());
        assertThat(chunks.get(1).encoding()).isEqualTo(ChunkEncoding.DELTA);
        assertThat(store.owners()).containsExactly("alice", "bob");
    }

    @Test
    void shouldVerifyChainReadBackFromDisk() throws Exception {
        Path dbPath = tempDir.resolve("archive.db");
        ColdArchive writer = new ColdArchive(new SqliteArchiveStore(dbPath), ArchiveConfig.defaults(), clock);
        ArchiveChunk first = writer.append("alice", "contact me at jane@example.com", 3.0);
        writer.append("alice", "second", 3.0);
        writer.redactFully("alice", first.chunkId());

        ColdArchive reader = new ColdArchive(new SqliteArchiveStore(dbPath), ArchiveConfig.defaults(), clock);

        assertThat(reader.verifyChain("alice")).isTrue();
        assertThat(reader.history("alice")).extracting(ArchivedPayload::payload).containsExactly("[REDACTED]", "second");
        assertThat(reader.history("alice").get(0).redacted()).isTrue();
    }

    @Test
    void shouldIgnoreDuplicateChunkIds() throws Exception {
        SqliteArchiveStore store = new SqliteArchiveStore(tempDir.resolve("archive.db"));
        ColdArchive archive = new ColdArchive(store, ArchiveConfig.defaults(), clock);
        ArchiveChunk chunk = archive.append("alice", "once", 2.0);

        store.append(chunk);

        assertThat(store.list("alice")).hasSize(1);
    }

    @Test
    void shouldFailRewriteOfUnknownChunkAtomically() throws Exception {
        SqliteArchiveStore store = new SqliteArchiveStore(tempDir.resolve("archive.db"));
        ColdArchive archive = new ColdArchive(store, ArchiveConfig.defaults(), clock);
        ArchiveChunk known = archive.append("alice", "keep me", 2.0);
        ArchiveChunk unknown = known.withBody(ChunkEncoding.FULL, "x", true);
        ArchiveChunk stranger = new ArchiveChunk(
            "missing", "alice", 9, null, ChunkEncoding.FULL, "x", "d", "r", "s", 1.0, clock.instant(), null, "h", false
        );

        assertThatThrownBy(() -> store.rewriteBodies("alice", List.of(unknown, stranger)))
            .isInstanceOf(IOException.class);
        assertThat(store.list("alice").get(0).deltaPayload()).isEqualTo("keep me");
        assertThat(store.list("alice").get(0).redacted()).isFalse();
    }
}
