package io.strata.core.archive;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.strata.core.MutableClock;
import io.strata.core.config.model.ArchiveConfig;
import io.strata.core.privacy.PiiRedactor;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class ColdArchiveTest {
    private static final String OWNER = "alice";
    private static final String BASE = "Customer asked about the refund policy for order 1234 and the shipping timeline to Porto.";

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    private final InMemoryArchiveStore store = new InMemoryArchiveStore();
    private final ColdArchive archive = new ColdArchive(store, ArchiveConfig.defaults(), clock);

    @Test
    void shouldLinkEveryChunkToItsPredecessor() throws Exception {
        for (int i = 0; i < 5; i++) {
            archive.append(OWNER, "payload " + i, 3.0);
            clock.advance(Duration.ofSeconds(1));
        }

        List<ArchiveChunk> chunks = archive.chunks(OWNER);
        assertThat(chunks).extracting(ArchiveChunk::sequence).containsExactly(1L, 2L, 3L, 4L, 5L);
        assertThat(chunks.get(0).previousHash()).isNull();
        for (int i = 1; i < chunks.size(); i++) {
            assertThat(chunks.get(i).previousHash()).isEqualTo(chunks.get(i - 1).contentHash());
        }
        assertThat(archive.verifyChain(OWNER)).isTrue();
        assertThat(archive.inspect(OWNER).chunks()).isEqualTo(5);
    }

    @Test
    void shouldStoreSimilarPayloadsAsDeltas() throws Exception {
        ArchiveChunk first = archive.append(OWNER, BASE, 4.0);
        ArchiveChunk second = archive.append(OWNER, BASE.replace("1234", "1235"), 4.0);
        ArchiveChunk third = archive.append(OWNER, "Something entirely different", 4.0);

        assertThat(first.encoding()).isEqualTo(ChunkEncoding.FULL);
        assertThat(second.encoding()).isEqualTo(ChunkEncoding.DELTA);
        assertThat(second.deltaPayload().length()).isLessThan(BASE.length());
        assertThat(third.encoding()).isEqualTo(ChunkEncoding.FULL);
        assertThat(archive.reconstruct(OWNER, third.chunkId()))
            .containsExactly(BASE, BASE.replace("1234", "1235"), "Something entirely different");
        assertThat(archive.payloadOf(OWNER, second.chunkId())).isEqualTo(BASE.replace("1234", "1235"));
        assertThat(archive.stats(OWNER).compressionRatio()).isLessThan(1.0);
    }

    @Test
    void shouldForceFullSnapshotsAtTheConfiguredInterval() throws Exception {
        ColdArchive snapshotting = new ColdArchive(new InMemoryArchiveStore(), new ArchiveConfig("SHA-256", 0.7, 2, 3), clock);

        List<ChunkEncoding> encodings = List.of(
            snapshotting.append(OWNER, BASE, 4.0).encoding(),
            snapshotting.append(OWNER, BASE + " 1", 4.0).encoding(),
            snapshotting.append(OWNER, BASE + " 2", 4.0).encoding(),
            snapshotting.append(OWNER, BASE + " 3", 4.0).encoding()
        );

        assertThat(encodings).containsExactly(ChunkEncoding.FULL, ChunkEncoding.DELTA, ChunkEncoding.FULL, ChunkEncoding.DELTA);
    }

    @Test
    void shouldDetectTamperedBody() throws Exception {
        archive.append(OWNER, "first", 3.0);
        ArchiveChunk second = archive.append(OWNER, "second", 3.0);
        archive.append(OWNER, "third", 3.0);

        store.overwrite(second.withBody(ChunkEncoding.FULL, "forged", false));

        ChainReport report = archive.inspect(OWNER);
        assertThat(report.intact()).isFalse();
        assertThat(report.failedChunkId()).isEqualTo(second.chunkId());
        assertThat(report.reason()).isEqualTo("payload digest mismatch");
        assertThatThrownBy(() -> archive.requireIntact(OWNER))
            .isInstanceOfSatisfying(ChainIntegrityException.class, e -> assertThat(e.chunkId()).isEqualTo(second.chunkId()));
    }

    @Test
    void shouldDetectTamperedHeader() throws Exception {
        ArchiveChunk first = archive.append(OWNER, "first", 3.0);
        archive.append(OWNER, "second", 3.0);

        store.overwrite(new ArchiveChunk(
            first.chunkId(),
            first.ownerId(),
            first.sequence(),
            first.itemId(),
            first.encoding(),
            first.deltaPayload(),
            first.payloadDigest(),
            first.redactedDigest(),
            first.salt(),
            9.9,
            first.timestamp(),
            first.previousHash(),
            first.contentHash(),
            first.redacted()
        ));

        ChainReport report = archive.inspect(OWNER);
        assertThat(report.intact()).isFalse();
        assertThat(report.failedChunkId()).isEqualTo(first.chunkId());
        assertThat(report.reason()).isEqualTo("content hash mismatch");
    }

    @Test
    void shouldKeepChainVerifiableAfterFullRedaction() throws Exception {
        ArchiveChunk first = archive.append(OWNER, "A", 3.0);
        ArchiveChunk second = archive.append(OWNER, "B", 3.0);

        archive.redactFully(OWNER, first.chunkId());

        assertThat(archive.verifyChain(OWNER)).isTrue();
        assertThat(archive.reconstruct(OWNER, second.chunkId())).containsExactly(PiiRedactor.FULL_PLACEHOLDER, "B");
        assertThat(archive.chunks(OWNER).get(0).redacted()).isTrue();
        assertThat(archive.chunks(OWNER).get(0).contentHash()).isEqualTo(first.contentHash());
        assertThat(archive.chunks(OWNER).get(0).payloadDigest()).isEqualTo(first.payloadDigest());
    }

    @Test
    void shouldRejectRedactedFlagOnForgedBody() throws Exception {
        ArchiveChunk first = archive.append(OWNER, "Bob owes me 500 dollars, mail bob@example.org", 3.0);
        archive.append(OWNER, "second", 3.0);

        store.overwrite(first.withBody(ChunkEncoding.FULL, "Bob owes me 10000 dollars", true));

        ChainReport report = archive.inspect(OWNER);
        assertThat(report.intact()).isFalse();
        assertThat(report.failedChunkId()).isEqualTo(first.chunkId());
        assertThat(report.reason()).isEqualTo("redacted body does not match its committed form");

        store.overwrite(first.withBody(ChunkEncoding.FULL, "Bob owes me 500 dollars, mail [REDACTED_EMAIL]", true));
        assertThat(archive.verifyChain(OWNER)).isTrue();
        store.overwrite(first.withBody(ChunkEncoding.FULL, PiiRedactor.FULL_PLACEHOLDER, true));
        assertThat(archive.verifyChain(OWNER)).isTrue();
    }

    @Test
    void shouldRebaseDependentDeltaWhenRedacting() throws Exception {
        String original = BASE + " Reach me at jane@example.com.";
        String follow = BASE + " Reach me at jane@example.com!";
        ArchiveChunk first = archive.append(OWNER, original, 4.0);
        ArchiveChunk second = archive.append(OWNER, follow, 4.0);
        assertThat(second.encoding()).isEqualTo(ChunkEncoding.DELTA);

        archive.redact(OWNER, first.chunkId());

        assertThat(archive.chunks(OWNER).get(1).encoding()).isEqualTo(ChunkEncoding.FULL);
        assertThat(archive.chunks(OWNER).get(1).redacted()).isFalse();
        assertThat(archive.reconstruct(OWNER, second.chunkId()))
            .containsExactly(BASE + " Reach me at [REDACTED_EMAIL].", follow);
        assertThat(archive.verifyChain(OWNER)).isTrue();
    }

    @Test
    void shouldRedactEveryChunkWithFindings() throws Exception {
        archive.append(OWNER, "call me at 555-123-4567", 3.0);
        archive.append(OWNER, "nothing to hide", 3.0);
        archive.append(OWNER, "mail bob@example.org", 3.0);

        int redacted = archive.redactAll(OWNER);

        assertThat(redacted).isEqualTo(2);
        assertThat(archive.history(OWNER)).extracting(ArchivedPayload::payload)
            .containsExactly("call me at [REDACTED_PHONE]", "nothing to hide", "mail [REDACTED_EMAIL]");
        assertThat(archive.stats(OWNER).redactedChunks()).isEqualTo(2);
        assertThat(archive.verifyChain(OWNER)).isTrue();
    }

    @Test
    void shouldContinueChainAfterReload() throws Exception {
        archive.append(OWNER, BASE, 4.0);
        archive.append(OWNER, BASE + " again", 4.0);

        ColdArchive reloaded = new ColdArchive(store, ArchiveConfig.defaults(), clock);
        ArchiveChunk third = reloaded.append(OWNER, BASE + " once more", 4.0);

        assertThat(third.sequence()).isEqualTo(3L);
        assertThat(third.encoding()).isEqualTo(ChunkEncoding.DELTA);
        assertThat(reloaded.history(OWNER)).extracting(ArchivedPayload::payload)
            .containsExactly(BASE, BASE + " again", BASE + " once more");
        assertThat(reloaded.verifyChain(OWNER)).isTrue();
    }

    @Test
    void shouldRejectUnknownChunk() throws Exception {
        archive.append(OWNER, "only", 1.0);

        assertThatThrownBy(() -> archive.reconstruct(OWNER, "missing"))
            .isInstanceOf(ChunkNotFoundException.class)
            .hasMessageContaining("missing");
        assertThatThrownBy(() -> archive.redactFully(OWNER, "missing")).isInstanceOf(ChunkNotFoundException.class);
        assertThat(archive.history("nobody")).isEmpty();
        assertThat(archive.verifyChain("nobody")).isTrue();
    }

    @Test
    void shouldRetryWritesWithTheSameChunk() throws Exception {
        FlakyStore flaky = new FlakyStore(1, true);
        ColdArchive retrying = new ColdArchive(flaky, ArchiveConfig.defaults(), clock);

        ArchiveChunk chunk = retrying.append(OWNER, "survives a lost acknowledgement", 2.0);

        assertThat(flaky.attempts).isEqualTo(2);
        assertThat(flaky.delegate.list(OWNER)).extracting(ArchiveChunk::chunkId).containsExactly(chunk.chunkId());
        assertThat(retrying.verifyChain(OWNER)).isTrue();
    }

    @Test
    void shouldNotAdvanceTailWhenWritesKeepFailing() throws Exception {
        FlakyStore flaky = new FlakyStore(3, false);
        ColdArchive retrying = new ColdArchive(flaky, ArchiveConfig.defaults(), clock);

        assertThatThrownBy(() -> retrying.append(OWNER, "lost", 2.0)).isInstanceOf(IOException.class);
        assertThat(flaky.attempts).isEqualTo(3);

        ArchiveChunk next = retrying.append(OWNER, "kept", 2.0);
        assertThat(next.sequence()).isEqualTo(1L);
        assertThat(next.previousHash()).isNull();
        assertThat(retrying.history(OWNER)).extracting(ArchivedPayload::payload).containsExactly("kept");
    }

    private static final class FlakyStore implements ArchiveStore {
        private final InMemoryArchiveStore delegate = new InMemoryArchiveStore();
        private final boolean writeBeforeFailing;
        private int failuresLeft;
        private int attempts;

        private FlakyStore(int failures, boolean writeBeforeFailing) {
            this.failuresLeft = failures;
            this.writeBeforeFailing = writeBeforeFailing;
        }

        @Override
        public void append(ArchiveChunk chunk) throws IOException {
            attempts++;
            if (failuresLeft > 0) {
                failuresLeft--;
                if (writeBeforeFailing) {
                    delegate.append(chunk);
                }
                throw new IOException("simulated write failure");
            }
            delegate.append(chunk);
        }

        @Override
        public List<ArchiveChunk> list(String ownerId) {
            return delegate.list(ownerId);
        }

        @Override
        public void rewriteBodies(String ownerId, List<ArchiveChunk> chunks) throws IOException {
            delegate.rewriteBodies(ownerId, chunks);
        }

        @Override
        public List<String> owners() {
            return delegate.owners();
        }
    }
}
