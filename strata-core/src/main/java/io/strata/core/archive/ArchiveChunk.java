package io.strata.core.archive;

import java.time.Instant;
import java.util.Objects;

/**
 * One link of an owner's hash chain.
 *
 * <p>{@code payloadDigest} commits to the full pre-redaction payload (salted),
 * {@code redactedDigest} to the payload's redacted form, and {@code contentHash} to both digests,
 * the position and {@code previousHash}. The stored body ({@code encoding}, {@code deltaPayload})
 * and the {@code redacted} flag sit outside the hashes; a redacted body must still match
 * {@code redactedDigest} or be the full placeholder.
 */
public record ArchiveChunk(
    String chunkId,
    String ownerId,
    long sequence,
    String itemId,
    ChunkEncoding encoding,
    String deltaPayload,
    String payloadDigest,
    String redactedDigest,
    String salt,
    double importance,
    Instant timestamp,
    String previousHash,
    String contentHash,
    boolean redacted
) {
    public ArchiveChunk {
        Objects.requireNonNull(chunkId, "chunkId must not be null");
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        Objects.requireNonNull(encoding, "encoding must not be null");
        deltaPayload = deltaPayload == null ? "" : deltaPayload;
        Objects.requireNonNull(payloadDigest, "payloadDigest must not be null");
        Objects.requireNonNull(redactedDigest, "redactedDigest must not be null");
        salt = salt == null ? "" : salt;
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(contentHash, "contentHash must not be null");
    }

    public ArchiveChunk withBody(ChunkEncoding newEncoding, String newPayload, boolean nowRedacted) {
        return new ArchiveChunk(
            chunkId,
            ownerId,
            sequence,
            itemId,
            newEncoding,
            newPayload,
            payloadDigest,
            redactedDigest,
            salt,
            importance,
            timestamp,
            previousHash,
            contentHash,
            nowRedacted
        );
    }
}
