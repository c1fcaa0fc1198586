package io.strata.core.archive;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

public final class ChainHasher {
    private static final HexFormat HEX = HexFormat.of();

    private final String algorithm;
    private final ObjectMapper canonical;
    private final SecureRandom random = new SecureRandom();

    public ChainHasher(String algorithm) {
        this.algorithm = algorithm;
        try {
            MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalArgumentException("Unsupported digest algorithm: " + algorithm, e);
        }
        this.canonical = new ObjectMapper();
        this.canonical.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    public String algorithm() {
        return algorithm;
    }

    public String newSalt() {
        byte[] salt = new byte[16];
        random.nextBytes(salt);
        return HEX.formatHex(salt);
    }

    public String payloadDigest(String salt, String payload) {
        MessageDigest digest = newDigest();
        digest.update(salt.getBytes(StandardCharsets.UTF_8));
        digest.update((byte) 0);
        digest.update(payload.getBytes(StandardCharsets.UTF_8));
        return HEX.formatHex(digest.digest());
    }

    public String contentHash(
        String chunkId,
        String ownerId,
        long sequence,
        String itemId,
        double importance,
        String payloadDigest,
        String redactedDigest,
        String previousHash,
        Instant timestamp
    ) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("chunk_id", chunkId);
        fields.put("owner_id", ownerId);
        fields.put("sequence", sequence);
        fields.put("item_id", itemId);
        fields.put("importance", importance);
        fields.put("payload_digest", payloadDigest);
        fields.put("redacted_digest", redactedDigest);
        fields.put("previous_hash", previousHash);
        fields.put("timestamp", timestamp.toString());
        try {
            byte[] serialized = canonical.writeValueAsBytes(fields);
            return HEX.formatHex(newDigest().digest(serialized));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize chunk header", e);
        }
    }

    public String contentHash(ArchiveChunk chunk) {
        return contentHash(
            chunk.chunkId(),
            chunk.ownerId(),
            chunk.sequence(),
            chunk.itemId(),
            chunk.importance(),
            chunk.payloadDigest(),
            chunk.redactedDigest(),
            chunk.previousHash(),
            chunk.timestamp()
        );
    }

    private MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Digest algorithm disappeared: " + algorithm, e);
        }
    }
}
