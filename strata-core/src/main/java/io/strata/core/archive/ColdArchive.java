package io.strata.core.archive;

import io.strata.core.config.model.ArchiveConfig;
import io.strata.core.privacy.PiiRedactor;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only, hash-chained and delta-compressed long-term log, one chain per owner.
 *
 * <p>Each chunk's {@code payloadDigest} is a salted digest of the full payload taken once at
 * append time, and {@code contentHash} covers that digest plus {@code previousHash}, so the chain
 * commits to content rather than to the stored encoding. The digest of the payload's redacted form
 * is committed alongside, so a redacted body verifies only when it is that form or the full
 * placeholder. Redaction rewrites stored bodies only, first re-encoding the following chunk as a
 * full snapshot when it was a delta against the chunk being redacted.
 *
 * <p>Appends and reads for the same owner are serialized on that owner's chain, so readers never
 * observe a half-written link.
 */
public final class ColdArchive {
    private static final Logger LOG = LoggerFactory.getLogger(ColdArchive.class);

    private final ArchiveStore store;
    private final ArchiveConfig config;
    private final ChainHasher hasher;
    private final DeltaCodec codec;
    private final PayloadRedaction redaction;
    private final Clock clock;
    private final Map<String, OwnerChain> chains = new ConcurrentHashMap<>();

    public ColdArchive(ArchiveStore store, ArchiveConfig config, Clock clock) {
        this(store, config, new PiiRedactor()::redact, clock);
    }

    public ColdArchive(ArchiveStore store, ArchiveConfig config, PayloadRedaction redaction, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.redaction = Objects.requireNonNull(redaction, "redaction must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.hasher = new ChainHasher(config.digestAlgorithm());
        this.codec = new DeltaCodec();
    }

    public ArchiveChunk append(String ownerId, String payload, double importance) throws IOException {
        return append(ownerId, null, payload, importance);
    }

    public ArchiveChunk append(String ownerId, String itemId, String payload, double importance) throws IOException {
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        if (importance < 0 || Double.isNaN(importance)) {
            throw new IllegalArgumentException("importance must be a non-negative number");
        }
        OwnerChain chain = chainFor(ownerId);
        synchronized (chain) {
            ArchiveChunk previous = chain.tail();
            if (previous != null && !hasher.contentHash(previous).equals(previous.contentHash())) {
                throw new ChainIntegrityException(ownerId, previous.chunkId(), "tail content hash mismatch");
            }

            long sequence = previous == null ? 1 : previous.sequence() + 1;
            String chunkId = UUID.randomUUID().toString();
            Instant timestamp = clock.instant();
            String salt = hasher.newSalt();
            String payloadDigest = hasher.payloadDigest(salt, payload);
            String redactedDigest = hasher.payloadDigest(salt, redaction.redact(payload));
            String previousHash = previous == null ? null : previous.contentHash();

            ChunkEncoding encoding = ChunkEncoding.FULL;
            String body = payload;
            if (previous != null && (sequence - 1) % config.snapshotInterval() != 0) {
                String delta = codec.encode(chain.tailPayload, payload);
                if (delta.length() <= config.deltaSimilarityThreshold() * payload.length()) {
                    encoding = ChunkEncoding.DELTA;
                    body = delta;
                }
            }

            String contentHash = hasher.contentHash(
                chunkId, ownerId, sequence, itemId, importance, payloadDigest, redactedDigest, previousHash, timestamp
            );
            ArchiveChunk chunk = new ArchiveChunk(
                chunkId,
                ownerId,
                sequence,
                itemId,
                encoding,
                body,
                payloadDigest,
                redactedDigest,
                salt,
                importance,
                timestamp,
                previousHash,
                contentHash,
                false
            );
            persistWithRetry(chunk);
            chain.chunks.add(chunk);
            chain.tailPayload = payload;
            LOG.debug("Archived chunk {} (seq {}, {}) for owner {}", chunkId, sequence, encoding, ownerId);
            return chunk;
        }
    }

    public boolean verifyChain(String ownerId) throws IOException {
        return inspect(ownerId).intact();
    }

    public void requireIntact(String ownerId) throws IOException {
        ChainReport report = inspect(ownerId);
        if (!report.intact()) {
            throw new ChainIntegrityException(ownerId, report.failedChunkId(), report.reason());
        }
    }

    /**
     * Re-reads the owner's chain from the store and checks every link: sequence continuity,
     * {@code previousHash} linkage, the recomputed content hash, and the digest of the replayed
     * payload against the committed original or, for redacted chunks, the committed redacted form.
     */
    public ChainReport inspect(String ownerId) throws IOException {
        OwnerChain chain = chainFor(ownerId);
        synchronized (chain) {
            List<ArchiveChunk> stored = store.list(ownerId);
            String previousHash = null;
            String state = null;
            long expectedSequence = 1;
            for (ArchiveChunk chunk : stored) {
                if (chunk.sequence() != expectedSequence) {
                    return ChainReport.broken(ownerId, stored.size(), chunk.chunkId(), "sequence gap");
                }
                if (!Objects.equals(chunk.previousHash(), previousHash)) {
                    return ChainReport.broken(ownerId, stored.size(), chunk.chunkId(), "previous hash link broken");
                }
                if (!hasher.contentHash(chunk).equals(chunk.contentHash())) {
                    return ChainReport.broken(ownerId, stored.size(), chunk.chunkId(), "content hash mismatch");
                }
                String payload;
                try {
                    payload = rehydrate(chunk, state);
                } catch (IllegalArgumentException e) {
                    return ChainReport.broken(ownerId, stored.size(), chunk.chunkId(), "undecodable body: " + e.getMessage());
                }
                String digest = hasher.payloadDigest(chunk.salt(), payload);
                if (chunk.redacted()) {
                    if (!PiiRedactor.FULL_PLACEHOLDER.equals(payload) && !digest.equals(chunk.redactedDigest())) {
                        return ChainReport.broken(ownerId, stored.size(), chunk.chunkId(), "redacted body does not match its committed form");
                    }
                } else if (!digest.equals(chunk.payloadDigest())) {
                    return ChainReport.broken(ownerId, stored.size(), chunk.chunkId(), "payload digest mismatch");
                }
                state = payload;
                previousHash = chunk.contentHash();
                expectedSequence++;
            }
            return ChainReport.intact(ownerId, stored.size());
        }
    }

    /**
     * Replays the chain from its first chunk up to and including {@code upToChunkId}.
     */
    public List<String> reconstruct(String ownerId, String upToChunkId) throws IOException {
        OwnerChain chain = chainFor(ownerId);
        synchronized (chain) {
            int target = indexOf(chain, upToChunkId);
            if (target < 0) {
                throw new ChunkNotFoundException(ownerId, upToChunkId);
            }
            return replay(chain.chunks.subList(0, target + 1));
        }
    }

    /**
     * Rehydrates a single chunk, replaying only from the nearest full snapshot at or before it.
     */
    public String payloadOf(String ownerId, String chunkId) throws IOException {
        OwnerChain chain = chainFor(ownerId);
        synchronized (chain) {
            int target = indexOf(chain, chunkId);
            if (target < 0) {
                throw new ChunkNotFoundException(ownerId, chunkId);
            }
            int start = target;
            while (start > 0 && chain.chunks.get(start).encoding() == ChunkEncoding.DELTA) {
                start--;
            }
            List<String> payloads = replay(chain.chunks.subList(start, target + 1));
            return payloads.get(payloads.size() - 1);
        }
    }

    public List<ArchivedPayload> history(String ownerId) throws IOException {
        OwnerChain chain = chainFor(ownerId);
        synchronized (chain) {
            List<String> payloads = replay(chain.chunks);
            List<ArchivedPayload> history = new ArrayList<>(payloads.size());
            for (int i = 0; i < payloads.size(); i++) {
                ArchiveChunk chunk = chain.chunks.get(i);
                history.add(new ArchivedPayload(
                    chunk.chunkId(),
                    chunk.sequence(),
                    chunk.itemId(),
                    chunk.timestamp(),
                    chunk.importance(),
                    chunk.redacted(),
                    payloads.get(i)
                ));
            }
            return history;
        }
    }

    public List<ArchiveChunk> chunks(String ownerId) throws IOException {
        OwnerChain chain = chainFor(ownerId);
        synchronized (chain) {
            return List.copyOf(chain.chunks);
        }
    }

    public Optional<ArchiveChunk> findByItem(String ownerId, String itemId) throws IOException {
        if (itemId == null) {
            return Optional.empty();
        }
        OwnerChain chain = chainFor(ownerId);
        synchronized (chain) {
            return chain.chunks.stream().filter(chunk -> itemId.equals(chunk.itemId())).findFirst();
        }
    }

    public ArchiveChunk redact(String ownerId, String chunkId) throws IOException {
        OwnerChain chain = chainFor(ownerId);
        synchronized (chain) {
            int target = indexOf(chain, chunkId);
            if (target < 0) {
                throw new ChunkNotFoundException(ownerId, chunkId);
            }
            List<String> payloads = replay(chain.chunks);
            Map<Integer, String> bodies = new LinkedHashMap<>();
            bodies.put(target, redaction.redact(payloads.get(target)));
            rewrite(chain, payloads, bodies);
            return chain.chunks.get(target);
        }
    }

    public ArchiveChunk redactFully(String ownerId, String chunkId) throws IOException {
        OwnerChain chain = chainFor(ownerId);
        synchronized (chain) {
            int target = indexOf(chain, chunkId);
            if (target < 0) {
                throw new ChunkNotFoundException(ownerId, chunkId);
            }
            List<String> payloads = replay(chain.chunks);
            Map<Integer, String> bodies = new LinkedHashMap<>();
            bodies.put(target, PiiRedactor.FULL_PLACEHOLDER);
            rewrite(chain, payloads, bodies);
            return chain.chunks.get(target);
        }
    }

    /**
     * Redacts every chunk whose payload still changes under redaction.
     *
     * @return the number of chunks rewritten
     */
    public int redactAll(String ownerId) throws IOException {
        OwnerChain chain = chainFor(ownerId);
        synchronized (chain) {
            List<String> payloads = replay(chain.chunks);
            Map<Integer, String> bodies = new LinkedHashMap<>();
            for (int i = 0; i < payloads.size(); i++) {
                String redacted = redaction.redact(payloads.get(i));
                if (!redacted.equals(payloads.get(i))) {
                    bodies.put(i, redacted);
                }
            }
            if (!bodies.isEmpty()) {
                rewrite(chain, payloads, bodies);
            }
            return bodies.size();
        }
    }

    public ArchiveStats stats(String ownerId) throws IOException {
        OwnerChain chain = chainFor(ownerId);
        synchronized (chain) {
            List<String> payloads = replay(chain.chunks);
            int deltas = 0;
            int redacted = 0;
            long payloadChars = 0;
            long storedChars = 0;
            for (int i = 0; i < chain.chunks.size(); i++) {
                ArchiveChunk chunk = chain.chunks.get(i);
                if (chunk.encoding() == ChunkEncoding.DELTA) {
                    deltas++;
                }
                if (chunk.redacted()) {
                    redacted++;
                }
                payloadChars += payloads.get(i).length();
                storedChars += chunk.deltaPayload().length();
            }
            return new ArchiveStats(chain.chunks.size(), deltas, redacted, payloadChars, storedChars);
        }
    }

    public List<String> owners() throws IOException {
        return store.owners();
    }

    private void rewrite(OwnerChain chain, List<String> payloads, Map<Integer, String> redactedBodies) throws IOException {
        Map<Integer, ArchiveChunk> changed = new LinkedHashMap<>();
        for (Map.Entry<Integer, String> entry : redactedBodies.entrySet()) {
            int index = entry.getKey();
            int next = index + 1;
            if (next < chain.chunks.size()
                && chain.chunks.get(next).encoding() == ChunkEncoding.DELTA
                && !redactedBodies.containsKey(next)) {
                ArchiveChunk dependent = chain.chunks.get(next);
                changed.put(next, dependent.withBody(ChunkEncoding.FULL, payloads.get(next), dependent.redacted()));
            }
            changed.put(index, chain.chunks.get(index).withBody(ChunkEncoding.FULL, entry.getValue(), true));
        }

        List<ArchiveChunk> updates = List.copyOf(changed.values());
        store.rewriteBodies(chain.ownerId, updates);
        for (Map.Entry<Integer, ArchiveChunk> entry : changed.entrySet()) {
            chain.chunks.set(entry.getKey(), entry.getValue());
        }
        int last = chain.chunks.size() - 1;
        if (redactedBodies.containsKey(last)) {
            chain.tailPayload = redactedBodies.get(last);
        }
        LOG.debug("Rewrote {} chunk bodies for owner {} ({} redacted)", updates.size(), chain.ownerId, redactedBodies.size());
    }

    private void persistWithRetry(ArchiveChunk chunk) throws IOException {
        IOException last = null;
        for (int attempt = 1; attempt <= config.persistenceRetries(); attempt++) {
            try {
                store.append(chunk);
                return;
            } catch (IOException e) {
                last = e;
                LOG.warn(
                    "Archive write for chunk {} failed (attempt {}/{}): {}",
                    chunk.chunkId(),
                    attempt,
                    config.persistenceRetries(),
                    e.getMessage()
                );
            }
        }
        throw last;
    }

    private List<String> replay(List<ArchiveChunk> chunks) {
        List<String> payloads = new ArrayList<>(chunks.size());
        String state = null;
        for (ArchiveChunk chunk : chunks) {
            try {
                state = rehydrate(chunk, state);
            } catch (IllegalArgumentException e) {
                throw new ChainIntegrityException(chunk.ownerId(), chunk.chunkId(), "undecodable body: " + e.getMessage());
            }
            payloads.add(state);
        }
        return payloads;
    }

    private String rehydrate(ArchiveChunk chunk, String previousPayload) {
        if (chunk.encoding() == ChunkEncoding.FULL) {
            return chunk.deltaPayload();
        }
        if (previousPayload == null) {
            throw new IllegalArgumentException("delta chunk without a base");
        }
        return codec.decode(previousPayload, chunk.deltaPayload());
    }

    private int indexOf(OwnerChain chain, String chunkId) {
        for (int i = 0; i < chain.chunks.size(); i++) {
            if (chain.chunks.get(i).chunkId().equals(chunkId)) {
                return i;
            }
        }
        return -1;
    }

    private OwnerChain chainFor(String ownerId) throws IOException {
        OwnerChain chain = chains.computeIfAbsent(ownerId, OwnerChain::new);
        synchronized (chain) {
            if (!chain.loaded) {
                chain.chunks.addAll(store.list(ownerId));
                if (!chain.chunks.isEmpty()) {
                    List<String> payloads = replay(chain.chunks);
                    chain.tailPayload = payloads.get(payloads.size() - 1);
                }
                chain.loaded = true;
            }
        }
        return chain;
    }

    private static final class OwnerChain {
        private final String ownerId;
        private final List<ArchiveChunk> chunks = new ArrayList<>();
        private String tailPayload;
        private boolean loaded;

        private OwnerChain(String ownerId) {
            this.ownerId = ownerId;
        }

        private ArchiveChunk tail() {
            return chunks.isEmpty() ? null : chunks.get(chunks.size() - 1);
        }
    }
}
