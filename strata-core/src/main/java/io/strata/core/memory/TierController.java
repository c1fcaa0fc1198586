package io.strata.core.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.strata.core.archive.ArchiveChunk;
import io.strata.core.archive.ArchivedPayload;
import io.strata.core.archive.ChainReport;
import io.strata.core.archive.ColdArchive;
import io.strata.core.config.model.MemoryConfig;
import io.strata.core.graph.GraphNode;
import io.strata.core.graph.NodeType;
import io.strata.core.graph.OwnerGraph;
import io.strata.core.graph.RankedNode;
import io.strata.core.graph.RelationKind;
import io.strata.core.graph.WarmGraphStore;
import io.strata.core.hot.HotCache;
import io.strata.core.hot.HotEviction;
import io.strata.core.observability.AccessType;
import io.strata.core.observability.MemoryMetrics;
import io.strata.core.privacy.PiiRedactor;
import io.strata.core.scoring.ImportanceScorer;
import io.strata.core.text.Terms;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point for recording and recalling conversational memory across the hot, warm and
 * cold tiers.
 *
 * <p>Every item lives in exactly one tier. Leaving the hot tier writes the target first and only
 * then removes the hot copy; both writes are idempotent, so a failed transition leaves the item in
 * the hot tier and a later one completes it. Demotion releases the warm copy first and admits it
 * again when archiving fails. Failures are rethrown. Mutations for one owner are serialized
 * through {@link OwnerLocks}.
 */
public final class TierController {
    private static final Logger LOG = LoggerFactory.getLogger(TierController.class);
    private static final Duration RECENCY_HORIZON = Duration.ofDays(7);
    private static final Duration METRICS_WINDOW = Duration.ofHours(24);
    private static final int EXCERPT_CHARS = 160;
    private static final int DERIVED_TOPICS = 3;

    private final ImportanceScorer scorer;
    private final HotCache hot;
    private final WarmGraphStore warm;
    private final ColdArchive cold;
    private final MemoryMetrics metrics;
    private final MemoryConfig config;
    private final OwnerLocks locks;
    private final Clock clock;
    private final ObjectMapper mapper;

    public TierController(
        ImportanceScorer scorer,
        HotCache hot,
        WarmGraphStore warm,
        ColdArchive cold,
        MemoryMetrics metrics,
        MemoryConfig config,
        Clock clock
    ) {
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
        this.hot = Objects.requireNonNull(hot, "hot must not be null");
        this.warm = Objects.requireNonNull(warm, "warm must not be null");
        this.cold = Objects.requireNonNull(cold, "cold must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.locks = new OwnerLocks(config.failFast());
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Scores the turn and stores it in the hot tier. Items that have to leave the hot cache to make
     * room are routed through the transition policy first; if one of them fails, the turn is not
     * stored.
     *
     * @throws io.strata.core.scoring.InvalidSignalException when a signal is out of range; nothing
     *     is written in that case
     */
    public MemoryItem recordTurn(String ownerId, String sessionId, TurnContent content) throws IOException {
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        Objects.requireNonNull(content, "content must not be null");
        double importance = scorer.score(content.signals());
        return locks.write(ownerId, () -> {
            Instant now = clock.instant();
            MemoryItem item = new MemoryItem(
                UUID.randomUUID().toString(),
                ownerId,
                sessionId,
                content,
                importance,
                now,
                now,
                MemoryTier.HOT,
                0
            );
            for (HotEviction eviction : hot.overflow(ownerId)) {
                route(eviction);
            }
            long started = MemoryMetrics.start();
            List<HotEviction> evictions = hot.put(item);
            metrics.record(ownerId, MemoryTier.HOT, AccessType.WRITE, started);
            for (HotEviction eviction : evictions) {
                route(eviction);
            }
            return hot.find(ownerId, item.id()).orElse(item);
        });
    }

    public List<ContextHit> recallContext(String ownerId, String hint, RecallDepth depth) throws IOException {
        return recallContext(ownerId, hint, depth, config.hotCapacity());
    }

    /**
     * Gathers hot items, then warm items reachable from the hint's anchor node within
     * {@code maxHops}, then for {@link RecallDepth#DEEP} archived items matching the hint. Hits are
     * ranked by {@code importance + recencyWeight * recency}, where recency falls linearly from 1
     * to 0 over seven days since the last reference. Returned hot and warm items are touched.
     */
    public List<ContextHit> recallContext(String ownerId, String hint, RecallDepth depth, int limit) throws IOException {
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        Objects.requireNonNull(depth, "depth must not be null");
        if (limit <= 0) {
            return List.of();
        }
        return locks.write(ownerId, () -> {
            Instant now = clock.instant();
            Map<String, ContextHit> candidates = new LinkedHashMap<>();

            long started = MemoryMetrics.start();
            for (MemoryItem item : hot.peek(ownerId)) {
                candidates.put(item.id(), new ContextHit(MemoryTier.HOT, item, score(item, now), null, 0));
            }
            metrics.record(ownerId, MemoryTier.HOT, candidates.isEmpty() ? AccessType.MISS : AccessType.HIT, started);

            started = MemoryMetrics.start();
            int before = candidates.size();
            for (RankedNode ranked : warm.traverse(ownerId, hint, config.maxHops())) {
                for (String itemId : ranked.node().sourceItemIds()) {
                    if (candidates.containsKey(itemId)) {
                        continue;
                    }
                    warm.resident(ownerId, itemId).ifPresent(item -> candidates.put(
                        item.id(),
                        new ContextHit(MemoryTier.WARM, item, score(item, now), ranked.node().nodeId(), ranked.hops())
                    ));
                }
            }
            metrics.record(ownerId, MemoryTier.WARM, candidates.size() > before ? AccessType.HIT : AccessType.MISS, started);

            if (depth == RecallDepth.DEEP) {
                started = MemoryMetrics.start();
                before = candidates.size();
                for (MemoryItem item : archivedItems(ownerId)) {
                    if (candidates.containsKey(item.id())) {
                        continue;
                    }
                    if (hint != null && !hint.isBlank() && Terms.overlap(hint, searchableText(item)) == 0.0) {
                        continue;
                    }
                    candidates.put(item.id(), new ContextHit(MemoryTier.COLD, item, score(item, now), null, 0));
                }
                metrics.record(ownerId, MemoryTier.COLD, candidates.size() > before ? AccessType.HIT : AccessType.MISS, started);
            }

            List<ContextHit> ranked = new ArrayList<>(candidates.values());
            ranked.sort(Comparator.comparingDouble(ContextHit::score).reversed()
                .thenComparing(ContextHit::tier));
            List<ContextHit> selected = ranked.subList(0, Math.min(limit, ranked.size()));
            return touch(ownerId, selected);
        });
    }

    /**
     * Ages out expired hot items and demotes warm items admitted longer than the warm retention
     * window ago. Recalling a warm item does not extend its stay.
     */
    public SweepReport sweep(String ownerId) throws IOException {
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        return locks.write(ownerId, () -> {
            int promoted = 0;
            int archived = 0;
            int dropped = 0;
            List<HotEviction> expired = hot.expired(ownerId);
            for (HotEviction eviction : expired) {
                switch (route(eviction)) {
                    case PROMOTED_TO_WARM -> promoted++;
                    case ARCHIVED_TO_COLD -> archived++;
                    case EVICTED -> dropped++;
                }
            }

            Instant cutoff = clock.instant().minus(config.warmRetention());
            int demoted = 0;
            for (MemoryItem item : warm.residents(ownerId)) {
                Optional<Instant> since = warm.residentSince(ownerId, item.id());
                if (since.isPresent() && since.get().isBefore(cutoff)) {
                    demoteFromWarm(item, since.get());
                    demoted++;
                }
            }
            SweepReport report = new SweepReport(ownerId, expired.size(), promoted, archived, dropped, demoted);
            if (expired.size() + demoted > 0) {
                LOG.debug(
                    "Sweep for owner {}: {} expired from hot, {} demoted from warm",
                    ownerId,
                    expired.size(),
                    demoted
                );
            }
            return report;
        });
    }

    public List<SweepReport> sweepAll() throws IOException {
        Set<String> owners = new LinkedHashSet<>(hot.owners());
        owners.addAll(warm.owners());
        List<SweepReport> reports = new ArrayList<>(owners.size());
        for (String owner : owners) {
            reports.add(sweep(owner));
        }
        return reports;
    }

    public ChainReport verifyIntegrity(String ownerId) throws IOException {
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        return locks.read(ownerId, () -> {
            ChainReport report = cold.inspect(ownerId);
            if (!report.intact()) {
                LOG.warn(
                    "Cold chain of owner {} failed verification at chunk {}: {}",
                    ownerId,
                    report.failedChunkId(),
                    report.reason()
                );
            }
            return report;
        });
    }

    /**
     * Exports the owner's cold chain after verifying it.
     *
     * @throws io.strata.core.archive.ChainIntegrityException when the chain does not verify
     */
    public AuditExport exportForAudit(String ownerId) throws IOException {
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        return locks.read(ownerId, () -> {
            cold.requireIntact(ownerId);
            return new AuditExport(
                ownerId,
                clock.instant(),
                cold.inspect(ownerId),
                cold.history(ownerId),
                cold.stats(ownerId)
            );
        });
    }

    /**
     * Redacts detected personal data in every archived chunk of the owner.
     *
     * @return the number of chunks rewritten
     */
    public int redactPii(String ownerId) throws IOException {
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        return locks.write(ownerId, () -> {
            int redacted = cold.redactAll(ownerId);
            LOG.debug("Redacted {} archived chunks for owner {}", redacted, ownerId);
            return redacted;
        });
    }

    public ArchiveChunk redactChunk(String ownerId, String chunkId) throws IOException {
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        Objects.requireNonNull(chunkId, "chunkId must not be null");
        return locks.write(ownerId, () -> cold.redactFully(ownerId, chunkId));
    }

    /**
     * Removes every live copy of an item: hot and warm copies are dropped, an archived copy is
     * fully redacted, and graph nodes whose every source item is purged become orphans.
     *
     * @return whether the item was found in any tier
     */
    public boolean purge(String ownerId, String itemId) throws IOException {
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        Objects.requireNonNull(itemId, "itemId must not be null");
        return locks.write(ownerId, () -> {
            boolean found = false;
            Optional<ArchiveChunk> archived = cold.findByItem(ownerId, itemId);
            if (archived.isPresent()) {
                cold.redactFully(ownerId, archived.get().chunkId());
                found = true;
            }
            found |= warm.resident(ownerId, itemId).isPresent();
            warm.markPurged(ownerId, itemId);
            found |= hot.remove(ownerId, itemId).isPresent();
            LOG.debug("Purged item {} of owner {} (found: {})", itemId, ownerId, found);
            return found;
        });
    }

    public Optional<MemoryTier> tierOf(String ownerId, String itemId) throws IOException {
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        return locks.read(ownerId, () -> {
            if (hot.contains(ownerId, itemId)) {
                return Optional.of(MemoryTier.HOT);
            }
            if (warm.resident(ownerId, itemId).isPresent()) {
                return Optional.of(MemoryTier.WARM);
            }
            Optional<ArchiveChunk> archived = cold.findByItem(ownerId, itemId);
            if (archived.isPresent()
                && !PiiRedactor.FULL_PLACEHOLDER.equals(cold.payloadOf(ownerId, archived.get().chunkId()))) {
                return Optional.of(MemoryTier.COLD);
            }
            return Optional.empty();
        });
    }

    public TierStats stats(String ownerId) throws IOException {
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        return locks.read(ownerId, () -> {
            List<GraphNode> nodes = warm.nodes(ownerId);
            int orphaned = (int) nodes.stream().filter(GraphNode::orphaned).count();
            return new TierStats(
                ownerId,
                hot.size(ownerId),
                warm.residents(ownerId).size(),
                nodes.size(),
                warm.edges(ownerId).size(),
                orphaned,
                cold.stats(ownerId),
                metrics.summary(ownerId, METRICS_WINDOW)
            );
        });
    }

    private TransitionOutcome route(HotEviction eviction) throws IOException {
        MemoryItem item = eviction.item();
        metrics.record(item.ownerId(), MemoryTier.HOT, AccessType.EVICTION, MemoryMetrics.start());
        try {
            TransitionOutcome outcome;
            if (item.importance() >= config.warmThreshold() || eviction.aboveFloor()) {
                promoteToWarm(item);
                outcome = TransitionOutcome.PROMOTED_TO_WARM;
            } else if (item.importance() >= config.retentionFloor()) {
                archive(item);
                outcome = TransitionOutcome.ARCHIVED_TO_COLD;
            } else {
                LOG.debug("Dropped item {} of owner {} with importance {}", item.id(), item.ownerId(), item.importance());
                outcome = TransitionOutcome.EVICTED;
            }
            hot.remove(item.ownerId(), item.id());
            return outcome;
        } catch (IOException | RuntimeException e) {
            LOG.warn("Transition of item {} for owner {} failed, kept in hot tier: {}", item.id(), item.ownerId(), e.getMessage());
            throw e;
        }
    }

    private void promoteToWarm(MemoryItem item) throws IOException {
        if (warm.resident(item.ownerId(), item.id()).isPresent()) {
            return;
        }
        long started = MemoryMetrics.start();
        Instant now = clock.instant();
        warm.apply(item.ownerId(), graph -> {
            graph.admit(item, now);
            connect(graph, item);
            return null;
        });
        metrics.record(item.ownerId(), MemoryTier.WARM, AccessType.WRITE, started);
        LOG.debug("Promoted item {} of owner {} to warm", item.id(), item.ownerId());
    }

    private void demoteFromWarm(MemoryItem item, Instant admittedAt) throws IOException {
        long started = MemoryMetrics.start();
        warm.apply(item.ownerId(), graph -> graph.release(item.id()));
        try {
            archive(item);
        } catch (IOException | RuntimeException e) {
            try {
                warm.apply(item.ownerId(), graph -> {
                    graph.admit(item, admittedAt);
                    return null;
                });
            } catch (IOException | RuntimeException restore) {
                e.addSuppressed(restore);
            }
            LOG.warn("Demotion of item {} for owner {} failed, kept in warm tier: {}", item.id(), item.ownerId(), e.getMessage());
            throw e;
        }
        metrics.record(item.ownerId(), MemoryTier.WARM, AccessType.EVICTION, started);
        LOG.debug("Demoted item {} of owner {} from warm to cold", item.id(), item.ownerId());
    }

    private void archive(MemoryItem item) throws IOException {
        if (cold.findByItem(item.ownerId(), item.id()).isPresent()) {
            return;
        }
        long started = MemoryMetrics.start();
        ArchiveChunk chunk = cold.append(item.ownerId(), item.id(), toPayload(item), item.importance());
        metrics.record(item.ownerId(), MemoryTier.COLD, AccessType.WRITE, started);
        LOG.debug("Archived item {} of owner {} as chunk {}", item.id(), item.ownerId(), chunk.chunkId());
    }

    /**
     * Folds an item into the owner's graph: one node per distinct entity and topic, the session's
     * summary node linked to each of them, entities linked pairwise and to every topic.
     */
    private void connect(OwnerGraph graph, MemoryItem item) {
        double importance = item.importance();
        double strength = importance / scorer.maxImportance();
        Set<String> entityIds = new LinkedHashSet<>();
        for (String entity : item.content().entities()) {
            if (!entity.isBlank()) {
                entityIds.add(graph.upsertLabeled(NodeType.ENTITY, entity, importance, item.id()).nodeId());
            }
        }
        List<String> topics = item.content().topics().isEmpty() && entityIds.isEmpty()
            ? derivedTopics(item.content().text())
            : item.content().topics();
        Set<String> topicIds = new LinkedHashSet<>();
        for (String topic : topics) {
            if (!topic.isBlank()) {
                topicIds.add(graph.upsertLabeled(NodeType.TOPIC, topic, importance, item.id()).nodeId());
            }
        }

        GraphNode summary = graph.upsertSummary(item.sessionId(), excerpt(item.content().text()), importance, item.id());
        for (String nodeId : entityIds) {
            graph.link(summary.nodeId(), nodeId, RelationKind.SUMMARY_OF, strength);
        }
        for (String nodeId : topicIds) {
            graph.link(summary.nodeId(), nodeId, RelationKind.SUMMARY_OF, strength);
        }

        List<String> entities = new ArrayList<>(entityIds);
        for (int i = 0; i < entities.size(); i++) {
            for (int j = i + 1; j < entities.size(); j++) {
                graph.link(entities.get(i), entities.get(j), RelationKind.DISCUSSED_WITH, strength);
            }
            for (String topicId : topicIds) {
                graph.link(entities.get(i), topicId, RelationKind.RELATES_TO, strength);
            }
        }
    }

    private List<ContextHit> touch(String ownerId, List<ContextHit> selected) throws IOException {
        List<ContextHit> touched = new ArrayList<>(selected.size());
        List<MemoryItem> warmTouched = new ArrayList<>();
        Instant now = clock.instant();
        for (ContextHit hit : selected) {
            MemoryItem item = hit.item();
            if (hit.tier() == MemoryTier.HOT) {
                item = hot.touch(ownerId, item.id()).orElse(item);
            } else if (hit.tier() == MemoryTier.WARM) {
                item = item.touched(now);
                warmTouched.add(item);
            }
            touched.add(new ContextHit(hit.tier(), item, hit.score(), hit.viaNodeId(), hit.hops()));
        }
        if (!warmTouched.isEmpty()) {
            warm.apply(ownerId, graph -> {
                warmTouched.forEach(graph::touchResident);
                return null;
            });
        }
        return touched;
    }

    private List<MemoryItem> archivedItems(String ownerId) throws IOException {
        List<MemoryItem> items = new ArrayList<>();
        for (ArchivedPayload archived : cold.history(ownerId)) {
            String payload = archived.payload();
            if (archived.itemId() == null || !payload.startsWith("{")) {
                continue;
            }
            try {
                items.add(mapper.readValue(payload, MemoryItem.class).inTier(MemoryTier.COLD));
            } catch (JsonProcessingException e) {
                LOG.debug("Skipping archived chunk {} of owner {}: not an item payload", archived.chunkId(), ownerId);
            }
        }
        return items;
    }

    private String toPayload(MemoryItem item) throws IOException {
        try {
            return mapper.writeValueAsString(item.inTier(MemoryTier.COLD));
        } catch (JsonProcessingException e) {
            throw new IOException("Failed to serialize item " + item.id(), e);
        }
    }

    private double score(MemoryItem item, Instant now) {
        long ageMillis = Math.max(0L, Duration.between(item.lastReferencedAt(), now).toMillis());
        double recency = Math.max(0.0, 1.0 - (double) ageMillis / RECENCY_HORIZON.toMillis());
        return item.importance() + config.recencyWeight() * recency;
    }

    private static String searchableText(MemoryItem item) {
        return item.content().text() + " " + String.join(" ", item.content().entities()) + " "
            + String.join(" ", item.content().topics());
    }

    private static String excerpt(String text) {
        return text.length() <= EXCERPT_CHARS ? text : text.substring(0, EXCERPT_CHARS);
    }

    private static List<String> derivedTopics(String text) {
        Set<String> topics = new LinkedHashSet<>();
        for (String token : Terms.tokenize(text)) {
            if (token.length() >= 4) {
                topics.add(token);
            }
            if (topics.size() == DERIVED_TOPICS) {
                break;
            }
        }
        return List.copyOf(topics);
    }
}
