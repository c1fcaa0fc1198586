package io.strata.core.graph;

import io.strata.core.memory.MemoryItem;
import io.strata.core.memory.MemoryTier;
import io.strata.core.text.Terms;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Mutable working copy of one owner's warm tier. {@link WarmGraphStore} hands out copies to
 * mutations and publishes them only after they were persisted, so a published instance is never
 * modified again.
 */
public final class OwnerGraph {
    private final String ownerId;
    private final Clock clock;
    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final List<GraphEdge> edges = new ArrayList<>();
    private final Map<String, MemoryItem> residents = new LinkedHashMap<>();
    private final Set<String> purgedItemIds = new LinkedHashSet<>();
    private final Map<String, Instant> admittedAt = new LinkedHashMap<>();

    OwnerGraph(String ownerId, Clock clock) {
        this.ownerId = Objects.requireNonNull(ownerId, "ownerId must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    static OwnerGraph fromSnapshot(WarmSnapshot snapshot, Clock clock) {
        OwnerGraph graph = new OwnerGraph(snapshot.ownerId(), clock);
        snapshot.nodes().forEach(node -> graph.nodes.put(node.nodeId(), node));
        graph.edges.addAll(snapshot.edges());
        snapshot.residents().forEach(item -> graph.residents.put(item.id(), item));
        graph.purgedItemIds.addAll(snapshot.purgedItemIds());
        snapshot.admittedAt().forEach((itemId, at) -> {
            if (graph.residents.containsKey(itemId)) {
                graph.admittedAt.put(itemId, at);
            }
        });
        return graph;
    }

    OwnerGraph copy() {
        return fromSnapshot(snapshot(), clock);
    }

    WarmSnapshot snapshot() {
        return new WarmSnapshot(
            ownerId,
            List.copyOf(nodes.values()),
            List.copyOf(edges),
            List.copyOf(residents.values()),
            List.copyOf(purgedItemIds),
            Map.copyOf(admittedAt)
        );
    }

    public String ownerId() {
        return ownerId;
    }

    public GraphNode createNode(NodeType type, String label, Map<String, Object> payload, double weight, String sourceItemId) {
        Objects.requireNonNull(type, "type must not be null");
        if (weight < 0 || Double.isNaN(weight)) {
            throw new IllegalArgumentException("weight must be a non-negative number");
        }
        Instant now = clock.instant();
        GraphNode node = new GraphNode(
            UUID.randomUUID().toString(),
            ownerId,
            type,
            label,
            payload,
            weight,
            sourceItemId == null ? List.of() : List.of(sourceItemId),
            false,
            now,
            now
        );
        nodes.put(node.nodeId(), node);
        return node;
    }

    /**
     * Returns the single entity or topic node for {@code label}, creating it on first mention and
     * adding {@code weight} on every later one.
     */
    public GraphNode upsertLabeled(NodeType type, String label, double weight, String sourceItemId) {
        if (type == NodeType.SUMMARY) {
            throw new IllegalArgumentException("summary nodes are not de-duplicated by label");
        }
        String normalized = Terms.normalizeLabel(label);
        if (normalized.isBlank()) {
            throw new IllegalArgumentException("label must not be blank");
        }
        Optional<GraphNode> existing = findLabeled(type, normalized);
        if (existing.isPresent()) {
            GraphNode node = existing.get();
            Map<String, Object> payload = new LinkedHashMap<>(node.payload());
            payload.put("mentions", mentions(node) + 1);
            GraphNode updated = node.reinforced(weight, sourceItemId, payload, clock.instant());
            nodes.put(updated.nodeId(), updated);
            return updated;
        }
        return createNode(type, label.trim(), Map.of("mentions", 1), weight, sourceItemId);
    }

    public GraphNode reinforce(String nodeId, double weight, String sourceItemId, Map<String, Object> payload) {
        GraphNode node = requireNode(nodeId);
        GraphNode updated = node.reinforced(weight, sourceItemId, payload, clock.instant());
        nodes.put(nodeId, updated);
        return updated;
    }

    /**
     * Adds an edge, or strengthens the existing edge of the same kind as {@code 1 - (1 - a)(1 - b)}
     * so repeated links saturate at 1.
     */
    public GraphEdge link(String fromNodeId, String toNodeId, RelationKind kind, double strength) {
        requireNode(fromNodeId);
        requireNode(toNodeId);
        if (fromNodeId.equals(toNodeId)) {
            throw new IllegalArgumentException("self links are not allowed");
        }
        Instant now = clock.instant();
        double bounded = Math.max(0.0, Math.min(1.0, strength));
        for (int i = 0; i < edges.size(); i++) {
            GraphEdge edge = edges.get(i);
            if (edge.connects(fromNodeId, toNodeId, kind)) {
                double combined = 1.0 - (1.0 - edge.strength()) * (1.0 - bounded);
                GraphEdge updated = new GraphEdge(fromNodeId, toNodeId, kind, combined, now);
                edges.set(i, updated);
                return updated;
            }
        }
        GraphEdge edge = new GraphEdge(fromNodeId, toNodeId, kind, bounded, now);
        edges.add(edge);
        return edge;
    }

    public void admit(MemoryItem item) {
        admit(item, clock.instant());
    }

    /**
     * Makes the item resident, admitted at {@code at}. Warm retention is measured from that time.
     */
    public void admit(MemoryItem item, Instant at) {
        if (!ownerId.equals(item.ownerId())) {
            throw new IllegalArgumentException("item belongs to another owner");
        }
        residents.put(item.id(), item.inTier(MemoryTier.WARM));
        admittedAt.put(item.id(), Objects.requireNonNull(at, "at must not be null"));
    }

    public Optional<MemoryItem> release(String itemId) {
        admittedAt.remove(itemId);
        return Optional.ofNullable(residents.remove(itemId));
    }

    /**
     * When the resident item was admitted. Snapshots written without admission times fall back to
     * the item's last reference.
     */
    public Optional<Instant> residentSince(String itemId) {
        MemoryItem item = residents.get(itemId);
        if (item == null) {
            return Optional.empty();
        }
        return Optional.of(admittedAt.getOrDefault(itemId, item.lastReferencedAt()));
    }

    public void touchResident(MemoryItem touched) {
        if (residents.containsKey(touched.id())) {
            residents.put(touched.id(), touched);
        }
    }

    /**
     * Records that an item is gone from every tier and orphans nodes left without a live source.
     *
     * @return the nodes orphaned by this call
     */
    public List<GraphNode> markPurged(String itemId) {
        purgedItemIds.add(itemId);
        residents.remove(itemId);
        admittedAt.remove(itemId);
        Instant now = clock.instant();
        List<GraphNode> orphaned = new ArrayList<>();
        for (GraphNode node : List.copyOf(nodes.values())) {
            if (node.orphaned() || !node.sourceItemIds().contains(itemId)) {
                continue;
            }
            if (purgedItemIds.containsAll(node.sourceItemIds())) {
                GraphNode orphan = node.orphan(now);
                nodes.put(orphan.nodeId(), orphan);
                orphaned.add(orphan);
            }
        }
        return orphaned;
    }

    public Optional<GraphNode> node(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public Collection<GraphNode> nodes() {
        return List.copyOf(nodes.values());
    }

    public List<GraphEdge> edges() {
        return List.copyOf(edges);
    }

    public List<MemoryItem> residents() {
        return List.copyOf(residents.values());
    }

    public Optional<MemoryItem> resident(String itemId) {
        return Optional.ofNullable(residents.get(itemId));
    }

    public Optional<GraphNode> findLabeled(NodeType type, String label) {
        String normalized = Terms.normalizeLabel(label);
        return nodes.values().stream()
            .filter(node -> node.nodeType() == type && Terms.normalizeLabel(node.label()).equals(normalized))
            .findFirst();
    }

    /**
     * Creates the session's summary node on its first item and folds every later item into it.
     */
    public GraphNode upsertSummary(String sessionId, String excerpt, double weight, String sourceItemId) {
        Optional<GraphNode> existing = summaryForSession(sessionId);
        if (existing.isEmpty()) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("session_id", sessionId);
            payload.put("items", 1);
            payload.put("excerpt", excerpt == null ? "" : excerpt);
            return createNode(NodeType.SUMMARY, "session " + sessionId, payload, weight, sourceItemId);
        }
        GraphNode summary = existing.get();
        Map<String, Object> payload = new LinkedHashMap<>(summary.payload());
        Object items = payload.get("items");
        payload.put("items", (items instanceof Number number ? number.intValue() : 0) + 1);
        payload.put("excerpt", excerpt == null ? "" : excerpt);
        return reinforce(summary.nodeId(), weight, sourceItemId, payload);
    }

    public Optional<GraphNode> summaryForSession(String sessionId) {
        return nodes.values().stream()
            .filter(node -> node.nodeType() == NodeType.SUMMARY)
            .filter(node -> Objects.equals(node.payload().get("session_id"), sessionId))
            .findFirst();
    }

    public Optional<GraphNode> latestSummary() {
        return nodes.values().stream()
            .filter(node -> node.nodeType() == NodeType.SUMMARY)
            .max(Comparator.comparing(GraphNode::updatedAt));
    }

    public List<GraphNode> nodesReferencing(String itemId) {
        return nodes.values().stream()
            .filter(node -> node.sourceItemIds().contains(itemId))
            .toList();
    }

    private int mentions(GraphNode node) {
        Object value = node.payload().get("mentions");
        return value instanceof Number number ? number.intValue() : 1;
    }

    private GraphNode requireNode(String nodeId) {
        GraphNode node = nodes.get(nodeId);
        if (node == null) {
            throw new IllegalArgumentException("Unknown node " + nodeId + " for owner " + ownerId);
        }
        return node;
    }
}
