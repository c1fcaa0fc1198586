package io.strata.core.graph;

import io.strata.core.memory.MemoryItem;
import io.strata.core.text.Terms;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persistent per-owner graph of entities, topics and summaries, plus the warm tier's live item
 * copies.
 *
 * <p>Mutations run against a private copy of the owner's graph that replaces the published one
 * only after the repository saved it. A mutation that throws, or whose save fails, leaves the
 * published graph untouched. Readers always see a complete, published graph.
 */
public final class WarmGraphStore {
    private static final Logger LOG = LoggerFactory.getLogger(WarmGraphStore.class);

    private final GraphRepository repository;
    private final Clock clock;
    private final Map<String, OwnerGraph> published = new ConcurrentHashMap<>();
    private final Map<String, Object> writeLocks = new ConcurrentHashMap<>();

    public WarmGraphStore(GraphRepository repository, Clock clock) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public <T> T apply(String ownerId, Function<OwnerGraph, T> mutation) throws IOException {
        Objects.requireNonNull(mutation, "mutation must not be null");
        synchronized (writeLockFor(ownerId)) {
            OwnerGraph working = current(ownerId).copy();
            T result = mutation.apply(working);
            repository.save(working.snapshot());
            published.put(ownerId, working);
            return result;
        }
    }

    public GraphNode createNode(String ownerId, NodeType type, String label, Map<String, Object> payload, double weight)
        throws IOException {
        return apply(ownerId, graph -> graph.createNode(type, label, payload, weight, null));
    }

    public GraphNode upsertEntity(String ownerId, String label, double weight, String sourceItemId) throws IOException {
        return apply(ownerId, graph -> graph.upsertLabeled(NodeType.ENTITY, label, weight, sourceItemId));
    }

    public GraphNode upsertTopic(String ownerId, String label, double weight, String sourceItemId) throws IOException {
        return apply(ownerId, graph -> graph.upsertLabeled(NodeType.TOPIC, label, weight, sourceItemId));
    }

    public GraphNode upsertSummary(String ownerId, String sessionId, String excerpt, double weight, String sourceItemId)
        throws IOException {
        return apply(ownerId, graph -> graph.upsertSummary(sessionId, excerpt, weight, sourceItemId));
    }

    public GraphEdge link(String ownerId, String fromNodeId, String toNodeId, RelationKind kind, double strength)
        throws IOException {
        return apply(ownerId, graph -> graph.link(fromNodeId, toNodeId, kind, strength));
    }

    public List<GraphNode> markPurged(String ownerId, String itemId) throws IOException {
        List<GraphNode> orphaned = apply(ownerId, graph -> graph.markPurged(itemId));
        if (!orphaned.isEmpty()) {
            LOG.debug("Orphaned {} warm nodes of owner {} after purging item {}", orphaned.size(), ownerId, itemId);
        }
        return orphaned;
    }

    public List<GraphNode> queryContext(String ownerId, String topicHint, int maxHops) throws IOException {
        return traverse(ownerId, topicHint, maxHops).stream().map(RankedNode::node).toList();
    }

    /**
     * Breadth-first shortest-path walk from the anchor node, treating edges as undirected. Nodes
     * within {@code maxHops} are ranked by hop distance, then weight, then most recent update.
     * The anchor is the node whose label best matches {@code topicHint}; without a hint, or when
     * nothing matches, it is the most recently updated summary node.
     */
    public List<RankedNode> traverse(String ownerId, String topicHint, int maxHops) throws IOException {
        OwnerGraph graph = current(ownerId);
        Optional<GraphNode> anchor = anchorFor(graph, topicHint);
        if (anchor.isEmpty()) {
            return List.of();
        }

        Map<String, List<String>> adjacency = new HashMap<>();
        for (GraphEdge edge : graph.edges()) {
            adjacency.computeIfAbsent(edge.fromNodeId(), ignored -> new ArrayList<>()).add(edge.toNodeId());
            adjacency.computeIfAbsent(edge.toNodeId(), ignored -> new ArrayList<>()).add(edge.fromNodeId());
        }

        Map<String, Integer> distances = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        distances.put(anchor.get().nodeId(), 0);
        queue.add(anchor.get().nodeId());
        while (!queue.isEmpty()) {
            String current = queue.poll();
            int hops = distances.get(current);
            if (hops >= Math.max(0, maxHops)) {
                continue;
            }
            for (String neighbour : adjacency.getOrDefault(current, List.of())) {
                if (!distances.containsKey(neighbour)) {
                    distances.put(neighbour, hops + 1);
                    queue.add(neighbour);
                }
            }
        }

        List<RankedNode> ranked = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : distances.entrySet()) {
            graph.node(entry.getKey()).ifPresent(node -> ranked.add(new RankedNode(node, entry.getValue())));
        }
        ranked.sort(Comparator.comparingInt(RankedNode::hops)
            .thenComparing(Comparator.comparingDouble((RankedNode candidate) -> candidate.node().weight()).reversed())
            .thenComparing(Comparator.comparing((RankedNode candidate) -> candidate.node().updatedAt()).reversed()));
        return List.copyOf(ranked);
    }

    public List<GraphNode> nodes(String ownerId) throws IOException {
        return List.copyOf(current(ownerId).nodes());
    }

    public List<GraphEdge> edges(String ownerId) throws IOException {
        return current(ownerId).edges();
    }

    public Optional<GraphNode> node(String ownerId, String nodeId) throws IOException {
        return current(ownerId).node(nodeId);
    }

    public List<GraphNode> nodesReferencing(String ownerId, String itemId) throws IOException {
        return current(ownerId).nodesReferencing(itemId);
    }

    public List<MemoryItem> residents(String ownerId) throws IOException {
        return current(ownerId).residents();
    }

    public Optional<MemoryItem> resident(String ownerId, String itemId) throws IOException {
        return current(ownerId).resident(itemId);
    }

    public Optional<Instant> residentSince(String ownerId, String itemId) throws IOException {
        return current(ownerId).residentSince(itemId);
    }

    public List<String> owners() throws IOException {
        List<String> owners = new ArrayList<>(repository.owners());
        for (String owner : published.keySet()) {
            if (!owners.contains(owner)) {
                owners.add(owner);
            }
        }
        return owners;
    }

    private Optional<GraphNode> anchorFor(OwnerGraph graph, String topicHint) {
        if (topicHint != null && !topicHint.isBlank()) {
            Comparator<GraphNode> byWeight = Comparator.comparingDouble(GraphNode::weight);
            String normalized = Terms.normalizeLabel(topicHint);
            Optional<GraphNode> exact = graph.nodes().stream()
                .filter(node -> Terms.normalizeLabel(node.label()).equals(normalized))
                .max(byWeight);
            if (exact.isPresent()) {
                return exact;
            }
            Optional<GraphNode> partial = graph.nodes().stream()
                .filter(node -> Terms.overlap(topicHint, node.label()) > 0)
                .max(Comparator.comparingDouble((GraphNode node) -> Terms.overlap(topicHint, node.label()))
                    .thenComparing(byWeight));
            if (partial.isPresent()) {
                return partial;
            }
        }
        return graph.latestSummary();
    }

    private OwnerGraph current(String ownerId) throws IOException {
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        OwnerGraph graph = published.get(ownerId);
        if (graph != null) {
            return graph;
        }
        synchronized (writeLockFor(ownerId)) {
            graph = published.get(ownerId);
            if (graph == null) {
                graph = repository.load(ownerId)
                    .map(snapshot -> OwnerGraph.fromSnapshot(snapshot, clock))
                    .orElseGet(() -> new OwnerGraph(ownerId, clock));
                published.put(ownerId, graph);
            }
            return graph;
        }
    }

    private Object writeLockFor(String ownerId) {
        return writeLocks.computeIfAbsent(ownerId, ignored -> new Object());
    }
}
