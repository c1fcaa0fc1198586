package io.strata.core.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.strata.core.memory.MemoryItem;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Persisted form of one owner's warm tier: the graph plus the live copies of items resident in
 * the warm tier and the time each of them was admitted.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WarmSnapshot(
    String ownerId,
    List<GraphNode> nodes,
    List<GraphEdge> edges,
    List<MemoryItem> residents,
    List<String> purgedItemIds,
    Map<String, Instant> admittedAt
) {
    public WarmSnapshot {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
        residents = residents == null ? List.of() : List.copyOf(residents);
        purgedItemIds = purgedItemIds == null ? List.of() : List.copyOf(purgedItemIds);
        admittedAt = admittedAt == null ? Map.of() : Map.copyOf(admittedAt);
    }
}
