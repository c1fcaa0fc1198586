package io.strata.core.graph;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Warm-tier node. {@code sourceItemIds} are lookup-only back references to the items that built
 * or reinforced the node.
 */
public record GraphNode(
    String nodeId,
    String ownerId,
    NodeType nodeType,
    String label,
    Map<String, Object> payload,
    double weight,
    List<String> sourceItemIds,
    boolean orphaned,
    Instant createdAt,
    Instant updatedAt
) {
    public GraphNode {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        Objects.requireNonNull(nodeType, "nodeType must not be null");
        label = label == null ? "" : label;
        payload = payload == null ? Map.of() : Map.copyOf(payload);
        sourceItemIds = sourceItemIds == null ? List.of() : List.copyOf(sourceItemIds);
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        updatedAt = updatedAt == null ? createdAt : updatedAt;
    }

    GraphNode reinforced(double extraWeight, String itemId, Map<String, Object> newPayload, Instant now) {
        List<String> sources = new ArrayList<>(sourceItemIds);
        if (itemId != null && !sources.contains(itemId)) {
            sources.add(itemId);
        }
        return new GraphNode(
            nodeId,
            ownerId,
            nodeType,
            label,
            newPayload == null ? payload : newPayload,
            weight + Math.max(0.0, extraWeight),
            sources,
            false,
            createdAt,
            now
        );
    }

    GraphNode orphan(Instant now) {
        return new GraphNode(nodeId, ownerId, nodeType, label, payload, weight, sourceItemIds, true, createdAt, now);
    }
}
