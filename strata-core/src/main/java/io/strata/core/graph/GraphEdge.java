package io.strata.core.graph;

import java.time.Instant;
import java.util.Objects;

public record GraphEdge(
    String fromNodeId,
    String toNodeId,
    RelationKind relationKind,
    double strength,
    Instant updatedAt
) {
    public GraphEdge {
        Objects.requireNonNull(fromNodeId, "fromNodeId must not be null");
        Objects.requireNonNull(toNodeId, "toNodeId must not be null");
        Objects.requireNonNull(relationKind, "relationKind must not be null");
        strength = Math.max(0.0, Math.min(1.0, strength));
    }

    boolean connects(String a, String b, RelationKind kind) {
        return relationKind == kind && fromNodeId.equals(a) && toNodeId.equals(b);
    }
}
