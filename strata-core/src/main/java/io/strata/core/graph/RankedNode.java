package io.strata.core.graph;

public record RankedNode(GraphNode node, int hops) {
}
