package io.strata.core.graph;

public enum NodeType {
    ENTITY,
    TOPIC,
    SUMMARY
}
