package io.strata.core.graph;

public enum RelationKind {
    RELATES_TO,
    MENTIONS,
    DISCUSSED_WITH,
    SUMMARY_OF
}
