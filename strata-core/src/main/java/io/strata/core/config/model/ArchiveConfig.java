package io.strata.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ArchiveConfig(
    String digestAlgorithm,
    double deltaSimilarityThreshold,
    int snapshotInterval,
    int persistenceRetries
) {

    public ArchiveConfig {
        digestAlgorithm = digestAlgorithm == null || digestAlgorithm.isBlank() ? "SHA-256" : digestAlgorithm.trim();
        if (deltaSimilarityThreshold < 0 || deltaSimilarityThreshold > 1) {
            throw new IllegalArgumentException("deltaSimilarityThreshold must be within [0, 1]");
        }
        snapshotInterval = Math.max(1, snapshotInterval);
        persistenceRetries = Math.max(1, persistenceRetries);
    }

    public static ArchiveConfig defaults() {
        return new ArchiveConfig("SHA-256", 0.7, 16, 3);
    }
}
