package io.strata.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(
    String dataDir,
    String archiveBackend
) {

    public StorageConfig {
        dataDir = dataDir == null ? "" : dataDir.trim();
        archiveBackend = archiveBackend == null || archiveBackend.isBlank() ? "sqlite" : archiveBackend.trim();
    }

    public boolean inMemory() {
        return "memory".equalsIgnoreCase(archiveBackend);
    }

    public static StorageConfig defaults() {
        return new StorageConfig("~/.strata/data", "sqlite");
    }
}
