package io.strata.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StrataConfig(
    MemoryConfig memory,
    ScoringConfig scoring,
    ArchiveConfig archive,
    StorageConfig storage
) {

    public static StrataConfig defaults() {
        return new StrataConfig(
            MemoryConfig.defaults(),
            ScoringConfig.defaults(),
            ArchiveConfig.defaults(),
            StorageConfig.defaults()
        );
    }
}
