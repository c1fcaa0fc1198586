package io.strata.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ScoringConfig(
    double noveltyWeight,
    double sentimentWeight,
    double feedbackWeight,
    double recurrenceWeight,
    double maxImportance
) {

    public ScoringConfig {
        if (noveltyWeight < 0 || sentimentWeight < 0 || feedbackWeight < 0 || recurrenceWeight < 0) {
            throw new IllegalArgumentException("scoring weights must not be negative");
        }
        if (maxImportance <= 0) {
            throw new IllegalArgumentException("maxImportance must be positive");
        }
    }

    public static ScoringConfig defaults() {
        return new ScoringConfig(0.40, 0.35, 0.25, 0.75, 10.0);
    }
}
