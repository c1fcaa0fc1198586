package io.strata.core.scoring;

import io.strata.core.config.model.ScoringConfig;
import io.strata.core.memory.TurnSignals;
import java.util.Objects;

/**
 * Converts the four turn signals into a single importance value.
 *
 * <p>Novelty and sentiment carry most of the weight. Recurrence adds a logarithmic bonus so a
 * topic that keeps coming back earns a boost without being able to dominate on its own. The result
 * is clamped to {@code [0, maxImportance]}; there is no other hidden state, so identical inputs
 * always yield identical scores.
 */
public final class ImportanceScorer {
    public static final double MAX_SIGNAL = 10.0;

    private final ScoringConfig config;

    public ImportanceScorer() {
        this(ScoringConfig.defaults());
    }

    public ImportanceScorer(ScoringConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public double score(TurnSignals signals) {
        Objects.requireNonNull(signals, "signals must not be null");
        return score(
            signals.semanticNovelty(),
            signals.sentimentIntensity(),
            signals.userFeedback(),
            signals.recurrenceCount()
        );
    }

    public double score(double semanticNovelty, double sentimentIntensity, double userFeedback, int recurrenceCount) {
        requireSignal("semanticNovelty", semanticNovelty);
        requireSignal("sentimentIntensity", sentimentIntensity);
        requireSignal("userFeedback", userFeedback);
        if (recurrenceCount < 0) {
            throw new InvalidSignalException("recurrenceCount must not be negative, was " + recurrenceCount);
        }

        double raw = config.noveltyWeight() * semanticNovelty
            + config.sentimentWeight() * sentimentIntensity
            + config.feedbackWeight() * userFeedback
            + config.recurrenceWeight() * Math.log1p(recurrenceCount);
        return Math.max(0.0, Math.min(config.maxImportance(), raw));
    }

    public double maxImportance() {
        return config.maxImportance();
    }

    private void requireSignal(String name, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new InvalidSignalException(name + " must be a finite number");
        }
        if (value < 0.0 || value > MAX_SIGNAL) {
            throw new InvalidSignalException(name + " must be within [0, " + MAX_SIGNAL + "], was " + value);
        }
    }
}
