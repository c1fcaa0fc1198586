package io.strata.core.memory;

/**
 * Caller-normalised importance inputs for one conversational turn. Scores are expected on a
 * {@code [0, 10]} scale; validation happens in the scorer.
 */
public record TurnSignals(
    double semanticNovelty,
    double sentimentIntensity,
    double userFeedback,
    int recurrenceCount
) {

    public static TurnSignals neutral() {
        return new TurnSignals(5.0, 5.0, 5.0, 0);
    }
}
