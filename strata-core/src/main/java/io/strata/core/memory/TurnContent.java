package io.strata.core.memory;

import java.util.List;

public record TurnContent(
    String text,
    List<String> entities,
    List<String> topics,
    TurnSignals signals
) {
    public TurnContent {
        text = text == null ? "" : text;
        entities = entities == null ? List.of() : List.copyOf(entities);
        topics = topics == null ? List.of() : List.copyOf(topics);
        signals = signals == null ? TurnSignals.neutral() : signals;
    }

    public static TurnContent of(String text, TurnSignals signals) {
        return new TurnContent(text, List.of(), List.of(), signals);
    }
}
