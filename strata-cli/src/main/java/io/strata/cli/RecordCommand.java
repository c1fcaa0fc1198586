package io.strata.cli;

import io.strata.core.memory.MemoryItem;
import io.strata.core.memory.TurnContent;
import io.strata.core.memory.TurnSignals;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "record", description = "Record a conversational turn")
public final class RecordCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Turn text")
    String text;

    @Option(names = {"-o", "--owner"}, required = true, description = "Owner id")
    String owner;

    @Option(names = {"-s", "--session"}, defaultValue = "default", description = "Session id")
    String session;

    @Option(names = "--novelty", defaultValue = "5", description = "Semantic novelty, 0-10")
    double novelty;

    @Option(names = "--sentiment", defaultValue = "5", description = "Sentiment intensity, 0-10")
    double sentiment;

    @Option(names = "--feedback", defaultValue = "5", description = "User feedback, 0-10")
    double feedback;

    @Option(names = "--recurrence", defaultValue = "0", description = "Times the topic has come up before")
    int recurrence;

    @Option(names = {"-e", "--entity"}, description = "Entity mentioned in the turn")
    List<String> entities = new ArrayList<>();

    @Option(names = {"-t", "--topic"}, description = "Topic of the turn")
    List<String> topics = new ArrayList<>();

    public RecordCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            TurnContent content = new TurnContent(
                text,
                entities,
                topics,
                new TurnSignals(novelty, sentiment, feedback, recurrence)
            );
            MemoryItem item = context.controller().recordTurn(owner, session, content);
            System.out.printf("Recorded %s (importance %.2f, tier %s)%n", item.id(), item.importance(), item.tier());
            return 0;
        } catch (Exception e) {
            System.err.println("Record command failed: " + e.getMessage());
            return 1;
        }
    }
}
