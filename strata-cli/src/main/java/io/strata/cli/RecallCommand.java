package io.strata.cli;

import io.strata.core.memory.ContextHit;
import io.strata.core.memory.RecallDepth;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "recall", description = "Recall context for an owner")
public final class RecallCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "0..1", description = "Topic hint")
    String hint;

    @Option(names = {"-o", "--owner"}, required = true, description = "Owner id")
    String owner;

    @Option(names = "--deep", description = "Include the cold archive")
    boolean deep;

    @Option(names = {"-n", "--limit"}, defaultValue = "10", description = "Maximum number of hits")
    int limit;

    public RecallCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            List<ContextHit> hits = context.controller().recallContext(
                owner,
                hint,
                deep ? RecallDepth.DEEP : RecallDepth.SHALLOW,
                limit
            );
            if (hits.isEmpty()) {
                System.out.println("No context found.");
                return 0;
            }
            for (ContextHit hit : hits) {
                System.out.printf("[%s %.2f] %s%n", hit.tier(), hit.score(), hit.item().content().text());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Recall command failed: " + e.getMessage());
            return 1;
        }
    }
}
