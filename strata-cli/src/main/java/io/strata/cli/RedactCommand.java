package io.strata.cli;

import io.strata.core.archive.ArchiveChunk;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "redact", description = "Redact personal data from an owner's cold archive")
public final class RedactCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-o", "--owner"}, required = true, description = "Owner id")
    String owner;

    @Option(names = {"-c", "--chunk"}, description = "Fully redact this chunk instead of scanning for personal data")
    String chunkId;

    @Option(names = "--item", description = "Purge this item from every tier")
    String itemId;

    public RedactCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (itemId != null) {
                boolean found = context.controller().purge(owner, itemId);
                System.out.println(found ? "Purged item " + itemId : "Item not found: " + itemId);
                return found ? 0 : 1;
            }
            if (chunkId != null) {
                ArchiveChunk chunk = context.controller().redactChunk(owner, chunkId);
                System.out.println("Redacted chunk " + chunk.chunkId() + " (sequence " + chunk.sequence() + ")");
                return 0;
            }
            int redacted = context.controller().redactPii(owner);
            System.out.println("Redacted " + redacted + " chunks");
            return 0;
        } catch (Exception e) {
            System.err.println("Redact command failed: " + e.getMessage());
            return 1;
        }
    }
}
