package io.strata.cli;

import io.strata.core.archive.ChainReport;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "verify", description = "Verify an owner's cold archive hash chain")
public final class VerifyCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-o", "--owner"}, required = true, description = "Owner id")
    String owner;

    public VerifyCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ChainReport report = context.controller().verifyIntegrity(owner);
            if (report.intact()) {
                System.out.println("Chain intact: " + report.chunks() + " chunks");
                return 0;
            }
            System.out.println("Chain broken at chunk " + report.failedChunkId() + ": " + report.reason());
            return 1;
        } catch (Exception e) {
            System.err.println("Verify command failed: " + e.getMessage());
            return 1;
        }
    }
}
