package io.strata.cli;

import io.strata.core.memory.SweepReport;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "sweep", description = "Expire hot items and demote stale warm items")
public final class SweepCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-o", "--owner"}, description = "Sweep a single owner; all owners when omitted")
    String owner;

    public SweepCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            List<SweepReport> reports = owner == null
                ? context.controller().sweepAll()
                : List.of(context.controller().sweep(owner));
            for (SweepReport report : reports) {
                System.out.println(report.ownerId() + ": " + report.expiredFromHot() + " expired, "
                    + report.promotedToWarm() + " promoted, " + report.archivedFromHot() + " archived, "
                    + report.dropped() + " dropped, " + report.demotedFromWarm() + " demoted");
            }
            System.out.println("Swept " + reports.size() + " owners");
            return 0;
        } catch (Exception e) {
            System.err.println("Sweep command failed: " + e.getMessage());
            return 1;
        }
    }
}
