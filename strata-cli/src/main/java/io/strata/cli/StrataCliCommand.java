package io.strata.cli;

import picocli.CommandLine.Command;

@Command(name = "strata", mixinStandardHelpOptions = true, description = "Strata tiered conversational memory")
public final class StrataCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
