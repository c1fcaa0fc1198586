package io.strata.cli;

import io.strata.core.config.ConfigPaths;
import io.strata.core.config.model.StrataConfig;
import io.strata.core.memory.MemoryTier;
import io.strata.core.memory.TierStats;
import io.strata.core.observability.TierLatency;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "status", description = "Show configuration and, for an owner, tier occupancy")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-o", "--owner"}, description = "Owner whose tiers to summarize")
    String owner;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            StrataConfig config = context.configService().load(context.configPath());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Data dir: " + ConfigPaths.resolveDataDir(config.storage().dataDir()));
            System.out.println("Archive backend: " + config.storage().archiveBackend());
            System.out.println("Hot capacity: " + config.memory().hotCapacity());
            System.out.println("Warm threshold: " + config.memory().warmThreshold());
            System.out.println("Retention floor: " + config.memory().retentionFloor());
            if (owner == null) {
                return 0;
            }

            TierStats stats = context.controller().stats(owner);
            System.out.println("Owner: " + owner);
            System.out.println("Hot items: " + stats.hotItems());
            System.out.println("Warm items: " + stats.warmItems());
            System.out.println("Warm graph: " + stats.warmNodes() + " nodes, " + stats.warmEdges() + " edges, "
                + stats.orphanedNodes() + " orphaned");
            System.out.println("Cold chunks: " + stats.cold().chunks() + " (" + stats.cold().deltaChunks() + " delta, "
                + stats.cold().redactedChunks() + " redacted)");
            System.out.printf("Cold compression ratio: %.2f%n", stats.cold().compressionRatio());
            for (MemoryTier tier : MemoryTier.values()) {
                TierLatency latency = stats.latency().get(tier);
                if (latency != null) {
                    System.out.printf(
                        "%s: hits=%d misses=%d p50=%.2fms p95=%.2fms%n",
                        tier,
                        latency.hits(),
                        latency.misses(),
                        latency.p50LatencyMs(),
                        latency.p95LatencyMs()
                    );
                }
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
