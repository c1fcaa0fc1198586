package io.strata.app;

import io.strata.cli.CliContext;
import io.strata.cli.ExportCommand;
import io.strata.cli.RecallCommand;
import io.strata.cli.RecordCommand;
import io.strata.cli.RedactCommand;
import io.strata.cli.StatusCommand;
import io.strata.cli.StrataCliCommand;
import io.strata.cli.SweepCommand;
import io.strata.cli.VerifyCommand;
import io.strata.core.archive.ArchiveStore;
import io.strata.core.archive.ColdArchive;
import io.strata.core.archive.InMemoryArchiveStore;
import io.strata.core.archive.SqliteArchiveStore;
import io.strata.core.config.ConfigPaths;
import io.strata.core.config.ConfigService;
import io.strata.core.config.model.StrataConfig;
import io.strata.core.graph.FileGraphRepository;
import io.strata.core.graph.GraphRepository;
import io.strata.core.graph.InMemoryGraphRepository;
import io.strata.core.graph.WarmGraphStore;
import io.strata.core.hot.FileHotRepository;
import io.strata.core.hot.HotCache;
import io.strata.core.hot.HotRepository;
import io.strata.core.hot.InMemoryHotRepository;
import io.strata.core.memory.ItemPayloadRedactor;
import io.strata.core.memory.TierController;
import io.strata.core.observability.MemoryMetrics;
import io.strata.core.privacy.PiiRedactor;
import io.strata.core.scoring.ImportanceScorer;
import java.nio.file.Path;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class StrataApplication {
    private static final Logger LOG = LoggerFactory.getLogger(StrataApplication.class);

    private StrataApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        StrataConfig config = loadConfig(configService, configPath);
        Clock clock = Clock.systemUTC();

        Path dataDir = ConfigPaths.resolveDataDir(config.storage().dataDir());
        TierController controller = new TierController(
            new ImportanceScorer(config.scoring()),
            new HotCache(
                config.memory().hotCapacity(),
                config.memory().hotTtl(),
                config.memory().hotFloor(),
                buildHotRepository(config, dataDir),
                clock
            ),
            new WarmGraphStore(buildGraphRepository(config, dataDir), clock),
            new ColdArchive(
                buildArchiveStore(config, dataDir),
                config.archive(),
                new ItemPayloadRedactor(new PiiRedactor()),
                clock
            ),
            new MemoryMetrics(clock),
            config.memory(),
            clock
        );

        CliContext context = new CliContext(controller, configService, configPath);
        CommandLine commandLine = new CommandLine(new StrataCliCommand());
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("record", new RecordCommand(context));
        commandLine.addSubcommand("recall", new RecallCommand(context));
        commandLine.addSubcommand("verify", new VerifyCommand(context));
        commandLine.addSubcommand("export", new ExportCommand(context));
        commandLine.addSubcommand("redact", new RedactCommand(context));
        commandLine.addSubcommand("sweep", new SweepCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static StrataConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (Exception e) {
            LOG.warn("Falling back to default configuration: {}", e.getMessage());
            return StrataConfig.defaults();
        }
    }

    private static ArchiveStore buildArchiveStore(StrataConfig config, Path dataDir) {
        if (config.storage().inMemory()) {
            return new InMemoryArchiveStore();
        }
        Path sqlitePath = dataDir.resolve("archive.db");
        try {
            return new SqliteArchiveStore(sqlitePath);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to initialize SQLite archive store at " + sqlitePath, e);
        }
    }

    private static HotRepository buildHotRepository(StrataConfig config, Path dataDir) {
        if (config.storage().inMemory()) {
            return new InMemoryHotRepository();
        }
        return new FileHotRepository(dataDir.resolve("hot"));
    }

    private static GraphRepository buildGraphRepository(StrataConfig config, Path dataDir) {
        if (config.storage().inMemory()) {
            return new InMemoryGraphRepository();
        }
        return new FileGraphRepository(dataDir.resolve("warm"));
    }
}
