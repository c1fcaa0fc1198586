package io.strata.cli;

import io.strata.core.config.ConfigService;
import io.strata.core.memory.TierController;
import java.nio.file.Path;

public record CliContext(
    TierController controller,
    ConfigService configService,
    Path configPath
) {
}
