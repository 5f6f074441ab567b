package io.parley.cli;

import io.parley.core.config.ConfigService;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    LogLevelSwitch logLevelSwitch
) {
    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, () -> {
        });
    }
}
