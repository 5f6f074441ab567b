package io.parley.app;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import io.parley.cli.CliContext;
import io.parley.cli.DetectCommand;
import io.parley.cli.DetectorsCommand;
import io.parley.cli.InitCommand;
import io.parley.cli.ParleyCliCommand;
import io.parley.cli.StatusCommand;
import io.parley.core.config.ConfigPaths;
import io.parley.core.config.ConfigService;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class ParleyApplication {

    private ParleyApplication() {
    }

    public static void main(String[] args) {
        CliContext context = new CliContext(
            new ConfigService(),
            ConfigPaths.defaultConfigPath(),
            ParleyApplication::enableDebugLogging
        );

        CommandLine commandLine = new CommandLine(new ParleyCliCommand());
        commandLine.addSubcommand("detect", new DetectCommand(context));
        commandLine.addSubcommand("detectors", new DetectorsCommand(context));
        commandLine.addSubcommand("init", new InitCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static void enableDebugLogging() {
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext loggerContext) {
            Logger root = loggerContext.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
            root.setLevel(Level.DEBUG);
            root.debug("Debug logging enabled");
        }
    }
}
