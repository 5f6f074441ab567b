package io.parley.cli;

/**
 * Raises the runtime log level when a command is invoked with {@code --debug}.
 */
@FunctionalInterface
public interface LogLevelSwitch {
    void enableDebug();
}
