package org.episim.cli.commands;

import org.episim.cli.config.LoggingConfigurator;

import picocli.CommandLine.Option;

/**
 * Log level option shared by all commands.
 */
public class LoggingOptions {

    @Option(
        names = {"-l", "--log-level"},
        description = "Log level: debug, info, warn, error or silent (default: from settings)"
    )
    private String logLevel;

    /**
     * Applies the command line level, if given, on top of the settings.
     */
    void apply() {
        if (logLevel != null) {
            LoggingConfigurator.applyCliLevel(logLevel);
        }
    }
}
