package org.episim.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.episim.cli.commands.InitCommand;
import org.episim.cli.commands.RunCommand;
import org.episim.cli.commands.SetupCommand;
import org.episim.cli.config.ConfigLoader;
import org.episim.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "episim",
    mixinStandardHelpOptions = true,
    version = "EpiSim 1.0",
    description = "EpiSim - Orchestration of metapopulation epidemic simulations",
    subcommands = {
        RunCommand.class,
        SetupCommand.class,
        InitCommand.class,
        CommandLine.HelpCommand.class
    },
    footer = {
        "",
        "Examples:",
        "  episim setup -n demo -M 2 -G 3",
        "  episim run -c models/demo/config.json -d models/demo/data -i runs/demo"
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"--app-config"},
        description = "Path to the application settings file (default: config/episim.conf)"
    )
    private File appConfigFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = createCommandLine();
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("episim");
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            LOG.error("{} failed: {}", cmd.getCommandName(), ex.getMessage());
            LOG.debug("Stack trace", ex);
            return 1;
        });
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        try {
            this.config = ConfigLoader.resolve(this.appConfigFile, (level, message) -> {
                switch (level) {
                    case INFO -> LOG.debug(message);
                    case WARN -> LOG.warn(message);
                }
            });
        } catch (com.typesafe.config.ConfigException e) {
            throw new IllegalStateException("Failed to load or parse settings: " + e.getMessage(), e);
        }

        LoggingConfigurator.configure(config);
        initialized = true;
    }

    /**
     * Returns the application settings, resolving them on first access.
     *
     * @throws IllegalArgumentException if an explicitly named settings file does not exist
     * @throws IllegalStateException    if the settings cannot be parsed
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
