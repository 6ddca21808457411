package org.episim.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.episim.api.exceptions.EpiSimException;
import org.episim.cli.CommandLineInterface;
import org.episim.config.SimulationConfig;
import org.episim.pipeline.SimulationRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Writes an initial condition file built from a seed table.
 * <p>
 * A relative {@code --output} is resolved against the data folder, where {@code run} looks for
 * {@code data.initial_condition_filename}.
 */
@Command(
    name = "init",
    description = "Create an initial condition file from a seed table"
)
public class InitCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(InitCommand.class);

    @Option(names = {"-c", "--config"}, required = true, description = "Simulation configuration (JSON)")
    private Path configFile;

    @Option(names = {"-d", "--data-folder"}, required = true, description = "Folder with the metapopulation table")
    private Path dataFolder;

    @Option(names = {"--seeds"}, required = true, description = "Seed table with columns idx and seed")
    private Path seedsFile;

    @Option(names = {"-o", "--output"}, defaultValue = "initial_conditions.nc",
        description = "Output file (default: ${DEFAULT-VALUE})")
    private Path output;

    @Mixin
    private LoggingOptions logging;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        var settings = parent.getConfig();
        logging.apply();

        try {
            SimulationConfig config = SimulationConfig.load(configFile);
            Path target = output.isAbsolute() ? output : dataFolder.resolve(output);
            Path written = SimulationRunner.fromSettings(settings)
                .generateInitialCondition(config, dataFolder, seedsFile, target);
            out.println("Initial condition written to " + written);
            return 0;
        } catch (EpiSimException e) {
            log.error("Initial condition not created: {}", e.getMessage());
            log.debug("Stack trace", e);
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("I/O error while creating initial condition: {}", e.getMessage());
            log.debug("Stack trace", e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
