package org.episim.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.concurrent.Callable;

import org.episim.api.exceptions.EpiSimException;
import org.episim.api.exceptions.InvalidParameterException;
import org.episim.cli.CommandLineInterface;
import org.episim.config.SimulationConfig;
import org.episim.pipeline.RunPaths;
import org.episim.pipeline.RunSummary;
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
 * Runs one simulation.
 * <p>
 * Command line overrides are written into the simulation configuration before the run starts,
 * so they pass the same validation as values from the file.
 */
@Command(
    name = "run",
    description = "Run a simulation from a configuration file and a data folder"
)
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Option(names = {"-c", "--config"}, required = true, description = "Simulation configuration (JSON)")
    private Path configFile;

    @Option(names = {"-d", "--data-folder"}, required = true, description = "Folder with the input data files")
    private Path dataFolder;

    @Option(names = {"-i", "--instance-folder"}, defaultValue = ".",
        description = "Folder receiving the output folder (default: ${DEFAULT-VALUE})")
    private Path instanceFolder;

    @Option(names = {"--initial-condition"}, description = "Initial condition file, overrides the configured one")
    private Path initialCondition;

    @Option(names = {"--start-date"}, description = "Overrides simulation.start_date (yyyy-MM-dd)")
    private String startDate;

    @Option(names = {"--end-date"}, description = "Overrides simulation.end_date (yyyy-MM-dd)")
    private String endDate;

    @Option(names = {"--export-compartments-full"}, description = "Write the full compartment dump")
    private boolean exportFull;

    @Option(names = {"--export-compartments-time-t"}, paramLabel = "STEP",
        description = "Write a compartment snapshot at this 1-based time step")
    private Integer exportStep;

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
            SimulationConfig config = applyOverrides(SimulationConfig.load(configFile));
            RunSummary summary = SimulationRunner.fromSettings(settings)
                .run(config, new RunPaths(dataFolder, instanceFolder, initialCondition));

            out.printf("Wrote %d file(s) to %s%n", summary.writtenFiles().size(), summary.outputFolder());
            for (Path file : summary.writtenFiles()) {
                out.println("  " + file.getFileName());
            }
            for (EpiSimException reported : summary.reportedErrors()) {
                err.println("Warning: " + reported.getMessage());
            }
            return 0;
        } catch (EpiSimException e) {
            log.error("Simulation failed: {}", e.getMessage());
            log.debug("Stack trace", e);
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("I/O error during simulation: {}", e.getMessage());
            log.debug("Stack trace", e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private SimulationConfig applyOverrides(SimulationConfig config) throws EpiSimException {
        SimulationConfig result = config;
        if (startDate != null) {
            result = result.withValue(SimulationConfig.SIMULATION, "start_date", checkedDate("--start-date", startDate));
        }
        if (endDate != null) {
            result = result.withValue(SimulationConfig.SIMULATION, "end_date", checkedDate("--end-date", endDate));
        }
        if (exportFull) {
            result = result.withValue(SimulationConfig.SIMULATION, "save_full_output", true);
        }
        if (exportStep != null) {
            result = result.withValue(SimulationConfig.SIMULATION, "save_time_step", exportStep);
        }
        return result;
    }

    private static String checkedDate(String option, String value) throws InvalidParameterException {
        try {
            return LocalDate.parse(value).toString();
        } catch (DateTimeParseException e) {
            throw new InvalidParameterException(
                option + " expects an ISO date (yyyy-MM-dd): " + value, e);
        }
    }
}
