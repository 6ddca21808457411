package org.episim.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

import org.episim.api.exceptions.UnknownEngineException;
import org.episim.cli.CommandLineInterface;
import org.episim.engine.EngineVariant;
import org.episim.setup.ModelTemplateFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Creates a new model folder with a configuration template and placeholder data.
 */
@Command(
    name = "setup",
    description = "Create a model folder with a configuration template and placeholder data"
)
public class SetupCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SetupCommand.class);

    @Option(names = {"-n", "--name"}, required = true, description = "Model name, used as folder name")
    private String name;

    @Option(names = {"-M", "--metapop"}, required = true, description = "Number of patches")
    private int patches;

    @Option(names = {"-G", "--agents"}, required = true, description = "Number of age groups")
    private int ageGroups;

    @Option(names = {"-o", "--output"}, defaultValue = "models",
        description = "Parent folder of the model (default: ${DEFAULT-VALUE})")
    private Path output;

    @Option(names = {"-e", "--engine"}, defaultValue = "MMCACovid19Vac",
        description = "Engine variant (default: ${DEFAULT-VALUE})")
    private String engine;

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

        parent.getConfig();
        logging.apply();

        if (patches < 1 || ageGroups < 1) {
            err.println("Error: --metapop and --agents must be at least 1");
            return 1;
        }

        try {
            EngineVariant variant = EngineVariant.fromId(engine).orElseThrow(() -> new UnknownEngineException(engine,
                Arrays.stream(EngineVariant.values()).map(EngineVariant::id).collect(Collectors.joining(", "))));

            Path modelFolder = output.resolve(name);
            if (Files.exists(modelFolder.resolve(ModelTemplateFactory.CONFIG_FILE))) {
                log.warn("Overwriting existing model in {}", modelFolder);
            }
            Path configFile = new ModelTemplateFactory().writeModel(modelFolder, variant, patches, ageGroups);

            out.printf("Created %s model '%s' (G=%d, M=%d)%n", variant.id(), name, ageGroups, patches);
            out.println("  Configuration: " + configFile);
            out.println("  Data folder:   " + modelFolder.resolve(ModelTemplateFactory.DATA_FOLDER));
            return 0;
        } catch (UnknownEngineException e) {
            log.error("{}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Failed to write model folder: {}", e.getMessage());
            log.debug("Stack trace", e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
