package org.episim.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;

import org.episim.cli.CommandLineInterface;
import org.episim.engine.EngineVariant;
import org.episim.setup.ModelTemplateFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

/**
 * Runs the template model through the command line.
 */
@Tag("integration")
public class RunCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private Path configFile;
    private Path dataFolder;

    @BeforeEach
    void setUp() throws Exception {
        Path model = tempDir.resolve("model");
        configFile = new ModelTemplateFactory().writeModel(model, EngineVariant.BASIC, 2, 3);
        dataFolder = model.resolve(ModelTemplateFactory.DATA_FOLDER);
    }

    private CommandLine commandLine() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        return cmdLine;
    }

    @Test
    void testRunWritesOutputs() {
        Path instance = tempDir.resolve("instance");

        int exitCode = commandLine().execute("run", "-c", configFile.toString(), "-d", dataFolder.toString(),
                "-i", instance.toString(), "--export-compartments-time-t", "2", "-l", "WARN");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Wrote 3 file(s)").contains("compartments_t_2020-02-10.nc");
        assertThat(instance.resolve("output/compartments_full.nc")).isRegularFile();
        assertThat(instance.resolve("output/observables.nc")).isRegularFile();
    }

    @Test
    void testDateOverridesShortenHorizon() {
        Path instance = tempDir.resolve("short");

        int exitCode = commandLine().execute("run", "-c", configFile.toString(), "-d", dataFolder.toString(),
                "-i", instance.toString(), "--end-date", "2020-02-10", "--export-compartments-time-t", "3");

        assertThat(exitCode).isZero();
        assertThat(err.toString()).contains("Warning:").contains("time step 3");
        assertThat(out.toString()).contains("Wrote 2 file(s)");
    }

    @Test
    void testInvalidDateFails() {
        int exitCode = commandLine().execute("run", "-c", configFile.toString(), "-d", dataFolder.toString(),
                "-i", tempDir.resolve("bad").toString(), "--start-date", "2020-13-01");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).startsWith("Error:");
    }

    @Test
    void testMissingConfigurationFails() {
        int exitCode = commandLine().execute("run", "-c", tempDir.resolve("absent.json").toString(),
                "-d", dataFolder.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("absent.json");
    }
}
