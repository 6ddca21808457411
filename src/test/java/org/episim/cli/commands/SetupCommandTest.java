package org.episim.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;

import org.episim.cli.CommandLineInterface;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

@Tag("unit")
public class SetupCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private CommandLine commandLine() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        return cmdLine;
    }

    @Test
    void testCommandParses() {
        assertThat(CommandLineInterface.createCommandLine().getSubcommands()).containsKeys("setup", "run", "init");
    }

    @Test
    void testRootWithoutSubcommandSucceeds() {
        assertThat(commandLine().execute()).isZero();
    }

    @Test
    void testCreatesModelFolder() {
        int exitCode = commandLine().execute("setup", "-n", "demo", "-M", "2", "-G", "3",
                "-o", tempDir.toString(), "-e", "MMCACovid19");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Created MMCACovid19 model 'demo' (G=3, M=2)");
        assertThat(tempDir.resolve("demo/config.json")).isRegularFile();
        assertThat(tempDir.resolve("demo/data/metapopulation_data.csv")).isRegularFile();
    }

    @Test
    void testDefaultsToVaccinationEngine() {
        int exitCode = commandLine().execute("setup", "-n", "vac", "-M", "1", "-G", "2", "-o", tempDir.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("MMCACovid19Vac");
    }

    @Test
    void testUnknownEngineFails() {
        int exitCode = commandLine().execute("setup", "-n", "demo", "-M", "2", "-G", "3",
                "-o", tempDir.toString(), "-e", "SIR");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("SIR");
        assertThat(tempDir.resolve("demo")).doesNotExist();
    }

    @Test
    void testRejectsEmptyMetapopulation() {
        int exitCode = commandLine().execute("setup", "-n", "demo", "-M", "0", "-G", "3", "-o", tempDir.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("--metapop");
    }

    @Test
    void testRequiresName() {
        assertThat(commandLine().execute("setup", "-M", "2", "-G", "3")).isNotZero();
    }
}
