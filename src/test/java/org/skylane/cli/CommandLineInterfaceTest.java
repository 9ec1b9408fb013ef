package org.skylane.cli;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;
import org.skylane.workers.pipeline.PipelineRunner;
import picocli.CommandLine;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("integration")
public class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    private static final String PIPELINE =
            "pipeline {\n"
            + "  pollIntervalMs = 20\n"
            + "  joinTimeoutMs = 2000\n"
            + "  runDurationSeconds = 30\n"
            + "  channels { numbers {}, doubled {} }\n"
            + "  workers {\n"
            + "    producer { className = \"org.skylane.workers.bodies.SequenceProducerWorker\", outputs = [numbers], options { maxMessages = 3 } }\n"
            + "    doubler { className = \"org.skylane.workers.bodies.ScalingWorker\", inputs = [numbers], outputs = [doubled] }\n"
            + "    sink { className = \"org.skylane.workers.bodies.LoggingSinkWorker\", inputs = [doubled] }\n"
            + "  }\n"
            + "}\n";

    @Test
    @Timeout(15)
    void runsConfiguredPipelineWithDurationOverride() throws IOException {
        Path config = tempDir.resolve("pipeline.conf");
        Files.writeString(config, PIPELINE);

        int exitCode = new CommandLine(new CommandLineInterface())
                .execute("--config", config.toString(), "run", "--duration", "1");

        assertEquals(PipelineRunner.EXIT_OK, exitCode);
    }

    @Test
    void missingConfigFileFailsSetup() {
        File missing = tempDir.resolve("missing.conf").toFile();

        int exitCode = new CommandLine(new CommandLineInterface())
                .execute("--config", missing.getPath(), "run");

        assertEquals(PipelineRunner.EXIT_SETUP_FAILED, exitCode);
    }

    @Test
    void malformedConfigFileFailsSetup() throws IOException {
        Path config = tempDir.resolve("broken.conf");
        Files.writeString(config, "pipeline { channels { a { capacity = ");

        int exitCode = new CommandLine(new CommandLineInterface())
                .execute("--config", config.toString(), "run");

        assertEquals(PipelineRunner.EXIT_SETUP_FAILED, exitCode);
    }

    @Test
    void unresolvableConfigFileFailsSetup() throws IOException {
        Path config = tempDir.resolve("unresolved.conf");
        Files.writeString(config, "pipeline { runDurationSeconds = ${undefined.duration} }");

        int exitCode = new CommandLine(new CommandLineInterface())
                .execute("--config=" + config, "run");

        assertEquals(PipelineRunner.EXIT_SETUP_FAILED, exitCode);
    }

    @Test
    void withoutSubcommandPrintsUsage() {
        StringWriter out = new StringWriter();
        CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(out));

        commandLine.execute("--help");

        assertThat(out.toString()).contains("skylane").contains("run");
    }
}
