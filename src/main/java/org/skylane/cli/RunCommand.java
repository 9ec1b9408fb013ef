package org.skylane.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueFactory;
import org.skylane.config.LoggingConfigurator;
import org.skylane.workers.pipeline.PipelineRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

@Command(
    name = "run",
    description = "Runs the configured worker pipeline, then shuts it down."
)
public class RunCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RunCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = {"-d", "--duration"}, description = "Seconds to let the workers run (overrides pipeline.runDurationSeconds).")
    private Long durationSeconds;

    @Override
    public Integer call() {
        Config config;
        try {
            config = parent.getConfig();
        } catch (IllegalArgumentException | ConfigException e) {
            LOGGER.error("Failed to load configuration: {}", e.getMessage());
            return PipelineRunner.EXIT_SETUP_FAILED;
        }
        if (durationSeconds != null) {
            config = ConfigFactory.empty()
                    .withValue("pipeline.runDurationSeconds", ConfigValueFactory.fromAnyRef(durationSeconds))
                    .withFallback(config);
        }
        LoggingConfigurator.configure(config);

        int exitCode = new PipelineRunner(config).run();
        if (exitCode < 0) {
            LOGGER.error("Failed with return code {}", exitCode);
        } else if (exitCode == 0) {
            LOGGER.info("Success!");
        } else {
            LOGGER.warn("Finished, but not all workers stopped cleanly (return code {})", exitCode);
        }
        return exitCode;
    }
}
