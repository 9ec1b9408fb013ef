package org.skylane.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

/**
 * Root command of the Skylane command line.
 */
@Command(
    name = "skylane",
    mixinStandardHelpOptions = true,
    version = "Skylane 1.0",
    description = "Skylane - replicated worker pipelines",
    subcommands = {
        RunCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file overriding the built-in defaults"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    /**
     * Returns the resolved configuration: system properties, then the {@code --config} file,
     * then {@code reference.conf}.
     *
     * @return The configuration.
     * @throws IllegalArgumentException if the config file does not exist.
     * @throws com.typesafe.config.ConfigException if the config file cannot be parsed or resolved.
     */
    Config getConfig() {
        if (config == null) {
            config = load(configFile);
        }
        return config;
    }

    /**
     * Loads the configuration with the precedence system properties, file, classpath defaults.
     *
     * @param file The configuration file, or {@code null} for defaults only.
     * @return The resolved configuration.
     * @throws IllegalArgumentException if the file does not exist.
     * @throws com.typesafe.config.ConfigException if the file cannot be parsed or resolved.
     */
    public static Config load(File file) {
        Config fileConfig = ConfigFactory.empty();
        if (file != null) {
            if (!file.exists()) {
                throw new IllegalArgumentException("Configuration file not found: " + file.getAbsolutePath());
            }
            fileConfig = ConfigFactory.parseFile(file);
        }
        return ConfigFactory.systemProperties()
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.defaultReference())
                .resolve();
    }
}
