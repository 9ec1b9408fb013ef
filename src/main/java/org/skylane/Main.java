package org.skylane;

import com.typesafe.config.ConfigException;
import org.skylane.cli.CommandLineInterface;
import org.skylane.config.LoggingConfigurator;
import picocli.CommandLine;

import java.io.File;

/**
 * The main entry point of the executable JAR.
 * <p>
 * Pre-loads the configuration only to choose the Logback configuration file before the first
 * logger is created. The {@link CommandLineInterface} loads it again from the parsed options and
 * reports configuration errors with the setup-failure exit code.
 */
public final class Main {

    private Main() {
        // This class should not be instantiated.
    }

    /**
     * The main method that launches the application.
     *
     * @param args The command-line arguments passed to the application.
     */
    public static void main(final String[] args) {
        System.setProperty("logback.configurationFile", logbackFile(findConfigPath(args)));

        int exitCode = new CommandLine(new CommandLineInterface()).execute(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * Finds the value of {@code -c}/{@code --config} in every form picocli accepts:
     * {@code --config path}, {@code --config=path}, {@code -c path}, {@code -c=path} and {@code -cpath}.
     *
     * @param args The command-line arguments.
     * @return The configuration path, or {@code null} if none is given.
     */
    static String findConfigPath(final String[] args) {
        String configPath = null;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--config".equals(arg) || "-c".equals(arg)) {
                if (i + 1 < args.length) {
                    configPath = args[++i];
                }
            } else if (arg.startsWith("--config=")) {
                configPath = arg.substring("--config=".length());
            } else if (arg.startsWith("-c=")) {
                configPath = arg.substring("-c=".length());
            } else if (arg.startsWith("-c") && !arg.startsWith("--")) {
                configPath = arg.substring("-c".length());
            }
        }
        return configPath;
    }

    private static String logbackFile(final String configPath) {
        try {
            return LoggingConfigurator.logbackFileFor(CommandLineInterface.load(configPath != null ? new File(configPath) : null));
        } catch (IllegalArgumentException | ConfigException e) {
            // The run command reports the broken configuration once logging is up.
            return "logback.xml";
        }
    }
}
