package org.codex.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.codex.cli.commands.CompileCommand;
import org.codex.cli.commands.ListCommand;
import org.codex.cli.commands.LookupCommand;
import org.codex.cli.config.ConfigLoader;
import org.codex.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "codex",
    mixinStandardHelpOptions = true,
    version = "codex 1.0",
    description = "Human-friendly names for Unicode symbols",
    subcommands = {
        CompileCommand.class,
        LookupCommand.class,
        ListCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/codex.conf)"
    )
    private File configFile;

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
        commandLine.setCommandName("codex");
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            if (ex instanceof ConfigurationFailedException) {
                return 1;
            }
            throw ex;
        });
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);
        try {
            this.config = ConfigLoader.resolve(this.configFile, (level, message) -> {
                switch (level) {
                    case INFO -> logger.debug(message);
                    case WARN -> logger.info(message);
                }
            });
        } catch (IllegalArgumentException e) {
            logger.error(e.getMessage());
            throw new ConfigurationFailedException(e);
        } catch (ConfigException e) {
            logger.error("Failed to load or parse configuration: {}", e.getMessage());
            throw new ConfigurationFailedException(e);
        }

        LoggingConfigurator.configure(config);
        initialized = true;
    }

    /**
     * Returns the resolved configuration, loading it on first use.
     * @throws ConfigurationFailedException if an explicitly given configuration file does not exist
     *         or the configuration cannot be parsed. The error is logged before it is thrown.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }

    /**
     * Signals a configuration error that has already been logged; the command exits with code 1.
     */
    public static final class ConfigurationFailedException extends RuntimeException {
        ConfigurationFailedException(Throwable cause) {
            super(cause.getMessage(), cause);
        }
    }
}
