package org.tilecascade.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.tilecascade.cli.commands.SimulateCommand;
import org.tilecascade.config.ConfigLoader;
import org.tilecascade.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "tilecascade",
    mixinStandardHelpOptions = true,
    version = "TileCascade 1.0",
    description = "TileCascade - deterministic match-3 simulation engine",
    subcommands = {
        SimulateCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: tilecascade.conf)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("tilecascade");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads and caches the configuration, applying its logging section on first use.
     *
     * @return The resolved configuration.
     * @throws CommandLine.ParameterException if an explicit --config file is missing.
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        if (configFile != null && !configFile.exists()) {
            throw new CommandLine.ParameterException(new CommandLine(this),
                "Configuration file specified via --config was not found: " + configFile.getAbsolutePath());
        }
        try {
            config = configFile != null ? ConfigLoader.load(configFile) : ConfigLoader.load();
        } catch (ConfigException e) {
            LOG.error("Failed to load or parse configuration: {}", e.getMessage());
            throw e;
        }
        LoggingConfigurator.configure(config);
        return config;
    }
}
