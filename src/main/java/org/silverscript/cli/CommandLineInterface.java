package org.silverscript.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.silverscript.cli.commands.InputCommand;
import org.silverscript.cli.commands.KeygenCommand;
import org.silverscript.cli.commands.OutlineCommand;
import org.silverscript.cli.commands.TraceCommand;
import org.silverscript.config.ConfigLoader;
import org.silverscript.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "silverscript",
    mixinStandardHelpOptions = true,
    version = "SilverScript debugger 0.1.0",
    description = "Compiles SilverScript contracts and traces their execution as JSON.",
    subcommands = {
        TraceCommand.class,
        OutlineCommand.class,
        InputCommand.class,
        KeygenCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: silverscript.conf)"
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
        commandLine.setCommandName("silverscript");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging levels.
     *
     * @return The merged configuration.
     * @throws CommandLine.ParameterException if {@code --config} names a missing file or the configuration is invalid.
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        final CommandLine commandLine = new CommandLine(this);
        if (configFile != null && !configFile.exists()) {
            throw new CommandLine.ParameterException(commandLine,
                    "Configuration file specified via --config was not found: " + configFile.getAbsolutePath());
        }
        try {
            config = configFile != null ? ConfigLoader.load(configFile) : ConfigLoader.load();
        } catch (ConfigException e) {
            throw new CommandLine.ParameterException(commandLine,
                    "Failed to load or parse configuration: " + e.getMessage());
        }
        LoggingConfigurator.configure(config);
        LOG.debug("Configuration loaded");
        return config;
    }
}
