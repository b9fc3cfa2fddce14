package org.qcircuit.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.qcircuit.cli.commands.ConvertCommand;
import org.qcircuit.cli.commands.InfoCommand;
import org.qcircuit.cli.config.ConfigLoader;
import org.qcircuit.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "qcircuit",
    mixinStandardHelpOptions = true,
    version = "qcircuit 1.0",
    description = "Import, inspect and convert quantum circuits (REAL, OpenQASM, GRCS, Qiskit)",
    subcommands = {
        ConvertCommand.class,
        InfoCommand.class,
        CommandLine.HelpCommand.class
    },
    footer = {
        "",
        "Exit codes:",
        "  0  success",
        "  1  malformed input or unsupported operation",
        "  3  file could not be read or written"
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/qcircuit.conf)"
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
        commandLine.setCommandName("qcircuit");
        return commandLine;
    }

    /**
     * Resolves the configuration on first use and applies its logging settings.
     *
     * @throws IllegalArgumentException if an explicitly given config file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed.
     */
    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        this.config = ConfigLoader.resolve(this.configFile, logger::debug);

        if (config.hasPath("logging.format")) {
            final String format = config.getString("logging.format");
            System.setProperty("qcircuit.logging.format", "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT");
            reconfigureLogback();
        }
        LoggingConfigurator.configure(config);

        initialized = true;
    }

    private void reconfigureLogback() {
        if (!(LoggerFactory.getILoggerFactory() instanceof ch.qos.logback.classic.LoggerContext context)) {
            return;
        }
        java.net.URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        try {
            ch.qos.logback.classic.joran.JoranConfigurator configurator = new ch.qos.logback.classic.joran.JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            configurator.doConfigure(configUrl);
        } catch (ch.qos.logback.core.joran.spi.JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
