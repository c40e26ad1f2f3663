package org.zignet.cli;

import ch.qos.logback.classic.Level;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zignet.cli.commands.AnalyzeCommand;
import org.zignet.cli.commands.FormatCommand;
import org.zignet.cli.config.LoggingConfigurator;
import org.zignet.compiler.backend.emit.CodeGenOptions;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "zignet",
    mixinStandardHelpOptions = true,
    version = "ZigNet 1.0",
    description = "ZigNet - analyzer and formatter for a Zig subset",
    subcommands = {
        AnalyzeCommand.class,
        FormatCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final String CONFIG_FILE_NAME = "zignet.conf";
    private static final String FORMAT_CONFIG_PATH = "zignet.format";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: zignet.conf)"
    )
    private File configFile;

    @Option(
        names = {"-v", "--verbose"},
        description = "Log compiler internals at DEBUG level"
    )
    private boolean verbose;

    @Spec
    private CommandSpec spec;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("zignet");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        try {
            final File file = selectConfigFile(logger);
            // Config load order: System Props > Env Vars > File > Classpath defaults
            Config layered = ConfigFactory.systemProperties()
                    .withFallback(ConfigFactory.systemEnvironment());
            if (file != null) {
                layered = layered.withFallback(ConfigFactory.parseFile(file));
            }
            this.config = layered.withFallback(ConfigFactory.load()).resolve();
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Failed to load or parse configuration: " + e.getMessage(), e);
        }

        LoggingConfigurator.configure(config);
        if (verbose) {
            LoggingConfigurator.setCompilerLevel(Level.DEBUG);
        }
        initialized = true;
    }

    /**
     * Picks the configuration file: {@code --config} first, then {@code -Dconfig.file},
     * then {@code zignet.conf} in the working directory.
     *
     * @return The file to layer over the classpath defaults, or {@code null} for defaults only.
     */
    private File selectConfigFile(final Logger logger) {
        if (this.configFile != null) {
            if (!this.configFile.exists()) {
                throw new IllegalArgumentException("Configuration file specified via --config was not found: "
                        + this.configFile.getAbsolutePath());
            }
            logger.info("Using configuration file specified via --config: {}", this.configFile.getAbsolutePath());
            return this.configFile;
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new IllegalArgumentException("Configuration file specified via -Dconfig.file was not found: "
                        + systemConfigFile.getAbsolutePath());
            }
            logger.info("Using configuration file specified via -Dconfig.file: {}", systemConfigFile.getAbsolutePath());
            return systemConfigFile;
        }

        final File cwdConfigFile = new File(CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            logger.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
            return cwdConfigFile;
        }

        logger.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
        return null;
    }

    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }

    /**
     * @return The formatter layout from the {@code zignet.format} block, or the defaults if it is absent.
     */
    public CodeGenOptions getFormatOptions() {
        final Config current = getConfig();
        return current.hasPath(FORMAT_CONFIG_PATH)
                ? CodeGenOptions.fromConfig(current.getConfig(FORMAT_CONFIG_PATH))
                : CodeGenOptions.defaults();
    }
}
