package org.scriptweaver.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.scriptweaver.cli.commands.CompileCommand;
import org.scriptweaver.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "scriptweaver",
    mixinStandardHelpOptions = true,
    version = "Scriptweaver 1.0",
    description = "Scriptweaver - compiles visual scripts into system source code",
    subcommands = {
        CompileCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final String CONFIG_FILE_NAME = "scriptweaver.conf";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: scriptweaver.conf)"
    )
    private File configFile;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

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
        commandLine.setCommandName("scriptweaver");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        try {
            // Config load order: System Props > Env Vars > File > Classpath defaults
            final File file = resolveConfigFile(logger);
            Config fileConfig = file != null ? ConfigFactory.parseFile(file) : ConfigFactory.empty();
            this.config = ConfigFactory.systemProperties()
                    .withFallback(ConfigFactory.systemEnvironment())
                    .withFallback(fileConfig)
                    .withFallback(ConfigFactory.load())
                    .resolve();
        } catch (ConfigException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Failed to load or parse configuration: " + e.getMessage(), e, null, null);
        }

        LoggingConfigurator.configure(config);
        initialized = true;
    }

    private File resolveConfigFile(final Logger logger) {
        // 1) Highest precedence: explicit CLI option --config
        if (this.configFile != null) {
            if (!this.configFile.exists()) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Configuration file specified via --config was not found: " + this.configFile.getAbsolutePath());
            }
            logger.info("Using configuration file specified via --config: {}", this.configFile.getAbsolutePath());
            return this.configFile;
        }
        // 2) Next: standard Typesafe Config system property -Dconfig.file
        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Configuration file specified via -Dconfig.file was not found: " + systemConfigFile);
            }
            logger.info("Using configuration file specified via -Dconfig.file: {}", systemConfigFile);
            return systemConfigFile;
        }
        // 3) Then: scriptweaver.conf in the current working directory
        final File cwdConfigFile = new File(CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            logger.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
            return cwdConfigFile;
        }
        // 4) Finally: classpath defaults only
        logger.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
        return null;
    }

    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
