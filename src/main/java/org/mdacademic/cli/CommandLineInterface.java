package org.mdacademic.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.mdacademic.cli.commands.CompileCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "mdacademic",
    mixinStandardHelpOptions = true,
    version = "mdacademic 0.1.0",
    description = "Compiler for academic Markdown: numbering, cross-references, footnotes and citations",
    subcommands = {
        CompileCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to a HOCON configuration file layered over the built-in defaults"
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
        System.exit(createCommandLine().execute(args));
    }

    /**
     * @return A command line wired to a fresh interface instance, with case-insensitive enum options.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("mdacademic");
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        return commandLine;
    }

    /**
     * Loads the configuration on first use.
     * Load order: system properties, then environment, then the {@code --config} file, then classpath defaults.
     *
     * @return The resolved configuration.
     * @throws ConfigException if the file given via {@code --config} is missing or malformed.
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        if (configFile != null) {
            if (!configFile.exists()) {
                LOG.error("Configuration file specified via --config was not found: {}", configFile.getAbsolutePath());
                throw new ConfigException.Generic("Configuration file not found: " + configFile.getAbsolutePath());
            }
            LOG.info("Using configuration file specified via --config: {}", configFile.getAbsolutePath());
            config = ConfigFactory.systemProperties()
                    .withFallback(ConfigFactory.systemEnvironment())
                    .withFallback(ConfigFactory.parseFile(configFile))
                    .withFallback(ConfigFactory.load())
                    .resolve();
        } else {
            LOG.debug("No --config given; using defaults from classpath");
            config = ConfigFactory.systemProperties()
                    .withFallback(ConfigFactory.systemEnvironment())
                    .withFallback(ConfigFactory.load())
                    .resolve();
        }
        return config;
    }
}
