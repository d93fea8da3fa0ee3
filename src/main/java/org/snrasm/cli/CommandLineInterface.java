package org.snrasm.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.snrasm.cli.commands.AssembleCommand;
import org.snrasm.cli.commands.DisassembleCommand;
import org.snrasm.cli.commands.LexCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "snrasm",
    mixinStandardHelpOptions = true,
    version = "snrasm 0.1.0",
    description = "Assembler and disassembler for scenario VM code",
    subcommands = {
        AssembleCommand.class,
        DisassembleCommand.class,
        LexCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    /** Exit code of a run that reported diagnostics errors. */
    public static final int EXIT_DIAGNOSTICS = 1;
    /** Exit code of a run that failed to read or write a file. */
    public static final int EXIT_IO = 2;

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file overriding the classpath defaults"
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
        final int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * @return The configured picocli command line; tests redirect its output streams.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("snrasm");
        return commandLine;
    }

    /**
     * Loads the configuration once.
     * Load order: system properties &gt; {@code --config} file &gt; classpath defaults.
     *
     * @return The resolved configuration.
     * @throws ConfigException if the file is missing or cannot be parsed.
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        Config fallback = ConfigFactory.load();
        if (configFile != null) {
            if (!configFile.exists()) {
                throw new ConfigException.IO(ConfigFactory.empty().origin(),
                        "Configuration file specified via --config was not found: " + configFile.getAbsolutePath());
            }
            LOG.info("Using configuration file specified via --config: {}", configFile.getAbsolutePath());
            fallback = ConfigFactory.parseFile(configFile).withFallback(fallback);
        }
        config = ConfigFactory.systemProperties().withFallback(fallback).resolve();
        return config;
    }
}
