package org.begend.cli;

import com.typesafe.config.Config;
import org.begend.cli.commands.ParseCommand;
import org.begend.cli.commands.TokensCommand;
import org.begend.cli.config.ConfigLoader;
import org.begend.cli.config.LoggingConfigurator;
import org.begend.compiler.FrontEnd;
import org.begend.compiler.api.NodeIdMode;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "begend",
    mixinStandardHelpOptions = true,
    version = "begend 1.0",
    description = "Front end for the begin/end language: tokens, syntax trees and JSON output.",
    subcommands = {
        TokensCommand.class,
        ParseCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + " in the working directory)"
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
        commandLine.setCommandName("begend");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Returns the merged configuration, loading it and applying the logging settings on first use.
     * @return The configuration.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }

    /**
     * Creates a front end set up from the configuration.
     * @return A new front end.
     */
    public FrontEnd createFrontEnd() {
        Config cfg = getConfig();
        FrontEnd frontEnd = new FrontEnd(NodeIdMode.fromConfig(cfg.getString("begend.parser.node-ids")));
        frontEnd.setVerbosity(cfg.getInt("begend.compiler.verbosity"));
        return frontEnd;
    }
}
