package org.silica.cli;

import com.typesafe.config.Config;
import org.silica.cli.commands.LoadCommand;
import org.silica.compiler.api.CompilationException;
import org.silica.compiler.api.SourceOptionsLoader;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "silica",
    mixinStandardHelpOptions = true,
    version = "Silica 0.1",
    description = "Silica - HDL source loading and parameter elaboration",
    subcommands = {
        LoadCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + SourceOptionsLoader.CONFIG_FILE_NAME + ")"
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
        commandLine.setCommandName("silica");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use.
     *
     * @return The resolved configuration.
     * @throws CompilationException if the configuration file is missing or malformed.
     */
    public Config getConfig() throws CompilationException {
        if (config == null) {
            config = SourceOptionsLoader.load(configFile);
        }
        return config;
    }
}
