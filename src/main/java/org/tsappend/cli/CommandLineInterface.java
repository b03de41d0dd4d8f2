package org.tsappend.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.tsappend.cli.commands.AppendCommand;
import org.tsappend.cli.commands.InspectCommand;
import org.tsappend.cli.config.ConfigLoader;
import org.tsappend.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
    name = "tsappend",
    mixinStandardHelpOptions = true,
    version = "tsappend 1.0",
    description = "Appends time-series array data onto chunked, compressed stores",
    subcommands = {
        AppendCommand.class,
        InspectCommand.class,
        CommandLine.HelpCommand.class
    },
    footer = {
        "",
        "Environment:",
        "  TSAPPEND_OUTPUT_DIR   directory new stores are written to",
        "  TSAPPEND_STAGING_DIR  parent of per-run staging directories (default: system temp)",
        "  AWS_REGION            region of the S3 client used for s3:// URLs"
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/tsappend.conf)"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // No subcommand: print usage
        spec.commandLine().usage(spec.commandLine().getOut());
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
        commandLine.setCommandName("tsappend");
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        // Configuration errors surface as IllegalArgumentException / ConfigException to the subcommand
        this.config = ConfigLoader.resolve(this.configFile, (level, message) -> {
            switch (level) {
                case INFO -> logger.info(message);
                case WARN -> logger.warn(message);
            }
        });

        LoggingConfigurator.configure(config);
        initialized = true;
    }

    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
