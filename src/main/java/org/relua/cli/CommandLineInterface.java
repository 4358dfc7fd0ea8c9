package org.relua.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.relua.cli.commands.PlanCommand;
import org.relua.cli.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "relua",
    mixinStandardHelpOptions = true,
    version = "relua 1.0",
    description = "relua - dependency discovery and restoration planning for decompiled Lua sources",
    subcommands = {
        PlanCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    static final String LOG_LEVEL_PATH = "relua.logging.level";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/relua.conf)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // No subcommand given
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final int exitCode = createCommandLine().execute(args);
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
        commandLine.setCommandName("relua");
        return commandLine;
    }

    /**
     * Resolves the application configuration on first use.
     *
     * @return The resolved configuration.
     * @throws IllegalArgumentException            if the file given via {@code --config} does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (config == null) {
            final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);
            config = ConfigLoader.resolve(configFile, (level, message) -> {
                switch (level) {
                    case INFO -> logger.debug(message);
                    case WARN -> logger.warn(message);
                }
            });
            applyLogLevel(config);
        }
        return config;
    }

    private static void applyLogLevel(final Config config) {
        if (!config.hasPath(LOG_LEVEL_PATH)) {
            return;
        }
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
            final Level level = Level.toLevel(config.getString(LOG_LEVEL_PATH), Level.INFO);
            context.getLogger("org.relua").setLevel(level);
        }
    }
}
