package work.cliforge.cli;

import java.nio.file.Path;
import picocli.CommandLine;
import work.cliforge.api.LogLevel;

/**
 * Options shared by every subcommand.
 */
final class SpecOptions {
    @CommandLine.Option(
        names = {"-c", "--config"},
        required = true,
        paramLabel = "SPEC",
        description = "CLI specification file (YAML or JSON)."
    )
    Path specPath;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold on stderr (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    LogLevel logLevel() {
        return LogLevel.from(logLevelRaw);
    }

    LogLevel applyLogLevel() {
        var level = logLevel();
        level.apply();
        return level;
    }
}
