package work.cliforge.api;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration for interpreting a specification once.
 *
 * @param arguments what the interpreted CLI receives, command names included
 * @param timeout bound on the whole dispatch; the step chain is cancelled when it elapses
 */
public record RunConfiguration(
    Path specPath,
    List<String> arguments,
    Optional<Duration> timeout,
    LogLevel logLevel
) {
    public RunConfiguration {
        Objects.requireNonNull(specPath, "specPath");
        arguments = List.copyOf(arguments);
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path specPath;
        private List<String> arguments = new ArrayList<>();
        private Optional<Duration> timeout = Optional.empty();
        private LogLevel logLevel = LogLevel.FATAL;

        public Builder specPath(Path specPath) {
            this.specPath = specPath;
            return this;
        }

        public Builder arguments(List<String> arguments) {
            this.arguments = arguments == null ? new ArrayList<>() : new ArrayList<>(arguments);
            return this;
        }

        public Builder timeout(Optional<Duration> timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public RunConfiguration build() {
            return new RunConfiguration(specPath, arguments, timeout, logLevel);
        }
    }
}
