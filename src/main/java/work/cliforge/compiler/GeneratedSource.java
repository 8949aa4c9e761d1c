package work.cliforge.compiler;

import java.util.Objects;
import java.util.Optional;

/**
 * Output of the compiling backend. When formatting failed, {@code source} is the raw, unformatted
 * text and {@code formatError} says why.
 */
public record GeneratedSource(String className, String source, Optional<String> formatError) {
    public GeneratedSource {
        Objects.requireNonNull(className, "className");
        Objects.requireNonNull(source, "source");
        formatError = formatError == null ? Optional.empty() : formatError;
    }

    public String fileName() {
        return className + ".java";
    }

    public boolean formatted() {
        return formatError.isEmpty();
    }
}
