package work.cliforge.compiler;

import com.google.googlejavaformat.java.Formatter;
import com.google.googlejavaformat.java.FormatterException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs generated source through google-java-format. A failure never loses the source: the raw
 * text comes back together with the formatter's message.
 */
public final class SourceFormatter {
    private static final Logger LOG = LoggerFactory.getLogger(SourceFormatter.class);

    private final Formatter formatter;

    public SourceFormatter() {
        this(new Formatter());
    }

    SourceFormatter(Formatter formatter) {
        this.formatter = formatter;
    }

    public GeneratedSource format(String className, String raw) {
        try {
            return new GeneratedSource(className, formatter.formatSource(raw), Optional.empty());
        } catch (FormatterException ex) {
            LOG.warn("Formatting {} failed: {}", className, ex.getMessage());
            return new GeneratedSource(className, raw, Optional.of(ex.getMessage()));
        }
    }
}
