package work.cliforge.plan;

import java.util.Locale;
import work.cliforge.render.RenderException;

public enum OutputFormat {
    JSON,
    TABLE,
    TEXT;

    public static OutputFormat parse(String value) {
        if (value == null || value.isBlank()) {
            return JSON;
        }
        try {
            return OutputFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new RenderException("unsupported output format \"" + value + "\" (expected json, table, or text)");
        }
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
