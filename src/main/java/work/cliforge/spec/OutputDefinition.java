package work.cliforge.spec;

import java.util.List;
import java.util.Optional;
import work.cliforge.expr.Expression;

/**
 * Output declaration as written. The format string is checked when the action is planned.
 */
public record OutputDefinition(String format, Optional<Expression> data, List<String> columns) {
    public static final String DEFAULT_FORMAT = "json";

    public OutputDefinition {
        format = format == null || format.isBlank() ? DEFAULT_FORMAT : format;
        data = data == null ? Optional.empty() : data;
        columns = columns == null ? List.of() : List.copyOf(columns);
    }
}
