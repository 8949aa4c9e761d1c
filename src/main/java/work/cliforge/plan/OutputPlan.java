package work.cliforge.plan;

import java.util.List;
import work.cliforge.expr.Expression;

/**
 * Output with its format checked and its data expression filled in. An empty column list means
 * the table columns come from the first record.
 */
public record OutputPlan(OutputFormat format, Expression data, List<String> columns) {
    public OutputPlan {
        columns = List.copyOf(columns);
    }
}
