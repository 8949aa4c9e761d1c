package work.cliforge.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;
import work.cliforge.plan.OutputFormat;
import work.cliforge.plan.OutputPlan;
import work.cliforge.value.JsonCodec;
import work.cliforge.value.Value;
import work.cliforge.value.Values;

/**
 * Renders a resolved output value. Every line, including the last, ends with {@code \n}.
 */
public final class OutputRenderer {
    private OutputRenderer() {}

    public static String render(OutputPlan output, Value data) {
        return render(output.format(), data, output.columns());
    }

    public static String render(OutputFormat format, Value data, List<String> columns) {
        return switch (format) {
            case JSON -> json(data);
            case TABLE -> table(data, columns);
            case TEXT -> Values.stringify(data) + "\n";
        };
    }

    public static String json(Value data) {
        try {
            return JsonCodec.pretty(data) + "\n";
        } catch (JsonProcessingException ex) {
            throw new RenderException("unable to encode output as JSON: " + ex.getOriginalMessage(), ex);
        }
    }

    /**
     * Header plus one tab-joined line per map record. Columns default to the first record's keys in
     * insertion order; records that are not maps are skipped and absent keys give empty cells.
     */
    public static String table(Value data, List<String> columns) {
        if (!(data instanceof Value.ListValue list)) {
            throw new RenderException("table output requires an array");
        }
        var effective = new ArrayList<>(columns);
        if (effective.isEmpty() && !list.items().isEmpty() && list.items().get(0) instanceof Value.MapValue first) {
            effective.addAll(first.entries().keySet());
        }
        if (effective.isEmpty()) {
            return "";
        }
        var out = new StringBuilder();
        out.append(String.join("\t", effective)).append('\n');
        for (var item : list.items()) {
            if (!(item instanceof Value.MapValue fields)) {
                continue;
            }
            var row = new StringJoiner("\t");
            for (String column : effective) {
                var cell = fields.entries().get(column);
                row.add(cell == null ? "" : Values.stringify(cell));
            }
            out.append(row).append('\n');
        }
        return out.toString();
    }
}
