package work.cliforge.value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Conversions and the shared "default representation" used by templates, text and table output.
 */
public final class Values {
    private Values() {}

    public static Value fromJava(Object raw) {
        if (raw == null) {
            return Value.NULL;
        }
        if (raw instanceof Value value) {
            return value;
        }
        if (raw instanceof String text) {
            return new Value.StringValue(text);
        }
        if (raw instanceof Boolean flag) {
            return new Value.BoolValue(flag);
        }
        if (raw instanceof Number number) {
            return new Value.NumberValue(number);
        }
        if (raw instanceof Map<?, ?> map) {
            var entries = new LinkedHashMap<String, Value>();
            for (var entry : map.entrySet()) {
                entries.put(String.valueOf(entry.getKey()), fromJava(entry.getValue()));
            }
            return new Value.MapValue(entries);
        }
        if (raw instanceof List<?> list) {
            var items = new ArrayList<Value>(list.size());
            for (var item : list) {
                items.add(fromJava(item));
            }
            return new Value.ListValue(items);
        }
        return new Value.StringValue(String.valueOf(raw));
    }

    /**
     * Plain Java graph (LinkedHashMap/ArrayList/boxed scalars/null) for Jackson and for the generated programs' helpers.
     */
    public static Object toJava(Value value) {
        return switch (value.kind()) {
            case NULL -> null;
            case BOOL -> ((Value.BoolValue) value).value();
            case NUMBER -> ((Value.NumberValue) value).value();
            case STRING -> ((Value.StringValue) value).value();
            case LIST -> {
                var items = ((Value.ListValue) value).items();
                var copy = new ArrayList<>(items.size());
                for (var item : items) {
                    copy.add(toJava(item));
                }
                yield copy;
            }
            case MAP -> {
                var copy = new LinkedHashMap<String, Object>();
                for (var entry : ((Value.MapValue) value).entries().entrySet()) {
                    copy.put(entry.getKey(), toJava(entry.getValue()));
                }
                yield copy;
            }
        };
    }

    /**
     * Default representation: strings verbatim, everything else in the form {@link String#valueOf(Object)}
     * gives the equivalent Java graph ({@code null}, {@code [a, b]}, {@code {k=v}}).
     */
    public static String stringify(Value value) {
        return switch (value.kind()) {
            case NULL -> "null";
            case BOOL -> Boolean.toString(((Value.BoolValue) value).value());
            case NUMBER -> ((Value.NumberValue) value).value().toString();
            case STRING -> ((Value.StringValue) value).value();
            case LIST -> {
                var joiner = new StringJoiner(", ", "[", "]");
                for (var item : ((Value.ListValue) value).items()) {
                    joiner.add(stringify(item));
                }
                yield joiner.toString();
            }
            case MAP -> {
                var joiner = new StringJoiner(", ", "{", "}");
                for (var entry : ((Value.MapValue) value).entries().entrySet()) {
                    joiner.add(entry.getKey() + "=" + stringify(entry.getValue()));
                }
                yield joiner.toString();
            }
        };
    }

    /**
     * Descends one map key per segment. A non-map value or a missing key yields {@link Value#NULL}.
     */
    public static Value lookup(Value root, List<String> path) {
        Value current = root;
        for (String key : path) {
            if (!(current instanceof Value.MapValue map)) {
                return Value.NULL;
            }
            current = map.entries().getOrDefault(key, Value.NULL);
        }
        return current;
    }
}
