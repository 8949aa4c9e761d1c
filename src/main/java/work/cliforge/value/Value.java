package work.cliforge.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON-shaped runtime value: step results, flag/arg bindings and output data.
 */
public interface Value {
    NullValue NULL = NullValue.INSTANCE;

    Kind kind();

    static Value of(String text) {
        return text == null ? NULL : new StringValue(text);
    }

    static Value of(boolean flag) {
        return new BoolValue(flag);
    }

    static Value of(Number number) {
        return number == null ? NULL : new NumberValue(number);
    }

    enum Kind {
        NULL,
        BOOL,
        NUMBER,
        STRING,
        LIST,
        MAP
    }

    enum NullValue implements Value {
        INSTANCE;

        @Override
        public Kind kind() {
            return Kind.NULL;
        }
    }

    record BoolValue(boolean value) implements Value {
        @Override
        public Kind kind() {
            return Kind.BOOL;
        }
    }

    /**
     * Keeps the boxed number as parsed (Integer, Long, BigInteger, Double, ...) so its text form matches the source.
     */
    record NumberValue(Number value) implements Value {
        public NumberValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Kind kind() {
            return Kind.NUMBER;
        }
    }

    record StringValue(String value) implements Value {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Kind kind() {
            return Kind.STRING;
        }
    }

    record ListValue(List<Value> items) implements Value {
        public ListValue {
            items = List.copyOf(items);
        }

        @Override
        public Kind kind() {
            return Kind.LIST;
        }
    }

    /**
     * Entries keep insertion order.
     */
    record MapValue(Map<String, Value> entries) implements Value {
        public MapValue {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        @Override
        public Kind kind() {
            return Kind.MAP;
        }
    }
}
