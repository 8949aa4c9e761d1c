package work.cliforge.compiler;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import work.cliforge.value.Value;

/**
 * Java source literals for scalar values. The boxed type is preserved so that a generated program
 * prints numbers exactly as the interpreter does.
 */
final class JavaLiterals {
    private JavaLiterals() {}

    static String of(Value value) {
        if (value == Value.NULL) {
            return "null";
        }
        if (value instanceof Value.BoolValue bool) {
            return Boolean.toString(bool.value());
        }
        if (value instanceof Value.StringValue text) {
            return quote(text.value());
        }
        if (value instanceof Value.NumberValue number) {
            return number(number.value());
        }
        throw new IllegalArgumentException("No Java literal for " + value.kind().name().toLowerCase(Locale.ROOT) + " values");
    }

    static String number(Number number) {
        if (number instanceof Integer) {
            return number.toString();
        }
        if (number instanceof Long) {
            return number + "L";
        }
        if (number instanceof Short) {
            return "(short) " + number;
        }
        if (number instanceof Byte) {
            return "(byte) " + number;
        }
        if (number instanceof Double d) {
            if (d.isNaN()) {
                return "Double.NaN";
            }
            if (d.isInfinite()) {
                return d > 0 ? "Double.POSITIVE_INFINITY" : "Double.NEGATIVE_INFINITY";
            }
            return d + "d";
        }
        if (number instanceof Float f) {
            if (f.isNaN()) {
                return "Float.NaN";
            }
            if (f.isInfinite()) {
                return f > 0 ? "Float.POSITIVE_INFINITY" : "Float.NEGATIVE_INFINITY";
            }
            return f + "f";
        }
        if (number instanceof BigInteger || number instanceof BigDecimal) {
            return "new " + number.getClass().getName() + "(" + quote(number.toString()) + ")";
        }
        throw new IllegalArgumentException("Unsupported number type: " + number.getClass().getName());
    }

    static String quote(String text) {
        var builder = new StringBuilder(text.length() + 2).append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> builder.append("\\\"");
                case '\\' -> builder.append("\\\\");
                case '\n' -> builder.append("\\n");
                case '\r' -> builder.append("\\r");
                case '\t' -> builder.append("\\t");
                case '\b' -> builder.append("\\b");
                case '\f' -> builder.append("\\f");
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        builder.append(String.format("\\u%04x", (int) c));
                    } else {
                        builder.append(c);
                    }
                }
            }
        }
        return builder.append('"').toString();
    }
}
