package work.cliforge.expr;

import java.util.Objects;

/**
 * {@code jsonencode(expr)}: the argument's compact JSON encoding as a string.
 */
public record JsonEncode(Expression argument) implements Expression {
    public JsonEncode {
        Objects.requireNonNull(argument, "argument");
    }
}
