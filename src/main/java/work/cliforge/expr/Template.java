package work.cliforge.expr;

import java.util.List;

/**
 * Ordered literal fragments and interpolated expressions, rendered by concatenation.
 */
public record Template(List<Expression> parts) implements Expression {
    public Template {
        parts = List.copyOf(parts);
    }
}
