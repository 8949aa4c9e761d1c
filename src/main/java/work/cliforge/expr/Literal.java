package work.cliforge.expr;

import java.util.Objects;
import work.cliforge.value.Value;

public record Literal(Value value) implements Expression {
    public Literal {
        Objects.requireNonNull(value, "value");
    }
}
