package work.cliforge.expr;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ordered key/value constructor, used for request headers and JSON bodies.
 */
public record ObjectExpression(Map<String, Expression> entries) implements Expression {
    public ObjectExpression {
        entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }
}
