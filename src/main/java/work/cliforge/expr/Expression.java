package work.cliforge.expr;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import work.cliforge.value.Value;

/**
 * Parsed expression node. Nodes are immutable and owned by the step or output that declared them.
 */
public interface Expression {
    static Literal literal(String text) {
        return new Literal(Value.of(text));
    }

    static Literal literal(Value value) {
        return new Literal(value);
    }

    static NamespaceReference flag(String name) {
        return new NamespaceReference(Namespace.FLAG, name, List.of());
    }

    static NamespaceReference arg(String name) {
        return new NamespaceReference(Namespace.ARG, name, List.of());
    }

    static NamespaceReference step(String name, String... path) {
        return new NamespaceReference(Namespace.STEP, name, Arrays.asList(path));
    }

    static Template template(Expression... parts) {
        return new Template(Arrays.asList(parts));
    }

    static ObjectExpression object(Map<String, Expression> entries) {
        return new ObjectExpression(entries);
    }

    static JsonEncode jsonEncode(Expression argument) {
        return new JsonEncode(argument);
    }
}
