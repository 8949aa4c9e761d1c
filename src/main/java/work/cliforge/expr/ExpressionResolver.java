package work.cliforge.expr;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Objects;
import work.cliforge.value.Value;

/**
 * Walks an expression tree once for both backends. Scope checks, template ordering and the
 * single-part unwrapping rule live here; the backend only supplies the realization of each node.
 */
public final class ExpressionResolver<T> {
    private final ResolutionBackend<T> backend;

    public ExpressionResolver(ResolutionBackend<T> backend) {
        this.backend = Objects.requireNonNull(backend, "backend");
    }

    public T resolve(Expression expression) {
        if (expression instanceof Literal literal) {
            return backend.literal(literal.value());
        }
        if (expression instanceof NamespaceReference reference) {
            return resolveReference(reference);
        }
        if (expression instanceof Template template) {
            return resolveTemplate(template);
        }
        if (expression instanceof ObjectExpression object) {
            var entries = new LinkedHashMap<String, T>();
            for (var entry : object.entries().entrySet()) {
                entries.put(entry.getKey(), resolve(entry.getValue()));
            }
            return backend.object(entries);
        }
        if (expression instanceof JsonEncode encode) {
            return backend.jsonEncode(resolve(encode.argument()));
        }
        throw new IllegalArgumentException("Unsupported expression: " + expression);
    }

    private T resolveReference(NamespaceReference reference) {
        var resolved = switch (reference.namespace()) {
            case FLAG -> backend.flag(reference.name());
            case ARG -> backend.arg(reference.name());
            case STEP -> backend.step(reference.name(), reference.path());
        };
        return resolved.orElseThrow(() -> ReferenceException.unknown(reference.namespace(), reference.name()));
    }

    private T resolveTemplate(Template template) {
        var parts = template.parts();
        if (parts.isEmpty()) {
            return backend.literal(Value.of(""));
        }
        // "${step.read.body}" keeps the value itself, not its string form
        if (parts.size() == 1 && !isTextFragment(parts.get(0))) {
            return resolve(parts.get(0));
        }
        var rendered = new ArrayList<T>(parts.size());
        for (var part : parts) {
            if (isTextFragment(part)) {
                rendered.add(backend.literal(((Literal) part).value()));
            } else {
                rendered.add(backend.stringify(resolve(part)));
            }
        }
        return backend.concat(rendered);
    }

    private static boolean isTextFragment(Expression part) {
        return part instanceof Literal literal && literal.value() instanceof Value.StringValue;
    }
}
