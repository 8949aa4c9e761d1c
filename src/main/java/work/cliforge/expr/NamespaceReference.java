package work.cliforge.expr;

import java.util.List;
import java.util.Objects;

/**
 * {@code flag.<name>}, {@code arg.<name>} or {@code step.<name>.<path...>}. Only step references carry a path.
 */
public record NamespaceReference(Namespace namespace, String name, List<String> path) implements Expression {
    public NamespaceReference {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(name, "name");
        path = path == null ? List.of() : List.copyOf(path);
        if (namespace != Namespace.STEP && !path.isEmpty()) {
            throw new IllegalArgumentException(namespace.label() + " references take no path: " + name + "." + String.join(".", path));
        }
    }

    public String display() {
        var builder = new StringBuilder(namespace.label()).append('.').append(name);
        for (String segment : path) {
            builder.append('.').append(segment);
        }
        return builder.toString();
    }
}
