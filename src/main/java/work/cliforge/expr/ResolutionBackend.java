package work.cliforge.expr;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.cliforge.value.Value;

/**
 * What a backend contributes to expression resolution: how to realize each node kind as a {@code T}.
 * The compiling backend produces Java source fragments, the interpreting backend produces {@link Value}s.
 * Lookups return empty when the name is not in scope; {@link ExpressionResolver} turns that into a
 * {@link ReferenceException}.
 */
public interface ResolutionBackend<T> {
    T literal(Value value);

    Optional<T> flag(String name);

    Optional<T> arg(String name);

    Optional<T> step(String name, List<String> path);

    /** Default representation of a resolved part, as a string. */
    T stringify(T resolved);

    /** Concatenation of already-stringified parts, in order. */
    T concat(List<T> parts);

    T object(Map<String, T> entries);

    T jsonEncode(T resolved);
}
