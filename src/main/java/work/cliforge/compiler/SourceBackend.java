package work.cliforge.compiler;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;
import work.cliforge.expr.Identifiers;
import work.cliforge.expr.ResolutionBackend;
import work.cliforge.plan.ActionPlan;
import work.cliforge.value.Value;

/**
 * Realizes expressions as Java source fragments inside one generated run method. Every fragment
 * is an expression of static type {@code Object} (or narrower) using the generated support routines.
 */
final class SourceBackend implements ResolutionBackend<String> {
    private static final String NULL = "null";

    private final ActionPlan plan;
    private final Set<String> completedSteps = new HashSet<>();

    SourceBackend(ActionPlan plan) {
        this.plan = plan;
    }

    /** Makes a step's result variable referenceable by everything that follows it. */
    void completed(String stepName) {
        completedSteps.add(stepName);
    }

    @Override
    public String literal(Value value) {
        return JavaLiterals.of(value);
    }

    @Override
    public Optional<String> flag(String name) {
        return plan.flagNames().contains(name) ? Optional.of(Identifiers.flagVariable(name)) : Optional.empty();
    }

    @Override
    public Optional<String> arg(String name) {
        int position = plan.argPosition(name);
        return position < 0 ? Optional.empty() : Optional.of("arg(args, " + position + ")");
    }

    @Override
    public Optional<String> step(String name, List<String> path) {
        if (!completedSteps.contains(name)) {
            return Optional.empty();
        }
        var variable = Identifiers.stepVariable(name);
        if (path.isEmpty()) {
            return Optional.of(variable);
        }
        var call = new StringJoiner(", ", "path(", ")");
        call.add(variable);
        path.forEach(segment -> call.add(JavaLiterals.quote(segment)));
        return Optional.of(call.toString());
    }

    @Override
    public String stringify(String resolved) {
        // String.valueOf(null) would pick the char[] overload
        if (NULL.equals(resolved)) {
            return JavaLiterals.quote(NULL);
        }
        return "String.valueOf(" + resolved + ")";
    }

    @Override
    public String concat(List<String> parts) {
        var joined = new StringJoiner(" + ", "(", ")");
        parts.forEach(joined::add);
        return joined.toString();
    }

    @Override
    public String object(Map<String, String> entries) {
        var call = new StringJoiner(", ", "mapOf(", ")");
        entries.forEach((key, value) -> {
            call.add(JavaLiterals.quote(key));
            call.add(value);
        });
        return call.toString();
    }

    @Override
    public String jsonEncode(String resolved) {
        return "toJson(" + resolved + ")";
    }
}
