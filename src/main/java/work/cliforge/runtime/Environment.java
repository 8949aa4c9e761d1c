package work.cliforge.runtime;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.cliforge.value.Value;

/**
 * Name bindings for one action execution. Flags and args are fixed up front; step results are
 * added as each step completes, so a step only sees the ones before it.
 */
final class Environment {
    private final Map<String, String> flags;
    private final List<String> argNames;
    private final List<String> args;
    private final Map<String, Value> steps = new LinkedHashMap<>();

    Environment(Map<String, String> flags, List<String> argNames, List<String> args) {
        this.flags = new HashMap<>(flags);
        this.argNames = List.copyOf(argNames);
        this.args = List.copyOf(args);
    }

    Optional<Value> flag(String name) {
        return flags.containsKey(name) ? Optional.of(Value.of(flags.get(name))) : Optional.empty();
    }

    /** A declared arg whose position was not supplied is null. */
    Optional<Value> arg(String name) {
        int position = argNames.indexOf(name);
        if (position < 0) {
            return Optional.empty();
        }
        return Optional.of(position < args.size() ? Value.of(args.get(position)) : Value.NULL);
    }

    Optional<Value> step(String name) {
        return Optional.ofNullable(steps.get(name));
    }

    void putStep(String name, Value result) {
        steps.put(name, result);
    }
}
