package work.cliforge.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.cliforge.expr.ResolutionBackend;
import work.cliforge.value.JsonCodec;
import work.cliforge.value.Value;
import work.cliforge.value.Values;

/**
 * Realizes expressions as concrete values against a live {@link Environment}.
 */
final class ValueBackend implements ResolutionBackend<Value> {
    private final Environment environment;

    ValueBackend(Environment environment) {
        this.environment = environment;
    }

    @Override
    public Value literal(Value value) {
        return value;
    }

    @Override
    public Optional<Value> flag(String name) {
        return environment.flag(name);
    }

    @Override
    public Optional<Value> arg(String name) {
        return environment.arg(name);
    }

    @Override
    public Optional<Value> step(String name, List<String> path) {
        return environment.step(name).map(result -> Values.lookup(result, path));
    }

    @Override
    public Value stringify(Value resolved) {
        return Value.of(Values.stringify(resolved));
    }

    @Override
    public Value concat(List<Value> parts) {
        var builder = new StringBuilder();
        for (var part : parts) {
            builder.append(Values.stringify(part));
        }
        return Value.of(builder.toString());
    }

    @Override
    public Value object(Map<String, Value> entries) {
        return new Value.MapValue(entries);
    }

    @Override
    public Value jsonEncode(Value resolved) {
        try {
            return Value.of(JsonCodec.compact(resolved));
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("jsonencode failed: " + ex.getOriginalMessage(), ex);
        }
    }
}
