package work.cliforge.plan;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import work.cliforge.expr.ExpressionResolver;
import work.cliforge.expr.ReferenceException;
import work.cliforge.expr.ResolutionBackend;
import work.cliforge.value.Value;

/**
 * Checks every reference in an action against what is in scope where it appears, without
 * evaluating anything. A step sees the steps declared before it; the output sees all of them.
 */
public final class ActionScope {
    private ActionScope() {}

    public static void verify(ActionPlan plan) {
        var completed = new HashSet<String>();
        var resolver = new ExpressionResolver<>(new ScopeBackend(plan, completed));
        for (var step : plan.steps()) {
            try {
                resolver.resolve(step.url());
                step.headers().ifPresent(resolver::resolve);
                step.body().ifPresent(resolver::resolve);
            } catch (ReferenceException ex) {
                throw ex.withContext(plan.stepContext(step));
            }
            completed.add(step.name());
        }
        plan.output().ifPresent(output -> {
            try {
                resolver.resolve(output.data());
            } catch (ReferenceException ex) {
                throw ex.withContext(plan.outputContext());
            }
        });
    }

    private static final class ScopeBackend implements ResolutionBackend<Value> {
        private final ActionPlan plan;
        private final Set<String> completed;

        ScopeBackend(ActionPlan plan, Set<String> completed) {
            this.plan = plan;
            this.completed = completed;
        }

        @Override
        public Value literal(Value value) {
            return value;
        }

        @Override
        public Optional<Value> flag(String name) {
            return plan.flagNames().contains(name) ? Optional.of(Value.NULL) : Optional.empty();
        }

        @Override
        public Optional<Value> arg(String name) {
            return plan.argNames().contains(name) ? Optional.of(Value.NULL) : Optional.empty();
        }

        @Override
        public Optional<Value> step(String name, List<String> path) {
            return completed.contains(name) ? Optional.of(Value.NULL) : Optional.empty();
        }

        @Override
        public Value stringify(Value resolved) {
            return resolved;
        }

        @Override
        public Value concat(List<Value> parts) {
            return Value.NULL;
        }

        @Override
        public Value object(Map<String, Value> entries) {
            return Value.NULL;
        }

        @Override
        public Value jsonEncode(Value resolved) {
            return Value.NULL;
        }
    }
}
