package work.cliforge.plan;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import work.cliforge.expr.Expression;
import work.cliforge.spec.ArgDefinition;
import work.cliforge.spec.CommandDefinition;
import work.cliforge.spec.FlagDefinition;
import work.cliforge.spec.OutputDefinition;
import work.cliforge.spec.StepDefinition;
import work.cliforge.value.Value;

/**
 * Turns a leaf command's action into an {@link ActionPlan}. Unknown output formats fail here, before
 * any backend has produced code or executed a step.
 */
public final class ActionPlanner {
    private ActionPlanner() {}

    public static ActionPlan plan(List<FlagDefinition> globalFlags, CommandDefinition leaf, String commandPath) {
        var action = leaf.action()
            .orElseThrow(() -> new IllegalArgumentException("Command \"" + commandPath + "\" has no action"));

        var flagNames = new ArrayList<String>();
        globalFlags.forEach(flag -> flagNames.add(flag.name()));
        leaf.flags().forEach(flag -> flagNames.add(flag.name()));

        var argNames = new ArrayList<String>();
        for (ArgDefinition arg : leaf.args()) {
            argNames.add(arg.name());
        }

        var steps = new ArrayList<StepPlan>();
        for (StepDefinition step : action.steps()) {
            steps.add(new StepPlan(step.name(), step.method().toUpperCase(Locale.ROOT), step.url(), step.headers(), step.body()));
        }

        Optional<OutputPlan> output = action.output().map(definition -> planOutput(definition, steps));
        return new ActionPlan(commandPath, flagNames, argNames, steps, output);
    }

    private static OutputPlan planOutput(OutputDefinition definition, List<StepPlan> steps) {
        var format = OutputFormat.parse(definition.format());
        var data = definition.data().orElseGet(() -> steps.isEmpty()
            ? Expression.literal(Value.NULL)
            : Expression.step(steps.get(steps.size() - 1).name()));
        return new OutputPlan(format, data, definition.columns());
    }
}
