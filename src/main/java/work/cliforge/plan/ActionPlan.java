package work.cliforge.plan;

import java.util.List;
import java.util.Optional;

/**
 * Everything a backend needs to realize one leaf's run handler.
 *
 * @param commandPath space-separated path from the root, used in error context
 * @param flagNames flags visible to the action's expressions: the globals plus the leaf's own flags
 * @param argNames declared args in positional order
 */
public record ActionPlan(
    String commandPath,
    List<String> flagNames,
    List<String> argNames,
    List<StepPlan> steps,
    Optional<OutputPlan> output
) {
    public ActionPlan {
        flagNames = List.copyOf(flagNames);
        argNames = List.copyOf(argNames);
        steps = List.copyOf(steps);
    }

    public int argPosition(String name) {
        return argNames.indexOf(name);
    }

    public String stepContext(StepPlan step) {
        return "command \"" + commandPath + "\" step \"" + step.name() + "\"";
    }

    public String outputContext() {
        return "command \"" + commandPath + "\" output";
    }
}
