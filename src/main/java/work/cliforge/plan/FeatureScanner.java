package work.cliforge.plan;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import work.cliforge.expr.Expression;
import work.cliforge.expr.JsonEncode;
import work.cliforge.expr.Namespace;
import work.cliforge.expr.NamespaceReference;
import work.cliforge.expr.ObjectExpression;
import work.cliforge.expr.Template;
import work.cliforge.spec.CliSpecification;
import work.cliforge.spec.CommandDefinition;
import work.cliforge.spec.FlagDefinition;

/**
 * Computes the feature set of a whole specification in one pass over the command tree.
 */
public final class FeatureScanner {
    private final EnumSet<Feature> features = EnumSet.noneOf(Feature.class);

    private FeatureScanner() {}

    public static Set<Feature> scan(CliSpecification spec) {
        var scanner = new FeatureScanner();
        scanner.flags(spec.flags());
        for (var command : spec.commands()) {
            scanner.command(spec.flags(), command, command.name());
        }
        if (scanner.features.contains(Feature.HTTP_STEP)
            || scanner.features.contains(Feature.JSON_OUTPUT)
            || scanner.features.contains(Feature.JSON_ENCODE)) {
            scanner.features.add(Feature.JSON_MAPPER);
        }
        return EnumSet.copyOf(scanner.features);
    }

    private void flags(List<FlagDefinition> flags) {
        for (var flag : flags) {
            if (flag.env().isPresent()) {
                features.add(Feature.ENV_FALLBACK);
            }
        }
    }

    private void command(List<FlagDefinition> globals, CommandDefinition command, String path) {
        flags(command.flags());
        if (command.isLeaf()) {
            var plan = ActionPlanner.plan(globals, command, path);
            for (var step : plan.steps()) {
                features.add(Feature.HTTP_STEP);
                expression(step.url());
                step.headers().ifPresent(this::expression);
                step.body().ifPresent(this::expression);
            }
            plan.output().ifPresent(output -> {
                switch (output.format()) {
                    case JSON -> features.add(Feature.JSON_OUTPUT);
                    case TABLE -> features.add(Feature.TABLE_OUTPUT);
                    case TEXT -> features.add(Feature.TEXT_OUTPUT);
                }
                expression(output.data());
            });
        }
        for (var child : command.commands()) {
            command(globals, child, path + " " + child.name());
        }
    }

    private void expression(Expression expression) {
        if (expression instanceof NamespaceReference reference) {
            if (reference.namespace() == Namespace.ARG) {
                features.add(Feature.ARG_LOOKUP);
            } else if (reference.namespace() == Namespace.STEP && !reference.path().isEmpty()) {
                features.add(Feature.STEP_PATH);
            }
        } else if (expression instanceof Template template) {
            template.parts().forEach(this::expression);
        } else if (expression instanceof ObjectExpression object) {
            features.add(Feature.OBJECT_LITERAL);
            object.entries().values().forEach(this::expression);
        } else if (expression instanceof JsonEncode encode) {
            features.add(Feature.JSON_ENCODE);
            expression(encode.argument());
        }
    }
}
