package work.cliforge.compiler;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.cliforge.expr.ExpressionResolver;
import work.cliforge.expr.Identifiers;
import work.cliforge.expr.ReferenceException;
import work.cliforge.plan.ActionPlan;
import work.cliforge.plan.ActionPlanner;
import work.cliforge.plan.CommandShape;
import work.cliforge.plan.Feature;
import work.cliforge.plan.FeatureScanner;
import work.cliforge.plan.OutputPlan;
import work.cliforge.plan.StepPlan;
import work.cliforge.spec.CliSpecification;
import work.cliforge.spec.CommandDefinition;
import work.cliforge.spec.FlagDefinition;
import work.cliforge.spec.SpecificationValidator;

/**
 * Translates a specification into the source of one standalone Java program built on picocli and
 * Jackson.
 *
 * <p>Pass 1 names every command, run method and step variable and computes the feature set.
 * Pass 2 emits the class: the command tree in {@code run}, one run method per leaf and only the
 * support routines the features require. Any reference error aborts generation with no source.
 */
public final class CompilingBackend {
    private static final Logger LOG = LoggerFactory.getLogger(CompilingBackend.class);
    static final String HEADER = "// Generated by cliforge. Do not edit.";

    private final SourceFormatter formatter;

    public CompilingBackend() {
        this(new SourceFormatter());
    }

    public CompilingBackend(SourceFormatter formatter) {
        this.formatter = formatter;
    }

    public GeneratedSource generate(CliSpecification spec) {
        SpecificationValidator.requireValid(spec);
        var commands = new ArrayList<CommandEntry>();
        for (var command : spec.commands()) {
            nameCommands(spec, command, command.name(), "rootCmd", commands);
        }
        var features = FeatureScanner.scan(spec);
        var className = className(spec.name());
        LOG.debug("Generating {} with features {}", className, features);

        var raw = new Emitter(spec, className, commands, features).emit();
        return formatter.format(className, raw);
    }

    public static String className(String specName) {
        var camel = Identifiers.toCamelCase(specName);
        if (camel.isEmpty() || Character.isDigit(camel.charAt(0))) {
            camel = "Generated" + camel;
        }
        return camel + "Cli";
    }

    private record CommandEntry(
        CommandDefinition definition,
        CommandShape shape,
        String variable,
        String parentVariable,
        String runMethod,
        ActionPlan plan
    ) {}

    private static void nameCommands(
        CliSpecification spec,
        CommandDefinition command,
        String path,
        String parentVariable,
        List<CommandEntry> commands
    ) {
        var camel = Identifiers.toCamelCase(path);
        var variable = "cmd" + camel;
        ActionPlan plan = null;
        String runMethod = null;
        if (command.isLeaf()) {
            plan = ActionPlanner.plan(spec.flags(), command, path);
            runMethod = "run" + camel;
        }
        commands.add(new CommandEntry(command, CommandShape.of(command), variable, parentVariable, runMethod, plan));
        for (var child : command.commands()) {
            nameCommands(spec, child, path + " " + child.name(), variable, commands);
        }
    }

    private static final class Emitter {
        private final CliSpecification spec;
        private final String className;
        private final List<CommandEntry> commands;
        private final Set<Feature> features;
        private final StringBuilder out = new StringBuilder();

        Emitter(CliSpecification spec, String className, List<CommandEntry> commands, Set<Feature> features) {
            this.spec = spec;
            this.className = className;
            this.commands = commands;
            this.features = features;
        }

        String emit() {
            line(0, HEADER);
            line(0, "");
            for (var name : SupportRoutines.imports(features)) {
                line(0, "import " + name + ";");
            }
            line(0, "");
            line(0, "public final class " + className + " {");
            for (var field : SupportRoutines.fields(features)) {
                block(1, field);
                line(0, "");
            }
            line(1, "private " + className + "() {}");
            line(0, "");
            line(1, "public static void main(String[] args) {");
            line(2, "System.exit(run(System.out, System.err, args));");
            line(1, "}");
            line(0, "");
            emitTree();
            for (var entry : commands) {
                if (entry.plan() != null) {
                    line(0, "");
                    emitRunMethod(entry);
                }
            }
            for (var member : SupportRoutines.members(features)) {
                line(0, "");
                block(1, member);
            }
            line(0, "}");
            return out.toString();
        }

        private void emitTree() {
            line(1, "public static int run(PrintStream out, PrintStream err, String... args) {");
            line(2, "List<Flag> globals = " + flagList(spec.flags()) + ";");
            line(2, "CommandSpec rootCmd = group(" + quote(spec.name()) + ", " + quote(spec.name()) + ", "
                + quote(spec.description()) + ", globals, List.of());");
            for (var entry : commands) {
                var shape = entry.shape();
                var common = quote(shape.name()) + ", " + quote(shape.usage()) + ", " + quote(shape.description())
                    + ", globals, " + flagList(entry.definition().flags());
                if (entry.plan() == null) {
                    line(2, "CommandSpec " + entry.variable() + " = group(" + common + ");");
                } else {
                    var arity = shape.arity();
                    line(2, "CommandSpec " + entry.variable() + " = leaf(" + common + ", " + arity.required() + ", "
                        + arity.exact() + ", " + className + "::" + entry.runMethod() + ");");
                }
                line(2, entry.parentVariable() + ".addSubcommand(" + quote(shape.name()) + ", " + entry.variable() + ");");
            }
            line(2, "return execute(rootCmd, globals, out, err, args);");
            line(1, "}");
        }

        private String flagList(List<FlagDefinition> flags) {
            var list = new StringJoiner(", ", "List.of(", ")");
            for (var flag : flags) {
                var defaultValue = flag.env()
                    .map(env -> "envOr(" + quote(env) + ", " + quote(flag.defaultValue()) + ")")
                    .orElse(quote(flag.defaultValue()));
                list.add("new Flag(" + quote(flag.name()) + ", "
                    + flag.shortName().map(JavaLiterals::quote).orElse("null") + ", "
                    + quote(flag.description()) + ", " + defaultValue + ", " + flag.required() + ")");
            }
            return list.toString();
        }

        private void emitRunMethod(CommandEntry entry) {
            var plan = entry.plan();
            var backend = new SourceBackend(plan);
            var resolver = new ExpressionResolver<>(backend);
            line(1, "private static void " + entry.runMethod() + "(Map<String, String> flags, List<String> args, PrintStream out)");
            line(3, "throws Exception {");
            for (var flagName : plan.flagNames()) {
                line(2, "String " + Identifiers.flagVariable(flagName) + " = flags.get(" + quote(flagName) + ");");
            }
            for (StepPlan step : plan.steps()) {
                String url;
                String headers;
                String body;
                try {
                    url = resolver.resolve(step.url());
                    headers = step.headers().map(resolver::resolve).orElse("null");
                    body = step.body().map(resolver::resolve).orElse("null");
                } catch (ReferenceException ex) {
                    throw ex.withContext(plan.stepContext(step));
                }
                var variable = Identifiers.stepVariable(step.name());
                line(2, "Object " + variable + ";");
                line(2, "try {");
                line(3, variable + " = httpStep(" + quote(step.method()) + ", " + url + ", " + headers + ", " + body + ");");
                line(2, "} catch (Exception e) {");
                line(3, "throw stepFailure(" + quote(step.name()) + ", e);");
                line(2, "}");
                backend.completed(step.name());
            }
            if (plan.output().isPresent()) {
                OutputPlan output = plan.output().get();
                String data;
                try {
                    data = resolver.resolve(output.data());
                } catch (ReferenceException ex) {
                    throw ex.withContext(plan.outputContext());
                }
                switch (output.format()) {
                    case JSON -> line(2, "renderJson(out, " + data + ");");
                    case TABLE -> line(2, "renderTable(out, " + data + ", " + columnList(output.columns()) + ");");
                    case TEXT -> line(2, "renderText(out, " + data + ");");
                }
            }
            line(1, "}");
        }

        private static String columnList(List<String> columns) {
            var list = new StringJoiner(", ", "List.of(", ")");
            columns.forEach(column -> list.add(quote(column)));
            return list.toString();
        }

        private static String quote(String text) {
            return JavaLiterals.quote(text);
        }

        private void block(int indent, String text) {
            var body = text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
            for (var textLine : body.split("\n", -1)) {
                line(textLine.isEmpty() ? 0 : indent, textLine);
            }
        }

        private void line(int indent, String text) {
            out.append("  ".repeat(indent)).append(text).append('\n');
        }
    }
}
