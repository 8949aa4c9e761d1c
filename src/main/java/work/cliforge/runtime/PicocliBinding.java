package work.cliforge.runtime;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import picocli.CommandLine;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Model.OptionSpec;
import picocli.CommandLine.Model.PositionalParamSpec;
import picocli.CommandLine.ParseResult;
import work.cliforge.runtime.ExecutionContext.CancellationToken;
import work.cliforge.spec.FlagDefinition;

/**
 * Registers a live {@link CommandNode} tree with picocli and performs exactly one dispatch.
 * Global flags are accepted at every depth; when given more than once the value closest to the
 * dispatched command wins. Exit codes: 0 success, 1 run handler error, 2 usage error.
 */
public final class PicocliBinding {
    private PicocliBinding() {}

    public static int execute(CommandNode root, PrintStream out, PrintStream err, CancellationToken token, String... args) {
        return commandLine(root, out, err, token).execute(args);
    }

    public static CommandLine commandLine(CommandNode root, PrintStream out, PrintStream err, CancellationToken token) {
        var commandLine = new CommandLine(toSpec(root, root.flags(), true));
        commandLine.setInterpolateVariables(false);
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        commandLine.setExecutionStrategy(parseResult -> dispatch(root, parseResult, new ExecutionContext(out, token)));
        commandLine.setExecutionExceptionHandler((ex, failed, parseResult) -> {
            var message = ex.getMessage();
            failed.getErr().println(message == null || message.isBlank() ? ex.toString() : message);
            return failed.getCommandSpec().exitCodeOnExecutionException();
        });
        return commandLine;
    }

    private static CommandSpec toSpec(CommandNode node, List<FlagCell> globals, boolean isRoot) {
        var spec = CommandSpec.create();
        spec.name(node.name());
        spec.mixinStandardHelpOptions(true);
        spec.usageMessage().customSynopsis(node.usage());
        if (!node.description().isEmpty()) {
            spec.usageMessage().description(node.description());
        }
        for (var cell : globals) {
            spec.addOption(option(cell.definition(), false));
        }
        if (!isRoot) {
            for (var cell : node.flags()) {
                spec.addOption(option(cell.definition(), cell.definition().required()));
            }
        }
        if (node.isLeaf()) {
            spec.addPositional(PositionalParamSpec.builder()
                .arity("0..*")
                .type(String[].class)
                .paramLabel("ARGS")
                .hidden(true)
                .build());
        }
        for (var child : node.children()) {
            spec.addSubcommand(child.name(), toSpec(child, globals, false));
        }
        return spec;
    }

    private static OptionSpec option(FlagDefinition flag, boolean required) {
        var names = new ArrayList<String>();
        flag.shortName().ifPresent(shortName -> names.add("-" + shortName));
        names.add("--" + flag.name());
        return OptionSpec.builder(names.toArray(new String[0]))
            .type(String.class)
            .arity("1")
            .paramLabel("<" + flag.name() + ">")
            .description(flag.description())
            .required(required)
            .build();
    }

    private static int dispatch(CommandNode root, ParseResult parseResult, ExecutionContext context) {
        Integer helpExitCode = CommandLine.executeHelpRequest(parseResult);
        if (helpExitCode != null) {
            return helpExitCode;
        }

        var chain = new ArrayList<ParseResult>();
        var current = parseResult;
        var node = root;
        chain.add(current);
        while (current.hasSubcommand()) {
            current = current.subcommand();
            var name = current.commandSpec().name();
            node = node.child(name).orElseThrow(() -> new IllegalStateException("Unknown command: " + name));
            chain.add(current);
        }
        var target = node;
        var targetResult = current;
        var commandLine = targetResult.commandSpec().commandLine();

        for (var cell : root.flags()) {
            cell.reset();
            for (int i = chain.size() - 1; i >= 0; i--) {
                var result = chain.get(i);
                if (result.hasMatchedOption("--" + cell.name())) {
                    cell.bind(result.matchedOptionValue("--" + cell.name(), ""));
                    break;
                }
            }
        }
        if (target != root) {
            for (var cell : target.flags()) {
                cell.reset();
                if (targetResult.hasMatchedOption("--" + cell.name())) {
                    cell.bind(targetResult.matchedOptionValue("--" + cell.name(), ""));
                }
            }
        }

        if (!target.isLeaf()) {
            commandLine.usage(commandLine.getOut());
            return 0;
        }
        for (var cell : root.flags()) {
            if (cell.definition().required() && !cell.supplied()) {
                throw new CommandLine.ParameterException(commandLine, "Missing required option: '--" + cell.name() + "'");
            }
        }

        String[] positionals = targetResult.matchedPositionalValue(0, new String[0]);
        List<String> args = Arrays.asList(positionals);
        var violation = target.arity().flatMap(policy -> policy.check(args.size()));
        if (violation.isPresent()) {
            throw new CommandLine.ParameterException(commandLine, target.usage() + ": " + violation.get());
        }

        try {
            target.handler().orElseThrow().run(args, context);
        } catch (Exception ex) {
            throw new CommandLine.ExecutionException(commandLine, ex.getMessage(), ex);
        }
        return 0;
    }
}
