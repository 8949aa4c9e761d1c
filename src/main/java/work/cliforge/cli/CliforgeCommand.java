package work.cliforge.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.cliforge.api.CliforgeRunner;
import work.cliforge.api.RunConfiguration;
import work.cliforge.shared.DurationParser;
import work.cliforge.spec.SpecificationLoader;
import work.cliforge.spec.SpecificationValidator;

@CommandLine.Command(
    name = "cliforge",
    description = "Turn a declarative CLI specification into a working command-line tool.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = {
        CliforgeCommand.Run.class,
        CliforgeCommand.Generate.class,
        CliforgeCommand.Build.class,
        CliforgeCommand.Validate.class
    }
)
final class CliforgeCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    @CommandLine.Command(
        name = "run",
        description = "Interpret the specification and dispatch ARGS once (options for cliforge come first).",
        mixinStandardHelpOptions = true
    )
    static final class Run implements Callable<Integer> {
        @CommandLine.Mixin
        private SpecOptions options;

        @CommandLine.Option(
            names = "--timeout",
            description = "Cancel the step chain after this long (e.g. 500ms, 30s, 2m).",
            defaultValue = CommandLine.Option.NULL_VALUE
        )
        private String timeoutRaw;

        @CommandLine.Parameters(paramLabel = "ARGS", arity = "0..*", description = "Arguments for the interpreted CLI.")
        private List<String> arguments = new ArrayList<>();

        @Override
        public Integer call() {
            var level = options.applyLogLevel();
            var configuration = RunConfiguration.builder()
                .specPath(options.specPath)
                .arguments(arguments)
                .timeout(DurationParser.parse(timeoutRaw))
                .logLevel(level)
                .build();
            return new CliforgeRunner().run(configuration, System.out, System.err);
        }
    }

    @CommandLine.Command(
        name = "generate",
        description = "Generate the Java source of a standalone program.",
        mixinStandardHelpOptions = true
    )
    static final class Generate implements Callable<Integer> {
        @CommandLine.Mixin
        private SpecOptions options;

        @CommandLine.Option(names = {"-o", "--output"}, paramLabel = "FILE", description = "Write the source here instead of stdout.")
        private Path output;

        @CommandLine.Spec
        private CommandLine.Model.CommandSpec spec;

        @Override
        public Integer call() throws IOException {
            options.applyLogLevel();
            var source = new CliforgeRunner().generate(options.specPath);
            if (output == null) {
                spec.commandLine().getOut().print(source.source());
                spec.commandLine().getOut().flush();
            } else {
                Files.writeString(output, source.source(), StandardCharsets.UTF_8);
            }
            if (source.formatError().isPresent()) {
                spec.commandLine().getErr().println("formatting failed, raw source written: " + source.formatError().get());
                return 1;
            }
            return 0;
        }
    }

    @CommandLine.Command(
        name = "build",
        description = "Generate, compile and package an executable jar.",
        mixinStandardHelpOptions = true
    )
    static final class Build implements Callable<Integer> {
        @CommandLine.Mixin
        private SpecOptions options;

        @CommandLine.Option(names = {"-o", "--output-dir"}, required = true, paramLabel = "DIR", description = "Build directory.")
        private Path outputDirectory;

        @CommandLine.Spec
        private CommandLine.Model.CommandSpec spec;

        @Override
        public Integer call() {
            options.applyLogLevel();
            var jar = new CliforgeRunner().build(options.specPath, outputDirectory);
            spec.commandLine().getOut().println(jar);
            return 0;
        }
    }

    @CommandLine.Command(
        name = "validate",
        description = "Check a specification and report every problem found.",
        mixinStandardHelpOptions = true
    )
    static final class Validate implements Callable<Integer> {
        @CommandLine.Mixin
        private SpecOptions options;

        @CommandLine.Spec
        private CommandLine.Model.CommandSpec spec;

        @Override
        public Integer call() {
            options.applyLogLevel();
            var loaded = SpecificationLoader.loadFromFile(options.specPath);
            var problems = SpecificationValidator.validate(loaded);
            if (problems.isEmpty()) {
                spec.commandLine().getOut().println("ok: " + loaded.name());
                return 0;
            }
            for (var problem : problems) {
                spec.commandLine().getErr().println(problem);
            }
            return 1;
        }
    }
}
