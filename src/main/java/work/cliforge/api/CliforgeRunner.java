package work.cliforge.api;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.cliforge.compiler.CompilingBackend;
import work.cliforge.compiler.GeneratedSource;
import work.cliforge.compiler.JavaToolchain;
import work.cliforge.runtime.ExecutionContext.CancellationToken;
import work.cliforge.runtime.InterpretingBackend;
import work.cliforge.runtime.PicocliBinding;
import work.cliforge.spec.CliSpecification;
import work.cliforge.spec.SpecificationLoader;

/**
 * Public entry point for embedding cliforge: interpret a specification, generate its source, or
 * build it into a jar.
 */
public final class CliforgeRunner {
    private static final Logger LOG = LoggerFactory.getLogger(CliforgeRunner.class);

    private final InterpretingBackend interpreter;
    private final CompilingBackend compiler;
    private final JavaToolchain toolchain;

    public CliforgeRunner() {
        this(InterpretingBackend.withDefaults(), new CompilingBackend(), new JavaToolchain());
    }

    public CliforgeRunner(InterpretingBackend interpreter, CompilingBackend compiler, JavaToolchain toolchain) {
        this.interpreter = interpreter;
        this.compiler = compiler;
        this.toolchain = toolchain;
    }

    /**
     * Loads, validates and interprets the specification, then performs one dispatch.
     *
     * @return the dispatched command's exit code
     */
    public int run(RunConfiguration configuration, PrintStream out, PrintStream err) {
        var spec = SpecificationLoader.loadFromFile(configuration.specPath());
        var root = interpreter.build(spec);
        var token = new CancellationToken();
        var scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            var thread = new Thread(runnable, "cliforge-timeout");
            thread.setDaemon(true);
            return thread;
        });
        try {
            configuration.timeout().ifPresent(timeout -> scheduler.schedule(() -> {
                LOG.warn("Timeout of {} elapsed, cancelling", timeout);
                token.cancel();
            }, timeout.toMillis(), TimeUnit.MILLISECONDS));
            return PicocliBinding.execute(root, out, err, token, configuration.arguments().toArray(new String[0]));
        } finally {
            scheduler.shutdownNow();
        }
    }

    public GeneratedSource generate(Path specPath) {
        return generate(SpecificationLoader.loadFromFile(specPath));
    }

    public GeneratedSource generate(CliSpecification spec) {
        return compiler.generate(spec);
    }

    /**
     * Generates, compiles and packages {@code outputDirectory/<spec name>.jar}.
     */
    public Path build(Path specPath, Path outputDirectory) {
        var spec = SpecificationLoader.loadFromFile(specPath);
        var source = compiler.generate(spec);
        source.formatError().ifPresent(error -> LOG.warn("Building unformatted source: {}", error));
        return toolchain.build(source, outputDirectory, spec.name());
    }
}
