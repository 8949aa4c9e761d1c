package work.cliforge.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.cliforge.plan.ActionPlanner;
import work.cliforge.plan.ActionScope;
import work.cliforge.plan.CommandShape;
import work.cliforge.spec.CliSpecification;
import work.cliforge.spec.CommandDefinition;
import work.cliforge.spec.FlagDefinition;
import work.cliforge.spec.SpecificationValidator;

/**
 * Builds a live command tree straight from a specification. Every leaf is planned and its
 * references checked while building, so a bad specification fails before anything runs.
 */
public final class InterpretingBackend {
    private static final Logger LOG = LoggerFactory.getLogger(InterpretingBackend.class);

    private final StepTransport transport;
    private final Function<String, String> environment;

    public InterpretingBackend(StepTransport transport, Function<String, String> environment) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    public static InterpretingBackend withDefaults() {
        return new InterpretingBackend(new JdkHttpTransport(), System::getenv);
    }

    public CommandNode build(CliSpecification spec) {
        SpecificationValidator.requireValid(spec);
        var globals = cells(spec.flags());
        var children = new ArrayList<CommandNode>();
        for (var command : spec.commands()) {
            children.add(buildCommand(spec, command, command.name(), globals));
        }
        LOG.debug("Built command tree for {}", spec.name());
        return new CommandNode(spec.name(), spec.description(), spec.name(), Optional.empty(), globals, children, Optional.empty());
    }

    private CommandNode buildCommand(CliSpecification spec, CommandDefinition command, String path, List<FlagCell> globals) {
        var shape = CommandShape.of(command);
        var locals = cells(command.flags());
        var children = new ArrayList<CommandNode>();
        for (var child : command.commands()) {
            children.add(buildCommand(spec, child, path + " " + child.name(), globals));
        }
        if (!command.isLeaf()) {
            return new CommandNode(shape.name(), shape.description(), shape.usage(), Optional.empty(), locals, children, Optional.empty());
        }

        var plan = ActionPlanner.plan(spec.flags(), command, path);
        ActionScope.verify(plan);
        var executor = new ActionExecutor(plan, transport);
        var visible = new ArrayList<FlagCell>(globals);
        visible.addAll(locals);
        RunHandler handler = (args, context) -> {
            var flags = new LinkedHashMap<String, String>();
            for (var cell : visible) {
                flags.put(cell.name(), cell.value());
            }
            executor.execute(flags, args, context);
        };
        return new CommandNode(shape.name(), shape.description(), shape.usage(), Optional.of(shape.arity()), locals, children, Optional.of(handler));
    }

    private List<FlagCell> cells(List<FlagDefinition> flags) {
        var cells = new ArrayList<FlagCell>(flags.size());
        for (var flag : flags) {
            cells.add(new FlagCell(flag, environment));
        }
        return cells;
    }
}
