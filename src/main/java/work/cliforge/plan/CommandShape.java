package work.cliforge.plan;

import java.util.StringJoiner;
import work.cliforge.spec.ArgDefinition;
import work.cliforge.spec.CommandDefinition;

/**
 * Structural facts both backends derive identically for a command: usage line and arity.
 * Groups carry no arity check.
 */
public record CommandShape(String name, String description, String usage, ArityPolicy arity, boolean leaf) {
    public static CommandShape of(CommandDefinition command) {
        var usage = new StringJoiner(" ");
        usage.add(command.name());
        for (ArgDefinition arg : command.args()) {
            usage.add(arg.required() ? "<" + arg.name() + ">" : "[" + arg.name() + "]");
        }
        return new CommandShape(
            command.name(),
            command.description(),
            usage.toString(),
            ArityPolicy.of(command.args()),
            command.isLeaf()
        );
    }
}
