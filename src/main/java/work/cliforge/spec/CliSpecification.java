package work.cliforge.spec;

import java.util.List;
import java.util.Objects;

/**
 * Root of a parsed CLI specification. Flag names form one namespace across the whole tree.
 */
public record CliSpecification(
    String name,
    String description,
    List<FlagDefinition> flags,
    List<CommandDefinition> commands
) {
    public CliSpecification {
        Objects.requireNonNull(name, "name");
        description = description == null ? "" : description;
        flags = flags == null ? List.of() : List.copyOf(flags);
        commands = commands == null ? List.of() : List.copyOf(commands);
    }
}
