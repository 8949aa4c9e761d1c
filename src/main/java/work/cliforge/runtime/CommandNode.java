package work.cliforge.runtime;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.cliforge.plan.ArityPolicy;

/**
 * One node of the live command tree. The root's flags are the global flags; every other node
 * holds only its own local flags. Leaves carry an arity policy and a run handler.
 */
public record CommandNode(
    String name,
    String description,
    String usage,
    Optional<ArityPolicy> arity,
    List<FlagCell> flags,
    List<CommandNode> children,
    Optional<RunHandler> handler
) {
    public CommandNode {
        Objects.requireNonNull(name, "name");
        flags = List.copyOf(flags);
        children = List.copyOf(children);
    }

    public boolean isLeaf() {
        return handler.isPresent();
    }

    public Optional<CommandNode> child(String name) {
        return children.stream().filter(child -> child.name().equals(name)).findFirst();
    }
}
