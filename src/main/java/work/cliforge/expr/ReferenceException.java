package work.cliforge.expr;

import work.cliforge.shared.CliforgeException;

/**
 * A flag, arg or step name that is not in scope where it is referenced.
 */
public final class ReferenceException extends CliforgeException {
    private final Namespace kind;
    private final String name;

    private ReferenceException(Namespace kind, String name, String message) {
        super("reference_error", message);
        this.kind = kind;
        this.name = name;
    }

    public static ReferenceException unknown(Namespace kind, String name) {
        return new ReferenceException(kind, name, "unknown " + kind.label() + " \"" + name + "\"");
    }

    public static ReferenceException unknownFlag(String name) {
        return unknown(Namespace.FLAG, name);
    }

    public static ReferenceException unknownArg(String name) {
        return unknown(Namespace.ARG, name);
    }

    public static ReferenceException unknownStep(String name) {
        return unknown(Namespace.STEP, name);
    }

    /**
     * Same kind and name, message prefixed with where the reference was found.
     */
    public ReferenceException withContext(String context) {
        return new ReferenceException(kind, name, context + ": " + getMessage());
    }

    public Namespace kind() {
        return kind;
    }

    public String name() {
        return name;
    }
}
