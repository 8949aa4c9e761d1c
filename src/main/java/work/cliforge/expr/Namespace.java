package work.cliforge.expr;

import java.util.Locale;

/**
 * The three scopes a reference can point into.
 */
public enum Namespace {
    FLAG,
    ARG,
    STEP;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
