package work.cliforge.plan;

import java.util.List;
import java.util.Optional;
import work.cliforge.spec.ArgDefinition;

/**
 * Positional argument count check. With R required out of T declared args: exactly R when R == T,
 * otherwise at least R with no upper bound.
 */
public record ArityPolicy(int required, int total) {
    public ArityPolicy {
        if (required < 0 || total < required) {
            throw new IllegalArgumentException("Invalid arity: " + required + " required of " + total);
        }
    }

    public static ArityPolicy of(List<ArgDefinition> args) {
        int required = (int) args.stream().filter(ArgDefinition::required).count();
        return new ArityPolicy(required, args.size());
    }

    public boolean exact() {
        return required == total;
    }

    /**
     * Returns the violation message, or empty when {@code count} positional arguments are acceptable.
     */
    public Optional<String> check(int count) {
        if (exact() && count != required) {
            return Optional.of(exactMessage(required, count));
        }
        if (!exact() && count < required) {
            return Optional.of(minimumMessage(required, count));
        }
        return Optional.empty();
    }

    public static String exactMessage(int expected, int received) {
        return String.format("accepts %d arg(s), received %d", expected, received);
    }

    public static String minimumMessage(int expected, int received) {
        return String.format("requires at least %d arg(s), only received %d", expected, received);
    }
}
