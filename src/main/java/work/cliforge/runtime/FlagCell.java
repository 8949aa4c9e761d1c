package work.cliforge.runtime;

import java.util.Objects;
import java.util.function.Function;
import work.cliforge.spec.FlagDefinition;

/**
 * Live storage for one flag. Bound at most once per dispatch; unbound cells fall back to the
 * environment variable (when named, set and non-empty) and then to the declared default.
 */
public final class FlagCell {
    private final FlagDefinition definition;
    private final String effectiveDefault;
    private String value;
    private boolean supplied;

    public FlagCell(FlagDefinition definition, Function<String, String> environment) {
        this.definition = Objects.requireNonNull(definition, "definition");
        this.effectiveDefault = definition.env()
            .map(environment)
            .filter(envValue -> !envValue.isEmpty())
            .orElse(definition.defaultValue());
    }

    public FlagDefinition definition() {
        return definition;
    }

    public String name() {
        return definition.name();
    }

    public String effectiveDefault() {
        return effectiveDefault;
    }

    public void bind(String value) {
        this.value = value;
        this.supplied = true;
    }

    public boolean supplied() {
        return supplied;
    }

    public String value() {
        return supplied ? value : effectiveDefault;
    }

    public void reset() {
        this.value = null;
        this.supplied = false;
    }
}
