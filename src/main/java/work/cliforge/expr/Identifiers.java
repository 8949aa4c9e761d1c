package work.cliforge.expr;

/**
 * Java identifiers derived from specification names. Word boundaries are any non-alphanumeric
 * character, so {@code my-flag}, {@code my_flag} and {@code my.flag} all become {@code MyFlag}.
 */
public final class Identifiers {
    private Identifiers() {}

    public static String toCamelCase(String name) {
        var result = new StringBuilder();
        for (String part : name.split("[^A-Za-z0-9]+")) {
            if (!part.isEmpty()) {
                result.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
            }
        }
        return result.toString();
    }

    public static String flagVariable(String flagName) {
        return "flag" + toCamelCase(flagName);
    }

    public static String stepVariable(String stepName) {
        return "step" + toCamelCase(stepName) + "Result";
    }
}
