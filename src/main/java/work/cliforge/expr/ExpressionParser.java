package work.cliforge.expr;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parses the string form used in specification files: {@code ${flag.x}}, {@code ${arg.x}},
 * {@code ${step.x.a.b}} and {@code ${jsonencode(...)}} interpolations inside literal text.
 * {@code $${} produces a literal {@code ${}.
 */
public final class ExpressionParser {
    private static final Pattern SEGMENT = Pattern.compile("[A-Za-z0-9_-]+");
    private static final String JSON_ENCODE = "jsonencode(";

    private ExpressionParser() {}

    public static Expression parse(String text) {
        var parts = new ArrayList<Expression>();
        var fragment = new StringBuilder();
        boolean interpolated = false;
        int i = 0;
        while (i < text.length()) {
            if (text.startsWith("$${", i)) {
                fragment.append("${");
                i += 3;
                continue;
            }
            if (text.startsWith("${", i)) {
                int close = text.indexOf('}', i + 2);
                if (close < 0) {
                    throw new ExpressionSyntaxException("unterminated interpolation in \"" + text + "\"");
                }
                if (fragment.length() > 0) {
                    parts.add(Expression.literal(fragment.toString()));
                    fragment.setLength(0);
                }
                parts.add(parseInterpolation(text.substring(i + 2, close).trim(), text));
                interpolated = true;
                i = close + 1;
                continue;
            }
            fragment.append(text.charAt(i));
            i++;
        }
        if (!interpolated) {
            return Expression.literal(fragment.toString());
        }
        if (fragment.length() > 0) {
            parts.add(Expression.literal(fragment.toString()));
        }
        return new Template(parts);
    }

    private static Expression parseInterpolation(String inner, String source) {
        if (inner.startsWith(JSON_ENCODE) && inner.endsWith(")")) {
            var argument = inner.substring(JSON_ENCODE.length(), inner.length() - 1).trim();
            return new JsonEncode(parseInterpolation(argument, source));
        }
        var segments = Arrays.asList(inner.split("\\.", -1));
        for (String segment : segments) {
            if (!SEGMENT.matcher(segment).matches()) {
                throw new ExpressionSyntaxException("invalid reference \"" + inner + "\" in \"" + source + "\"");
            }
        }
        if (segments.size() < 2) {
            throw new ExpressionSyntaxException("reference \"" + inner + "\" needs a namespace and a name");
        }
        String name = segments.get(1);
        List<String> path = segments.subList(2, segments.size());
        switch (segments.get(0)) {
            case "flag":
                requireNoPath(Namespace.FLAG, inner, path);
                return Expression.flag(name);
            case "arg":
                requireNoPath(Namespace.ARG, inner, path);
                return Expression.arg(name);
            case "step":
                return new NamespaceReference(Namespace.STEP, name, path);
            default:
                throw new ExpressionSyntaxException(
                    "unsupported variable root \"" + segments.get(0) + "\" (expected flag, arg, or step)"
                );
        }
    }

    private static void requireNoPath(Namespace namespace, String inner, List<String> path) {
        if (!path.isEmpty()) {
            throw new ExpressionSyntaxException(namespace.label() + " references take no path: \"" + inner + "\"");
        }
    }
}
