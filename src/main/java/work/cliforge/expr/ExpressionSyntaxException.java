package work.cliforge.expr;

import work.cliforge.shared.CliforgeException;

public final class ExpressionSyntaxException extends CliforgeException {
    public ExpressionSyntaxException(String message) {
        super("expression_syntax", message);
    }
}
