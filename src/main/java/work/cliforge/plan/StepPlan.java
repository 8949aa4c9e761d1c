package work.cliforge.plan;

import java.util.Optional;
import work.cliforge.expr.Expression;

public record StepPlan(String name, String method, Expression url, Optional<Expression> headers, Optional<Expression> body) {}
