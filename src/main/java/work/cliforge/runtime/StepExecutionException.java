package work.cliforge.runtime;

import work.cliforge.shared.CliforgeException;

/**
 * A step's transport failure, non-2xx response or cancellation. Carries the step's name.
 */
public final class StepExecutionException extends CliforgeException {
    private final String step;

    public StepExecutionException(String step, String detail) {
        super("step_failed", message(step, detail));
        this.step = step;
    }

    public StepExecutionException(String step, Throwable cause) {
        super("step_failed", message(step, describe(cause)), cause);
        this.step = step;
    }

    public String step() {
        return step;
    }

    private static String message(String step, String detail) {
        return "step \"" + step + "\" failed: " + detail;
    }

    private static String describe(Throwable cause) {
        var message = cause.getMessage();
        return message == null || message.isBlank() ? cause.toString() : message;
    }
}
