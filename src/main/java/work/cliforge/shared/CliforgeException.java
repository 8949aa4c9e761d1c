package work.cliforge.shared;

/**
 * Base type for cliforge failures. Carries a stable error code next to the human readable message.
 */
public class CliforgeException extends RuntimeException {
    private final String code;

    public CliforgeException(String code, String message) {
        super(message);
        this.code = code;
    }

    public CliforgeException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
