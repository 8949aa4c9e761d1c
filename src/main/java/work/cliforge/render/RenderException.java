package work.cliforge.render;

import work.cliforge.shared.CliforgeException;

/**
 * The resolved data does not fit the requested output format, or the format itself is unknown.
 */
public final class RenderException extends CliforgeException {
    public RenderException(String message) {
        super("render_error", message);
    }

    public RenderException(String message, Throwable cause) {
        super("render_error", message, cause);
    }
}
