package work.cliforge.compiler;

import work.cliforge.shared.CliforgeException;

/**
 * The Java toolchain rejected generated source or could not package it. {@link #output()} holds
 * the toolchain's diagnostics verbatim.
 */
public final class BuildException extends CliforgeException {
    private final String output;

    public BuildException(String message, String output) {
        super("build_error", output == null || output.isBlank() ? message : message + ":\n" + output.strip());
        this.output = output == null ? "" : output;
    }

    public BuildException(String message, Throwable cause) {
        super("build_error", message, cause);
        this.output = "";
    }

    public String output() {
        return output;
    }
}
