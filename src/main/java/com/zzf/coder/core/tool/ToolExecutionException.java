package com.zzf.coder.core.tool;

/**
 * Raised by a tool for an expected failure. The message is shown to the model
 * verbatim; {@code output} carries whatever the tool produced before failing.
 */
public class ToolExecutionException extends RuntimeException {
    private final String output;

    public ToolExecutionException(String message) {
        this(message, null);
    }

    public ToolExecutionException(String message, String output) {
        super(message);
        this.output = output;
    }

    public String getOutput() {
        return output;
    }
}
