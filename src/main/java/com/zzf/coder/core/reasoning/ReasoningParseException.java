package com.zzf.coder.core.reasoning;

public class ReasoningParseException extends RuntimeException {
    public ReasoningParseException(String message) {
        super(message);
    }

    public ReasoningParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
