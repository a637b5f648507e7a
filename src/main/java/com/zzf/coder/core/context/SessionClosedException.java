package com.zzf.coder.core.context;

public class SessionClosedException extends IllegalStateException {
    public SessionClosedException(String sessionId) {
        super("session " + sessionId + " is terminal; no more turns can be appended");
    }
}
