package com.zzf.coder.session;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Per-session overrides; null fields fall back to {@code coder.agent.*}.
 */
@Value
@Builder
@Jacksonized
public class SessionOptions {
    Integer maxCycles;
    Long toolTimeoutMs;
    Integer contextBudgetTokens;

    public static SessionOptions defaults() {
        return SessionOptions.builder().build();
    }
}
