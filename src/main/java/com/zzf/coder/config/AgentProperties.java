package com.zzf.coder.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Agent loop settings. Every value can be overridden per session through
 * {@link com.zzf.coder.session.SessionOptions}.
 */
@Data
@ConfigurationProperties(prefix = "coder.agent")
public class AgentProperties {
    /** Hard ceiling on reasoning cycles before the session fails with BUDGET_EXCEEDED. */
    private int maxCycles = 50;
    /** Malformed replies accepted within one cycle; reaching it fails the session. */
    private int reasoningParseAttempts = 2;
    private int providerRetries = 2;
    private long providerRetryInitialDelayMs = 2000L;
    private long toolTimeoutMs = 120_000L;
    private Context context = new Context();
    private Checkpoint checkpoint = new Checkpoint();

    @Data
    public static class Context {
        private int budgetTokens = 24_000;
        private int minRecentTurns = 2;
        private int summaryReserveTokens = 1_500;
        private int summaryInputChars = 48_000;
        private int summaryBatchTurns = 4;
    }

    @Data
    public static class Checkpoint {
        private boolean enabled = false;
        private String directory = ".coder-agent/sessions";
    }
}
