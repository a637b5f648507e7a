package com.zzf.coder.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "coder.tools")
public class ToolProperties {
    /** When non-empty only these tools may be dispatched. */
    private List<String> allow = new ArrayList<>();
    private List<String> deny = new ArrayList<>();
    private int maxArgsChars = 12_000;
    private int maxResultChars = 16_000;
    private Bash bash = new Bash();
    private Grep grep = new Grep();

    @Data
    public static class Bash {
        /** Empty means the user's login shell, falling back to bash or sh. */
        private String shell = "";
        private int outputLimitChars = 8_000;
        private long defaultTimeoutMs = 60_000L;
        private boolean failOnNonZeroExit = true;
    }

    @Data
    public static class Grep {
        private int maxResults = 100;
    }
}
