package com.zzf.coder.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * External MCP servers whose tools are registered at session start.
 * A server is either stdio ({@code command} + {@code args}) or streamable HTTP ({@code url}).
 */
@Data
@ConfigurationProperties(prefix = "coder.mcp")
public class McpProperties {
    private int requestTimeoutSeconds = 30;
    private List<Server> servers = new ArrayList<>();

    @Data
    public static class Server {
        private String name;
        private String command;
        private List<String> args = new ArrayList<>();
        private Map<String, String> env = new LinkedHashMap<>();
        private String url;
        private String bearerToken;

        public boolean isHttp() {
            return url != null && !url.isBlank();
        }
    }
}
