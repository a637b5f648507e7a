package com.zzf.coder.core.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.coder.config.McpProperties;
import com.zzf.coder.core.tool.ToolRegistry;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Connects to the configured MCP servers on first use and registers their tools.
 * A server that cannot be reached is logged and skipped; it is tried again at the next session start.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class McpToolLoader {

    private final McpProperties properties;
    private final McpClientFactory clientFactory;
    private final ToolRegistry registry;
    private final ObjectMapper objectMapper;

    private final Map<String, McpSyncClient> clients = new ConcurrentHashMap<>();

    public synchronized List<String> ensureRegistered() {
        List<String> registered = new ArrayList<>();
        for (McpProperties.Server server : properties.getServers()) {
            String name = server.getName();
            if (name == null || name.isBlank()) {
                log.warn("mcp.skip reason=missing_name command={} url={}", server.getCommand(), server.getUrl());
                continue;
            }
            if (clients.containsKey(name)) {
                continue;
            }
            McpSyncClient client = null;
            try {
                client = clientFactory.create(server, Duration.ofSeconds(properties.getRequestTimeoutSeconds()));
                client.initialize();
                McpSchema.ListToolsResult tools = client.listTools();
                for (McpSchema.Tool tool : tools.tools()) {
                    JsonNode schema = objectMapper.valueToTree(tool.inputSchema());
                    McpTool mcpTool = new McpTool(name, tool.name(), tool.description(), schema, client, objectMapper);
                    registry.register(mcpTool);
                    registered.add(mcpTool.getId());
                }
                clients.put(name, client);
                log.info("mcp.connected server={} tools={}", name, tools.tools().size());
            } catch (RuntimeException e) {
                log.warn("mcp.unavailable server={} err={}", name, e.toString());
                if (client != null) {
                    closeQuietly(name, client);
                }
            }
        }
        return registered;
    }

    public boolean isConnected(String serverName) {
        return clients.containsKey(serverName);
    }

    @PreDestroy
    public void close() {
        clients.forEach(this::closeQuietly);
        clients.clear();
    }

    private void closeQuietly(String name, McpSyncClient client) {
        try {
            client.closeGracefully();
        } catch (RuntimeException e) {
            log.debug("mcp.close.failed server={} err={}", name, e.toString());
        }
    }
}
