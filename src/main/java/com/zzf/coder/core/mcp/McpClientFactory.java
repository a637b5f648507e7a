package com.zzf.coder.core.mcp;

import com.zzf.coder.config.McpProperties;
import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.HttpClientStreamableHttpTransport;
import io.modelcontextprotocol.client.transport.ServerParameters;
import io.modelcontextprotocol.client.transport.StdioClientTransport;
import io.modelcontextprotocol.spec.McpClientTransport;
import io.modelcontextprotocol.spec.McpSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Builds synchronous MCP clients for configured servers: stdio when a command is given,
 * streamable HTTP when a URL is given.
 */
@Slf4j
@Component
public class McpClientFactory {

    public McpSyncClient create(McpProperties.Server server, Duration requestTimeout) {
        return McpClient.sync(transport(server))
                .loggingConsumer(notification -> log.debug("mcp.log server={} level={} data={}",
                        server.getName(), notification.level(), notification.data()))
                .capabilities(McpSchema.ClientCapabilities.builder().build())
                .requestTimeout(requestTimeout)
                .build();
    }

    McpClientTransport transport(McpProperties.Server server) {
        if (server.isHttp()) {
            HttpClientStreamableHttpTransport.Builder builder = HttpClientStreamableHttpTransport.builder(server.getUrl());
            String bearerToken = server.getBearerToken();
            if (bearerToken != null && !bearerToken.isBlank()) {
                String token = bearerToken.startsWith("Bearer ") ? bearerToken : "Bearer " + bearerToken;
                builder.customizeRequest(request -> request.header("Authorization", token));
            }
            return builder.build();
        }
        if (server.getCommand() == null || server.getCommand().isBlank()) {
            throw new IllegalArgumentException("MCP server '" + server.getName() + "' needs either a command or a url");
        }
        ServerParameters params = ServerParameters.builder(server.getCommand())
                .args(server.getArgs())
                .env(server.getEnv())
                .build();
        return new StdioClientTransport(params);
    }
}
