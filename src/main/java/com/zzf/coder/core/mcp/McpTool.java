package com.zzf.coder.core.mcp;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.coder.core.tool.Tool;
import com.zzf.coder.core.tool.ToolExecutionException;
import com.zzf.coder.core.tool.ToolSchema;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpSchema;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A tool published by an MCP server, registered as {@code <server>__<tool>}.
 */
public class McpTool implements Tool {
    private static final TypeReference<Map<String, Object>> ARGS_TYPE = new TypeReference<>() {};

    private final String serverName;
    private final String toolName;
    private final String description;
    private final ToolSchema schema;
    private final McpSyncClient client;
    private final ObjectMapper mapper;

    public McpTool(String serverName, String toolName, String description, JsonNode inputSchema,
                   McpSyncClient client, ObjectMapper mapper) {
        this.serverName = serverName;
        this.toolName = toolName;
        this.description = description == null || description.isBlank()
                ? "Tool '" + toolName + "' of MCP server '" + serverName + "'"
                : description;
        this.schema = ToolSchema.fromJsonSchema(inputSchema);
        this.client = client;
        this.mapper = mapper;
    }

    public static String qualifiedName(String serverName, String toolName) {
        return sanitize(serverName) + "__" + sanitize(toolName);
    }

    private static String sanitize(String name) {
        return name == null ? "" : name.trim().replaceAll("[^A-Za-z0-9_\\-]", "_");
    }

    public String getServerName() {
        return serverName;
    }

    public String getToolName() {
        return toolName;
    }

    @Override
    public String getId() {
        return qualifiedName(serverName, toolName);
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public ToolSchema getSchema() {
        return schema;
    }

    @Override
    public CompletableFuture<Result> execute(JsonNode args, Context ctx) {
        return ctx.async(() -> {
            Map<String, Object> arguments = mapper.convertValue(args, ARGS_TYPE);
            McpSchema.CallToolResult result = client.callTool(new McpSchema.CallToolRequest(toolName, arguments));
            String text = flatten(result.content());
            if (Boolean.TRUE.equals(result.isError())) {
                throw new ToolExecutionException(text.isBlank() ? "MCP tool '" + toolName + "' reported an error" : text);
            }
            return Result.builder()
                    .title(getId())
                    .output(text)
                    .metadata(Map.of("server", serverName, "tool", toolName))
                    .build();
        });
    }

    static String flatten(List<McpSchema.Content> content) {
        if (content == null || content.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (McpSchema.Content part : content) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            if (part instanceof McpSchema.TextContent) {
                sb.append(((McpSchema.TextContent) part).text());
            } else {
                sb.append('[').append(part.type()).append(" content omitted]");
            }
        }
        return sb.toString();
    }
}
