package com.zzf.coder.core.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.coder.config.McpProperties;
import com.zzf.coder.core.tool.ToolRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class McpToolLoaderTest {

    @Test
    void shouldSkipUnreachableServerAndRetryLater() {
        McpProperties properties = new McpProperties();
        McpProperties.Server server = new McpProperties.Server();
        server.setName("broken");
        server.setCommand("does-not-exist");
        properties.getServers().add(server);
        McpClientFactory factory = mock(McpClientFactory.class);
        when(factory.create(any(), any())).thenThrow(new IllegalStateException("spawn failed"));
        ToolRegistry registry = new ToolRegistry();
        McpToolLoader loader = new McpToolLoader(properties, factory, registry, new ObjectMapper());

        assertTrue(loader.ensureRegistered().isEmpty());
        assertFalse(loader.isConnected("broken"));
        assertTrue(registry.names().isEmpty());

        loader.ensureRegistered();
        verify(factory, times(2)).create(any(), any());
    }

    @Test
    void shouldIgnoreServersWithoutName() {
        McpProperties properties = new McpProperties();
        properties.getServers().add(new McpProperties.Server());
        McpClientFactory factory = mock(McpClientFactory.class);
        McpToolLoader loader = new McpToolLoader(properties, factory, new ToolRegistry(), new ObjectMapper());

        assertTrue(loader.ensureRegistered().isEmpty());
        verify(factory, never()).create(any(), any());
    }
}
