package com.zzf.coder.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolRegistryTest {

    @Test
    void shouldReplaceToolRegisteredUnderSameName() {
        ToolRegistry registry = new ToolRegistry();
        Tool first = new NamedTool("echo", "first");
        Tool second = new NamedTool("echo", "second");

        assertNull(registry.register(first));
        assertSame(first, registry.register(second));

        assertSame(second, registry.get("echo"));
        assertEquals(List.of("echo"), registry.names());
        assertEquals("second", registry.catalog().get(0).getDescription());
    }

    @Test
    void shouldKeepRegistrationOrderInCatalog() {
        ToolRegistry registry = new ToolRegistry();
        registry.register(new NamedTool("b", "b"));
        registry.register(new NamedTool("a", "a"));

        List<ToolSpec> catalog = registry.catalog();

        assertEquals("b", catalog.get(0).getName());
        assertEquals("a", catalog.get(1).getName());
        assertEquals("object", catalog.get(0).getParameters().path("type").asText());
    }

    @Test
    void shouldUnregisterAndRejectBlankIds() {
        ToolRegistry registry = new ToolRegistry();
        registry.register(new NamedTool("x", "x"));

        assertTrue(registry.contains("x"));
        registry.unregister("x");
        assertFalse(registry.contains("x"));
        assertNull(registry.get(null));
        assertThrows(IllegalArgumentException.class, () -> registry.register(new NamedTool(" ", "blank")));
    }

    private static final class NamedTool implements Tool {
        private final String id;
        private final String description;

        NamedTool(String id, String description) {
            this.id = id;
            this.description = description;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public String getDescription() {
            return description;
        }

        @Override
        public ToolSchema getSchema() {
            return ToolSchema.builder().build();
        }

        @Override
        public CompletableFuture<Result> execute(JsonNode args, Context ctx) {
            return CompletableFuture.completedFuture(Result.builder().output(id).build());
        }
    }
}
