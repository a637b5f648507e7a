package com.zzf.coder.core.tool;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Name to tool map. Registration order is kept for the catalog; re-registering
 * a name replaces the earlier tool.
 */
@Slf4j
public class ToolRegistry {
    private final Map<String, Tool> tools = new LinkedHashMap<>();

    public synchronized Tool register(Tool tool) {
        if (tool == null || tool.getId() == null || tool.getId().isBlank()) {
            throw new IllegalArgumentException("tool id is required");
        }
        Tool previous = tools.put(tool.getId(), tool);
        if (previous != null && previous != tool) {
            log.info("tool.replaced tool={} previous={} next={}", tool.getId(),
                    previous.getClass().getSimpleName(), tool.getClass().getSimpleName());
        } else {
            log.debug("tool.registered tool={}", tool.getId());
        }
        return previous;
    }

    public synchronized Tool unregister(String name) {
        return tools.remove(name);
    }

    public synchronized Tool get(String name) {
        return name == null ? null : tools.get(name);
    }

    public synchronized boolean contains(String name) {
        return name != null && tools.containsKey(name);
    }

    public synchronized List<String> names() {
        return new ArrayList<>(tools.keySet());
    }

    public synchronized List<ToolSpec> catalog() {
        List<ToolSpec> specs = new ArrayList<>(tools.size());
        for (Tool tool : tools.values()) {
            specs.add(ToolSpec.builder()
                    .name(tool.getId())
                    .description(tool.getDescription())
                    .parameters(tool.getSchema().toJsonSchema())
                    .build());
        }
        return specs;
    }
}
