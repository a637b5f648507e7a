package com.zzf.coder.core.tool;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads tool descriptions from {@code classpath:prompts/tool/<id>.txt}.
 */
@Slf4j
final class ToolDescriptions {
    private static final Map<String, String> CACHE = new ConcurrentHashMap<>();

    private ToolDescriptions() {
    }

    static String load(String toolId, String fallback) {
        return CACHE.computeIfAbsent(toolId, id -> read(id, fallback));
    }

    private static String read(String toolId, String fallback) {
        ClassPathResource resource = new ClassPathResource("prompts/tool/" + toolId + ".txt");
        if (!resource.exists()) {
            return fallback;
        }
        try (InputStream in = resource.getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            log.error("Failed to load {} tool description", toolId, e);
            return fallback;
        }
    }
}
