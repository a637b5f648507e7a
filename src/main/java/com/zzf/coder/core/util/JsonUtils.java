package com.zzf.coder.core.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class JsonUtils {
    private static final Pattern FENCED_JSON = Pattern.compile("(?s)```(?:json|JSON)?\\s*(\\{.*?\\})\\s*```");

    private JsonUtils() {}

    /**
     * Pulls the first JSON object out of a model reply: a fenced block wins,
     * otherwise the first balanced {...} in the text.
     */
    public static String extractFirstJsonObject(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("reply is null");
        }
        Matcher fenced = FENCED_JSON.matcher(raw);
        if (fenced.find()) {
            return fenced.group(1).trim();
        }
        String cleaned = raw.replace("```json", "").replace("```JSON", "").replace("```", "").trim();
        int start = cleaned.indexOf('{');
        if (start < 0) {
            throw new IllegalArgumentException("no json object found");
        }
        return balancedJsonObject(cleaned, start);
    }

    private static String balancedJsonObject(String text, int startIndex) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = startIndex; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (ch == '\\') {
                    escaped = true;
                } else if (ch == '"') {
                    inString = false;
                }
                continue;
            }
            if (ch == '"') {
                inString = true;
            } else if (ch == '{') {
                depth++;
            } else if (ch == '}') {
                depth--;
                if (depth == 0) {
                    return text.substring(startIndex, i + 1);
                }
            }
        }
        throw new IllegalArgumentException("unterminated json");
    }

    public static String text(JsonNode args, String key, String fallback) {
        if (args == null) {
            return fallback;
        }
        JsonNode node = args.path(key);
        if (node.isMissingNode() || node.isNull()) {
            return fallback;
        }
        return node.asText(fallback);
    }

    public static Integer intOrNull(JsonNode args, String key) {
        if (args == null) {
            return null;
        }
        JsonNode node = args.path(key);
        return node.isNumber() ? node.asInt() : null;
    }

    public static Long longOrNull(JsonNode args, String key) {
        if (args == null) {
            return null;
        }
        JsonNode node = args.path(key);
        return node.isNumber() ? node.asLong() : null;
    }
}
