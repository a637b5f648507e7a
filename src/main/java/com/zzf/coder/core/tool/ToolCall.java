package com.zzf.coder.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class ToolCall {
    String id;
    String tool;
    JsonNode args;
    long turnSeq;

    public static ToolCall of(String id, String tool, JsonNode args, long turnSeq) {
        JsonNode copy = args == null ? JsonNodeFactory.instance.objectNode() : args.deepCopy();
        return new ToolCall(id, tool, copy, turnSeq);
    }
}
