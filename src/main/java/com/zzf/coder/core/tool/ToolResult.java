package com.zzf.coder.core.tool;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Outcome of exactly one {@link ToolCall}. Failures are data, never exceptions.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolResult {
    String callId;
    String tool;
    boolean success;
    ToolErrorType errorType;
    String output;
    String error;
    long durationMs;
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    Map<String, Object> metadata;

    public static ToolResult success(ToolCall call, String output, Map<String, Object> metadata, long durationMs) {
        return ToolResult.builder()
                .callId(call.getId())
                .tool(call.getTool())
                .success(true)
                .output(output == null ? "" : output)
                .metadata(metadata == null ? Map.of() : metadata)
                .durationMs(durationMs)
                .build();
    }

    public static ToolResult failure(ToolCall call, ToolErrorType type, String error, long durationMs) {
        return failure(call, type, error, null, durationMs);
    }

    public static ToolResult failure(ToolCall call, ToolErrorType type, String error, String output, long durationMs) {
        return ToolResult.builder()
                .callId(call.getId())
                .tool(call.getTool())
                .success(false)
                .errorType(type)
                .error(error)
                .output(output)
                .metadata(Map.of())
                .durationMs(durationMs)
                .build();
    }

    /** Text the model sees for this result. */
    @JsonIgnore
    public String render() {
        if (success) {
            return output == null ? "" : output;
        }
        StringBuilder sb = new StringBuilder("ERROR [").append(errorType).append("]: ").append(error);
        if (output != null && !output.isEmpty()) {
            sb.append('\n').append(output);
        }
        return sb.toString();
    }

    public ToolResult withOutput(String newOutput) {
        return toBuilder().output(newOutput).build();
    }
}
