package com.zzf.coder.core.context;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.zzf.coder.core.tool.ToolCall;
import com.zzf.coder.core.tool.ToolResult;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * One step of the conversation history. Immutable once built; every result
 * belongs to a call of the same Turn and every call has exactly one result.
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Turn {
    private final long seq;
    private final TurnRole role;
    private final String content;
    private final List<ToolCall> calls;
    private final List<ToolResult> results;
    private final long timestamp;
    private final boolean finalAnswer;
    private final Long summarizedFrom;
    private final Long summarizedTo;

    @JsonCreator
    public Turn(@JsonProperty("seq") long seq,
                @JsonProperty("role") TurnRole role,
                @JsonProperty("content") String content,
                @JsonProperty("calls") List<ToolCall> calls,
                @JsonProperty("results") List<ToolResult> results,
                @JsonProperty("timestamp") long timestamp,
                @JsonProperty("finalAnswer") boolean finalAnswer,
                @JsonProperty("summarizedFrom") Long summarizedFrom,
                @JsonProperty("summarizedTo") Long summarizedTo) {
        if (role == null) {
            throw new IllegalArgumentException("turn role is required");
        }
        this.seq = seq;
        this.role = role;
        this.content = content == null ? "" : content;
        this.calls = calls == null ? List.of() : List.copyOf(calls);
        this.results = results == null ? List.of() : List.copyOf(results);
        this.timestamp = timestamp;
        this.finalAnswer = finalAnswer;
        this.summarizedFrom = summarizedFrom;
        this.summarizedTo = summarizedTo;
        checkPairing();
    }

    public static Turn instruction(String text, long timestamp) {
        return new Turn(0, TurnRole.INSTRUCTION, text, null, null, timestamp, false, null, null);
    }

    public static Turn assistant(long seq, String thought, List<ToolCall> calls, List<ToolResult> results, long timestamp) {
        return new Turn(seq, TurnRole.ASSISTANT, thought, calls, results, timestamp, false, null, null);
    }

    public static Turn answer(long seq, String finalAnswer, long timestamp) {
        return new Turn(seq, TurnRole.ASSISTANT, finalAnswer, null, null, timestamp, true, null, null);
    }

    public static Turn summary(long fromSeq, long toSeq, String text, long timestamp) {
        return new Turn(toSeq, TurnRole.SYSTEM_SUMMARY, text, null, null, timestamp, false, fromSeq, toSeq);
    }

    private void checkPairing() {
        Set<String> callIds = new HashSet<>();
        for (ToolCall call : calls) {
            if (!callIds.add(call.getId())) {
                throw new IllegalArgumentException("duplicate tool call id '" + call.getId() + "' in turn " + seq);
            }
        }
        Set<String> answered = new HashSet<>();
        for (ToolResult result : results) {
            if (!callIds.contains(result.getCallId())) {
                throw new IllegalArgumentException("result for unknown call id '" + result.getCallId() + "' in turn " + seq);
            }
            if (!answered.add(result.getCallId())) {
                throw new IllegalArgumentException("more than one result for call id '" + result.getCallId() + "' in turn " + seq);
            }
        }
        if (!results.isEmpty() && answered.size() != callIds.size()) {
            throw new IllegalArgumentException("turn " + seq + " has " + calls.size() + " calls but " + results.size() + " results");
        }
    }
}
