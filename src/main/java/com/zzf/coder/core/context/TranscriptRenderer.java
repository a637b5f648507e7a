package com.zzf.coder.core.context;

import com.zzf.coder.core.tool.ToolCall;
import com.zzf.coder.core.tool.ToolResult;

import java.util.List;

/**
 * Plain-text rendering of Turns, shared by prompts, summaries and token estimates.
 */
public final class TranscriptRenderer {
    private TranscriptRenderer() {
    }

    public static String render(List<Turn> turns) {
        StringBuilder sb = new StringBuilder();
        for (Turn turn : turns) {
            if (sb.length() > 0) {
                sb.append("\n\n");
            }
            sb.append(render(turn));
        }
        return sb.toString();
    }

    public static String render(Turn turn) {
        StringBuilder sb = new StringBuilder();
        switch (turn.getRole()) {
            case INSTRUCTION:
                sb.append("### Turn ").append(turn.getSeq()).append(" (user instruction)\n").append(turn.getContent());
                break;
            case SYSTEM_SUMMARY:
                sb.append("### Summary of turns ").append(turn.getSummarizedFrom()).append('-').append(turn.getSummarizedTo())
                        .append('\n').append(turn.getContent());
                break;
            default:
                if (turn.isFinalAnswer()) {
                    sb.append("### Turn ").append(turn.getSeq()).append(" (final answer)\n").append(turn.getContent());
                    break;
                }
                sb.append("### Turn ").append(turn.getSeq()).append(" (assistant)");
                if (!turn.getContent().isBlank()) {
                    sb.append("\nThought: ").append(turn.getContent());
                }
                for (ToolCall call : turn.getCalls()) {
                    sb.append("\nCall [").append(call.getId()).append("] ").append(call.getTool())
                            .append(' ').append(call.getArgs());
                    ToolResult result = resultFor(turn, call.getId());
                    if (result != null) {
                        sb.append("\nResult [").append(call.getId()).append("] ")
                                .append(result.isSuccess() ? "ok" : "failed").append(":\n").append(result.render());
                    }
                }
        }
        return sb.toString();
    }

    private static ToolResult resultFor(Turn turn, String callId) {
        for (ToolResult result : turn.getResults()) {
            if (result.getCallId().equals(callId)) {
                return result;
            }
        }
        return null;
    }
}
