package com.zzf.coder.core.reasoning;

import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.coder.core.plan.PlanItem;
import com.zzf.coder.core.plan.PlanStatus;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A parsed model reply: either a final answer or one or more tool calls,
 * optionally carrying plan changes.
 */
@Value
@Builder
public class ReasoningReply {

    public enum Type {
        FINAL,
        TOOL_CALLS
    }

    Type type;
    String thought;
    String finalAnswer;
    @Builder.Default
    List<RequestedCall> calls = List.of();
    /** Full plan restatement; null when the reply does not restate the plan. */
    List<PlanItem> plan;
    @Builder.Default
    List<PlanUpdate> planUpdates = List.of();
    /** Problems found in optional parts of the reply; they never make the reply malformed. */
    @Builder.Default
    List<String> warnings = List.of();

    public boolean isFinal() {
        return type == Type.FINAL;
    }

    /** Call as the model wrote it; {@code id} may be missing or repeated. */
    @Value
    public static class RequestedCall {
        String id;
        String tool;
        JsonNode args;
    }

    @Value
    public static class PlanUpdate {
        String id;
        PlanStatus status;
    }
}
