package com.zzf.coder.core.reasoning;

import com.zzf.coder.core.context.ContextWindow;
import com.zzf.coder.core.plan.PlanSnapshot;
import com.zzf.coder.core.tool.ToolSpec;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

@Value
@Builder
public class ReasoningRequest {
    String sessionId;
    Path projectRoot;
    int cycle;
    /** 1 for the first call of a cycle, 2 after a malformed reply. */
    int attempt;
    ContextWindow window;
    PlanSnapshot plan;
    List<ToolSpec> tools;
    /** Correction hint after a malformed reply; null otherwise. */
    String correction;
    /** Warnings from the previous cycle, e.g. plan updates naming unknown items. */
    @Builder.Default
    List<String> notes = List.of();
}
