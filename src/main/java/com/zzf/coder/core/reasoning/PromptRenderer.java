package com.zzf.coder.core.reasoning;

import com.zzf.coder.core.context.ContextWindow;
import com.zzf.coder.core.context.TranscriptRenderer;
import com.zzf.coder.core.tool.ToolSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Renders {@link ReasoningRequest}s into the text prompt of {@code prompts/coder_agent.txt}.
 */
@Slf4j
public final class PromptRenderer {
    static final String AGENT_TEMPLATE = "prompts/coder_agent.txt";
    static final String SUMMARY_TEMPLATE = "prompts/summarize.txt";

    private final String agentTemplate;
    private final String summaryTemplate;

    public PromptRenderer() {
        this(load(AGENT_TEMPLATE), load(SUMMARY_TEMPLATE));
    }

    PromptRenderer(String agentTemplate, String summaryTemplate) {
        this.agentTemplate = agentTemplate;
        this.summaryTemplate = summaryTemplate;
    }

    public String render(ReasoningRequest request) {
        return agentTemplate
                .replace("${projectRoot}", String.valueOf(request.getProjectRoot()))
                .replace("${tools}", renderTools(request.getTools()))
                .replace("${plan}", request.getPlan() == null ? "(no plan yet)" : request.getPlan().render())
                .replace("${notes}", renderNotes(request.getNotes()))
                .replace("${history}", renderHistory(request.getWindow()))
                .replace("${correction}", request.getCorrection() == null ? "" : "\n" + request.getCorrection());
    }

    public String renderSummary(String transcript) {
        return summaryTemplate.replace("${transcript}", transcript);
    }

    static String renderTools(List<ToolSpec> tools) {
        if (tools == null || tools.isEmpty()) {
            return "(no tools)";
        }
        StringBuilder sb = new StringBuilder();
        for (ToolSpec spec : tools) {
            sb.append("- ").append(spec.getName()).append(": ").append(spec.getDescription())
                    .append("\n  parameters: ").append(spec.getParameters()).append('\n');
        }
        return sb.toString().trim();
    }

    private static String renderNotes(List<String> notes) {
        if (notes == null || notes.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("\n## Warnings from the previous step\n");
        notes.forEach(n -> sb.append("- ").append(n).append('\n'));
        return sb.toString();
    }

    private static String renderHistory(ContextWindow window) {
        if (window == null || window.getTurns().isEmpty()) {
            return "(empty)";
        }
        return TranscriptRenderer.render(window.getTurns());
    }

    private static String load(String path) {
        try (InputStream in = new ClassPathResource(path).getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("missing prompt template " + path, e);
        }
    }
}
