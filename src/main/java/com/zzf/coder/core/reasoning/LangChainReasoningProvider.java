package com.zzf.coder.core.reasoning;

import com.zzf.coder.config.LlmProperties;
import com.zzf.coder.core.util.StringUtils;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * OpenAI-compatible chat model through langchain4j. Only created when an API key is configured.
 */
@Slf4j
@Component
@ConditionalOnExpression("'${coder.llm.api-key:}' != ''")
public class LangChainReasoningProvider implements ReasoningProvider {

    private final OpenAiChatModel model;
    private final PromptRenderer prompts;

    public LangChainReasoningProvider(LlmProperties properties) {
        this(OpenAiChatModel.builder()
                .apiKey(properties.getApiKey())
                .baseUrl(properties.getBaseUrl())
                .modelName(properties.getModelName())
                .temperature(properties.getTemperature())
                .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                .build(), new PromptRenderer());
        log.info("llm.provider model={} baseUrl={}", properties.getModelName(), properties.getBaseUrl());
    }

    LangChainReasoningProvider(OpenAiChatModel model, PromptRenderer prompts) {
        this.model = model;
        this.prompts = prompts;
    }

    @Override
    public String complete(ReasoningRequest request) {
        String prompt = prompts.render(request);
        log.info("llm.request sessionId={} cycle={} attempt={} promptChars={}",
                request.getSessionId(), request.getCycle(), request.getAttempt(), prompt.length());
        String raw = model.chat(prompt);
        log.debug("llm.raw sessionId={} raw={}", request.getSessionId(), StringUtils.truncate(raw, 2000));
        return raw;
    }

    @Override
    public String summarize(String transcript) {
        return model.chat(prompts.renderSummary(transcript));
    }
}
