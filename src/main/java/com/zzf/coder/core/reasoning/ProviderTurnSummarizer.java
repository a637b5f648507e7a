package com.zzf.coder.core.reasoning;

import com.zzf.coder.core.context.TurnSummarizer;
import lombok.RequiredArgsConstructor;

/**
 * Summaries through the session's reasoning provider.
 */
@RequiredArgsConstructor
public class ProviderTurnSummarizer implements TurnSummarizer {
    private final ReasoningProvider provider;

    @Override
    public String summarize(String transcript) {
        return provider.summarize(transcript);
    }
}
