package com.zzf.coder.core.reasoning;

/**
 * The model. {@link #complete} returns the raw reply text, which must follow the JSON
 * action protocol parsed by {@link ReasoningReplyParser}. Transport failures are thrown
 * as runtime exceptions; the agent loop decides whether to retry them.
 */
public interface ReasoningProvider {

    String complete(ReasoningRequest request);

    String summarize(String transcript);
}
