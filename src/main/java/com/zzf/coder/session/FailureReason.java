package com.zzf.coder.session;

public enum FailureReason {
    /** The model sent malformed replies on every attempt of one cycle. */
    REASONING_PARSE_ERROR,
    /** The cycle ceiling was reached without a final answer. */
    BUDGET_EXCEEDED,
    /** The provider failed with a non-retryable error, or retries ran out. */
    PROVIDER_ERROR,
    INTERNAL_ERROR
}
