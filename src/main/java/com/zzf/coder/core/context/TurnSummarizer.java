package com.zzf.coder.core.context;

/**
 * Condenses a rendered span of turns into a short summary. A single bounded call;
 * implementations may throw, the caller falls back to a local digest.
 */
@FunctionalInterface
public interface TurnSummarizer {
    String summarize(String transcript);
}
