package com.zzf.coder.core.context;

import lombok.Value;

import java.util.List;

/**
 * Bounded view of the history handed to the reasoning provider: the instruction,
 * at most one summary of the older turns, then the most recent turns verbatim.
 */
@Value
public class ContextWindow {
    List<Turn> turns;
    Turn summary;
    int estimatedTokens;
    int budgetTokens;

    public boolean isOverBudget() {
        return estimatedTokens > budgetTokens;
    }

    public static ContextWindow empty(int budgetTokens) {
        return new ContextWindow(List.of(), null, 0, budgetTokens);
    }
}
