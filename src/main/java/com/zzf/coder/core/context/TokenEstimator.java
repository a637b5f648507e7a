package com.zzf.coder.core.context;

/**
 * Rough token count: four characters per token.
 */
public final class TokenEstimator {
    private TokenEstimator() {
    }

    public static int estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (text.length() + 3) / 4;
    }

    public static int estimate(Turn turn) {
        return estimate(TranscriptRenderer.render(turn));
    }
}
