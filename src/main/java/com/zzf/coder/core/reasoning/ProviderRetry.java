package com.zzf.coder.core.reasoning;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;

/**
 * Backoff policy for provider transport errors: rate limits, overload and timeouts are retried.
 */
public final class ProviderRetry {

    public static final double RETRY_BACKOFF_FACTOR = 2.0;
    public static final long RETRY_MAX_DELAY = 30_000L;

    private ProviderRetry() {
    }

    public static long getDelay(int attempt, long initialDelayMs) {
        return (long) Math.min(initialDelayMs * Math.pow(RETRY_BACKOFF_FACTOR, attempt - 1), RETRY_MAX_DELAY);
    }

    /** Reason label when the error is worth retrying, null otherwise. Walks the cause chain. */
    public static String getRetryableMessage(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException || t instanceof HttpTimeoutException) {
                return "Request Timeout";
            }
            String msg = t.getMessage();
            if (msg == null) {
                continue;
            }
            if (msg.contains("Rate limit") || msg.contains("rate limit") || msg.contains("429")) {
                return "Rate Limited";
            }
            if (msg.contains("Overloaded") || msg.contains("overloaded") || msg.contains("503")) {
                return "Provider is overloaded";
            }
            if (msg.contains("timeout") || msg.contains("Timeout") || msg.contains("timed out")) {
                return "Request Timeout";
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return null;
    }

    /** Sleeps; returns false when interrupted, with the interrupt flag restored. */
    public static boolean sleep(long ms) {
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
