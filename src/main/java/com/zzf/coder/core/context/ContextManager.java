package com.zzf.coder.core.context;

import com.zzf.coder.config.AgentProperties;
import com.zzf.coder.core.tool.ToolCall;
import com.zzf.coder.core.util.StringUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Append-only Turn history of one session plus the window builder.
 * <p>
 * {@link #windowFor(int)} keeps Turn 0 and the newest turns verbatim and replaces the
 * older span with one summary turn. Summaries are cached by span, so repeated calls
 * without an append return equal windows and cost no extra summarizer call.
 */
@Slf4j
public class ContextManager {
    private static final int DIGEST_THOUGHT_CHARS = 200;

    private final String sessionId;
    private final TurnSummarizer summarizer;
    private final AgentProperties.Context settings;
    private final List<Turn> turns = new ArrayList<>();
    /** toSeq -> summary of span 1..toSeq */
    private final TreeMap<Long, Turn> summaries = new TreeMap<>();
    private boolean closed;

    public ContextManager(String sessionId, TurnSummarizer summarizer, AgentProperties.Context settings) {
        this.sessionId = sessionId;
        this.summarizer = summarizer;
        this.settings = settings == null ? new AgentProperties.Context() : settings;
    }

    public synchronized void append(Turn turn) {
        if (closed) {
            throw new SessionClosedException(sessionId);
        }
        if (turn.getRole() == TurnRole.SYSTEM_SUMMARY) {
            throw new IllegalArgumentException("summary turns are derived and cannot be appended");
        }
        long expected = turns.size();
        if (turn.getSeq() != expected) {
            throw new IllegalArgumentException("expected turn seq " + expected + " but got " + turn.getSeq());
        }
        if (expected == 0 && turn.getRole() != TurnRole.INSTRUCTION) {
            throw new IllegalArgumentException("turn 0 must be the user instruction");
        }
        if (expected > 0 && turn.getRole() == TurnRole.INSTRUCTION) {
            throw new IllegalArgumentException("only turn 0 can be an instruction");
        }
        turns.add(turn);
        log.debug("context.append sessionId={} seq={} calls={}", sessionId, turn.getSeq(), turn.getCalls().size());
    }

    public synchronized long nextSeq() {
        return turns.size();
    }

    public synchronized void close() {
        closed = true;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public synchronized List<Turn> turns() {
        return Collections.unmodifiableList(new ArrayList<>(turns));
    }

    public synchronized Turn lastTurn() {
        return turns.isEmpty() ? null : turns.get(turns.size() - 1);
    }

    /** Replaces the history with checkpointed turns; cached summaries are dropped. */
    public synchronized void restore(List<Turn> restored) {
        if (closed) {
            throw new SessionClosedException(sessionId);
        }
        turns.clear();
        summaries.clear();
        for (Turn turn : restored) {
            append(turn);
        }
    }

    public synchronized ContextWindow windowFor(int budgetTokens) {
        if (turns.isEmpty()) {
            return ContextWindow.empty(budgetTokens);
        }
        Turn instruction = turns.get(0);
        int instructionTokens = TokenEstimator.estimate(instruction);
        int n = turns.size();

        int total = instructionTokens;
        for (int i = 1; i < n; i++) {
            total += TokenEstimator.estimate(turns.get(i));
        }
        if (total <= budgetTokens) {
            return new ContextWindow(List.copyOf(turns), null, total, budgetTokens);
        }

        // newest first: the minimum recent turns always, then older ones while they fit
        int minRecent = Math.max(1, settings.getMinRecentTurns());
        int reserve = Math.max(0, settings.getSummaryReserveTokens());
        int firstIncluded = n;
        int recentTokens = 0;
        for (int i = n - 1; i >= 1; i--) {
            int cost = TokenEstimator.estimate(turns.get(i));
            boolean mandatory = n - i <= minRecent;
            if (!mandatory && instructionTokens + reserve + recentTokens + cost > budgetTokens) {
                break;
            }
            recentTokens += cost;
            firstIncluded = i;
        }
        if (firstIncluded <= 1) {
            // everything fits once the reserve is not needed
            return new ContextWindow(List.copyOf(turns), null, instructionTokens + recentTokens, budgetTokens);
        }

        long spanEnd = alignToBatch(firstIncluded - 1, n - 1 - Math.min(minRecent, n - 1));
        Turn summary = summaryFor(spanEnd);

        List<Turn> window = new ArrayList<>();
        window.add(instruction);
        window.add(summary);
        int estimated = instructionTokens + TokenEstimator.estimate(summary);
        for (int i = (int) spanEnd + 1; i < n; i++) {
            window.add(turns.get(i));
            estimated += TokenEstimator.estimate(turns.get(i));
        }
        log.debug("context.window sessionId={} turns={} summarized=1-{} estimated={} budget={}",
                sessionId, n, spanEnd, estimated, budgetTokens);
        return new ContextWindow(Collections.unmodifiableList(window), summary, estimated, budgetTokens);
    }

    /**
     * Rounds the summarized span up to a batch boundary so the span (and its cached summary)
     * only changes every few turns. Never swallows the mandatory recent turns.
     */
    private long alignToBatch(long spanEnd, long maxSpanEnd) {
        int batch = Math.max(1, settings.getSummaryBatchTurns());
        long aligned = ((spanEnd + batch - 1) / batch) * batch;
        return Math.max(spanEnd, Math.min(aligned, maxSpanEnd));
    }

    private Turn summaryFor(long spanEnd) {
        Turn cached = summaries.get(spanEnd);
        if (cached != null) {
            return cached;
        }
        Map.Entry<Long, Turn> previous = summaries.lowerEntry(spanEnd);
        long from = previous == null ? 1 : previous.getKey() + 1;
        List<Turn> span = turns.subList((int) from, (int) spanEnd + 1);

        StringBuilder transcript = new StringBuilder();
        if (previous != null) {
            transcript.append("Summary of earlier turns 1-").append(previous.getKey()).append(":\n")
                    .append(previous.getValue().getContent()).append("\n\n");
        }
        transcript.append(TranscriptRenderer.render(span));
        String input = StringUtils.truncate(transcript.toString(), settings.getSummaryInputChars());

        String text;
        try {
            text = summarizer == null ? null : summarizer.summarize(input);
        } catch (RuntimeException e) {
            log.warn("context.summary.failed sessionId={} span=1-{} err={}", sessionId, spanEnd, e.toString());
            text = null;
        }
        if (text == null || text.isBlank()) {
            text = digest(turns.subList(1, (int) spanEnd + 1));
        }
        int maxChars = Math.max(0, settings.getSummaryReserveTokens()) * 4;
        if (maxChars > 0 && text.length() > maxChars) {
            text = StringUtils.truncate(text, maxChars);
        }
        Turn summary = Turn.summary(1, spanEnd, text.trim(), System.currentTimeMillis());
        summaries.put(spanEnd, summary);
        return summary;
    }

    /** Local fallback when no summary could be produced: counts, tools used and the last thought. */
    static String digest(List<Turn> span) {
        Map<String, Integer> tools = new LinkedHashMap<>();
        int failures = 0;
        String lastThought = "";
        for (Turn turn : span) {
            for (ToolCall call : turn.getCalls()) {
                tools.merge(call.getTool(), 1, Integer::sum);
            }
            failures += (int) turn.getResults().stream().filter(r -> !r.isSuccess()).count();
            if (!turn.getContent().isBlank()) {
                lastThought = turn.getContent();
            }
        }
        StringBuilder sb = new StringBuilder();
        sb.append(span.size()).append(" earlier turns were condensed.");
        if (!tools.isEmpty()) {
            sb.append(" Tools used: ");
            List<String> parts = new ArrayList<>();
            tools.forEach((name, count) -> parts.add(name + " x" + count));
            sb.append(String.join(", ", parts)).append('.');
        }
        if (failures > 0) {
            sb.append(' ').append(failures).append(" tool calls failed.");
        }
        if (!lastThought.isEmpty()) {
            sb.append(" Last thought: ").append(lastThought.length() > DIGEST_THOUGHT_CHARS
                    ? lastThought.substring(0, DIGEST_THOUGHT_CHARS) + "..." : lastThought);
        }
        return sb.toString();
    }
}
