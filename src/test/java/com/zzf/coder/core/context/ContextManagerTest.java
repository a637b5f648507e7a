package com.zzf.coder.core.context;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.coder.config.AgentProperties;
import com.zzf.coder.core.tool.ToolCall;
import com.zzf.coder.core.tool.ToolErrorType;
import com.zzf.coder.core.tool.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContextManagerTest {

    private static final String THOUGHT = "x".repeat(400);

    private final List<String> summarizerInputs = new ArrayList<>();
    private AgentProperties.Context settings;
    private ContextManager context;

    @BeforeEach
    void setUp() {
        settings = new AgentProperties.Context();
        settings.setMinRecentTurns(2);
        settings.setSummaryReserveTokens(50);
        settings.setSummaryBatchTurns(4);
        context = new ContextManager("s1", transcript -> {
            summarizerInputs.add(transcript);
            return "summary #" + summarizerInputs.size();
        }, settings);
        context.append(Turn.instruction("fix the bug", 1L));
    }

    @Test
    void shouldEnforceAppendOrdering() {
        assertThrows(IllegalArgumentException.class, () -> context.append(thoughtTurn(2)));
        assertThrows(IllegalArgumentException.class, () -> context.append(Turn.instruction("again", 1L)));
        assertThrows(IllegalArgumentException.class, () -> context.append(Turn.summary(1, 1, "s", 1L)));

        ContextManager fresh = new ContextManager("s2", null, settings);
        assertThrows(IllegalArgumentException.class, () -> fresh.append(thoughtTurn(0)));

        context.append(thoughtTurn(1));
        assertEquals(2, context.nextSeq());
        assertEquals(1, context.lastTurn().getSeq());
    }

    @Test
    void shouldRejectAppendsAfterClose() {
        context.close();

        assertTrue(context.isClosed());
        assertThrows(SessionClosedException.class, () -> context.append(thoughtTurn(1)));
        assertEquals(1, context.turns().size());
    }

    @Test
    void shouldReturnEverythingWhenHistoryFits() {
        appendThoughts(3);

        ContextWindow window = context.windowFor(10_000);

        assertEquals(4, window.getTurns().size());
        assertNull(window.getSummary());
        assertTrue(summarizerInputs.isEmpty());
    }

    @Test
    void shouldSummarizeOlderTurnsAndKeepInstructionAndRecentTurns() {
        appendThoughts(10);

        ContextWindow window = context.windowFor(400);

        List<Turn> turns = window.getTurns();
        assertEquals(TurnRole.INSTRUCTION, turns.get(0).getRole());
        assertEquals(TurnRole.SYSTEM_SUMMARY, turns.get(1).getRole());
        assertSame(window.getSummary(), turns.get(1));
        assertEquals(1L, window.getSummary().getSummarizedFrom());
        long summarizedTo = window.getSummary().getSummarizedTo();
        assertEquals(summarizedTo + 1, turns.get(2).getSeq());
        assertEquals(10, turns.get(turns.size() - 1).getSeq());
        assertTrue(turns.size() >= 4);
        assertEquals("summary #1", window.getSummary().getContent());
    }

    @Test
    void shouldClipSummaryToReserve() {
        ContextManager verbose = new ContextManager("s3", transcript -> "y".repeat(1_000), settings);
        verbose.append(Turn.instruction("fix the bug", 1L));
        for (int i = 1; i <= 10; i++) {
            verbose.append(thoughtTurn(i));
        }

        String summary = verbose.windowFor(400).getSummary().getContent();

        assertTrue(summary.startsWith("y".repeat(200) + "\n... [truncated 800 chars]"), summary);
    }

    @Test
    void shouldReturnEqualWindowsWithoutNewSummariesBetweenAppends() {
        appendThoughts(10);

        ContextWindow first = context.windowFor(400);
        ContextWindow second = context.windowFor(400);

        assertEquals(first, second);
        assertEquals(1, summarizerInputs.size());
    }

    @Test
    void shouldReuseCachedSummaryUntilSpanMovesPastBatch() {
        appendThoughts(10);
        ContextWindow before = context.windowFor(400);
        assertEquals(8L, before.getSummary().getSummarizedTo());

        context.append(thoughtTurn(11));
        ContextWindow afterOne = context.windowFor(400);
        assertEquals(8L, afterOne.getSummary().getSummarizedTo());
        assertEquals(1, summarizerInputs.size());

        context.append(thoughtTurn(12));
        ContextWindow afterTwo = context.windowFor(400);
        assertEquals(10L, afterTwo.getSummary().getSummarizedTo());
        assertEquals(2, summarizerInputs.size());
        assertTrue(summarizerInputs.get(1).startsWith("Summary of earlier turns 1-8:\nsummary #1"));
    }

    @Test
    void shouldKeepMinimumRecentTurnsEvenOverBudget() {
        appendThoughts(6);

        ContextWindow window = context.windowFor(50);

        List<Turn> turns = window.getTurns();
        assertEquals(0, turns.get(0).getSeq());
        assertEquals(5, turns.get(turns.size() - 2).getSeq());
        assertEquals(6, turns.get(turns.size() - 1).getSeq());
        assertTrue(window.isOverBudget());
    }

    @Test
    void shouldFallBackToDigestWhenSummarizerFails() {
        ContextManager failing = new ContextManager("s3", transcript -> {
            throw new IllegalStateException("provider down");
        }, settings);
        failing.append(Turn.instruction("task", 1L));
        ObjectMapper mapper = new ObjectMapper();
        for (int seq = 1; seq <= 8; seq++) {
            ToolCall call = ToolCall.of("c" + seq, seq % 2 == 0 ? "grep" : "bash", mapper.createObjectNode(), seq);
            ToolResult result = seq == 3
                    ? ToolResult.failure(call, ToolErrorType.TIMEOUT, "slow", 1)
                    : ToolResult.success(call, "y".repeat(300), null, 1);
            failing.append(Turn.assistant(seq, "step " + seq, List.of(call), List.of(result), 1L));
        }

        ContextWindow window = failing.windowFor(300);

        String digest = window.getSummary().getContent();
        assertTrue(digest.contains("earlier turns were condensed."), digest);
        assertTrue(digest.contains("bash x"), digest);
        assertTrue(digest.contains("1 tool calls failed."), digest);
    }

    @Test
    void shouldRestoreTurnsFromCheckpoint() {
        appendThoughts(2);
        List<Turn> saved = context.turns();

        ContextManager restored = new ContextManager("s1", null, settings);
        restored.restore(saved);

        assertEquals(saved, restored.turns());
        assertEquals(3, restored.nextSeq());
    }

    @Test
    void shouldRejectResultsThatDoNotBelongToTheTurn() {
        ObjectMapper mapper = new ObjectMapper();
        ToolCall call = ToolCall.of("c1", "ls", mapper.createObjectNode(), 1);
        ToolCall other = ToolCall.of("c2", "ls", mapper.createObjectNode(), 1);

        assertThrows(IllegalArgumentException.class,
                () -> Turn.assistant(1, "t", List.of(call), List.of(ToolResult.success(other, "", null, 1)), 1L));
        assertThrows(IllegalArgumentException.class,
                () -> Turn.assistant(1, "t", List.of(call, call), List.of(), 1L));
    }

    private void appendThoughts(int count) {
        for (int i = 0; i < count; i++) {
            context.append(thoughtTurn(context.nextSeq()));
        }
    }

    private static Turn thoughtTurn(long seq) {
        return Turn.assistant(seq, THOUGHT, List.of(), List.of(), 1L);
    }
}
