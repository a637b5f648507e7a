package com.zzf.coder.session;

import com.zzf.coder.bus.AgentBus;
import com.zzf.coder.config.AgentProperties;
import com.zzf.coder.core.context.ContextWindow;
import com.zzf.coder.core.context.Turn;
import com.zzf.coder.core.plan.PlanItem;
import com.zzf.coder.core.plan.PlanSnapshot;
import com.zzf.coder.core.plan.TaskPlanner;
import com.zzf.coder.core.plan.UnknownPlanItemException;
import com.zzf.coder.core.reasoning.ProviderRetry;
import com.zzf.coder.core.reasoning.ReasoningParseException;
import com.zzf.coder.core.reasoning.ReasoningProvider;
import com.zzf.coder.core.reasoning.ReasoningReply;
import com.zzf.coder.core.reasoning.ReasoningReplyParser;
import com.zzf.coder.core.reasoning.ReasoningRequest;
import com.zzf.coder.core.tool.TodoWriteTool;
import com.zzf.coder.core.tool.Tool;
import com.zzf.coder.core.tool.ToolCall;
import com.zzf.coder.core.tool.ToolDispatcher;
import com.zzf.coder.core.tool.ToolRegistry;
import com.zzf.coder.core.tool.ToolResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Reason → dispatch → observe state machine of one session. One instance serves every
 * session; all per-run state lives on the {@link Session}.
 */
@Slf4j
public class AgentLoop {
    private static final long CANCEL_POLL_MS = 100L;

    private final ReasoningProvider provider;
    private final ToolDispatcher dispatcher;
    private final ToolRegistry registry;
    private final ReasoningReplyParser parser;
    private final AgentProperties properties;
    private final AgentBus bus;
    private final SessionCheckpointStore checkpoints;

    public AgentLoop(ReasoningProvider provider,
                     ToolDispatcher dispatcher,
                     ToolRegistry registry,
                     ReasoningReplyParser parser,
                     AgentProperties properties,
                     AgentBus bus,
                     SessionCheckpointStore checkpoints) {
        this.provider = provider;
        this.dispatcher = dispatcher;
        this.registry = registry;
        this.parser = parser;
        this.properties = properties;
        this.bus = bus;
        this.checkpoints = checkpoints;
    }

    /**
     * Runs until the session reaches a terminal state. Never throws; failures end up on the session.
     */
    public Session run(Session session) {
        log.info("loop.start sessionId={} projectRoot={} maxCycles={}",
                session.getId(), session.getProjectRoot(), session.getMaxCycles());
        try {
            while (!session.getStatus().isTerminal()) {
                cycle(session);
            }
        } catch (RuntimeException e) {
            log.error("loop.internal_error sessionId={} err={}", session.getId(), e.toString(), e);
            session.fail(FailureReason.INTERNAL_ERROR, e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            session.getContext().close();
            saveCheckpoint(session);
            log.info("loop.end sessionId={} status={} reason={} cycles={}", session.getId(), session.getStatus(),
                    session.getFailureReason(), session.getCyclesCompleted());
            publishStatus(session);
            session.markFinished();
        }
        return session;
    }

    private void cycle(Session session) {
        session.setState(LoopState.AWAITING_REASONING);
        if (session.isCancelRequested()) {
            session.cancelled();
            return;
        }
        if (session.getCyclesCompleted() >= session.getMaxCycles()) {
            session.fail(FailureReason.BUDGET_EXCEEDED,
                    "no final answer after " + session.getCyclesCompleted() + " cycles");
            return;
        }

        int cycleNo = session.getCyclesCompleted() + 1;
        ReasoningReply reply = reason(session, cycleNo);
        if (reply == null) {
            // failed or cancelled while reasoning
            return;
        }
        if (session.isCancelRequested()) {
            // the reply is discarded; the last appended Turn stays the coherent end of history
            session.cancelled();
            return;
        }

        List<String> notes = new ArrayList<>(reply.getWarnings());
        if (reply.isFinal()) {
            applyReplyPlan(session.getPlanner(), reply, notes);
            long seq = session.getContext().nextSeq();
            session.getContext().append(Turn.answer(seq, reply.getFinalAnswer(), System.currentTimeMillis()));
            session.complete(reply.getFinalAnswer());
            log.info("loop.final sessionId={} cycle={} seq={}", session.getId(), cycleNo, seq);
            turnAppended(session, seq);
            return;
        }

        session.setState(LoopState.DISPATCHING_TOOLS);
        long seq = session.getContext().nextSeq();
        List<ToolCall> calls = assignCallIds(reply.getCalls(), seq);
        log.info("loop.dispatch sessionId={} cycle={} seq={} calls={}", session.getId(), cycleNo, seq, calls.size());

        Tool.Context ctx = Tool.Context.builder()
                .sessionID(session.getId())
                .turnSeq(seq)
                .projectRoot(session.getProjectRoot())
                .build();
        CompletableFuture<List<ToolResult>> pending = dispatcher.dispatchAll(calls, session.getToolTimeout(), ctx);
        if (session.isCancelRequested()) {
            dispatcher.cancelSession(session.getId());
        }
        List<ToolResult> results = pending.join();

        applyReplyPlan(session.getPlanner(), reply, notes);
        applyTodoWrites(session.getPlanner(), results, notes);
        results = withReminders(results, session.getPlanner().snapshot());

        session.getContext().append(Turn.assistant(seq, reply.getThought(), calls, results, System.currentTimeMillis()));
        session.cycleCompleted();
        notes.forEach(session::addNote);
        turnAppended(session, seq);

        if (session.isCancelRequested()) {
            session.cancelled();
        }
    }

    /**
     * One reasoning cycle: provider retries for transport errors, a correction round for malformed replies.
     * Returns null when the session ended inside the cycle.
     */
    private ReasoningReply reason(Session session, int cycleNo) {
        int parseAttempts = Math.max(1, properties.getReasoningParseAttempts());
        List<String> notes = session.drainNotes();
        String correction = null;
        String lastParseError = null;
        for (int attempt = 1; attempt <= parseAttempts; attempt++) {
            ContextWindow window = session.getContext().windowFor(session.getContextBudgetTokens());
            ReasoningRequest request = ReasoningRequest.builder()
                    .sessionId(session.getId())
                    .projectRoot(session.getProjectRoot())
                    .cycle(cycleNo)
                    .attempt(attempt)
                    .window(window)
                    .plan(session.getPlanner().snapshot())
                    .tools(registry.catalog())
                    .correction(correction)
                    .notes(notes)
                    .build();
            String raw = callProvider(session, request);
            if (raw == null) {
                return null;
            }
            try {
                ReasoningReply reply = parser.parse(raw);
                log.info("loop.reply sessionId={} cycle={} attempt={} type={} calls={}",
                        session.getId(), cycleNo, attempt, reply.getType(), reply.getCalls().size());
                return reply;
            } catch (ReasoningParseException e) {
                lastParseError = e.getMessage();
                log.warn("loop.parse_error sessionId={} cycle={} attempt={} err={}",
                        session.getId(), cycleNo, attempt, lastParseError);
                correction = String.format(ReasoningReplyParser.CORRECTION_HINT, lastParseError);
            }
            if (session.isCancelRequested()) {
                session.cancelled();
                return null;
            }
        }
        session.fail(FailureReason.REASONING_PARSE_ERROR,
                parseAttempts + " malformed replies in cycle " + cycleNo + ": " + lastParseError);
        return null;
    }

    private String callProvider(Session session, ReasoningRequest request) {
        int retries = Math.max(0, properties.getProviderRetries());
        for (int attempt = 1; ; attempt++) {
            try {
                return provider.complete(request);
            } catch (RuntimeException e) {
                String retryable = ProviderRetry.getRetryableMessage(e);
                if (retryable == null || attempt > retries) {
                    log.warn("loop.provider_error sessionId={} cycle={} attempt={} retryable={} err={}",
                            session.getId(), request.getCycle(), attempt, retryable != null, e.toString());
                    session.fail(FailureReason.PROVIDER_ERROR, e.getClass().getSimpleName() + ": " + e.getMessage());
                    return null;
                }
                long delay = ProviderRetry.getDelay(attempt, properties.getProviderRetryInitialDelayMs());
                log.info("loop.provider_retry sessionId={} cycle={} attempt={} reason={} delayMs={}",
                        session.getId(), request.getCycle(), attempt, retryable, delay);
                if (!sleepUnlessCancelled(session, delay)) {
                    session.cancelled();
                    return null;
                }
            }
        }
    }

    private boolean sleepUnlessCancelled(Session session, long delayMs) {
        long deadline = System.currentTimeMillis() + delayMs;
        while (!session.isCancelRequested()) {
            long left = deadline - System.currentTimeMillis();
            if (left <= 0) {
                return true;
            }
            if (!ProviderRetry.sleep(Math.min(left, CANCEL_POLL_MS))) {
                return false;
            }
        }
        return false;
    }

    /** Model ids are kept when present and unique within the Turn; others become call_<seq>_<index>. */
    static List<ToolCall> assignCallIds(List<ReasoningReply.RequestedCall> requested, long seq) {
        Set<String> used = new HashSet<>();
        for (ReasoningReply.RequestedCall call : requested) {
            if (call.getId() != null) {
                used.add(call.getId());
            }
        }
        Set<String> seen = new HashSet<>();
        List<ToolCall> calls = new ArrayList<>(requested.size());
        for (int i = 0; i < requested.size(); i++) {
            ReasoningReply.RequestedCall call = requested.get(i);
            String id = call.getId();
            if (id == null || !seen.add(id)) {
                int n = i + 1;
                id = "call_" + seq + "_" + n;
                while (used.contains(id) || seen.contains(id)) {
                    id = "call_" + seq + "_" + (++n);
                }
                seen.add(id);
            }
            calls.add(ToolCall.of(id, call.getTool(), call.getArgs(), seq));
        }
        return calls;
    }

    private void applyReplyPlan(TaskPlanner planner, ReasoningReply reply, List<String> notes) {
        if (reply.getPlan() != null) {
            try {
                planner.setPlan(reply.getPlan());
            } catch (IllegalArgumentException e) {
                notes.add("plan restatement ignored: " + e.getMessage());
            }
        }
        for (ReasoningReply.PlanUpdate update : reply.getPlanUpdates()) {
            try {
                planner.updateItem(update.getId(), update.getStatus());
            } catch (UnknownPlanItemException e) {
                notes.add("plan update ignored: " + e.getMessage());
            }
        }
    }

    private void applyTodoWrites(TaskPlanner planner, List<ToolResult> results, List<String> notes) {
        for (ToolResult result : results) {
            if (!result.isSuccess() || !TodoWriteTool.ID.equals(result.getTool()) || result.getMetadata() == null) {
                continue;
            }
            Object todos = result.getMetadata().get(TodoWriteTool.TODOS_METADATA);
            if (!(todos instanceof List)) {
                continue;
            }
            List<PlanItem> items = new ArrayList<>();
            for (Object item : (List<?>) todos) {
                if (item instanceof PlanItem) {
                    items.add((PlanItem) item);
                }
            }
            try {
                planner.setPlan(items);
            } catch (IllegalArgumentException e) {
                notes.add("todo_write " + result.getCallId() + " not applied: " + e.getMessage());
            }
        }
    }

    /** Appends the unfinished-todo reminder to successful results, except todo_write's own. */
    private static List<ToolResult> withReminders(List<ToolResult> results, PlanSnapshot plan) {
        String reminder = plan.reminder();
        if (reminder.isEmpty()) {
            return results;
        }
        List<ToolResult> out = new ArrayList<>(results.size());
        for (ToolResult result : results) {
            if (result.isSuccess() && !TodoWriteTool.ID.equals(result.getTool())) {
                String output = result.getOutput() == null ? "" : result.getOutput();
                out.add(result.withOutput(output + reminder));
            } else {
                out.add(result);
            }
        }
        return out;
    }

    private void turnAppended(Session session, long seq) {
        saveCheckpoint(session);
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("sessionId", session.getId());
        props.put("seq", seq);
        bus.publish(AgentBus.TURN_APPENDED, props);
    }

    private void saveCheckpoint(Session session) {
        if (checkpoints == null || !checkpoints.isEnabled()) {
            return;
        }
        try {
            checkpoints.save(session);
        } catch (RuntimeException e) {
            log.warn("checkpoint.failed sessionId={} err={}", session.getId(), e.toString());
        }
    }

    private void publishStatus(Session session) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("sessionId", session.getId());
        props.put("status", session.getStatus());
        props.put("state", session.getState());
        if (session.getFailureReason() != null) {
            props.put("reason", session.getFailureReason());
        }
        bus.publish(AgentBus.SESSION_STATUS, props);
    }
}
