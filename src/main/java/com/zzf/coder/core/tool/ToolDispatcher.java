package com.zzf.coder.core.tool;

import com.zzf.coder.bus.AgentBus;
import com.zzf.coder.config.ToolProperties;
import com.zzf.coder.core.util.StringUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Validates and runs tool calls. Every returned future completes normally with a
 * {@link ToolResult}; unknown tools, invalid arguments, tool exceptions, deadlines
 * and cancellation are all reported as failed results. Calls are never retried.
 */
@Slf4j
@Service
public class ToolDispatcher {
    private static final Pattern SENSITIVE_KV = Pattern.compile("(?i)(password|passwd|secret|token|apikey|api_key|accesskey|secretkey)\\s*[:=]\\s*([\"']?)([^\"'\\\\\\r\\n\\s]{1,160})\\2");
    private static final Pattern SENSITIVE_JSON_KV = Pattern.compile("(?i)(\"(?:password|passwd|secret|token|apiKey|api_key|accessKey|secretKey)\"\\s*:\\s*\")([^\"]{1,160})(\")");

    private final ToolRegistry registry;
    private final ToolProperties properties;
    private final ExecutorService executor;
    private final AgentBus bus;
    private final Set<String> allowTools;
    private final Set<String> denyTools;
    private final Map<String, Map<String, InFlight>> inFlight = new ConcurrentHashMap<>();

    public ToolDispatcher(ToolRegistry registry,
                          ToolProperties properties,
                          @Qualifier("toolExecutor") ExecutorService executor,
                          AgentBus bus) {
        this.registry = registry;
        this.properties = properties;
        this.executor = executor;
        this.bus = bus;
        this.allowTools = normalize(properties.getAllow());
        this.denyTools = normalize(properties.getDeny());
    }

    public boolean isToolAllowed(String toolName) {
        if (toolName == null || toolName.isBlank()) {
            return false;
        }
        String normalized = toolName.trim().toLowerCase(Locale.ROOT);
        if (!allowTools.isEmpty() && !allowTools.contains(normalized)) {
            return false;
        }
        return !denyTools.contains(normalized);
    }

    /**
     * Runs all calls of one Turn concurrently; results come back in call order.
     */
    public CompletableFuture<List<ToolResult>> dispatchAll(List<ToolCall> calls, Duration timeout, Tool.Context ctx) {
        List<CompletableFuture<ToolResult>> futures = new ArrayList<>(calls.size());
        for (ToolCall call : calls) {
            futures.add(dispatch(call, timeout, ctx));
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> futures.stream().map(CompletableFuture::join).collect(Collectors.toList()));
    }

    public CompletableFuture<ToolResult> dispatch(ToolCall call, Duration timeout, Tool.Context ctx) {
        long t0 = System.nanoTime();
        String sessionId = ctx == null ? null : ctx.getSessionID();
        String name = call.getTool();

        Tool tool = registry.get(name);
        if (tool == null) {
            return rejected(call, sessionId, ToolErrorType.UNKNOWN_TOOL,
                    "unknown tool '" + name + "'. Available tools: " + registry.names(), t0);
        }
        if (!isToolAllowed(name)) {
            return rejected(call, sessionId, ToolErrorType.VALIDATION_ERROR,
                    "tool not permitted: '" + name + "' is blocked by the allow/deny rules", t0);
        }
        int argChars = call.getArgs() == null ? 0 : call.getArgs().toString().length();
        if (argChars > properties.getMaxArgsChars()) {
            return rejected(call, sessionId, ToolErrorType.VALIDATION_ERROR,
                    "arguments too large (" + argChars + " > " + properties.getMaxArgsChars() + " chars)", t0);
        }
        List<String> violations = tool.getSchema().validate(call.getArgs());
        if (!violations.isEmpty()) {
            return rejected(call, sessionId, ToolErrorType.VALIDATION_ERROR,
                    "invalid arguments for '" + name + "': " + String.join("; ", violations), t0);
        }

        log.info("tool.call sessionId={} callId={} tool={} argsChars={}", sessionId, call.getId(), name, argChars);
        Tool.Context callCtx = (ctx == null ? Tool.Context.builder().build() : ctx).toBuilder()
                .callID(call.getId())
                .turnSeq(call.getTurnSeq())
                .executor(executor)
                .build();

        CompletableFuture<Tool.Result> running;
        try {
            running = CompletableFuture.supplyAsync(() -> tool.execute(call.getArgs(), callCtx), executor)
                    .thenCompose(f -> f);
        } catch (RuntimeException e) {
            // executor rejected the task
            running = CompletableFuture.failedFuture(e);
        }

        long timeoutMs = timeout == null ? 0 : timeout.toMillis();
        CompletableFuture<ToolResult> out = new CompletableFuture<>();
        InFlight entry = new InFlight(call, tool, running, out, t0);
        track(sessionId, entry);

        running.whenComplete((res, err) -> {
            if (err == null) {
                out.complete(finish(ToolResult.success(call,
                        res == null ? "" : res.getOutput(),
                        res == null ? null : res.getMetadata(),
                        elapsedMs(t0))));
            } else {
                out.complete(finish(fromThrowable(call, err, t0)));
            }
        });

        if (timeoutMs > 0) {
            ToolResult timedOut = ToolResult.failure(call, ToolErrorType.TIMEOUT,
                    "tool '" + name + "' did not complete within " + timeoutMs + " ms", timeoutMs);
            out.completeOnTimeout(timedOut, timeoutMs, TimeUnit.MILLISECONDS);
            out.thenAccept(result -> {
                if (result == timedOut) {
                    log.warn("tool.timeout sessionId={} callId={} tool={} timeoutMs={}", sessionId, call.getId(), name, timeoutMs);
                    abort(entry, sessionId);
                }
            });
        }
        return out.whenComplete((result, err) -> {
            untrack(sessionId, call.getId());
            if (result != null) {
                log.info("tool.result sessionId={} callId={} tool={} success={} errorType={} tookMs={}",
                        sessionId, call.getId(), name, result.isSuccess(), result.getErrorType(), result.getDurationMs());
                bus.publish(AgentBus.TOOL_RESULT, result);
            }
        });
    }

    /**
     * Resolves every in-flight call of the session as CANCELLED and asks the tools to stop.
     */
    public int cancelSession(String sessionId) {
        if (sessionId == null) {
            return 0;
        }
        Map<String, InFlight> calls = inFlight.get(sessionId);
        if (calls == null || calls.isEmpty()) {
            return 0;
        }
        int cancelled = 0;
        for (InFlight entry : new ArrayList<>(calls.values())) {
            ToolResult result = ToolResult.failure(entry.call, ToolErrorType.CANCELLED,
                    "tool call cancelled", elapsedMs(entry.startedNanos));
            if (entry.out.complete(result)) {
                cancelled++;
                abort(entry, sessionId);
            }
        }
        log.info("tool.cancel sessionId={} cancelled={}", sessionId, cancelled);
        return cancelled;
    }

    public int inFlightCount(String sessionId) {
        Map<String, InFlight> calls = inFlight.get(sessionId);
        return calls == null ? 0 : calls.size();
    }

    private void abort(InFlight entry, String sessionId) {
        try {
            entry.tool.cancel(sessionId, entry.call.getId());
        } catch (RuntimeException e) {
            log.warn("tool.cancel.failed sessionId={} callId={} tool={} err={}",
                    sessionId, entry.call.getId(), entry.call.getTool(), e.toString());
        }
        entry.running.cancel(true);
    }

    private CompletableFuture<ToolResult> rejected(ToolCall call, String sessionId, ToolErrorType type, String error, long t0) {
        ToolResult result = finish(ToolResult.failure(call, type, error, elapsedMs(t0)));
        log.info("tool.rejected sessionId={} callId={} tool={} errorType={} error={}",
                sessionId, call.getId(), call.getTool(), type, error);
        bus.publish(AgentBus.TOOL_RESULT, result);
        return CompletableFuture.completedFuture(result);
    }

    private ToolResult fromThrowable(ToolCall call, Throwable err, long t0) {
        Throwable cause = unwrap(err);
        if (cause instanceof ToolExecutionException) {
            ToolExecutionException te = (ToolExecutionException) cause;
            return ToolResult.failure(call, ToolErrorType.EXECUTION_ERROR, te.getMessage(), te.getOutput(), elapsedMs(t0));
        }
        log.warn("tool.fail callId={} tool={} err={}", call.getId(), call.getTool(), cause.toString());
        return ToolResult.failure(call, ToolErrorType.EXECUTION_ERROR,
                cause.getClass().getSimpleName() + ": " + cause.getMessage(), elapsedMs(t0));
    }

    private ToolResult finish(ToolResult result) {
        ToolResult.ToolResultBuilder b = result.toBuilder();
        if (result.getOutput() != null) {
            b.output(mask(StringUtils.truncate(result.getOutput(), properties.getMaxResultChars())));
        }
        if (result.getError() != null) {
            b.error(mask(StringUtils.truncate(result.getError(), properties.getMaxResultChars())));
        }
        return b.build();
    }

    static String mask(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String masked = SENSITIVE_JSON_KV.matcher(text).replaceAll("$1******$3");
        return SENSITIVE_KV.matcher(masked).replaceAll("$1=******");
    }

    private static Throwable unwrap(Throwable err) {
        Throwable current = err;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private void track(String sessionId, InFlight entry) {
        if (sessionId != null) {
            inFlight.computeIfAbsent(sessionId, k -> new ConcurrentHashMap<>()).put(entry.call.getId(), entry);
        }
    }

    private void untrack(String sessionId, String callId) {
        if (sessionId == null) {
            return;
        }
        inFlight.computeIfPresent(sessionId, (k, calls) -> {
            calls.remove(callId);
            return calls.isEmpty() ? null : calls;
        });
    }

    private static long elapsedMs(long t0) {
        return (System.nanoTime() - t0) / 1_000_000L;
    }

    private static Set<String> normalize(List<String> names) {
        if (names == null) {
            return Set.of();
        }
        return names.stream()
                .filter(n -> n != null && !n.isBlank())
                .map(n -> n.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    private static final class InFlight {
        final ToolCall call;
        final Tool tool;
        final CompletableFuture<Tool.Result> running;
        final CompletableFuture<ToolResult> out;
        final long startedNanos;

        InFlight(ToolCall call, Tool tool, CompletableFuture<Tool.Result> running,
                 CompletableFuture<ToolResult> out, long startedNanos) {
            this.call = call;
            this.tool = tool;
            this.running = running;
            this.out = out;
            this.startedNanos = startedNanos;
        }
    }
}
