package com.zzf.coder.session;

import com.zzf.coder.bus.AgentBus;
import com.zzf.coder.config.AgentProperties;
import com.zzf.coder.core.context.ContextManager;
import com.zzf.coder.core.context.Turn;
import com.zzf.coder.core.mcp.McpToolLoader;
import com.zzf.coder.core.plan.TaskPlanner;
import com.zzf.coder.core.reasoning.ProviderTurnSummarizer;
import com.zzf.coder.core.reasoning.ReasoningProvider;
import com.zzf.coder.core.reasoning.ReasoningReplyParser;
import com.zzf.coder.core.tool.ToolDispatcher;
import com.zzf.coder.core.tool.ToolRegistry;
import com.zzf.coder.id.Identifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

/**
 * Session control: start, cancel, status, resume. Each session runs its loop on the session executor.
 */
@Slf4j
@Service
public class SessionService {

    private final ObjectProvider<ReasoningProvider> providers;
    private final ToolDispatcher dispatcher;
    private final ToolRegistry registry;
    private final ReasoningReplyParser parser;
    private final AgentProperties properties;
    private final AgentBus bus;
    private final SessionCheckpointStore checkpoints;
    private final McpToolLoader mcpToolLoader;
    private final ExecutorService executor;

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    public SessionService(ObjectProvider<ReasoningProvider> providers,
                          ToolDispatcher dispatcher,
                          ToolRegistry registry,
                          ReasoningReplyParser parser,
                          AgentProperties properties,
                          AgentBus bus,
                          SessionCheckpointStore checkpoints,
                          McpToolLoader mcpToolLoader,
                          @Qualifier("sessionExecutor") ExecutorService executor) {
        this.providers = providers;
        this.dispatcher = dispatcher;
        this.registry = registry;
        this.parser = parser;
        this.properties = properties;
        this.bus = bus;
        this.checkpoints = checkpoints;
        this.mcpToolLoader = mcpToolLoader;
        this.executor = executor;
    }

    public Session start(String instruction, String projectRoot, SessionOptions options) {
        if (instruction == null || instruction.isBlank()) {
            throw new IllegalArgumentException("instruction must not be blank");
        }
        Path root = resolveRoot(projectRoot);
        ReasoningProvider provider = requireProvider();

        Session session = newSession(Identifier.ascending("session"), root, provider, options);
        session.getContext().append(Turn.instruction(instruction, System.currentTimeMillis()));
        log.info("session.start sessionId={} projectRoot={} instructionChars={}",
                session.getId(), root, instruction.length());
        launch(session, provider);
        return session;
    }

    /**
     * Continues a checkpointed session at AWAITING_REASONING with its Turns and Plan restored.
     * The cycle counter starts again from zero.
     */
    public Session resume(String sessionId, String projectRoot, SessionOptions options) {
        Session existing = sessions.get(sessionId);
        if (existing != null && !existing.getStatus().isTerminal()) {
            throw new IllegalStateException("session " + sessionId + " is still running");
        }
        Path root = resolveRoot(projectRoot);
        SessionCheckpoint checkpoint = checkpoints.load(root, sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        if (checkpoint.getStatus() == SessionStatus.COMPLETED) {
            throw new IllegalStateException("session " + sessionId + " already completed");
        }
        if (checkpoint.getTurns() == null || checkpoint.getTurns().isEmpty()) {
            throw new IllegalStateException("checkpoint of session " + sessionId + " has no turns");
        }
        ReasoningProvider provider = requireProvider();

        Session session = newSession(sessionId, root, provider, options);
        session.getContext().restore(checkpoint.getTurns());
        session.getPlanner().restore(checkpoint.getPlan());
        log.info("session.resume sessionId={} turns={} previousStatus={}",
                sessionId, checkpoint.getTurns().size(), checkpoint.getStatus());
        launch(session, provider);
        return session;
    }

    public Session get(String sessionId) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    public SessionView status(String sessionId) {
        return SessionView.of(get(sessionId));
    }

    public List<Turn> turns(String sessionId) {
        return get(sessionId).getContext().turns();
    }

    /**
     * Requests cancellation; in-flight tool calls resolve as CANCELLED and the loop stops at the
     * next Turn boundary. Cancelling a finished session is a no-op.
     */
    public SessionView cancel(String sessionId) {
        Session session = get(sessionId);
        if (!session.getStatus().isTerminal() && session.requestCancel()) {
            int cancelled = dispatcher.cancelSession(sessionId);
            log.info("session.cancel sessionId={} cancelledCalls={}", sessionId, cancelled);
        }
        return SessionView.of(session);
    }

    public void remove(String sessionId) {
        Session session = get(sessionId);
        if (!session.getStatus().isTerminal()) {
            throw new IllegalStateException("session " + sessionId + " is still running");
        }
        sessions.remove(sessionId);
    }

    public List<SessionView> list() {
        return sessions.values().stream().map(SessionView::of).collect(Collectors.toList());
    }

    private Session newSession(String id, Path root, ReasoningProvider provider, SessionOptions options) {
        SessionOptions opts = options == null ? SessionOptions.defaults() : options;
        int maxCycles = opts.getMaxCycles() != null ? opts.getMaxCycles() : properties.getMaxCycles();
        long toolTimeoutMs = opts.getToolTimeoutMs() != null ? opts.getToolTimeoutMs() : properties.getToolTimeoutMs();
        int budget = opts.getContextBudgetTokens() != null
                ? opts.getContextBudgetTokens() : properties.getContext().getBudgetTokens();
        if (maxCycles <= 0 || toolTimeoutMs <= 0 || budget <= 0) {
            throw new IllegalArgumentException("maxCycles, toolTimeoutMs and contextBudgetTokens must be positive");
        }
        ContextManager context = new ContextManager(id, new ProviderTurnSummarizer(provider), properties.getContext());
        TaskPlanner planner = new TaskPlanner(id, bus);
        return new Session(id, root, context, planner, maxCycles, Duration.ofMillis(toolTimeoutMs), budget);
    }

    private void launch(Session session, ReasoningProvider provider) {
        mcpToolLoader.ensureRegistered();
        sessions.put(session.getId(), session);
        AgentLoop loop = new AgentLoop(provider, dispatcher, registry, parser, properties, bus, checkpoints);
        executor.execute(() -> loop.run(session));
    }

    private ReasoningProvider requireProvider() {
        ReasoningProvider provider = providers.getIfAvailable();
        if (provider == null) {
            throw new IllegalStateException("no reasoning provider configured; set coder.llm.api-key");
        }
        return provider;
    }

    private static Path resolveRoot(String projectRoot) {
        if (projectRoot == null || projectRoot.isBlank()) {
            throw new IllegalArgumentException("projectRoot must not be blank");
        }
        Path root = Paths.get(projectRoot).toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("projectRoot is not a directory: " + root);
        }
        return root;
    }
}
