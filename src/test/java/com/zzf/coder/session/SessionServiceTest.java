package com.zzf.coder.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.coder.bus.AgentBus;
import com.zzf.coder.config.AgentProperties;
import com.zzf.coder.config.ToolProperties;
import com.zzf.coder.core.context.Turn;
import com.zzf.coder.core.mcp.McpToolLoader;
import com.zzf.coder.core.reasoning.ReasoningProvider;
import com.zzf.coder.core.reasoning.ReasoningReplyParser;
import com.zzf.coder.core.tool.ListTool;
import com.zzf.coder.core.tool.ToolDispatcher;
import com.zzf.coder.core.tool.ToolRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.ObjectProvider;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SessionServiceTest {

    private static final String LIST_FILES = "{\"type\":\"tool\",\"toolCalls\":[{\"tool\":\"ls\",\"args\":{}}]}";
    private static final String FINAL = "{\"type\":\"final\",\"finalAnswer\":\"done\"}";

    private final ObjectMapper mapper = new ObjectMapper();
    private final AgentProperties properties = new AgentProperties();
    private final ReasoningProvider provider = mock(ReasoningProvider.class);
    private final McpToolLoader mcpToolLoader = mock(McpToolLoader.class);
    private ExecutorService toolExecutor;
    private ExecutorService sessionExecutor;
    private ObjectProvider<ReasoningProvider> providers;
    private SessionService service;

    @TempDir
    Path root;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() throws Exception {
        Files.writeString(root.resolve("notes.txt"), "hello");
        properties.getCheckpoint().setEnabled(true);
        toolExecutor = Executors.newCachedThreadPool();
        sessionExecutor = Executors.newCachedThreadPool();
        providers = mock(ObjectProvider.class);
        when(providers.getIfAvailable()).thenReturn(provider);

        AgentBus bus = new AgentBus();
        ToolRegistry registry = new ToolRegistry();
        registry.register(new ListTool());
        ToolDispatcher dispatcher = new ToolDispatcher(registry, new ToolProperties(), toolExecutor, bus);
        service = new SessionService(providers, dispatcher, registry, new ReasoningReplyParser(mapper), properties, bus,
                new SessionCheckpointStore(mapper, properties), mcpToolLoader, sessionExecutor);
    }

    @AfterEach
    void tearDown() {
        toolExecutor.shutdownNow();
        sessionExecutor.shutdownNow();
    }

    @Test
    void shouldRunSessionToCompletion() throws Exception {
        when(provider.complete(any())).thenReturn(LIST_FILES, FINAL);

        Session session = service.start("what is in this project?", root.toString(), null);
        session.completion().get(5, TimeUnit.SECONDS);

        SessionView view = service.status(session.getId());
        assertEquals(SessionStatus.COMPLETED, view.getStatus());
        assertEquals("done", view.getFinalAnswer());
        assertEquals(3, view.getTurnCount());
        assertEquals(3, service.turns(session.getId()).size());
        assertEquals(1, service.list().size());
        assertTrue(session.getId().startsWith("session_"));
        assertTrue(Files.isRegularFile(root.resolve(".coder-agent/sessions/" + session.getId() + ".json")));
        verify(mcpToolLoader).ensureRegistered();
    }

    @Test
    void shouldCancelWhileWaitingForProvider() throws Exception {
        CountDownLatch called = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(provider.complete(any())).thenAnswer(inv -> {
            called.countDown();
            release.await(5, TimeUnit.SECONDS);
            return LIST_FILES;
        });

        Session session = service.start("list files", root.toString(), null);
        assertTrue(called.await(5, TimeUnit.SECONDS));
        service.cancel(session.getId());
        release.countDown();
        session.completion().get(5, TimeUnit.SECONDS);

        assertEquals(SessionStatus.CANCELLED, session.getStatus());
        assertEquals(1, session.getContext().turns().size());
        // second cancel is a no-op
        assertEquals(SessionStatus.CANCELLED, service.cancel(session.getId()).getStatus());
    }

    @Test
    void shouldApplyOptionOverrides() throws Exception {
        when(provider.complete(any())).thenReturn(LIST_FILES);

        Session session = service.start("loop forever", root.toString(),
                SessionOptions.builder().maxCycles(2).toolTimeoutMs(5_000L).build());
        session.completion().get(5, TimeUnit.SECONDS);

        assertEquals(FailureReason.BUDGET_EXCEEDED, session.getFailureReason());
        assertEquals(2, session.getCyclesCompleted());
    }

    @Test
    void shouldResumeFailedSessionFromCheckpoint() throws Exception {
        when(provider.complete(any())).thenReturn(LIST_FILES, FINAL);
        Session first = service.start("list files", root.toString(), SessionOptions.builder().maxCycles(1).build());
        first.completion().get(5, TimeUnit.SECONDS);
        assertEquals(FailureReason.BUDGET_EXCEEDED, first.getFailureReason());

        Session resumed = service.resume(first.getId(), root.toString(), null);
        resumed.completion().get(5, TimeUnit.SECONDS);

        assertEquals(SessionStatus.COMPLETED, resumed.getStatus());
        List<Turn> turns = resumed.getContext().turns();
        assertEquals(3, turns.size());
        assertEquals("list files", turns.get(0).getContent());
        assertThrows(IllegalStateException.class, () -> service.resume(first.getId(), root.toString(), null));
    }

    @Test
    void shouldRejectInvalidRequests() {
        assertThrows(IllegalArgumentException.class, () -> service.start(" ", root.toString(), null));
        assertThrows(IllegalArgumentException.class, () -> service.start("go", root.resolve("missing").toString(), null));
        assertThrows(IllegalArgumentException.class,
                () -> service.start("go", root.toString(), SessionOptions.builder().maxCycles(0).build()));
        assertThrows(SessionNotFoundException.class, () -> service.status("session_unknown"));
        assertThrows(SessionNotFoundException.class, () -> service.resume("session_unknown", root.toString(), null));
    }

    @Test
    void shouldRequireProvider() {
        when(providers.getIfAvailable()).thenReturn(null);

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> service.start("go", root.toString(), null));
        assertTrue(e.getMessage().contains("coder.llm.api-key"));
    }

    @Test
    void shouldRemoveOnlyFinishedSessions() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(provider.complete(any())).thenAnswer(inv -> {
            release.await(5, TimeUnit.SECONDS);
            return FINAL;
        });
        Session session = service.start("answer", root.toString(), null);

        assertThrows(IllegalStateException.class, () -> service.remove(session.getId()));
        release.countDown();
        session.completion().get(5, TimeUnit.SECONDS);
        service.remove(session.getId());
        assertThrows(SessionNotFoundException.class, () -> service.get(session.getId()));
    }
}
