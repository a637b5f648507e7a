package com.zzf.coder.session;

import com.zzf.coder.core.context.ContextManager;
import com.zzf.coder.core.plan.TaskPlanner;
import lombok.Getter;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One agent run: owns its context and plan. Status fields are written by the loop thread
 * only and read from anywhere.
 */
@Getter
public class Session {
    private final String id;
    private final Path projectRoot;
    private final long createdAt;
    private final ContextManager context;
    private final TaskPlanner planner;
    private final int maxCycles;
    private final Duration toolTimeout;
    private final int contextBudgetTokens;

    private volatile SessionStatus status = SessionStatus.RUNNING;
    private volatile LoopState state = LoopState.AWAITING_REASONING;
    private volatile FailureReason failureReason;
    private volatile String failureMessage;
    private volatile String finalAnswer;
    private volatile int cyclesCompleted;

    @Getter(lombok.AccessLevel.NONE)
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    @Getter(lombok.AccessLevel.NONE)
    private final List<String> notes = new ArrayList<>();
    @Getter(lombok.AccessLevel.NONE)
    private final CompletableFuture<Session> completion = new CompletableFuture<>();

    public Session(String id, Path projectRoot, ContextManager context, TaskPlanner planner,
                   int maxCycles, Duration toolTimeout, int contextBudgetTokens) {
        this.id = id;
        this.projectRoot = projectRoot;
        this.createdAt = System.currentTimeMillis();
        this.context = context;
        this.planner = planner;
        this.maxCycles = maxCycles;
        this.toolTimeout = toolTimeout;
        this.contextBudgetTokens = contextBudgetTokens;
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    /** Returns false when cancellation was already requested. */
    boolean requestCancel() {
        return cancelRequested.compareAndSet(false, true);
    }

    /** Completes once the loop has reached a terminal state. */
    public CompletableFuture<Session> completion() {
        return completion;
    }

    void addNote(String note) {
        synchronized (notes) {
            notes.add(note);
        }
    }

    List<String> drainNotes() {
        synchronized (notes) {
            List<String> drained = List.copyOf(notes);
            notes.clear();
            return drained;
        }
    }

    void setState(LoopState state) {
        this.state = state;
    }

    void cycleCompleted() {
        cyclesCompleted++;
    }

    void restoreCycles(int cycles) {
        this.cyclesCompleted = cycles;
    }

    void complete(String answer) {
        this.finalAnswer = answer;
        this.state = LoopState.DONE;
        this.status = SessionStatus.COMPLETED;
    }

    void fail(FailureReason reason, String message) {
        this.failureReason = reason;
        this.failureMessage = message;
        this.state = LoopState.FAILED;
        this.status = SessionStatus.FAILED;
    }

    void cancelled() {
        this.state = LoopState.CANCELLED;
        this.status = SessionStatus.CANCELLED;
    }

    void markFinished() {
        completion.complete(this);
    }
}
