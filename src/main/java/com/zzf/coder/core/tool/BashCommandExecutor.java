package com.zzf.coder.core.tool;

import com.zzf.coder.shell.ShellService;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Runs one shell command per call with stdout and stderr captured separately.
 * Running processes are keyed by session and call so a cancel can kill the tree.
 */
@Slf4j
final class BashCommandExecutor {

    private final ShellService shellService;
    private final Map<String, Process> running = new ConcurrentHashMap<>();
    private final Map<String, Boolean> cancelled = new ConcurrentHashMap<>();

    BashCommandExecutor(ShellService shellService) {
        this.shellService = shellService;
    }

    void cancel(String sessionID, String callID) {
        String prefix = key(sessionID, "");
        for (Map.Entry<String, Process> entry : running.entrySet()) {
            boolean match = callID == null || callID.isBlank()
                    ? entry.getKey().startsWith(prefix)
                    : entry.getKey().equals(key(sessionID, callID));
            if (match) {
                cancelled.put(entry.getKey(), Boolean.TRUE);
                shellService.killTree(entry.getValue());
            }
        }
    }

    int runningCount() {
        return running.size();
    }

    ExecutionResult execute(String command, String shell, Path workdir, long timeoutMs, int outputLimit,
                            String sessionID, String callID) throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(shellService.commandLine(shell, command));
        pb.directory(workdir.toFile());
        pb.redirectInput(ProcessBuilder.Redirect.PIPE);

        long startedAt = System.currentTimeMillis();
        Process process = pb.start();
        process.getOutputStream().close();
        String key = key(sessionID, callID);
        running.put(key, process);

        CappedCapture stdout = new CappedCapture(process.getInputStream(), outputLimit, "coder-bash-out-" + callID);
        CappedCapture stderr = new CappedCapture(process.getErrorStream(), outputLimit, "coder-bash-err-" + callID);
        try {
            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                shellService.killTree(process);
            }
            stdout.await();
            stderr.await();
            boolean wasCancelled = cancelled.remove(key) != null;
            int exitCode = finished ? process.exitValue() : -1;
            return new ExecutionResult(exitCode, stdout.text(), stderr.text(), !finished, wasCancelled,
                    System.currentTimeMillis() - startedAt);
        } catch (InterruptedException e) {
            shellService.killTree(process);
            throw e;
        } finally {
            running.remove(key, process);
            cancelled.remove(key);
        }
    }

    private static String key(String sessionID, String callID) {
        return (sessionID == null ? "" : sessionID) + ":" + (callID == null ? "" : callID);
    }

    /** Drains a stream on its own thread, keeping at most {@code limit} chars. */
    private static final class CappedCapture implements Runnable {
        private final InputStream in;
        private final int limit;
        private final StringBuilder kept = new StringBuilder();
        private long dropped;
        private final Thread thread;

        CappedCapture(InputStream in, int limit, String name) {
            this.in = in;
            this.limit = limit;
            this.thread = new Thread(this, name);
            this.thread.setDaemon(true);
            this.thread.start();
        }

        @Override
        public void run() {
            char[] buf = new char[4096];
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                int n;
                while ((n = reader.read(buf)) != -1) {
                    synchronized (this) {
                        int room = Math.max(0, limit - kept.length());
                        int take = Math.min(room, n);
                        kept.append(buf, 0, take);
                        dropped += n - take;
                    }
                }
            } catch (IOException e) {
                // stream closed by a killed process
                log.debug("bash.capture.closed thread={} err={}", thread.getName(), e.toString());
            }
        }

        void await() throws InterruptedException {
            thread.join(2_000);
        }

        synchronized String text() {
            if (dropped == 0) {
                return kept.toString();
            }
            return kept + "\n... [truncated " + dropped + " chars]";
        }
    }

    static final class ExecutionResult {
        final int exitCode;
        final String stdout;
        final String stderr;
        final boolean timedOut;
        final boolean cancelled;
        final long durationMs;

        ExecutionResult(int exitCode, String stdout, String stderr, boolean timedOut, boolean cancelled, long durationMs) {
            this.exitCode = exitCode;
            this.stdout = stdout;
            this.stderr = stderr;
            this.timedOut = timedOut;
            this.cancelled = cancelled;
            this.durationMs = durationMs;
        }

        String render() {
            StringBuilder sb = new StringBuilder("Exit code: ").append(exitCode);
            if (!stdout.isEmpty()) {
                sb.append("\n\nSTDOUT:\n").append(stdout);
            }
            if (!stderr.isEmpty()) {
                sb.append("\n\nSTDERR:\n").append(stderr);
            }
            return sb.toString();
        }
    }
}
