package com.zzf.coder.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.coder.config.ToolProperties;
import com.zzf.coder.core.util.JsonUtils;
import com.zzf.coder.shell.ShellService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * BashTool: runs a shell command in the project root.
 */
@Component
@Slf4j
public class BashTool implements Tool {

    private static final ToolSchema SCHEMA = ToolSchema.builder()
            .required("command", ToolSchema.Type.STRING, "The command to execute")
            .optional("timeout", ToolSchema.Type.INTEGER, "Optional timeout in milliseconds")
            .build();

    private final ShellService shellService;
    private final ToolProperties properties;
    private final BashCommandExecutor executor;

    public BashTool(ShellService shellService, ToolProperties properties) {
        this.shellService = shellService;
        this.properties = properties;
        this.executor = new BashCommandExecutor(shellService);
    }

    @Override
    public String getId() {
        return "bash";
    }

    @Override
    public String getDescription() {
        return ToolDescriptions.load(getId(),
                "Executes a shell command in the project root and returns its exit code, stdout and stderr.");
    }

    @Override
    public ToolSchema getSchema() {
        return SCHEMA;
    }

    @Override
    public CompletableFuture<Result> execute(JsonNode args, Context ctx) {
        return ctx.async(() -> {
            String command = JsonUtils.text(args, "command", "");
            if (command.isBlank()) {
                throw new ToolExecutionException("command must not be blank");
            }
            ToolProperties.Bash bash = properties.getBash();
            Long requested = JsonUtils.longOrNull(args, "timeout");
            long timeoutMs = requested != null && requested > 0 ? requested : bash.getDefaultTimeoutMs();
            String shell = bash.getShell() == null || bash.getShell().isBlank() ? shellService.preferred() : bash.getShell();
            Path workdir = ToolPathResolver.projectRoot(ctx);

            log.info("bash.exec sessionId={} callId={} shell={} timeoutMs={}", ctx.getSessionID(), ctx.getCallID(), shell, timeoutMs);
            BashCommandExecutor.ExecutionResult result;
            try {
                result = executor.execute(command, shell, workdir, timeoutMs, bash.getOutputLimitChars(),
                        ctx.getSessionID(), ctx.getCallID());
            } catch (IOException e) {
                throw new ToolExecutionException("failed to start shell '" + shell + "': " + e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ToolExecutionException("command interrupted");
            }

            String output = result.render();
            if (result.cancelled) {
                throw new ToolExecutionException("command cancelled", output);
            }
            if (result.timedOut) {
                throw new ToolExecutionException("command timed out after " + timeoutMs + " ms", output);
            }
            if (result.exitCode != 0 && bash.isFailOnNonZeroExit()) {
                throw new ToolExecutionException("command exited with code " + result.exitCode, output);
            }

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("exitCode", result.exitCode);
            metadata.put("shell", shell);
            metadata.put("durationMs", result.durationMs);
            return Result.builder()
                    .title(command)
                    .output(output)
                    .metadata(metadata)
                    .build();
        });
    }

    @Override
    public void cancel(String sessionID, String callID) {
        executor.cancel(sessionID, callID);
    }

    int runningCount() {
        return executor.runningCount();
    }
}
