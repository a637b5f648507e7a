package com.zzf.coder.core.tool;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * A single capability the agent can invoke. Arguments arrive already validated
 * against {@link #getSchema()}; failures are signalled by completing the future
 * exceptionally, preferably with a {@link ToolExecutionException}.
 */
public interface Tool {

    @Data
    @Builder(toBuilder = true)
    @AllArgsConstructor
    @NoArgsConstructor
    class Context {
        private String sessionID;
        private String callID;
        private long turnSeq;
        private Path projectRoot;
        private Executor executor;
        private Map<String, Object> extra;

        public <T> CompletableFuture<T> async(Supplier<T> work) {
            if (executor == null) {
                return CompletableFuture.supplyAsync(work);
            }
            return CompletableFuture.supplyAsync(work, executor);
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    class Result {
        private String title;
        private String output;
        private Map<String, Object> metadata;
    }

    String getId();

    String getDescription();

    ToolSchema getSchema();

    CompletableFuture<Result> execute(JsonNode args, Context ctx);

    default void cancel(String sessionID, String callID) {
        // Optional cancellation hook for long-running tools.
    }
}
