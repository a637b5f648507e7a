package com.zzf.coder.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.coder.core.plan.PlanItem;
import com.zzf.coder.core.plan.PlanStatus;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * TodoWriteTool: restates the whole todo list. The tool only validates and echoes the
 * items under the {@link #TODOS_METADATA} key; the agent loop applies them to the session plan.
 */
@Component
public class TodoWriteTool implements Tool {
    public static final String ID = "todo_write";
    public static final String TODOS_METADATA = "todos";

    private static final ToolSchema ITEM = ToolSchema.builder()
            .optional("id", ToolSchema.Type.ANY, "Stable id of the item; omit for new items")
            .required("content", ToolSchema.Type.STRING, "What needs to be done")
            .optionalEnum("status", "pending, in_progress, completed or cancelled",
                    List.of("pending", "in_progress", "completed", "cancelled"))
            .optionalEnum("priority", "low, medium or high", List.of("low", "medium", "high"))
            .additionalProperties(true)
            .build();

    private static final ToolSchema SCHEMA = ToolSchema.builder()
            .requiredArray("todos", ITEM, "The complete, updated TODO list")
            .build();

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDescription() {
        return ToolDescriptions.load(getId(),
                "Updates the entire TODO list with the latest items. Keep exactly one item in_progress while working.");
    }

    @Override
    public ToolSchema getSchema() {
        return SCHEMA;
    }

    @Override
    public CompletableFuture<Result> execute(JsonNode args, Context ctx) {
        List<PlanItem> todos = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        int index = 0;
        for (JsonNode node : args.path("todos")) {
            index++;
            PlanItem item = PlanItem.fromJson(node);
            if (item.getDescription() == null) {
                return CompletableFuture.failedFuture(new ToolExecutionException("todo #" + index + " has blank content"));
            }
            if (item.getId() != null && !ids.add(item.getId())) {
                return CompletableFuture.failedFuture(new ToolExecutionException("duplicate todo id '" + item.getId() + "'"));
            }
            todos.add(item);
        }

        long unfinished = todos.stream().filter(t -> !t.getStatus().isFinished()).count();
        long inProgress = todos.stream().filter(t -> t.getStatus() == PlanStatus.IN_PROGRESS).count();
        StringBuilder message = new StringBuilder("Successfully updated the TODO list with ")
                .append(todos.size()).append(" items.");
        if (unfinished > 0) {
            message.append(' ').append(unfinished).append(unfinished == 1 ? " todo is" : " todos are").append(" not completed.");
        } else {
            message.append(" All todos are completed.");
        }
        if (inProgress > 1) {
            message.append(" Only the first in_progress item stays in progress; the others are set back to pending.");
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(TODOS_METADATA, List.copyOf(todos));
        return CompletableFuture.completedFuture(Result.builder()
                .title("todo_write")
                .output(message.toString())
                .metadata(metadata)
                .build());
    }
}
