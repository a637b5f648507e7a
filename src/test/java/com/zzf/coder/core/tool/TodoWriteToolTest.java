package com.zzf.coder.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.coder.core.plan.PlanItem;
import com.zzf.coder.core.plan.PlanPriority;
import com.zzf.coder.core.plan.PlanStatus;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TodoWriteToolTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final TodoWriteTool tool = new TodoWriteTool();

    @Test
    @SuppressWarnings("unchecked")
    void shouldEchoItemsAsPlanMetadata() throws Exception {
        JsonNode args = mapper.readTree("{\"todos\":["
                + "{\"id\":\"1\",\"content\":\"Read the code\",\"status\":\"completed\"},"
                + "{\"content\":\"Fix the bug\",\"status\":\"in_progress\",\"priority\":\"high\"},"
                + "{\"content\":\"Run tests\"}]}");

        Tool.Result result = tool.execute(args, Tool.Context.builder().build()).get(5, TimeUnit.SECONDS);

        assertEquals("Successfully updated the TODO list with 3 items. 2 todos are not completed.", result.getOutput());
        List<PlanItem> todos = (List<PlanItem>) result.getMetadata().get(TodoWriteTool.TODOS_METADATA);
        assertEquals(3, todos.size());
        assertEquals("1", todos.get(0).getId());
        assertEquals(PlanStatus.COMPLETED, todos.get(0).getStatus());
        assertNull(todos.get(1).getId());
        assertEquals(PlanPriority.HIGH, todos.get(1).getPriority());
        assertEquals(PlanStatus.PENDING, todos.get(2).getStatus());
    }

    @Test
    void shouldReportAllCompleted() throws Exception {
        JsonNode args = mapper.readTree("{\"todos\":[{\"content\":\"done\",\"status\":\"completed\"}]}");

        Tool.Result result = tool.execute(args, Tool.Context.builder().build()).get(5, TimeUnit.SECONDS);

        assertTrue(result.getOutput().endsWith("All todos are completed."));
    }

    @Test
    void shouldRejectDuplicateIds() throws Exception {
        JsonNode args = mapper.readTree("{\"todos\":[{\"id\":\"a\",\"content\":\"x\"},{\"id\":\"a\",\"content\":\"y\"}]}");

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> tool.execute(args, Tool.Context.builder().build()).get(5, TimeUnit.SECONDS));
        assertEquals("duplicate todo id 'a'", error.getCause().getMessage());
    }

    @Test
    void shouldRequireContentThroughSchema() throws Exception {
        List<String> violations = tool.getSchema().validate(mapper.readTree("{\"todos\":[{\"status\":\"pending\"}]}"));

        assertEquals(List.of("missing required argument 'todos[0].content'"), violations);
    }
}
