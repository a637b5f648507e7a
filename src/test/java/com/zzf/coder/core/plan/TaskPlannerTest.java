package com.zzf.coder.core.plan;

import com.zzf.coder.bus.AgentBus;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskPlannerTest {

    private final AgentBus bus = new AgentBus();
    private final TaskPlanner planner = new TaskPlanner("s1", bus);

    @Test
    void shouldDemotePreviousItemWhenAnotherStarts() {
        PlanItem a = planner.addItem("write parser");
        PlanItem b = planner.addItem("write tests");

        planner.updateItem(a.getId(), PlanStatus.IN_PROGRESS);
        planner.updateItem(b.getId(), PlanStatus.IN_PROGRESS);

        PlanSnapshot snapshot = planner.snapshot();
        assertEquals(PlanStatus.PENDING, snapshot.getItems().get(0).getStatus());
        assertEquals(PlanStatus.IN_PROGRESS, snapshot.getItems().get(1).getStatus());
        assertEquals(1, snapshot.count(PlanStatus.IN_PROGRESS));
    }

    @Test
    void shouldAssignIdsAndDefaults() {
        PlanItem first = planner.addItem("one");
        PlanItem second = planner.addItem("two", PlanPriority.HIGH);

        assertEquals("todo_1", first.getId());
        assertEquals("todo_2", second.getId());
        assertEquals(PlanStatus.PENDING, first.getStatus());
        assertEquals(PlanPriority.MEDIUM, first.getPriority());
        assertEquals(PlanPriority.HIGH, second.getPriority());
        assertThrows(IllegalArgumentException.class, () -> planner.addItem("  "));
    }

    @Test
    void shouldReplacePlanKeepingOnlyFirstInProgress() {
        planner.setPlan(List.of(
                PlanItem.builder().description("a").status(PlanStatus.IN_PROGRESS).build(),
                PlanItem.builder().id("todo_1").description("b").status(PlanStatus.IN_PROGRESS).build(),
                PlanItem.builder().description("c").build()));

        PlanSnapshot snapshot = planner.snapshot();
        assertEquals(List.of("todo_2", "todo_1", "todo_3"), ids(snapshot));
        assertEquals(PlanStatus.IN_PROGRESS, snapshot.getItems().get(0).getStatus());
        assertEquals(PlanStatus.PENDING, snapshot.getItems().get(1).getStatus());
        assertEquals(3, snapshot.getUnfinished());
    }

    @Test
    void shouldSortRankedItemsFirstAndStably() {
        planner.setPlan(List.of(
                PlanItem.builder().id("u1").description("unranked").build(),
                PlanItem.builder().id("r2").description("second").rank(2).build(),
                PlanItem.builder().id("r1a").description("first a").rank(1).build(),
                PlanItem.builder().id("r1b").description("first b").rank(1).build()));

        assertEquals(List.of("r1a", "r1b", "r2", "u1"), ids(planner.snapshot()));
    }

    @Test
    void shouldRejectInvalidPlansWithoutChangingState() {
        planner.addItem("keep me");

        assertThrows(IllegalArgumentException.class, () -> planner.setPlan(List.of(
                PlanItem.builder().id("x").description("a").build(),
                PlanItem.builder().id("x").description("b").build())));
        assertThrows(IllegalArgumentException.class, () -> planner.setPlan(List.of(
                PlanItem.builder().description(" ").build())));

        assertEquals(List.of("todo_1"), ids(planner.snapshot()));
    }

    @Test
    void shouldRejectUnknownIds() {
        planner.addItem("only");

        UnknownPlanItemException error = assertThrows(UnknownPlanItemException.class,
                () -> planner.updateItem("todo_9", PlanStatus.COMPLETED));
        assertEquals("todo_9", error.getItemId());
        assertThrows(UnknownPlanItemException.class, () -> planner.reorder(List.of("todo_9")));
    }

    @Test
    void shouldReorderNamedItemsToFront() {
        planner.addItem("a");
        planner.addItem("b");
        planner.addItem("c");

        planner.reorder(List.of("todo_3", "todo_1"));

        assertEquals(List.of("todo_3", "todo_1", "todo_2"), ids(planner.snapshot()));
        assertThrows(IllegalArgumentException.class, () -> planner.reorder(List.of("todo_1", "todo_1")));
    }

    @Test
    void shouldRenderChecklistAndReminder() {
        planner.addItem("read");
        PlanItem fix = planner.addItem("fix");
        planner.complete("todo_1");
        planner.updateItem(fix.getId(), PlanStatus.IN_PROGRESS);

        PlanSnapshot snapshot = planner.snapshot();

        assertEquals("1. [x] read (id=todo_1, completed, medium)\n2. [>] fix (id=todo_2, in_progress, medium)",
                snapshot.render());
        assertTrue(snapshot.reminder().contains("1 todo is not completed"));
        planner.complete(fix.getId());
        assertEquals("", planner.snapshot().reminder());
        assertEquals("(no plan yet)", PlanSnapshot.empty().render());
    }

    @Test
    void shouldPublishPlanUpdates() {
        List<Object> events = new ArrayList<>();
        bus.subscribe(AgentBus.PLAN_UPDATED, event -> events.add(event.getProperties()));

        planner.addItem("a");
        planner.complete("todo_1");

        assertEquals(2, events.size());
    }

    @Test
    void shouldRestoreSnapshot() {
        planner.addItem("a");
        PlanSnapshot saved = planner.snapshot();
        planner.addItem("b");

        planner.restore(saved);

        assertEquals(saved, planner.snapshot());
    }

    private static List<String> ids(PlanSnapshot snapshot) {
        return snapshot.getItems().stream().map(PlanItem::getId).collect(Collectors.toList());
    }
}
