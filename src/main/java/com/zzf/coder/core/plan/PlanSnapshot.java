package com.zzf.coder.core.plan;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Immutable view of the plan at one instant.
 */
public final class PlanSnapshot {
    private final List<PlanItem> items;

    @JsonCreator
    public PlanSnapshot(@JsonProperty("items") List<PlanItem> items) {
        this.items = items == null ? List.of() : List.copyOf(items);
    }

    public static PlanSnapshot empty() {
        return new PlanSnapshot(List.of());
    }

    public List<PlanItem> getItems() {
        return items;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return items.isEmpty();
    }

    public long count(PlanStatus status) {
        return items.stream().filter(i -> i.getStatus() == status).count();
    }

    @JsonIgnore
    public long getUnfinished() {
        return items.stream().filter(i -> !i.getStatus().isFinished()).count();
    }

    @JsonIgnore
    public PlanItem getInProgress() {
        return items.stream().filter(i -> i.getStatus() == PlanStatus.IN_PROGRESS).findFirst().orElse(null);
    }

    /** Numbered checklist used in prompts. */
    public String render() {
        if (items.isEmpty()) {
            return "(no plan yet)";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < items.size(); i++) {
            PlanItem item = items.get(i);
            sb.append(i + 1).append(". ").append(marker(item.getStatus())).append(' ')
                    .append(item.getDescription())
                    .append(" (id=").append(item.getId())
                    .append(", ").append(item.getStatus().wire())
                    .append(", ").append(item.getPriority().wire()).append(")");
            if (i < items.size() - 1) {
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    /** Reminder appended to tool results while work is left; empty when all items are finished. */
    public String reminder() {
        long unfinished = getUnfinished();
        if (unfinished == 0) {
            return "";
        }
        return "\n\nIMPORTANT:\n- " + unfinished + " todo" + (unfinished == 1 ? " is" : "s are")
                + " not completed. Before you present the final result to the user, **make sure** all the todos are completed."
                + "\n- Immediately update the TODO list using the `todo_write` tool.";
    }

    private static String marker(PlanStatus status) {
        switch (status) {
            case IN_PROGRESS:
                return "[>]";
            case COMPLETED:
                return "[x]";
            case CANCELLED:
                return "[-]";
            default:
                return "[ ]";
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PlanSnapshot && items.equals(((PlanSnapshot) o).items);
    }

    @Override
    public int hashCode() {
        return items.hashCode();
    }
}
