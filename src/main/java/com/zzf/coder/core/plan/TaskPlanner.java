package com.zzf.coder.core.plan;

import com.zzf.coder.bus.AgentBus;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered todo list of one session. At most one item is in progress at any time:
 * starting an item demotes the one that was running back to pending.
 */
@Slf4j
public class TaskPlanner {
    private static final String ID_PREFIX = "todo_";

    private final String sessionId;
    private final AgentBus bus;
    private final List<PlanItem> items = new ArrayList<>();

    public TaskPlanner(String sessionId, AgentBus bus) {
        this.sessionId = sessionId;
        this.bus = bus;
    }

    /**
     * Replaces the whole plan. Ranked items sort first by rank (stable), unranked keep their order after them.
     */
    public synchronized PlanSnapshot setPlan(List<PlanItem> newItems) {
        List<PlanItem> incoming = newItems == null ? List.of() : newItems;
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < incoming.size(); i++) {
            PlanItem item = incoming.get(i);
            if (item == null || item.getDescription() == null || item.getDescription().isBlank()) {
                throw new IllegalArgumentException("plan item #" + (i + 1) + " has a blank description");
            }
            if (item.getId() != null && !ids.add(item.getId())) {
                throw new IllegalArgumentException("duplicate plan item id '" + item.getId() + "'");
            }
        }

        List<PlanItem> ordered = new ArrayList<>(incoming);
        ordered.sort(Comparator.comparing(PlanItem::getRank, Comparator.nullsLast(Comparator.naturalOrder())));

        List<PlanItem> accepted = new ArrayList<>(ordered.size());
        boolean inProgressSeen = false;
        for (PlanItem item : ordered) {
            PlanItem.PlanItemBuilder b = item.toBuilder();
            if (item.getId() == null) {
                String id = nextId(ids);
                ids.add(id);
                b.id(id);
            }
            if (item.getStatus() == null) {
                b.status(PlanStatus.PENDING);
            } else if (item.getStatus() == PlanStatus.IN_PROGRESS) {
                if (inProgressSeen) {
                    b.status(PlanStatus.PENDING);
                }
                inProgressSeen = true;
            }
            if (item.getPriority() == null) {
                b.priority(PlanPriority.MEDIUM);
            }
            accepted.add(b.build());
        }
        items.clear();
        items.addAll(accepted);
        return changed("set");
    }

    public synchronized PlanItem addItem(String description) {
        return addItem(description, PlanPriority.MEDIUM);
    }

    public synchronized PlanItem addItem(String description, PlanPriority priority) {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("plan item description must not be blank");
        }
        Set<String> ids = new HashSet<>();
        items.forEach(i -> ids.add(i.getId()));
        PlanItem item = PlanItem.builder()
                .id(nextId(ids))
                .description(description.trim())
                .priority(priority == null ? PlanPriority.MEDIUM : priority)
                .build();
        items.add(item);
        changed("add");
        return item;
    }

    public synchronized PlanItem updateItem(String id, PlanStatus status) {
        int index = indexOf(id);
        if (status == PlanStatus.IN_PROGRESS) {
            for (int i = 0; i < items.size(); i++) {
                if (i != index && items.get(i).getStatus() == PlanStatus.IN_PROGRESS) {
                    log.info("plan.demote sessionId={} itemId={}", sessionId, items.get(i).getId());
                    items.set(i, items.get(i).toBuilder().status(PlanStatus.PENDING).build());
                }
            }
        }
        PlanItem updated = items.get(index).toBuilder().status(status).build();
        items.set(index, updated);
        changed("update");
        return updated;
    }

    public synchronized PlanItem complete(String id) {
        return updateItem(id, PlanStatus.COMPLETED);
    }

    /**
     * Moves the named items to the front in the given order; the rest keep their relative order.
     */
    public synchronized PlanSnapshot reorder(List<String> ids) {
        Map<String, PlanItem> byId = new LinkedHashMap<>();
        items.forEach(i -> byId.put(i.getId(), i));
        List<PlanItem> reordered = new ArrayList<>(items.size());
        for (String id : ids) {
            PlanItem item = byId.remove(id);
            if (item == null) {
                if (reordered.stream().anyMatch(i -> i.getId().equals(id))) {
                    throw new IllegalArgumentException("plan item '" + id + "' listed twice");
                }
                throw new UnknownPlanItemException(id);
            }
            reordered.add(item);
        }
        reordered.addAll(byId.values());
        items.clear();
        items.addAll(reordered);
        return changed("reorder");
    }

    public synchronized PlanSnapshot snapshot() {
        return new PlanSnapshot(items);
    }

    public synchronized void restore(PlanSnapshot snapshot) {
        items.clear();
        if (snapshot != null) {
            items.addAll(snapshot.getItems());
        }
    }

    private int indexOf(String id) {
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i).getId().equals(id)) {
                return i;
            }
        }
        throw new UnknownPlanItemException(id);
    }

    private String nextId(Set<String> taken) {
        int n = 1;
        while (taken.contains(ID_PREFIX + n)) {
            n++;
        }
        return ID_PREFIX + n;
    }

    private PlanSnapshot changed(String op) {
        PlanSnapshot snapshot = new PlanSnapshot(items);
        log.debug("plan.{} sessionId={} items={} unfinished={}", op, sessionId, snapshot.getItems().size(), snapshot.getUnfinished());
        if (bus != null) {
            bus.publish(AgentBus.PLAN_UPDATED, Map.of("sessionId", sessionId == null ? "" : sessionId, "plan", snapshot));
        }
        return snapshot;
    }
}
