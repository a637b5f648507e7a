package com.zzf.coder.bus;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * In-process event bus. Session state changes, plan updates and tool
 * results are published here; subscribers run on the publishing thread.
 */
@Slf4j
@Component
public class AgentBus {

    public static final String SESSION_STATUS = "session.status";
    public static final String PLAN_UPDATED = "plan.updated";
    public static final String TOOL_RESULT = "tool.result";
    public static final String TURN_APPENDED = "turn.appended";

    private final Map<String, List<Subscription>> subscriptions = new ConcurrentHashMap<>();

    @Data
    @AllArgsConstructor
    public static class EventInstance {
        private String type;
        private Object properties;
    }

    public interface Subscription extends Consumer<EventInstance> {}

    /**
     * Delivers to subscribers of {@code type} and to wildcard subscribers.
     * A failing subscriber is logged and never breaks the publisher.
     */
    public void publish(String type, Object properties) {
        EventInstance event = new EventInstance(type, properties);
        for (String key : Arrays.asList(type, "*")) {
            List<Subscription> subs = subscriptions.getOrDefault(key, Collections.emptyList());
            for (Subscription sub : new ArrayList<>(subs)) {
                try {
                    sub.accept(event);
                } catch (RuntimeException e) {
                    log.warn("bus.subscriber.failed type={} err={}", type, e.toString());
                }
            }
        }
    }

    public Runnable subscribe(String type, Subscription callback) {
        subscriptions.computeIfAbsent(type, k -> Collections.synchronizedList(new ArrayList<>())).add(callback);
        return () -> unsubscribe(type, callback);
    }

    public Runnable subscribeAll(Subscription callback) {
        return subscribe("*", callback);
    }

    private void unsubscribe(String type, Subscription callback) {
        List<Subscription> subs = subscriptions.get(type);
        if (subs != null) {
            subs.remove(callback);
        }
    }
}
