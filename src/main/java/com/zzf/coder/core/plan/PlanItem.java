package com.zzf.coder.core.plan;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 计划条目. Immutable; the planner swaps items on every change.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PlanItem {
    String id;
    String description;
    @Builder.Default
    PlanStatus status = PlanStatus.PENDING;
    @Builder.Default
    PlanPriority priority = PlanPriority.MEDIUM;
    Integer rank;

    /**
     * Reads an item as the model writes it: the text may come as
     * {@code description}, {@code content} or {@code title}, ids may be numbers.
     */
    public static PlanItem fromJson(JsonNode node) {
        String id = textOrNull(node, "id");
        String description = textOrNull(node, "description");
        if (description == null) {
            description = textOrNull(node, "content");
        }
        if (description == null) {
            description = textOrNull(node, "title");
        }
        JsonNode rank = node.path("rank");
        return PlanItem.builder()
                .id(id)
                .description(description)
                .status(PlanStatus.from(textOrNull(node, "status")))
                .priority(PlanPriority.from(textOrNull(node, "priority")))
                .rank(rank.isNumber() ? rank.asInt() : null)
                .build();
    }

    private static String textOrNull(JsonNode node, String key) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text.trim();
    }
}
