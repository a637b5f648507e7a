package com.zzf.coder.core.plan;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PlanPriority {
    LOW, MEDIUM, HIGH;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PlanPriority from(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        try {
            return PlanPriority.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown plan priority '" + value + "'");
        }
    }
}
