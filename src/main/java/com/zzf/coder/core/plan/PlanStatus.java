package com.zzf.coder.core.plan;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PlanStatus {
    PENDING("pending"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    CANCELLED("cancelled");

    private final String wire;

    PlanStatus(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public boolean isFinished() {
        return this == COMPLETED || this == CANCELLED;
    }

    /** Accepts the wire form plus common spellings such as "in-progress" or "done". */
    @JsonCreator
    public static PlanStatus from(String value) {
        if (value == null || value.isBlank()) {
            return PENDING;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        switch (normalized) {
            case "pending":
            case "todo":
                return PENDING;
            case "in_progress":
            case "inprogress":
            case "active":
                return IN_PROGRESS;
            case "completed":
            case "complete":
            case "done":
                return COMPLETED;
            case "cancelled":
            case "canceled":
                return CANCELLED;
            default:
                throw new IllegalArgumentException("unknown plan status '" + value + "'");
        }
    }
}
