package com.zzf.coder.core.plan;

public class UnknownPlanItemException extends RuntimeException {
    private final String itemId;

    public UnknownPlanItemException(String itemId) {
        super("unknown plan item '" + itemId + "'");
        this.itemId = itemId;
    }

    public String getItemId() {
        return itemId;
    }
}
