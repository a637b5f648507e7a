package com.zzf.coder.core.context;

public enum TurnRole {
    INSTRUCTION,
    ASSISTANT,
    SYSTEM_SUMMARY
}
