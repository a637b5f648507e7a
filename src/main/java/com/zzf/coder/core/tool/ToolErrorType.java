package com.zzf.coder.core.tool;

public enum ToolErrorType {
    VALIDATION_ERROR,
    UNKNOWN_TOOL,
    EXECUTION_ERROR,
    TIMEOUT,
    CANCELLED
}
