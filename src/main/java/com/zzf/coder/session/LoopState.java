package com.zzf.coder.session;

public enum LoopState {
    AWAITING_REASONING,
    DISPATCHING_TOOLS,
    DONE,
    FAILED,
    CANCELLED
}
