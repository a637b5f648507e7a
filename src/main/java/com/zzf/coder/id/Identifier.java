package com.zzf.coder.id;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 标识符生成器
 */
public final class Identifier {

    private static final AtomicLong counter = new AtomicLong(System.currentTimeMillis());

    private Identifier() {}

    /** Monotonic id, used for session ids so sessions sort by start order. */
    public static String ascending(String prefix) {
        return prefix + "_" + counter.incrementAndGet();
    }
}
