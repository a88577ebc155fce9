package com.minijs.debug;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Global debug hub for all MiniJs components.
 *
 * - Singleton access via Debug.get()
 * - Pluggable sink via setSink(...)
 * - Messages below the configured minimum level never reach the sink
 * - Safe default (no-op) if no sink installed
 */
public final class Debug {

    // Must be initialised before INSTANCE, whose constructor reads it.
    private static final DebugSink NOOP = (level, tag, message, error) -> {
        // intentionally empty
    };

    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(NOOP);
    private volatile DebugLevel minLevel = DebugLevel.TRACE;

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    public void setSink(DebugSink sink) {
        sinkRef.set(sink == null ? NOOP : sink);
    }

    public DebugSink getSink() {
        return sinkRef.get();
    }

    public void setMinLevel(DebugLevel level) {
        this.minLevel = (level == null) ? DebugLevel.TRACE : level;
    }

    public DebugLevel getMinLevel() {
        return minLevel;
    }

    /** Lets callers skip building expensive messages. */
    public boolean isEnabled(DebugLevel level) {
        return sinkRef.get() != NOOP && level.atLeast(minLevel);
    }

    // Convenience methods
    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO,  tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (!level.atLeast(minLevel)) return;
        sinkRef.get().log(level, tag, message, error);
    }
}
