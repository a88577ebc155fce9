package com.minijs.debug;

/** Pluggable debug output target (stdout, file, test collector, etc.). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
