package com.minijs.debug;

import java.io.PrintStream;

/** Writes one line per message: {@code LEVEL tag: message}. Errors append their stack trace. */
public final class PrintStreamDebugSink implements DebugSink {

    private final PrintStream out;

    public PrintStreamDebugSink(PrintStream out) {
        if (out == null) throw new IllegalArgumentException("out must not be null");
        this.out = out;
    }

    @Override
    public void log(DebugLevel level, String tag, String message, Throwable error) {
        synchronized (out) {
            out.println(level + " " + tag + ": " + message);
            if (error != null) error.printStackTrace(out);
        }
    }
}
