package com.xmas.debug;

import java.io.PrintStream;

/**
 * Writes every record at or above a minimum level as one line:
 * {@code DEBUG: message} for DEBUG records, {@code LEVEL [tag]: message} for
 * everything else. The default minimum is DEBUG, so TRACE records are dropped.
 */
public final class StderrDebugSink implements DebugSink {

    private final PrintStream out;
    private final DebugLevel minLevel;

    public StderrDebugSink() {
        this(System.err);
    }

    public StderrDebugSink(PrintStream out) {
        this(out, DebugLevel.DEBUG);
    }

    public StderrDebugSink(PrintStream out, DebugLevel minLevel) {
        this.out = out;
        this.minLevel = minLevel;
    }

    @Override
    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (level.compareTo(minLevel) < 0) return;
        if (level == DebugLevel.DEBUG) {
            out.println("DEBUG: " + message);
        } else {
            out.println(level + " [" + tag + "]: " + message);
        }
        if (error != null) error.printStackTrace(out);
    }
}
