package com.filelog.sdk.console;

import com.filelog.sdk.model.LogLevel;

import java.io.PrintStream;

/**
 * Writes errors to stderr and everything else to stdout.
 */
public class StandardConsoleSink implements ConsoleSink {

    private final PrintStream out;
    private final PrintStream err;
    private final boolean interactive;

    public StandardConsoleSink() {
        this(System.out, System.err, System.console() != null);
    }

    public StandardConsoleSink(PrintStream out, PrintStream err, boolean interactive) {
        this.out = out;
        this.err = err;
        this.interactive = interactive;
    }

    @Override
    public void write(LogLevel level, String line) {
        PrintStream target = level == LogLevel.ERROR ? err : out;
        target.print(line);
        target.flush();
    }

    @Override
    public boolean isInteractive() {
        return interactive;
    }
}
