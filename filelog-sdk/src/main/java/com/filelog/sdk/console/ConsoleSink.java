package com.filelog.sdk.console;

import com.filelog.sdk.model.LogLevel;

/**
 * Destination for console lines. Lines arrive fully formatted, newline included.
 */
public interface ConsoleSink {

    void write(LogLevel level, String line);

    /**
     * Whether the sink is attached to an interactive terminal. Colors are only
     * honored when it is.
     */
    boolean isInteractive();
}
