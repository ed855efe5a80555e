package com.filelog.sdk.client.stream;

import java.io.Closeable;
import java.io.IOException;

/**
 * An open, append-only log file.
 */
public interface LogStream extends Closeable {

    /**
     * Append bytes. Implementations push them to the file before returning.
     */
    void write(byte[] bytes) throws IOException;
}
