package com.filelog.sdk.client.stream;

import com.filelog.sdk.exception.StreamCloseException;
import com.filelog.sdk.exception.StreamOpenException;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Opens and closes log streams, translating I/O failures into SDK exceptions.
 */
public class StreamController {

    private final LogFileSystem fileSystem;

    public StreamController(LogFileSystem fileSystem) {
        this.fileSystem = fileSystem;
    }

    public LogFileSystem getFileSystem() {
        return fileSystem;
    }

    public boolean isSupported() {
        return fileSystem.isSupported();
    }

    /**
     * Open {@code file} in append mode.
     *
     * @throws StreamOpenException if the file cannot be opened
     */
    public LogStream open(Path file) {
        try {
            return fileSystem.openAppend(file);
        } catch (IOException | SecurityException e) {
            throw new StreamOpenException("Failed to open log file: " + file, e);
        }
    }

    /**
     * Close {@code stream}. The handle is released even when this throws.
     *
     * @throws StreamCloseException if closing reported an error
     */
    public void close(LogStream stream) {
        try {
            stream.close();
        } catch (IOException e) {
            throw new StreamCloseException("Failed to close log file", e);
        }
    }

    /**
     * @return the size of {@code file}, 0 if it does not exist yet
     * @throws StreamOpenException if the size cannot be read
     */
    public long size(Path file) {
        try {
            return fileSystem.size(file);
        } catch (NoSuchFileException e) {
            return 0;
        } catch (IOException | SecurityException e) {
            throw new StreamOpenException("Failed to stat log file: " + file, e);
        }
    }
}
