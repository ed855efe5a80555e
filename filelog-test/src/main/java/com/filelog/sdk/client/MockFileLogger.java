package com.filelog.sdk.client;

import com.filelog.sdk.client.stream.LogFileSystem;
import com.filelog.sdk.config.LoggerOptions;
import com.filelog.sdk.model.LogLevel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory FileLogger for tests. Opened at level spam, never touches the
 * console or the file system, and keeps every emitted line.
 */
public class MockFileLogger extends FileLogger {

    private final CopyOnWriteArrayList<CapturedLine> capturedLines = new CopyOnWriteArrayList<>();

    public MockFileLogger() {
        this(LogLevel.SPAM);
    }

    public MockFileLogger(LogLevel level) {
        super(FileLogger.builder()
                .options(LoggerOptions.builder()
                        .level(level)
                        .console(false)
                        .build())
                .fileSystem(LogFileSystem.unsupported())
                .registerShutdownHook(false));
        open();
    }

    @Override
    protected void emit(LogLevel level, String module, String message) {
        capturedLines.add(new CapturedLine(level, module, message));
    }

    public List<CapturedLine> getCapturedLines() {
        return Collections.unmodifiableList(capturedLines);
    }

    public List<CapturedLine> getLinesForModule(String module) {
        List<CapturedLine> matches = new ArrayList<>();
        for (CapturedLine line : capturedLines) {
            if (module.equals(line.module())) {
                matches.add(line);
            }
        }
        return matches;
    }

    public List<CapturedLine> getLinesAtLevel(LogLevel level) {
        List<CapturedLine> matches = new ArrayList<>();
        for (CapturedLine line : capturedLines) {
            if (line.level() == level) {
                matches.add(line);
            }
        }
        return matches;
    }

    public void reset() {
        capturedLines.clear();
    }

    public void assertLineCount(int expected) {
        int actual = capturedLines.size();
        if (actual != expected) {
            throw new AssertionError("Expected " + expected + " lines but found " + actual);
        }
    }

    public void assertLogged(LogLevel level, String messageFragment) {
        for (CapturedLine line : capturedLines) {
            if (line.level() == level && line.message().contains(messageFragment)) {
                return;
            }
        }
        throw new AssertionError("Expected " + level.getValue() + " line containing '" + messageFragment + "'");
    }

    public void assertNothingLogged() {
        assertLineCount(0);
    }

    /**
     * A line as it reached the sinks. {@code module} is null outside a context.
     */
    public record CapturedLine(LogLevel level, String module, String message) {
    }
}
