package com.filelog.sdk.client;

import com.filelog.sdk.model.LogLevel;
import com.filelog.sdk.model.LogPayload;
import com.filelog.sdk.model.MemoryUsage;

import java.lang.ref.WeakReference;
import java.nio.file.Path;

/**
 * Module-scoped view of a {@link FileLogger}. Every line it writes is tagged with the
 * module name.
 *
 * <p>The context holds only a weak reference to its logger. Once the logger has been
 * garbage collected, every call on the context does nothing.</p>
 */
public class LoggerContext {

    private final WeakReference<FileLogger> logger;
    private final String module;

    LoggerContext(FileLogger logger, String module) {
        this.logger = new WeakReference<>(logger);
        this.module = module;
    }

    public String getModule() {
        return module;
    }

    public void open() {
        FileLogger target = logger.get();
        if (target != null) {
            target.open();
        }
    }

    public void close() {
        FileLogger target = logger.get();
        if (target != null) {
            target.close();
        }
    }

    public void setFile(Path file) {
        FileLogger target = logger.get();
        if (target != null) {
            target.setFile(file);
        }
    }

    public void setLevel(String level) {
        FileLogger target = logger.get();
        if (target != null) {
            target.setLevel(level);
        }
    }

    public void error(Object... args) {
        log(LogLevel.ERROR, LogPayload.args(args));
    }

    public void error(Throwable err) {
        log(LogLevel.ERROR, payloadOf(err));
    }

    public void warning(Object... args) {
        log(LogLevel.WARNING, LogPayload.args(args));
    }

    public void warning(Throwable err) {
        log(LogLevel.WARNING, payloadOf(err));
    }

    public void info(Object... args) {
        log(LogLevel.INFO, LogPayload.args(args));
    }

    public void info(Throwable err) {
        log(LogLevel.INFO, payloadOf(err));
    }

    public void debug(Object... args) {
        log(LogLevel.DEBUG, LogPayload.args(args));
    }

    public void debug(Throwable err) {
        log(LogLevel.DEBUG, payloadOf(err));
    }

    public void spam(Object... args) {
        log(LogLevel.SPAM, LogPayload.args(args));
    }

    public void spam(Throwable err) {
        log(LogLevel.SPAM, payloadOf(err));
    }

    public void log(LogLevel level, LogPayload payload) {
        FileLogger target = logger.get();
        if (target != null) {
            target.log(level, module, payload);
        }
    }

    /**
     * Create a sibling context on the same logger. Returns {@code null} once the logger
     * has been collected.
     */
    public LoggerContext context(String name) {
        FileLogger target = logger.get();
        return target != null ? target.context(name) : null;
    }

    public MemoryUsage memoryUsage() {
        return MemoryUsage.current();
    }

    /**
     * Log the current memory usage under this module at the {@code debug} level.
     */
    public void memory() {
        FileLogger target = logger.get();
        if (target != null) {
            target.memory(module);
        }
    }

    private static LogPayload payloadOf(Throwable err) {
        return err != null ? LogPayload.error(err) : LogPayload.args("null");
    }

    @Override
    public String toString() {
        return "LoggerContext{module='" + module + "'}";
    }
}
