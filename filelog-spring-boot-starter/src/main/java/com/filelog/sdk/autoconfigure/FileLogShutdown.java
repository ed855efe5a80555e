package com.filelog.sdk.autoconfigure;

import com.filelog.sdk.client.FileLogger;
import org.springframework.context.SmartLifecycle;

/**
 * Closes the logger late in context shutdown, after the beans that log through it have stopped.
 */
final class FileLogShutdown implements SmartLifecycle {
    private final FileLogger fileLogger;
    private volatile boolean running = true;

    FileLogShutdown(FileLogger fileLogger) {
        this.fileLogger = fileLogger;
    }

    @Override
    public void start() {
        running = true;
    }

    @Override
    public void stop() {
        if (running) {
            running = false;
            fileLogger.shutdown();
        }
    }

    @Override
    public void stop(Runnable callback) {
        stop();
        callback.run();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
