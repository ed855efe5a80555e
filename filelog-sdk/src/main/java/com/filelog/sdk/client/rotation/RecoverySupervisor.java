package com.filelog.sdk.client.rotation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Holds at most one pending reopen attempt.
 */
public class RecoverySupervisor {

    private static final Logger log = LoggerFactory.getLogger(RecoverySupervisor.class);

    private final ScheduledExecutorService scheduler;
    private final long retryDelayMs;
    private ScheduledFuture<?> pending;

    public RecoverySupervisor(ScheduledExecutorService scheduler, long retryDelayMs) {
        this.scheduler = scheduler;
        this.retryDelayMs = retryDelayMs;
    }

    /**
     * Run {@code attempt} after the retry delay, unless an attempt is already pending.
     *
     * @return true if a new attempt was scheduled
     */
    public synchronized boolean schedule(Runnable attempt) {
        if (pending != null) {
            return false;
        }
        try {
            pending = scheduler.schedule(() -> {
                synchronized (this) {
                    pending = null;
                }
                attempt.run();
            }, retryDelayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Retry scheduler rejected reopen attempt; log file stays closed");
            return false;
        }
        log.debug("Scheduled log file reopen in {}ms", retryDelayMs);
        return true;
    }

    public synchronized void cancel() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }

    public synchronized boolean isPending() {
        return pending != null;
    }

    public long getRetryDelayMs() {
        return retryDelayMs;
    }
}
