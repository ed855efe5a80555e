package com.filelog.sdk.client;

/**
 * Callback invoked when a file line is dropped and will not be written.
 *
 * <p>Implementations must be thread-safe and should not throw exceptions.
 * The default implementation logs a warning via SLF4J.</p>
 */
@FunctionalInterface
public interface LineLossCallback {

    /**
     * Called when a line is lost.
     *
     * @param line   the formatted line that was dropped
     * @param reason a short identifier describing why the line was lost
     *               (e.g. "buffer_full", "closed")
     */
    void onLineLoss(String line, String reason);
}
