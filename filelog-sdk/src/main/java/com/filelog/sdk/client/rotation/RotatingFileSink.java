package com.filelog.sdk.client.rotation;

import com.filelog.sdk.client.LineLossCallback;
import com.filelog.sdk.client.stream.LogStream;
import com.filelog.sdk.client.stream.StreamController;
import com.filelog.sdk.exception.InvalidStateException;
import com.filelog.sdk.exception.RotationRenameException;
import com.filelog.sdk.exception.StreamCloseException;
import com.filelog.sdk.exception.StreamOpenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Size-bounded, self-rotating log file.
 *
 * <p>Lines are appended on the caller's thread. Once the file reaches {@code maxFileSize}
 * a rotation is handed to the rotation executor: the file is closed, renamed to
 * {@code <base>_<timestamp><ext>}, reopened empty, and old archives are pruned. Lines
 * logged while a rotation is in flight, or while a broken stream waits to be reopened,
 * are held in a {@link WriteBuffer} and written in order once a stream is back.</p>
 *
 * <p>All state is guarded by one lock. Rotation I/O runs outside of it, so writers
 * never wait for a rotation.</p>
 */
public class RotatingFileSink {

    private static final Logger log = LoggerFactory.getLogger(RotatingFileSink.class);

    static final long CLOSE_WAIT_MS = 10_000;

    private final StreamController controller;
    private final RetentionPruner pruner;
    private final RecoverySupervisor recovery;
    private final ExecutorService rotationExecutor;
    private final Clock clock;
    private final LineLossCallback lineLossCallback;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition rotationDone = lock.newCondition();

    // Guarded by lock
    private Path file;
    private long maxFileSize;
    private int maxFiles;
    private boolean open;
    private boolean rotating;
    private boolean rotationQueued;
    private LogStream stream;
    private long fileSize;
    private final WriteBuffer buffer;

    // Metrics
    private final AtomicLong linesWritten = new AtomicLong(0);
    private final AtomicLong linesBuffered = new AtomicLong(0);
    private final AtomicLong linesDropped = new AtomicLong(0);
    private final AtomicLong rotations = new AtomicLong(0);
    private final AtomicLong rotationFailures = new AtomicLong(0);
    private final AtomicLong streamErrors = new AtomicLong(0);

    public RotatingFileSink(StreamController controller,
                            RetentionPruner pruner,
                            RecoverySupervisor recovery,
                            ExecutorService rotationExecutor,
                            Clock clock,
                            int bufferCapacity,
                            LineLossCallback lineLossCallback) {
        this.controller = controller;
        this.pruner = pruner;
        this.recovery = recovery;
        this.rotationExecutor = rotationExecutor;
        this.clock = clock;
        this.buffer = new WriteBuffer(bufferCapacity);
        this.lineLossCallback = lineLossCallback;
    }

    // ========================================================================
    // Configuration
    // ========================================================================

    /**
     * Set the log file location.
     *
     * @throws InvalidStateException if a stream is already open
     */
    public void setFile(Path file) {
        lock.lock();
        try {
            if (stream != null || rotating) {
                throw new InvalidStateException("Log stream has already been created.");
            }
            this.file = file;
        } finally {
            lock.unlock();
        }
    }

    public void setLimits(long maxFileSize, int maxFiles) {
        lock.lock();
        try {
            this.maxFileSize = maxFileSize;
            this.maxFiles = maxFiles;
        } finally {
            lock.unlock();
        }
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    /**
     * Open the sink, acquiring a stream if a file is configured and the file system
     * is supported. Without one the sink opens in console-only mode.
     *
     * @throws StreamOpenException if the file cannot be opened
     */
    public void open() {
        lock.lock();
        try {
            if (file == null || !controller.isSupported() || stream != null || rotating) {
                open = true;
                return;
            }

            long existing = controller.size(file);
            stream = controller.open(file);
            fileSize = existing;
            open = true;
            log.debug("Opened log file {} ({} bytes)", file, existing);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Close the sink and cancel any pending reopen.
     *
     * <p>If a rotation is in flight, waits for it to finish; the rotation sees the sink
     * closed, writes the lines it buffered and closes its new stream.</p>
     *
     * @throws StreamCloseException if closing the file reported an error; the sink
     *         is closed regardless
     */
    public void close() {
        LogStream toClose;
        lock.lock();
        try {
            recovery.cancel();
            open = false;
            rotationQueued = false;

            if (rotating) {
                awaitRotation();
                if (rotating) {
                    log.warn("Log rotation still running after {}ms; it will close its own file", CLOSE_WAIT_MS);
                    return;
                }
            }

            dropBuffered("closed");
            toClose = stream;
            stream = null;
            fileSize = 0;
        } finally {
            lock.unlock();
        }

        if (toClose != null) {
            controller.close(toClose);
        }
    }

    // Called with lock held
    private void awaitRotation() {
        long remaining = TimeUnit.MILLISECONDS.toNanos(CLOSE_WAIT_MS);
        try {
            while (rotating && remaining > 0) {
                remaining = rotationDone.awaitNanos(remaining);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // ========================================================================
    // Write path
    // ========================================================================

    /**
     * Append a formatted line. Never throws and never waits for a rotation.
     */
    public void write(String line) {
        lock.lock();
        try {
            if (!open || file == null || !controller.isSupported()) {
                return;
            }

            if (rotating || stream == null) {
                enqueue(line);
                return;
            }

            byte[] bytes = line.getBytes(StandardCharsets.UTF_8);
            try {
                stream.write(bytes);
            } catch (IOException e) {
                handleStreamError(e, line);
                return;
            }

            fileSize += bytes.length;
            linesWritten.incrementAndGet();
            checkThreshold();
        } finally {
            lock.unlock();
        }
    }

    // Called with lock held
    private void enqueue(String line) {
        if (buffer.offer(line)) {
            linesBuffered.incrementAndGet();
            return;
        }
        linesDropped.incrementAndGet();
        notifyLineLoss(line, "buffer_full");
    }

    // Called with lock held
    private void checkThreshold() {
        // an empty file never crosses, even with a zero limit
        if (stream == null || fileSize == 0 || fileSize < maxFileSize || rotating || rotationQueued) {
            return;
        }
        rotationQueued = true;
        try {
            rotationExecutor.execute(this::rotateQuietly);
        } catch (RejectedExecutionException e) {
            rotationQueued = false;
            log.warn("Rotation executor rejected rotation of {}", file);
        }
    }

    // Called with lock held. Writes buffered lines until the buffer is empty or the stream breaks.
    private void drainBuffer() {
        while (stream != null && !buffer.isEmpty()) {
            String line = buffer.peek();
            byte[] bytes = line.getBytes(StandardCharsets.UTF_8);
            try {
                stream.write(bytes);
            } catch (IOException e) {
                handleStreamError(e, null);
                return;
            }
            buffer.poll();
            fileSize += bytes.length;
            linesWritten.incrementAndGet();
        }
    }

    // Called with lock held
    private void dropBuffered(String reason) {
        String line;
        while ((line = buffer.poll()) != null) {
            linesDropped.incrementAndGet();
            notifyLineLoss(line, reason);
        }
    }

    // ========================================================================
    // Rotation
    // ========================================================================

    /**
     * Rotate out the current file.
     *
     * @return the archive path, or empty if no rotation was performed because one is
     *         already running, no file is configured, the file system is unsupported
     *         or the sink is closed
     * @throws RotationRenameException if the file could not be renamed; the sink keeps
     *         appending to the original file
     */
    public Optional<Path> rotate() {
        Path source;
        LogStream old;
        lock.lock();
        try {
            if (rotating || file == null || !controller.isSupported() || !open) {
                return Optional.empty();
            }
            rotating = true;
            source = file;
            old = stream;
            stream = null;
            fileSize = 0;
        } finally {
            lock.unlock();
        }

        // The rotation reopens the file itself
        recovery.cancel();

        if (old != null) {
            try {
                controller.close(old);
            } catch (StreamCloseException e) {
                log.warn("Failed to close {} before rotation: {}", source, e.getMessage());
            }
        }

        ArchiveNames names = ArchiveNames.of(source);
        Path archive = names.archivePath(clock.instant());
        RotationRenameException renameFailure = null;
        try {
            controller.getFileSystem().move(source, archive);
        } catch (IOException | RuntimeException e) {
            renameFailure = new RotationRenameException(
                    "Failed to rename " + source + " to " + archive, e);
            rotationFailures.incrementAndGet();
            log.warn("{}: {}", renameFailure.getMessage(), e.getMessage());
        }

        LogStream fresh = null;
        try {
            fresh = controller.open(source);
        } catch (StreamOpenException e) {
            log.warn("Failed to reopen {} after rotation: {}", source, getRootCauseMessage(e));
        }

        int keep;
        lock.lock();
        try {
            keep = maxFiles;
            if (fresh != null) {
                stream = fresh;
                fileSize = 0;
                drainBuffer();
                if (!open) {
                    // closed while rotating
                    closeQuietly(stream);
                    stream = null;
                    fileSize = 0;
                }
            } else if (open) {
                recovery.schedule(this::reopen);
            }
            if (!open) {
                dropBuffered("closed");
            }
            rotating = false;
            rotationDone.signalAll();
            checkThreshold();
        } finally {
            lock.unlock();
        }

        if (renameFailure != null) {
            throw renameFailure;
        }

        rotations.incrementAndGet();
        log.info("Rotated log file {} to {}", source, archive.getFileName());
        schedulePrune(names, keep);
        return Optional.of(archive);
    }

    private void rotateQuietly() {
        lock.lock();
        try {
            rotationQueued = false;
            // a direct rotate() may already have handled this crossing
            if (fileSize == 0 || fileSize < maxFileSize) {
                return;
            }
        } finally {
            lock.unlock();
        }

        try {
            rotate();
        } catch (RotationRenameException e) {
            log.debug("Scheduled rotation kept the current file: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error during log rotation", e);
        }
    }

    private void schedulePrune(ArchiveNames names, int keep) {
        try {
            rotationExecutor.execute(() -> pruner.prune(names.dir(), names.base(), names.ext(), keep));
        } catch (RejectedExecutionException e) {
            log.warn("Rotation executor rejected pruning of {}{} archives", names.base(), names.ext());
        }
    }

    // ========================================================================
    // Recovery
    // ========================================================================

    // Called with lock held. A failed line, if any, is kept for the next stream.
    private void handleStreamError(IOException error, String failedLine) {
        streamErrors.incrementAndGet();
        log.warn("Log stream error on {}: {}", file, error.getMessage());

        LogStream broken = stream;
        stream = null;
        fileSize = 0;
        closeQuietly(broken);

        if (failedLine != null) {
            enqueue(failedLine);
        }
        if (open) {
            recovery.schedule(this::reopen);
        }
    }

    /**
     * One reopen attempt. Reschedules itself on failure for as long as the sink is open.
     */
    void reopen() {
        Path target;
        lock.lock();
        try {
            if (stream != null || !open || rotating || file == null || !controller.isSupported()) {
                return;
            }
            target = file;
        } finally {
            lock.unlock();
        }

        LogStream fresh;
        long existing;
        try {
            existing = controller.size(target);
            fresh = controller.open(target);
        } catch (StreamOpenException e) {
            log.warn("Reopen of {} failed, retrying in {}ms: {}",
                    target, recovery.getRetryDelayMs(), getRootCauseMessage(e));
            lock.lock();
            try {
                if (open && stream == null && !rotating) {
                    recovery.schedule(this::reopen);
                }
            } finally {
                lock.unlock();
            }
            return;
        }

        lock.lock();
        try {
            if (!open || stream != null || rotating) {
                closeQuietly(fresh);
                return;
            }
            stream = fresh;
            fileSize = existing;
            log.info("Reopened log file {}; writing {} buffered line(s)", target, buffer.size());
            drainBuffer();
            checkThreshold();
        } finally {
            lock.unlock();
        }
    }

    private void closeQuietly(LogStream target) {
        if (target == null) {
            return;
        }
        try {
            target.close();
        } catch (IOException e) {
            log.debug("Ignoring close failure on broken log stream: {}", e.getMessage());
        }
    }

    private void notifyLineLoss(String line, String reason) {
        try {
            lineLossCallback.onLineLoss(line, reason);
        } catch (Exception e) {
            log.warn("LineLossCallback threw for reason={}: {}", reason, e.getMessage());
        }
    }

    private static String getRootCauseMessage(Throwable t) {
        Throwable root = t;
        while (root.getCause() != null) root = root.getCause();
        return root.getClass().getSimpleName() + ": " + root.getMessage();
    }

    // ========================================================================
    // State
    // ========================================================================

    public boolean isOpen() {
        lock.lock();
        try {
            return open;
        } finally {
            lock.unlock();
        }
    }

    public boolean isRotating() {
        lock.lock();
        try {
            return rotating;
        } finally {
            lock.unlock();
        }
    }

    public boolean hasStream() {
        lock.lock();
        try {
            return stream != null;
        } finally {
            lock.unlock();
        }
    }

    public long getFileSize() {
        lock.lock();
        try {
            return fileSize;
        } finally {
            lock.unlock();
        }
    }

    public int getBufferDepth() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    public Path getFile() {
        lock.lock();
        try {
            return file;
        } finally {
            lock.unlock();
        }
    }

    public boolean isRecoveryPending() {
        return recovery.isPending();
    }

    public long getLinesWritten() {
        return linesWritten.get();
    }

    public long getLinesBuffered() {
        return linesBuffered.get();
    }

    public long getLinesDropped() {
        return linesDropped.get();
    }

    public long getRotations() {
        return rotations.get();
    }

    public long getRotationFailures() {
        return rotationFailures.get();
    }

    public long getStreamErrors() {
        return streamErrors.get();
    }
}
