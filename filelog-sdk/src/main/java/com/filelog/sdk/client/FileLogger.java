package com.filelog.sdk.client;

import com.filelog.sdk.client.rotation.RecoverySupervisor;
import com.filelog.sdk.client.rotation.RetentionPruner;
import com.filelog.sdk.client.rotation.RotatingFileSink;
import com.filelog.sdk.client.stream.LogFileSystem;
import com.filelog.sdk.client.stream.NioLogFileSystem;
import com.filelog.sdk.client.stream.StreamController;
import com.filelog.sdk.config.LoggerOptions;
import com.filelog.sdk.console.ConsoleSink;
import com.filelog.sdk.console.StandardConsoleSink;
import com.filelog.sdk.exception.InvalidStateException;
import com.filelog.sdk.exception.RotationRenameException;
import com.filelog.sdk.exception.StreamCloseException;
import com.filelog.sdk.format.DefaultMessageFormatter;
import com.filelog.sdk.format.LineFormatter;
import com.filelog.sdk.format.MessageFormatter;
import com.filelog.sdk.model.LogLevel;
import com.filelog.sdk.model.LogPayload;
import com.filelog.sdk.model.MemoryUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * File Logger - leveled logging to the console and a self-rotating file
 *
 * <p>Log calls never block on file rotation and never throw. File problems are
 * handled in the background: a full file is rotated and old archives pruned, a
 * broken stream is reopened on a fixed delay, and lines produced meanwhile are
 * buffered and written once the file is back.</p>
 *
 * <h2>Usage:</h2>
 * <pre>{@code
 * FileLogger logger = FileLogger.builder()
 *     .options(LoggerOptions.builder()
 *         .level("info")
 *         .filename(Path.of("node/debug.log"))
 *         .build())
 *     .build();
 * logger.open();
 *
 * LoggerContext net = logger.context("net");
 * net.info("Connected to %s", peer);
 *
 * // At application shutdown (optional - shutdown hook handles this)
 * logger.shutdown();
 * }</pre>
 */
public class FileLogger implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FileLogger.class);

    /** Default rotation threshold: 20 MiB. */
    public static final long MAX_FILE_SIZE = 20L << 20;

    /** Default number of archives kept on disk. */
    public static final int MAX_ARCHIVAL_FILES = 10;

    private static final LineLossCallback DEFAULT_LOSS_CALLBACK = (line, reason) ->
            log.warn("Log line lost ({}): {}", reason, line.stripTrailing());

    private final ConsoleSink consoleSink;
    private final LineFormatter lineFormatter;
    private final RotatingFileSink sink;
    private final ExecutorService rotationExecutor;
    private final ScheduledExecutorService retryExecutor;
    private final boolean ownsRotationExecutor;
    private final boolean ownsRetryExecutor;
    private final ConcurrentMap<String, LoggerContext> contexts = new ConcurrentHashMap<>();

    private volatile LogLevel level = LogLevel.NONE;
    private volatile boolean colors;
    private volatile boolean timestamps = true;
    private volatile boolean console = true;
    private long maxFileSize = MAX_FILE_SIZE;
    private int maxFiles = MAX_ARCHIVAL_FILES;

    // Shutdown handling
    private final AtomicBoolean shutdownRequested = new AtomicBoolean(false);
    private Thread shutdownHook;

    protected FileLogger(Builder builder) {
        this.consoleSink = builder.consoleSink != null ? builder.consoleSink : new StandardConsoleSink();
        this.colors = consoleSink.isInteractive();

        Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        MessageFormatter formatter = builder.messageFormatter != null
                ? builder.messageFormatter
                : new DefaultMessageFormatter();
        this.lineFormatter = new LineFormatter(formatter, clock);

        this.ownsRotationExecutor = builder.rotationExecutor == null;
        this.ownsRetryExecutor = builder.retryExecutor == null;
        this.rotationExecutor = builder.rotationExecutor != null
                ? builder.rotationExecutor
                : Executors.newSingleThreadExecutor(r -> {
                    Thread t = new Thread(r, "filelog-rotation");
                    t.setDaemon(true);
                    return t;
                });
        this.retryExecutor = builder.retryExecutor != null
                ? builder.retryExecutor
                : Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "filelog-retry");
                    t.setDaemon(true);
                    return t;
                });

        LogFileSystem fileSystem = builder.fileSystem != null ? builder.fileSystem : new NioLogFileSystem();
        LineLossCallback lossCallback = builder.lineLossCallback != null
                ? builder.lineLossCallback
                : DEFAULT_LOSS_CALLBACK;
        this.sink = new RotatingFileSink(
                new StreamController(fileSystem),
                new RetentionPruner(fileSystem),
                new RecoverySupervisor(retryExecutor, builder.retryDelayMs),
                rotationExecutor,
                clock,
                builder.bufferCapacity,
                lossCallback);
        this.sink.setLimits(maxFileSize, maxFiles);

        if (builder.options != null) {
            configure(builder.options);
        }

        if (builder.registerShutdownHook) {
            this.shutdownHook = new Thread(this::shutdown, "filelog-shutdown");
            Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
    }

    /**
     * Create a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // Configuration
    // ========================================================================

    /**
     * Apply options. Unset fields keep their current value.
     *
     * @throws InvalidStateException if the logger is open
     */
    public synchronized void configure(LoggerOptions options) {
        Objects.requireNonNull(options, "options");
        if (sink.isOpen()) {
            throw new InvalidStateException("Logger options can only be changed while the logger is closed");
        }

        if (options.getLevel() != null) {
            this.level = options.getLevel();
        }

        if (options.getColors() != null && consoleSink.isInteractive()) {
            this.colors = options.getColors();
        }

        if (options.getTimestamps() != null) {
            this.timestamps = options.getTimestamps();
        }

        if (options.getConsole() != null) {
            this.console = options.getConsole();
        }

        if (options.getFilename() != null) {
            sink.setFile(options.getFilename());
        }

        if (options.getMaxFileSize() != null) {
            this.maxFileSize = options.getMaxFileSize();
        }

        if (options.getMaxFiles() != null) {
            this.maxFiles = options.getMaxFiles();
        }

        sink.setLimits(maxFileSize, maxFiles);
    }

    /**
     * Set the log file location.
     *
     * @throws InvalidStateException if the log file is already open
     */
    public void setFile(Path file) {
        Objects.requireNonNull(file, "file");
        sink.setFile(file);
    }

    /**
     * Set or reset the log level by name.
     *
     * @throws com.filelog.sdk.exception.InvalidConfigurationException on an unknown name
     */
    public void setLevel(String levelName) {
        this.level = LogLevel.fromValue(levelName);
    }

    public void setLevel(LogLevel level) {
        this.level = Objects.requireNonNull(level, "level");
    }

    public LogLevel getLevel() {
        return level;
    }

    public boolean isColors() {
        return colors;
    }

    public boolean isTimestamps() {
        return timestamps;
    }

    public boolean isConsole() {
        return console;
    }

    public Path getFile() {
        return sink.getFile();
    }

    public synchronized long getMaxFileSize() {
        return maxFileSize;
    }

    public synchronized int getMaxFiles() {
        return maxFiles;
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    /**
     * Open the logger. Opens the log file if one is configured.
     *
     * @throws com.filelog.sdk.exception.StreamOpenException if the file cannot be opened
     */
    public void open() {
        if (shutdownRequested.get()) {
            throw new InvalidStateException("Logger has been shut down");
        }
        sink.open();
    }

    /**
     * Close the logger. It can be opened again later.
     *
     * @throws StreamCloseException if the file reported an error while closing;
     *         the logger is closed regardless
     */
    @Override
    public void close() {
        sink.close();
    }

    public boolean isOpen() {
        return sink.isOpen();
    }

    /**
     * Rotate out the current log file now.
     *
     * @return the archive path, or empty if no rotation was performed
     * @throws RotationRenameException if the file could not be renamed
     */
    public Optional<Path> rotate() {
        return sink.rotate();
    }

    /**
     * Close the logger for good and stop the background threads it created.
     */
    public void shutdown() {
        if (!shutdownRequested.compareAndSet(false, true)) {
            return; // Already shutting down
        }

        if (shutdownHook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                log.debug("JVM already shutting down, shutdown hook stays registered");
            }
        }

        try {
            sink.close();
        } catch (StreamCloseException e) {
            log.warn("Failed to close log file on shutdown: {}", e.getMessage());
        }

        // Executors passed in through the builder belong to the caller
        if (ownsRetryExecutor) {
            retryExecutor.shutdownNow();
        }

        if (ownsRotationExecutor) {
            // Let a queued prune finish
            rotationExecutor.shutdown();
            try {
                if (!rotationExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                    log.warn("Rotation executor did not finish within 10s");
                    rotationExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                rotationExecutor.shutdownNow();
            }
        }

        log.debug("FileLogger shutdown complete - written: {}, dropped: {}, rotations: {}",
                sink.getLinesWritten(), sink.getLinesDropped(), sink.getRotations());
    }

    // ========================================================================
    // Logging
    // ========================================================================

    /**
     * Output a log to the {@code error} log level.
     */
    public void error(Object... args) {
        if (!level.allows(LogLevel.ERROR)) {
            return;
        }
        log(LogLevel.ERROR, null, LogPayload.args(args));
    }

    public void error(Throwable err) {
        if (!level.allows(LogLevel.ERROR)) {
            return;
        }
        log(LogLevel.ERROR, null, payloadOf(err));
    }

    /**
     * Output a log to the {@code warning} log level.
     */
    public void warning(Object... args) {
        if (!level.allows(LogLevel.WARNING)) {
            return;
        }
        log(LogLevel.WARNING, null, LogPayload.args(args));
    }

    public void warning(Throwable err) {
        if (!level.allows(LogLevel.WARNING)) {
            return;
        }
        log(LogLevel.WARNING, null, payloadOf(err));
    }

    /**
     * Output a log to the {@code info} log level.
     */
    public void info(Object... args) {
        if (!level.allows(LogLevel.INFO)) {
            return;
        }
        log(LogLevel.INFO, null, LogPayload.args(args));
    }

    public void info(Throwable err) {
        if (!level.allows(LogLevel.INFO)) {
            return;
        }
        log(LogLevel.INFO, null, payloadOf(err));
    }

    /**
     * Output a log to the {@code debug} log level.
     */
    public void debug(Object... args) {
        if (!level.allows(LogLevel.DEBUG)) {
            return;
        }
        log(LogLevel.DEBUG, null, LogPayload.args(args));
    }

    public void debug(Throwable err) {
        if (!level.allows(LogLevel.DEBUG)) {
            return;
        }
        log(LogLevel.DEBUG, null, payloadOf(err));
    }

    /**
     * Output a log to the {@code spam} log level.
     */
    public void spam(Object... args) {
        if (!level.allows(LogLevel.SPAM)) {
            return;
        }
        log(LogLevel.SPAM, null, LogPayload.args(args));
    }

    public void spam(Throwable err) {
        if (!level.allows(LogLevel.SPAM)) {
            return;
        }
        log(LogLevel.SPAM, null, payloadOf(err));
    }

    /**
     * Output a log at {@code level}, tagged with {@code module} when not null.
     * A closed logger drops the call.
     */
    public void log(LogLevel level, String module, LogPayload payload) {
        if (!sink.isOpen()) {
            return;
        }

        if (!this.level.allows(level)) {
            return;
        }

        emit(level, module, lineFormatter.message(level, payload));
    }

    /**
     * Write an already filtered message to the console and the file.
     */
    protected void emit(LogLevel level, String module, String message) {
        writeConsole(level, module, message);
        sink.write(lineFormatter.fileLine(level, module, message));
    }

    private void writeConsole(LogLevel level, String module, String message) {
        if (!console) {
            return;
        }

        String line = lineFormatter.consoleLine(level, module, message, timestamps, colors);
        try {
            consoleSink.write(level, line);
        } catch (RuntimeException e) {
            log.warn("Console sink failed: {}", e.getMessage());
        }
    }

    private static LogPayload payloadOf(Throwable err) {
        return err != null ? LogPayload.error(err) : LogPayload.args("null");
    }

    /**
     * Create logger context. Contexts are cached per module name.
     */
    public LoggerContext context(String module) {
        Objects.requireNonNull(module, "module");
        return contexts.computeIfAbsent(module, name -> new LoggerContext(this, name));
    }

    // ========================================================================
    // Memory
    // ========================================================================

    /**
     * Get the current memory usage.
     */
    public MemoryUsage memoryUsage() {
        return MemoryUsage.current();
    }

    /**
     * Log the current memory usage at the {@code debug} level.
     */
    public void memory(String module) {
        MemoryUsage mem = memoryUsage();

        log(LogLevel.DEBUG, module, LogPayload.args(
                "Memory: total=%dmb, heap=%d/%dmb non-heap=%dmb",
                mem.total(),
                mem.heap(),
                mem.heapTotal(),
                mem.nonHeap()));
    }

    // ========================================================================
    // Metrics
    // ========================================================================

    /**
     * Get logger metrics
     */
    public Metrics getMetrics() {
        return new Metrics(
                sink.getLinesWritten(),
                sink.getLinesBuffered(),
                sink.getLinesDropped(),
                sink.getRotations(),
                sink.getRotationFailures(),
                sink.getStreamErrors(),
                sink.getFileSize(),
                sink.getBufferDepth());
    }

    /**
     * Exposed for tests and health checks.
     */
    public boolean hasStream() {
        return sink.hasStream();
    }

    public boolean isRotating() {
        return sink.isRotating();
    }

    public boolean isRecoveryPending() {
        return sink.isRecoveryPending();
    }

    /**
     * Metrics snapshot
     */
    public static class Metrics {
        public final long linesWritten;
        public final long linesBuffered;
        public final long linesDropped;
        public final long rotations;
        public final long rotationFailures;
        public final long streamErrors;
        public final long currentFileSize;
        public final int bufferDepth;

        Metrics(long linesWritten, long linesBuffered, long linesDropped, long rotations,
                long rotationFailures, long streamErrors, long currentFileSize, int bufferDepth) {
            this.linesWritten = linesWritten;
            this.linesBuffered = linesBuffered;
            this.linesDropped = linesDropped;
            this.rotations = rotations;
            this.rotationFailures = rotationFailures;
            this.streamErrors = streamErrors;
            this.currentFileSize = currentFileSize;
            this.bufferDepth = bufferDepth;
        }

        @Override
        public String toString() {
            return String.format("Metrics{written=%d, buffered=%d, dropped=%d, rotations=%d, rotationFailures=%d, streamErrors=%d, fileSize=%d, bufferDepth=%d}",
                    linesWritten, linesBuffered, linesDropped, rotations, rotationFailures,
                    streamErrors, currentFileSize, bufferDepth);
        }
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private LoggerOptions options;
        private ConsoleSink consoleSink;
        private LogFileSystem fileSystem;
        private Clock clock;
        private MessageFormatter messageFormatter;
        private ExecutorService rotationExecutor;
        private ScheduledExecutorService retryExecutor;
        private LineLossCallback lineLossCallback;
        private long retryDelayMs = 10_000;
        private int bufferCapacity = 10_000;
        private boolean registerShutdownHook = true;

        /**
         * Initial options
         */
        public Builder options(LoggerOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Set the console destination (default: stdout/stderr)
         */
        public Builder consoleSink(ConsoleSink consoleSink) {
            this.consoleSink = consoleSink;
            return this;
        }

        /**
         * Set the file system (default: java.nio). Pass {@link LogFileSystem#unsupported()}
         * for console-only environments.
         */
        public Builder fileSystem(LogFileSystem fileSystem) {
            this.fileSystem = fileSystem;
            return this;
        }

        /**
         * Clock for line and archive timestamps (default: system UTC)
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder messageFormatter(MessageFormatter messageFormatter) {
            this.messageFormatter = messageFormatter;
            return this;
        }

        /**
         * Provide a custom executor for rotation and pruning. The caller stays
         * responsible for shutting it down.
         */
        public Builder rotationExecutor(ExecutorService rotationExecutor) {
            this.rotationExecutor = rotationExecutor;
            return this;
        }

        /**
         * Provide a custom scheduler for reopen attempts
         */
        public Builder retryExecutor(ScheduledExecutorService retryExecutor) {
            this.retryExecutor = retryExecutor;
            return this;
        }

        /**
         * Delay between attempts to reopen a broken log file in milliseconds (default: 10000)
         */
        public Builder retryDelayMs(long retryDelayMs) {
            this.retryDelayMs = retryDelayMs;
            return this;
        }

        /**
         * Maximum number of lines held while the file is rotating or being reopened
         * (default: 10,000). Lines beyond this are dropped.
         */
        public Builder bufferCapacity(int bufferCapacity) {
            this.bufferCapacity = bufferCapacity;
            return this;
        }

        /**
         * Set a callback invoked whenever a file line is dropped.
         * Defaults to a SLF4J WARN logger if not set.
         */
        public Builder onLineLoss(LineLossCallback callback) {
            this.lineLossCallback = callback;
            return this;
        }

        /**
         * Enable/disable automatic shutdown hook (default: true)
         */
        public Builder registerShutdownHook(boolean register) {
            this.registerShutdownHook = register;
            return this;
        }

        public FileLogger build() {
            if (bufferCapacity < 1) {
                throw new IllegalArgumentException("bufferCapacity must be >= 1, got: " + bufferCapacity);
            }
            if (retryDelayMs < 0) {
                throw new IllegalArgumentException("retryDelayMs must be >= 0, got: " + retryDelayMs);
            }
            return new FileLogger(this);
        }
    }
}
