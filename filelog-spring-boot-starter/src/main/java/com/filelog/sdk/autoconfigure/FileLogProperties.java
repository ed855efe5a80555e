package com.filelog.sdk.autoconfigure;

import com.filelog.sdk.client.FileLogger;
import com.filelog.sdk.config.LoggerOptions;
import com.filelog.sdk.model.LogLevel;
import jakarta.validation.constraints.AssertTrue;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.util.Locale;

@ConfigurationProperties(prefix = "filelog")
@Validated
public class FileLogProperties {

    private static final int DEFAULT_BUFFER_CAPACITY = 10_000;
    private static final long DEFAULT_RETRY_DELAY_MS = 10_000;

    private final boolean enabled;
    private final String level;
    private final Boolean colors;
    private final boolean timestamps;
    private final boolean console;
    private final Path filename;
    private final long maxFileSize;
    private final int maxFiles;
    private final int bufferCapacity;
    private final long retryDelayMs;

    @NestedConfigurationProperty
    private final Metrics metrics;

    public FileLogProperties(
            Boolean enabled,
            String level,
            Boolean colors,
            Boolean timestamps,
            Boolean console,
            Path filename,
            Long maxFileSize,
            Integer maxFiles,
            Integer bufferCapacity,
            Long retryDelayMs,
            Metrics metrics) {
        this.enabled = enabled != null && enabled;
        this.level = hasText(level) ? level.trim().toLowerCase(Locale.ROOT) : null;
        this.colors = colors;
        this.timestamps = timestamps == null || timestamps;
        this.console = console == null || console;
        this.filename = filename;
        this.maxFileSize = maxFileSize != null ? maxFileSize : FileLogger.MAX_FILE_SIZE;
        this.maxFiles = maxFiles != null ? maxFiles : FileLogger.MAX_ARCHIVAL_FILES;
        this.bufferCapacity = bufferCapacity != null ? bufferCapacity : DEFAULT_BUFFER_CAPACITY;
        this.retryDelayMs = retryDelayMs != null ? retryDelayMs : DEFAULT_RETRY_DELAY_MS;
        this.metrics = metrics != null ? metrics : new Metrics(null);
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Level name, or null when unset.
     */
    public String getLevel() {
        return level;
    }

    /**
     * Null leaves the choice to the console's interactivity.
     */
    public Boolean getColors() {
        return colors;
    }

    public boolean isTimestamps() {
        return timestamps;
    }

    public boolean isConsole() {
        return console;
    }

    public Path getFilename() {
        return filename;
    }

    public long getMaxFileSize() {
        return maxFileSize;
    }

    public int getMaxFiles() {
        return maxFiles;
    }

    public int getBufferCapacity() {
        return bufferCapacity;
    }

    public long getRetryDelayMs() {
        return retryDelayMs;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    @AssertTrue(message = "filelog.level must be one of: none, error, warning, info, debug, spam")
    public boolean isLevelValid() {
        if (level == null) {
            return true;
        }
        for (LogLevel candidate : LogLevel.values()) {
            if (candidate.getValue().equals(level)) {
                return true;
            }
        }
        return false;
    }

    @AssertTrue(message = "filelog.max-file-size and filelog.max-files must not be negative")
    public boolean isLimitsValid() {
        return maxFileSize >= 0 && maxFiles >= 0;
    }

    @AssertTrue(message = "filelog.buffer-capacity must be at least 1")
    public boolean isBufferCapacityValid() {
        return bufferCapacity >= 1;
    }

    @AssertTrue(message = "filelog.retry-delay-ms must not be negative")
    public boolean isRetryDelayValid() {
        return retryDelayMs >= 0;
    }

    /**
     * Logger options for these properties. The level is left unset when not configured.
     */
    public LoggerOptions toOptions() {
        LoggerOptions.Builder builder = LoggerOptions.builder()
                .timestamps(timestamps)
                .console(console)
                .maxFileSize(maxFileSize)
                .maxFiles(maxFiles);

        if (level != null) {
            builder.level(level);
        }

        if (colors != null) {
            builder.colors(colors);
        }

        if (filename != null) {
            builder.filename(filename);
        }

        return builder.build();
    }

    public static class Metrics {
        private final boolean enabled;

        public Metrics(Boolean enabled) {
            this.enabled = enabled == null || enabled;
        }

        public boolean isEnabled() {
            return enabled;
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
