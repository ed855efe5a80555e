package com.filelog.sdk.config;

import com.filelog.sdk.exception.InvalidConfigurationException;
import com.filelog.sdk.model.LogLevel;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Logger options. Every field is optional; an unset field leaves the logger's
 * current value alone when applied.
 *
 * <pre>{@code
 * LoggerOptions options = LoggerOptions.builder()
 *     .level("info")
 *     .filename(Path.of("/var/log/node/debug.log"))
 *     .maxFileSize(20L << 20)
 *     .maxFiles(10)
 *     .build();
 * }</pre>
 */
public final class LoggerOptions {

    public static final String LEVEL = "level";
    public static final String COLORS = "colors";
    public static final String TIMESTAMPS = "timestamps";
    public static final String CONSOLE = "console";
    public static final String FILENAME = "filename";
    public static final String MAX_FILE_SIZE = "maxFileSize";
    public static final String MAX_FILES = "maxFiles";

    private final LogLevel level;
    private final Boolean colors;
    private final Boolean timestamps;
    private final Boolean console;
    private final Path filename;
    private final Long maxFileSize;
    private final Integer maxFiles;

    private LoggerOptions(Builder builder) {
        this.level = builder.level;
        this.colors = builder.colors;
        this.timestamps = builder.timestamps;
        this.console = builder.console;
        this.filename = builder.filename;
        this.maxFileSize = builder.maxFileSize;
        this.maxFiles = builder.maxFiles;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parse options from loosely typed values, as they come out of a command line or
     * a properties file. Values may be typed or strings. Unknown keys are ignored.
     *
     * @throws InvalidConfigurationException on a bad level name, a malformed or
     *         negative number, or a value of the wrong type
     */
    public static LoggerOptions fromMap(Map<String, ?> values) {
        if (values == null) {
            throw new InvalidConfigurationException("options must not be null");
        }

        Builder builder = builder();

        Object level = values.get(LEVEL);
        if (level != null) {
            if (!(level instanceof String)) {
                throw new InvalidConfigurationException("'" + LEVEL + "' must be a string");
            }
            builder.level((String) level);
        }

        Boolean colors = toBoolean(COLORS, values.get(COLORS));
        if (colors != null) {
            builder.colors(colors);
        }

        Boolean timestamps = toBoolean(TIMESTAMPS, values.get(TIMESTAMPS));
        if (timestamps != null) {
            builder.timestamps(timestamps);
        }

        Boolean console = toBoolean(CONSOLE, values.get(CONSOLE));
        if (console != null) {
            builder.console(console);
        }

        Object filename = values.get(FILENAME);
        if (filename instanceof Path path) {
            builder.filename(path);
        } else if (filename instanceof String name) {
            if (name.isBlank()) {
                throw new InvalidConfigurationException("'" + FILENAME + "' must not be blank");
            }
            builder.filename(Path.of(name));
        } else if (filename != null) {
            throw new InvalidConfigurationException("'" + FILENAME + "' must be a path");
        }

        Long maxFileSize = toLong(MAX_FILE_SIZE, values.get(MAX_FILE_SIZE));
        if (maxFileSize != null) {
            builder.maxFileSize(maxFileSize);
        }

        Long maxFiles = toLong(MAX_FILES, values.get(MAX_FILES));
        if (maxFiles != null) {
            if (maxFiles > Integer.MAX_VALUE) {
                throw new InvalidConfigurationException("'" + MAX_FILES + "' is too large: " + maxFiles);
            }
            builder.maxFiles(maxFiles.intValue());
        }

        return builder.build();
    }

    public LogLevel getLevel() {
        return level;
    }

    public Boolean getColors() {
        return colors;
    }

    public Boolean getTimestamps() {
        return timestamps;
    }

    public Boolean getConsole() {
        return console;
    }

    public Path getFilename() {
        return filename;
    }

    public Long getMaxFileSize() {
        return maxFileSize;
    }

    public Integer getMaxFiles() {
        return maxFiles;
    }

    private static Boolean toBoolean(String key, Object value) {
        if (value == null || value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String text) {
            String normalized = text.trim().toLowerCase(Locale.ROOT);
            if (normalized.equals("true")) {
                return Boolean.TRUE;
            }
            if (normalized.equals("false")) {
                return Boolean.FALSE;
            }
        }
        throw new InvalidConfigurationException("'" + key + "' must be a boolean, got: " + value);
    }

    private static Long toLong(String key, Object value) {
        if (value == null) {
            return null;
        }
        long parsed;
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            parsed = ((Number) value).longValue();
        } else if (value instanceof String text) {
            try {
                parsed = Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                throw new InvalidConfigurationException("'" + key + "' must be an integer, got: " + text, e);
            }
        } else {
            throw new InvalidConfigurationException("'" + key + "' must be an integer, got: " + value);
        }
        if (parsed < 0) {
            throw new InvalidConfigurationException("'" + key + "' must be >= 0, got: " + parsed);
        }
        return parsed;
    }

    public static class Builder {
        private LogLevel level;
        private Boolean colors;
        private Boolean timestamps;
        private Boolean console;
        private Path filename;
        private Long maxFileSize;
        private Integer maxFiles;

        /**
         * Set the level by name: none, error, warning, info, debug or spam
         */
        public Builder level(String level) {
            this.level = LogLevel.fromValue(level);
            return this;
        }

        public Builder level(LogLevel level) {
            this.level = level;
            return this;
        }

        /**
         * Color console tags. Ignored unless the console is interactive.
         */
        public Builder colors(boolean colors) {
            this.colors = colors;
            return this;
        }

        /**
         * Prefix console lines with a timestamp (default: true)
         */
        public Builder timestamps(boolean timestamps) {
            this.timestamps = timestamps;
            return this;
        }

        /**
         * Enable/disable console output (default: true)
         */
        public Builder console(boolean console) {
            this.console = console;
            return this;
        }

        /**
         * Log file location. Without one the logger is console-only.
         */
        public Builder filename(Path filename) {
            this.filename = filename;
            return this;
        }

        /**
         * Rotate once the file reaches this many bytes (default: 20 MiB)
         */
        public Builder maxFileSize(long maxFileSize) {
            if (maxFileSize < 0) {
                throw new InvalidConfigurationException("maxFileSize must be >= 0, got: " + maxFileSize);
            }
            this.maxFileSize = maxFileSize;
            return this;
        }

        /**
         * Number of archived files to keep (default: 10)
         */
        public Builder maxFiles(int maxFiles) {
            if (maxFiles < 0) {
                throw new InvalidConfigurationException("maxFiles must be >= 0, got: " + maxFiles);
            }
            this.maxFiles = maxFiles;
            return this;
        }

        public LoggerOptions build() {
            return new LoggerOptions(this);
        }
    }
}
