package com.filelog.sdk.model;

import com.filelog.sdk.exception.InvalidConfigurationException;

import java.util.Locale;

/**
 * Log levels, ordered from least to most verbose.
 *
 * <p>A message is emitted when its level is not above the logger's threshold,
 * so a threshold of {@link #NONE} silences everything.</p>
 */
public enum LogLevel {
    NONE("none", 'N', "0"),
    ERROR("error", 'E', "1;31"),
    WARNING("warning", 'W', "1;33"),
    INFO("info", 'I', "94"),
    DEBUG("debug", 'D', "90"),
    SPAM("spam", 'S', "90");

    private final String value;
    private final char prefix;
    private final String style;

    LogLevel(String value, char prefix, String style) {
        this.value = value;
        this.prefix = prefix;
        this.style = style;
    }

    public String getValue() {
        return value;
    }

    /**
     * Single letter used in file lines, e.g. {@code [E:2019-10-28T19:02:45Z]}.
     */
    public char getPrefix() {
        return prefix;
    }

    /**
     * ANSI SGR parameters used to color the console tag.
     */
    public String getStyle() {
        return style;
    }

    /**
     * @return true if a message at {@code level} passes this threshold
     */
    public boolean allows(LogLevel level) {
        return level != NONE && level.ordinal() <= ordinal();
    }

    public static LogLevel fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (LogLevel level : LogLevel.values()) {
                if (level.value.equals(normalized)) {
                    return level;
                }
            }
        }
        throw new InvalidConfigurationException("Invalid log level: " + value);
    }
}
