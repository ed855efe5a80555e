package com.filelog.sdk.autoconfigure;

import com.filelog.sdk.client.FileLogger;
import com.filelog.sdk.config.LoggerOptions;
import com.filelog.sdk.model.LogLevel;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class FileLogPropertiesTest {

    @Test
    void defaultValuesWhenAllNulls() {
        FileLogProperties props = new FileLogProperties(
                null, null, null, null, null, null, null, null, null, null, null);
        assertThat(props.isEnabled()).isFalse();
        assertThat(props.getLevel()).isNull();
        assertThat(props.getColors()).isNull();
        assertThat(props.isTimestamps()).isTrue();
        assertThat(props.isConsole()).isTrue();
        assertThat(props.getFilename()).isNull();
        assertThat(props.getMaxFileSize()).isEqualTo(FileLogger.MAX_FILE_SIZE);
        assertThat(props.getMaxFiles()).isEqualTo(FileLogger.MAX_ARCHIVAL_FILES);
        assertThat(props.getBufferCapacity()).isEqualTo(10_000);
        assertThat(props.getRetryDelayMs()).isEqualTo(10_000);
        assertThat(props.getMetrics().isEnabled()).isTrue();
    }

    @Test
    void customValuesPreserved() {
        Path file = Path.of("/var/log/app.log");
        FileLogProperties props = new FileLogProperties(
                true, " Debug ", false, false, false, file, 1024L, 2, 50, 250L,
                new FileLogProperties.Metrics(false));
        assertThat(props.isEnabled()).isTrue();
        assertThat(props.getLevel()).isEqualTo("debug");
        assertThat(props.getColors()).isFalse();
        assertThat(props.isTimestamps()).isFalse();
        assertThat(props.isConsole()).isFalse();
        assertThat(props.getFilename()).isEqualTo(file);
        assertThat(props.getMaxFileSize()).isEqualTo(1024L);
        assertThat(props.getMaxFiles()).isEqualTo(2);
        assertThat(props.getBufferCapacity()).isEqualTo(50);
        assertThat(props.getRetryDelayMs()).isEqualTo(250L);
        assertThat(props.getMetrics().isEnabled()).isFalse();
    }

    @Test
    void levelValidation() {
        assertThat(withLevel(null).isLevelValid()).isTrue();
        assertThat(withLevel("spam").isLevelValid()).isTrue();
        assertThat(withLevel("WARNING").isLevelValid()).isTrue();
        assertThat(withLevel("warn").isLevelValid()).isFalse();
    }

    @Test
    void numericValidation() {
        FileLogProperties negative = new FileLogProperties(
                true, null, null, null, null, null, -1L, null, 0, -5L, null);
        assertThat(negative.isLimitsValid()).isFalse();
        assertThat(negative.isBufferCapacityValid()).isFalse();
        assertThat(negative.isRetryDelayValid()).isFalse();

        FileLogProperties defaults = withLevel(null);
        assertThat(defaults.isLimitsValid()).isTrue();
        assertThat(defaults.isBufferCapacityValid()).isTrue();
        assertThat(defaults.isRetryDelayValid()).isTrue();
    }

    @Test
    void toOptionsCarriesConfiguredValues() {
        Path file = Path.of("/var/log/app.log");
        FileLogProperties props = new FileLogProperties(
                true, "info", true, false, true, file, 2048L, 4, null, null, null);

        LoggerOptions options = props.toOptions();

        assertThat(options.getLevel()).isEqualTo(LogLevel.INFO);
        assertThat(options.getColors()).isTrue();
        assertThat(options.getTimestamps()).isFalse();
        assertThat(options.getConsole()).isTrue();
        assertThat(options.getFilename()).isEqualTo(file);
        assertThat(options.getMaxFileSize()).isEqualTo(2048L);
        assertThat(options.getMaxFiles()).isEqualTo(4);
    }

    @Test
    void toOptionsLeavesUnsetLevelAndColorsAlone() {
        LoggerOptions options = withLevel(null).toOptions();

        assertThat(options.getLevel()).isNull();
        assertThat(options.getColors()).isNull();
        assertThat(options.getFilename()).isNull();
    }

    private static FileLogProperties withLevel(String level) {
        return new FileLogProperties(true, level, null, null, null, null, null, null, null, null, null);
    }
}
