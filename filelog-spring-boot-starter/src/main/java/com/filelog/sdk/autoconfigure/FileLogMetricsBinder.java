package com.filelog.sdk.autoconfigure;

import com.filelog.sdk.client.FileLogger;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

class FileLogMetricsBinder {

    FileLogMetricsBinder(FileLogger logger, MeterRegistry registry) {
        Gauge.builder("filelog.lines.written", logger,
                        l -> l.getMetrics().linesWritten)
                .description("Total lines written to the log file")
                .register(registry);

        Gauge.builder("filelog.lines.buffered", logger,
                        l -> l.getMetrics().linesBuffered)
                .description("Total lines held back during rotation or recovery")
                .register(registry);

        Gauge.builder("filelog.lines.dropped", logger,
                        l -> l.getMetrics().linesDropped)
                .description("Total lines dropped")
                .register(registry);

        Gauge.builder("filelog.rotations", logger,
                        l -> l.getMetrics().rotations)
                .description("Completed log file rotations")
                .register(registry);

        Gauge.builder("filelog.rotation.failures", logger,
                        l -> l.getMetrics().rotationFailures)
                .description("Rotations that failed to rename the log file")
                .register(registry);

        Gauge.builder("filelog.stream.errors", logger,
                        l -> l.getMetrics().streamErrors)
                .description("Write errors on the log file stream")
                .register(registry);

        Gauge.builder("filelog.file.size", logger,
                        l -> l.getMetrics().currentFileSize)
                .description("Current log file size in bytes")
                .baseUnit("bytes")
                .register(registry);

        Gauge.builder("filelog.buffer.depth", logger,
                        l -> l.getMetrics().bufferDepth)
                .description("Lines currently waiting in the write buffer")
                .register(registry);

        Gauge.builder("filelog.recovery.pending", logger,
                        l -> l.isRecoveryPending() ? 1 : 0)
                .description("Log file reopen pending (1=pending, 0=idle)")
                .register(registry);
    }
}
