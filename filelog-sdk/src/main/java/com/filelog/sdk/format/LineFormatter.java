package com.filelog.sdk.format;

import com.filelog.sdk.model.LogLevel;
import com.filelog.sdk.model.LogPayload;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Builds console and file lines.
 *
 * <pre>
 * console: (2019-10-28T19:02:45.122Z) [info] (net) connected to peer
 * file:    [I:2019-10-28T19:02:45Z] (net) connected to peer
 * </pre>
 */
public class LineFormatter {

    private static final String CSI = "\u001b[";

    private final MessageFormatter messageFormatter;
    private final Clock clock;

    public LineFormatter(MessageFormatter messageFormatter, Clock clock) {
        this.messageFormatter = messageFormatter;
        this.clock = clock;
    }

    public String consoleLine(LogLevel level, String module, String message,
                              boolean timestamps, boolean colors) {
        StringBuilder line = new StringBuilder();

        if (timestamps) {
            line.append('(').append(DateTimeFormatter.ISO_INSTANT.format(
                    clock.instant().truncatedTo(ChronoUnit.MILLIS))).append(") ");
        }

        if (colors) {
            line.append(CSI).append(level.getStyle()).append("m[")
                    .append(level.getValue()).append(']').append(CSI).append("m ");
        } else {
            line.append('[').append(level.getValue()).append("] ");
        }

        if (module != null) {
            line.append('(').append(module).append(") ");
        }

        return line.append(message).append('\n').toString();
    }

    public String fileLine(LogLevel level, String module, String message) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);

        StringBuilder line = new StringBuilder()
                .append('[').append(level.getPrefix()).append(':')
                .append(DateTimeFormatter.ISO_INSTANT.format(now)).append("] ");

        if (module != null) {
            line.append('(').append(module).append(") ");
        }

        return line.append(message).append('\n').toString();
    }

    /**
     * Renders the message part of a payload at the given level.
     */
    public String message(LogLevel level, LogPayload payload) {
        if (payload instanceof LogPayload.ErrorPayload error) {
            return errorMessage(level, error);
        }
        return messageFormatter.format(((LogPayload.ArgsPayload) payload).values());
    }

    private String errorMessage(LogLevel level, LogPayload.ErrorPayload error) {
        String msg = error.message().replaceFirst("^ *Error: *", "");

        // error lines already say what they are
        if (level != LogLevel.ERROR) {
            msg = "Error: " + msg;
        }

        List<String> trace = error.trace();
        if (level.ordinal() <= LogLevel.WARNING.ordinal() && !trace.isEmpty()) {
            msg += "\n" + String.join("\n", trace);
        }

        return msg;
    }
}
