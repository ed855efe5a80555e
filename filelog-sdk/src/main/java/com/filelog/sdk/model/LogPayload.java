package com.filelog.sdk.model;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * What a caller hands to a log call: either an error or a list of format arguments.
 */
public sealed interface LogPayload permits LogPayload.ErrorPayload, LogPayload.ArgsPayload {

    static ErrorPayload error(Throwable error) {
        return ErrorPayload.of(error);
    }

    static ArgsPayload args(Object... values) {
        return new ArgsPayload(values == null ? List.of() : Arrays.asList(values));
    }

    /**
     * A captured error.
     *
     * @param kind    exception class name
     * @param message exception message, never null
     * @param trace   stack trace lines following the first line of {@code printStackTrace}
     */
    record ErrorPayload(String kind, String message, List<String> trace) implements LogPayload {

        public ErrorPayload {
            Objects.requireNonNull(kind, "kind");
            message = message != null ? message : "";
            trace = trace != null ? List.copyOf(trace) : List.of();
        }

        public static ErrorPayload of(Throwable error) {
            Objects.requireNonNull(error, "error");
            StringWriter out = new StringWriter();
            error.printStackTrace(new PrintWriter(out));
            String[] lines = out.toString().split("\\R");
            List<String> trace = new ArrayList<>(Math.max(0, lines.length - 1));
            for (int i = 1; i < lines.length; i++) {
                if (!lines[i].isEmpty()) {
                    trace.add(lines[i]);
                }
            }
            String message = error.getMessage() != null ? error.getMessage() : error.getClass().getName();
            return new ErrorPayload(error.getClass().getName(), message, trace);
        }
    }

    /**
     * Format arguments; the first one is usually a format string.
     */
    record ArgsPayload(List<Object> values) implements LogPayload {

        public ArgsPayload {
            // Arrays.asList tolerates null elements, List.copyOf does not
            values = values != null ? Collections.unmodifiableList(new ArrayList<>(values)) : List.of();
        }
    }
}
