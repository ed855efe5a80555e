package com.filelog.sdk.format;

import java.util.List;

/**
 * Turns a list of log arguments into the message part of a line.
 */
@FunctionalInterface
public interface MessageFormatter {

    String format(List<Object> args);
}
