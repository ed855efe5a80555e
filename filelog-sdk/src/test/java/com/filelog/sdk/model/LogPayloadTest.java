package com.filelog.sdk.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LogPayloadTest {

    @Test
    void errorPayloadCapturesTraceWithoutHeader() {
        IllegalStateException error = new IllegalStateException("boom");

        LogPayload.ErrorPayload payload = LogPayload.error(error);

        assertEquals("java.lang.IllegalStateException", payload.kind());
        assertEquals("boom", payload.message());
        assertFalse(payload.trace().isEmpty());
        assertTrue(payload.trace().get(0).trim().startsWith("at "));
    }

    @Test
    void errorWithoutMessageUsesClassName() {
        LogPayload.ErrorPayload payload = LogPayload.error(new NullPointerException());

        assertEquals("java.lang.NullPointerException", payload.message());
    }

    @Test
    void causesStayInTrace() {
        RuntimeException error = new RuntimeException("outer", new IllegalArgumentException("inner"));

        LogPayload.ErrorPayload payload = LogPayload.error(error);

        assertTrue(payload.trace().stream().anyMatch(l -> l.startsWith("Caused by: java.lang.IllegalArgumentException: inner")));
    }

    @Test
    void argsPayloadAllowsNulls() {
        LogPayload.ArgsPayload payload = LogPayload.args("value: %s", null);

        assertEquals(Arrays.asList("value: %s", null), payload.values());
        assertThrows(UnsupportedOperationException.class, () -> payload.values().add("x"));
    }

    @Test
    void nullArgsArrayIsEmpty() {
        assertEquals(List.of(), LogPayload.args((Object[]) null).values());
    }

    @Test
    void payloadIsEitherErrorOrArgs() {
        assertTrue(LogPayload.class.isSealed());
        assertEquals(
                List.of(LogPayload.ErrorPayload.class, LogPayload.ArgsPayload.class),
                Arrays.asList(LogPayload.class.getPermittedSubclasses()));
    }
}
