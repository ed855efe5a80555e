package com.filelog.sdk.exception;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FileLogExceptionTest {

    @Test
    void messageOnlyConstructor() {
        FileLogException ex = new FileLogException("Something went wrong");
        assertEquals("Something went wrong", ex.getMessage());
        assertNull(ex.getErrorCode());
        assertNull(ex.getCause());
    }

    @Test
    void messageAndCauseConstructor() {
        RuntimeException cause = new RuntimeException("root cause");
        FileLogException ex = new FileLogException("Wrapped error", cause);
        assertEquals("Wrapped error", ex.getMessage());
        assertNull(ex.getErrorCode());
        assertSame(cause, ex.getCause());
    }

    @Test
    void errorCodeConstructor() {
        FileLogException ex = new FileLogException("Bad state", "invalid_state");
        assertEquals("invalid_state", ex.getErrorCode());
        assertNull(ex.getCause());
    }

    @Test
    void subclassesCarryTheirErrorCodes() {
        assertEquals("stream_open", new StreamOpenException("x").getErrorCode());
        assertEquals("stream_close", new StreamCloseException("x").getErrorCode());
        assertEquals("rotation_rename", new RotationRenameException("x").getErrorCode());
        assertEquals("prune_delete", new PruneDeleteException("x").getErrorCode());
        assertEquals("invalid_configuration", new InvalidConfigurationException("x").getErrorCode());
        assertEquals("invalid_state", new InvalidStateException("x").getErrorCode());
    }

    @Test
    void subclassesKeepCause() {
        RuntimeException cause = new RuntimeException("io");
        StreamOpenException ex = new StreamOpenException("open failed", cause);
        assertSame(cause, ex.getCause());
        assertInstanceOf(FileLogException.class, ex);
    }
}
