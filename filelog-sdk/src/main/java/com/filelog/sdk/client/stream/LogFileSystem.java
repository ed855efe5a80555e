package com.filelog.sdk.client.stream;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * File operations needed by the rotating sink.
 *
 * <p>The default implementation is {@link NioLogFileSystem}. A file system that reports
 * {@link #isSupported()} as false puts the logger in console-only mode: every file
 * operation becomes a no-op.</p>
 */
public interface LogFileSystem {

    /**
     * File system that is never used. For environments without file access.
     */
    static LogFileSystem unsupported() {
        return UnsupportedFileSystem.INSTANCE;
    }

    default boolean isSupported() {
        return true;
    }

    /**
     * Open {@code file} for appending, creating it if missing.
     */
    LogStream openAppend(Path file) throws IOException;

    /**
     * @return the file length in bytes
     * @throws java.nio.file.NoSuchFileException if the file does not exist
     */
    long size(Path file) throws IOException;

    /**
     * Rename {@code source} to {@code target}. Fails if {@code target} exists.
     */
    void move(Path source, Path target) throws IOException;

    /**
     * @return the regular files directly inside {@code dir}
     */
    List<Path> list(Path dir) throws IOException;

    void delete(Path file) throws IOException;

    final class UnsupportedFileSystem implements LogFileSystem {
        private static final UnsupportedFileSystem INSTANCE = new UnsupportedFileSystem();

        private UnsupportedFileSystem() {
        }

        @Override
        public boolean isSupported() {
            return false;
        }

        @Override
        public LogStream openAppend(Path file) {
            throw new UnsupportedOperationException("file system unsupported");
        }

        @Override
        public long size(Path file) {
            throw new UnsupportedOperationException("file system unsupported");
        }

        @Override
        public void move(Path source, Path target) {
            throw new UnsupportedOperationException("file system unsupported");
        }

        @Override
        public List<Path> list(Path dir) {
            throw new UnsupportedOperationException("file system unsupported");
        }

        @Override
        public void delete(Path file) {
            throw new UnsupportedOperationException("file system unsupported");
        }
    }
}
