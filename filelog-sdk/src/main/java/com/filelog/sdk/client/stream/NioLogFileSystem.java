package com.filelog.sdk.client.stream;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link LogFileSystem} backed by {@code java.nio.file}.
 */
public class NioLogFileSystem implements LogFileSystem {

    @Override
    public LogStream openAppend(Path file) throws IOException {
        OutputStream out = Files.newOutputStream(file,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        return new FileLogStream(out);
    }

    @Override
    public long size(Path file) throws IOException {
        return Files.size(file);
    }

    @Override
    public void move(Path source, Path target) throws IOException {
        // an atomic rename silently replaces an existing target on POSIX
        if (Files.exists(target)) {
            throw new FileAlreadyExistsException(target.toString());
        }
        try {
            moveFileAtomic(source, target);
        } catch (AtomicMoveNotSupportedException e) {
            moveFile(source, target);
        }
    }

    @Override
    public List<Path> list(Path dir) throws IOException {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.filter(Files::isRegularFile).collect(Collectors.toList());
        }
    }

    @Override
    public void delete(Path file) throws IOException {
        Files.delete(file);
    }

    protected void moveFileAtomic(Path source, Path target) throws IOException {
        Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
    }

    protected void moveFile(Path source, Path target) throws IOException {
        Files.move(source, target);
    }

    private static final class FileLogStream implements LogStream {
        private final OutputStream out;

        FileLogStream(OutputStream out) {
            this.out = out;
        }

        @Override
        public void write(byte[] bytes) throws IOException {
            out.write(bytes);
            out.flush();
        }

        @Override
        public void close() throws IOException {
            out.close();
        }
    }
}
