package com.filelog.sdk.client.rotation;

import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Naming scheme for archived log files: {@code <dir>/<base>_<timestamp><ext>}.
 *
 * <p>The timestamp is {@code yyyy-MM-dd_HH-mm-ss-SSS} in UTC, so archives of one base
 * name sort lexicographically in the order they were created.</p>
 */
public final class ArchiveNames {

    static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss-SSS").withZone(ZoneOffset.UTC);

    private final Path file;
    private final Path dir;
    private final String base;
    private final String ext;

    private ArchiveNames(Path file, Path dir, String base, String ext) {
        this.file = file;
        this.dir = dir;
        this.base = base;
        this.ext = ext;
    }

    public static ArchiveNames of(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        // ".log" has no extension, like "Makefile"
        String ext = dot > 0 ? name.substring(dot) : "";
        String base = dot > 0 ? name.substring(0, dot) : name;
        Path dir = file.toAbsolutePath().getParent();
        return new ArchiveNames(file, dir, base, ext);
    }

    public static String timestamp(Instant instant) {
        return TIMESTAMP.format(instant);
    }

    public Path dir() {
        return dir;
    }

    public String base() {
        return base;
    }

    public String ext() {
        return ext;
    }

    public Path archivePath(Instant instant) {
        return file.resolveSibling(base + "_" + timestamp(instant) + ext);
    }

    /**
     * @return true if {@code fileName} looks like an archive of this file
     */
    public boolean matches(String fileName) {
        return matches(fileName, base, ext);
    }

    static boolean matches(String fileName, String base, String ext) {
        String prefix = base + "_";
        return fileName.length() > prefix.length() + ext.length()
                && fileName.startsWith(prefix)
                && fileName.endsWith(ext);
    }
}
