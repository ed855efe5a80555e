package com.filelog.sdk.client.rotation;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ArchiveNamesTest {

    @Test
    void splitsBaseAndExtension() {
        ArchiveNames names = ArchiveNames.of(Path.of("/var/log/node/debug.log"));

        assertEquals("debug", names.base());
        assertEquals(".log", names.ext());
        assertEquals(Path.of("/var/log/node"), names.dir());
    }

    @Test
    void onlyLastExtensionCounts() {
        ArchiveNames names = ArchiveNames.of(Path.of("/tmp/node.debug.log"));

        assertEquals("node.debug", names.base());
        assertEquals(".log", names.ext());
    }

    @Test
    void leadingDotIsNotAnExtension() {
        ArchiveNames dotfile = ArchiveNames.of(Path.of("/tmp/.log"));
        assertEquals(".log", dotfile.base());
        assertEquals("", dotfile.ext());

        ArchiveNames plain = ArchiveNames.of(Path.of("/tmp/Makefile"));
        assertEquals("Makefile", plain.base());
        assertEquals("", plain.ext());
    }

    @Test
    void archivePathUsesUtcMillisecondTimestamp() {
        ArchiveNames names = ArchiveNames.of(Path.of("/var/log/debug.log"));

        Path archive = names.archivePath(Instant.parse("2019-10-28T19:02:45.122Z"));

        assertEquals(Path.of("/var/log/debug_2019-10-28_19-02-45-122.log"), archive);
    }

    @Test
    void timestampsSortChronologically() {
        String earlier = ArchiveNames.timestamp(Instant.parse("2019-10-28T09:59:59.999Z"));
        String later = ArchiveNames.timestamp(Instant.parse("2019-10-28T10:00:00.000Z"));

        assertTrue(earlier.compareTo(later) < 0);
    }

    @Test
    void matchesOnlyArchivesOfSameFile() {
        ArchiveNames names = ArchiveNames.of(Path.of("/var/log/debug.log"));

        assertTrue(names.matches("debug_2019-10-28_19-02-45-122.log"));
        assertFalse(names.matches("debug.log"));
        assertFalse(names.matches("debug_.log"));
        assertFalse(names.matches("debug_2019-10-28_19-02-45-122.txt"));
        assertFalse(names.matches("other_2019-10-28_19-02-45-122.log"));
    }

    @Test
    void relativePathResolvesDirectoryAgainstWorkingDirectory() {
        ArchiveNames names = ArchiveNames.of(Path.of("debug.log"));

        assertTrue(names.dir().isAbsolute());
        assertEquals(Path.of("debug_2019-10-28_19-02-45-122.log"),
                names.archivePath(Instant.parse("2019-10-28T19:02:45.122Z")));
    }
}
