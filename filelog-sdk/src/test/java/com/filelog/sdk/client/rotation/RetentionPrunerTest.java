package com.filelog.sdk.client.rotation;

import com.filelog.sdk.exception.PruneDeleteException;
import com.filelog.sdk.support.FaultyLogFileSystem;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RetentionPrunerTest {

    private static final String T1 = "debug_2020-01-01_00-00-01-000.log";
    private static final String T2 = "debug_2020-01-01_00-00-02-000.log";
    private static final String T3 = "debug_2020-01-01_00-00-03-000.log";

    @Test
    void keepsNewestArchives(@TempDir Path dir) throws Exception {
        // created out of order; names decide age
        touch(dir, T3, T1, T2);

        RetentionPruner.Result result = new RetentionPruner(new FaultyLogFileSystem())
                .prune(dir, "debug", ".log", 2);

        assertEquals(List.of(dir.resolve(T1)), result.getDeleted());
        assertTrue(result.getFailures().isEmpty());
        assertFalse(Files.exists(dir.resolve(T1)));
        assertTrue(Files.exists(dir.resolve(T2)));
        assertTrue(Files.exists(dir.resolve(T3)));
    }

    @Test
    void leavesUnrelatedFilesAlone(@TempDir Path dir) throws Exception {
        touch(dir, T1, T2, "debug.log", "debug_.log", "debug_x.txt", "other_2020-01-01.log");

        new RetentionPruner(new FaultyLogFileSystem()).prune(dir, "debug", ".log", 0);

        assertFalse(Files.exists(dir.resolve(T1)));
        assertFalse(Files.exists(dir.resolve(T2)));
        assertTrue(Files.exists(dir.resolve("debug.log")));
        assertTrue(Files.exists(dir.resolve("debug_.log")));
        assertTrue(Files.exists(dir.resolve("debug_x.txt")));
        assertTrue(Files.exists(dir.resolve("other_2020-01-01.log")));
    }

    @Test
    void nothingToDoUnderLimit(@TempDir Path dir) throws Exception {
        touch(dir, T1, T2);

        RetentionPruner.Result result = new RetentionPruner(new FaultyLogFileSystem())
                .prune(dir, "debug", ".log", 10);

        assertTrue(result.getDeleted().isEmpty());
        assertTrue(Files.exists(dir.resolve(T1)));
    }

    @Test
    void deleteFailureIsReportedAndSkipped(@TempDir Path dir) throws Exception {
        touch(dir, T1, T2, T3);
        FaultyLogFileSystem fs = new FaultyLogFileSystem();
        fs.undeletable.add(T1);

        RetentionPruner.Result result = new RetentionPruner(fs).prune(dir, "debug", ".log", 1);

        assertEquals(List.of(dir.resolve(T2)), result.getDeleted());
        assertEquals(1, result.getFailures().size());
        PruneDeleteException failure = result.getFailures().get(0);
        assertEquals(PruneDeleteException.ERROR_CODE, failure.getErrorCode());
        assertInstanceOf(IOException.class, failure.getCause());
        assertTrue(Files.exists(dir.resolve(T1)));
        assertTrue(Files.exists(dir.resolve(T3)));
    }

    @Test
    void missingDirectoryIsNotAnError(@TempDir Path dir) {
        RetentionPruner.Result result = new RetentionPruner(new FaultyLogFileSystem())
                .prune(dir.resolve("missing"), "debug", ".log", 1);

        assertTrue(result.getDeleted().isEmpty());
        assertTrue(result.getFailures().isEmpty());
    }

    @Test
    void extensionlessArchives(@TempDir Path dir) throws Exception {
        touch(dir, "Makefile_2020-01-01_00-00-01-000", "Makefile_2020-01-01_00-00-02-000", "Makefile");

        new RetentionPruner(new FaultyLogFileSystem()).prune(dir, "Makefile", "", 1);

        assertFalse(Files.exists(dir.resolve("Makefile_2020-01-01_00-00-01-000")));
        assertTrue(Files.exists(dir.resolve("Makefile_2020-01-01_00-00-02-000")));
        assertTrue(Files.exists(dir.resolve("Makefile")));
    }

    private static void touch(Path dir, String... names) throws IOException {
        for (String name : names) {
            Files.writeString(dir.resolve(name), name);
        }
    }
}
