package com.filelog.sdk.client.rotation;

import com.filelog.sdk.client.stream.LogFileSystem;
import com.filelog.sdk.exception.PruneDeleteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Deletes the oldest archives of a log file, keeping the newest {@code maxFiles}.
 */
public class RetentionPruner {

    private static final Logger log = LoggerFactory.getLogger(RetentionPruner.class);

    private final LogFileSystem fileSystem;

    public RetentionPruner(LogFileSystem fileSystem) {
        this.fileSystem = fileSystem;
    }

    /**
     * Prune archives named {@code <base>_*<ext>} in {@code dir}.
     *
     * <p>Best effort: a file that cannot be deleted is reported and skipped.</p>
     */
    public Result prune(Path dir, String base, String ext, int maxFiles) {
        List<Path> entries;
        try {
            entries = fileSystem.list(dir);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to list {} for pruning: {}", dir, e.getMessage());
            return Result.EMPTY;
        }

        List<Path> archives = new ArrayList<>();
        for (Path entry : entries) {
            if (ArchiveNames.matches(entry.getFileName().toString(), base, ext)) {
                archives.add(entry);
            }
        }

        if (archives.size() <= maxFiles) {
            return Result.EMPTY;
        }

        // Timestamps sort chronologically; directory order is not guaranteed
        archives.sort(Comparator.comparing(p -> p.getFileName().toString()));

        List<Path> deleted = new ArrayList<>();
        List<PruneDeleteException> failures = new ArrayList<>();
        for (Path archive : archives.subList(0, archives.size() - maxFiles)) {
            try {
                fileSystem.delete(archive);
                deleted.add(archive);
            } catch (IOException | RuntimeException e) {
                PruneDeleteException failure =
                        new PruneDeleteException("Failed to delete archived log file: " + archive, e);
                log.warn(failure.getMessage(), e);
                failures.add(failure);
            }
        }

        log.debug("Pruned {} archived log file(s) of {}{}", deleted.size(), base, ext);
        return new Result(deleted, failures);
    }

    /**
     * Outcome of one pruning pass.
     */
    public static final class Result {
        static final Result EMPTY = new Result(List.of(), List.of());

        private final List<Path> deleted;
        private final List<PruneDeleteException> failures;

        Result(List<Path> deleted, List<PruneDeleteException> failures) {
            this.deleted = List.copyOf(deleted);
            this.failures = List.copyOf(failures);
        }

        public List<Path> getDeleted() {
            return deleted;
        }

        public List<PruneDeleteException> getFailures() {
            return failures;
        }
    }
}
