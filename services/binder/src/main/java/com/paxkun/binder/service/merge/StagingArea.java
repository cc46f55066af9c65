package com.paxkun.binder.service.merge;

import com.paxkun.binder.service.merge.exception.MergeIOException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Temporary directory owned by exactly one operation. Closing it deletes
 * everything inside, whatever way the operation ended.
 */
@Slf4j
public final class StagingArea implements AutoCloseable {

    public static final String PREFIX = "binder-staging-";

    private final Path root;

    private StagingArea(Path root) {
        this.root = root;
    }

    /**
     * @param parent directory to create the staging area in, or {@code null} for the system temp directory
     */
    public static StagingArea create(Path parent) {
        try {
            Path root;
            if (parent == null) {
                root = Files.createTempDirectory(PREFIX);
            } else {
                Files.createDirectories(parent);
                root = Files.createTempDirectory(parent, PREFIX);
            }
            log.debug("Created staging area {}", root);
            return new StagingArea(root);
        } catch (IOException e) {
            throw new MergeIOException("Cannot create staging directory: " + e.getMessage(), e);
        }
    }

    public Path root() {
        return root;
    }

    public Path chapterDirectory(SourceEntry source) {
        Path directory = root.resolve(String.format(Locale.ROOT, "source-%03d-ch%d", source.ordinal() + 1, source.chapterIndex()));
        try {
            return Files.createDirectories(directory);
        } catch (IOException e) {
            throw new MergeIOException("Cannot create staging directory " + directory + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        deleteRecursively(root);
    }

    /**
     * Removes staging directories left behind by an earlier process.
     *
     * @return number of directories removed
     */
    public static int purgeStale(Path parent) {
        if (parent == null || !Files.isDirectory(parent)) {
            return 0;
        }
        int purged = 0;
        try (Stream<Path> children = Files.list(parent)) {
            for (Path child : (Iterable<Path>) children::iterator) {
                if (Files.isDirectory(child) && child.getFileName().toString().startsWith(PREFIX)) {
                    deleteRecursively(child);
                    purged++;
                }
            }
        } catch (IOException e) {
            log.warn("⚠️ Failed to scan {} for stale staging directories: {}", parent, e.getMessage());
        }
        return purged;
    }

    static void deleteRecursively(Path folder) {
        if (!Files.exists(folder)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(folder)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.delete(path);
                } catch (IOException e) {
                    log.warn("⚠️ Failed to delete {}: {}", path, e.getMessage());
                }
            });
            log.debug("🗑️ Deleted staging folder {}", folder);
        } catch (IOException e) {
            log.warn("⚠️ Failed to delete folder {}: {}", folder, e.getMessage());
        }
    }
}
