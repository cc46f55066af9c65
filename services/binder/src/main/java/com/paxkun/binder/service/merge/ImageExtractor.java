package com.paxkun.binder.service.merge;

import com.paxkun.binder.service.merge.exception.CorruptEntryException;
import com.paxkun.binder.service.merge.exception.EmptyArchiveException;
import com.paxkun.binder.service.merge.exception.MergeCancelledException;
import com.paxkun.binder.service.merge.exception.MergeException;
import com.paxkun.binder.service.merge.exception.MergeIOException;
import com.paxkun.binder.service.merge.exception.NoFormatsSelectedException;
import com.paxkun.binder.service.merge.exception.PathRejectedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Pulls the selected image formats out of one archive and writes them as
 * {@code ch{chapter}_{page:03d}.{ext}} files, pages numbered in natural order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ImageExtractor {

    private final ArchiveReader archiveReader;

    public ChapterGroup extract(Path source, int chapter, Set<ImageFormat> formats, Path destinationDir) {
        return extract(source, chapter, formats, destinationDir, false, new ArrayList<>(),
                ProgressObserver.none(), CancellationToken.create());
    }

    /**
     * @param strict   fail on the first rejected or corrupt entry instead of skipping it
     * @param skipped  receives every entry left out
     * @throws NoFormatsSelectedException when {@code formats} is empty
     * @throws EmptyArchiveException      when no entry of the selected formats survives
     * @throws MergeCancelledException    when {@code token} is cancelled between entries
     */
    public ChapterGroup extract(Path source,
                                int chapter,
                                Set<ImageFormat> formats,
                                Path destinationDir,
                                boolean strict,
                                List<SkippedItem> skipped,
                                ProgressObserver<ExtractionProgress> observer,
                                CancellationToken token) {
        if (formats == null || formats.isEmpty()) {
            throw new NoFormatsSelectedException();
        }
        if (chapter < 1) {
            throw new IllegalArgumentException("chapter must be 1 or greater: " + chapter);
        }
        String sourceName = source.getFileName() != null ? source.getFileName().toString() : source.toString();
        ProgressReporter<ExtractionProgress> reporter = new ProgressReporter<>(observer, ExtractionProgress.builder()
                .sourceName(sourceName)
                .phase(MergePhase.READING)
                .build());

        List<Path> files = new ArrayList<>();
        try {
            createDirectories(destinationDir);
            PathValidator validator = PathValidator.within(destinationDir);

            try (ArchiveHandle handle = archiveReader.open(source)) {
                List<ArchiveEntry> pages = selectPages(handle, formats, validator, strict, skipped);
                reporter.publish(reporter.latest().toBuilder()
                        .entriesFound(pages.size())
                        .phase(MergePhase.EXTRACTING)
                        .build());

                List<RenamedEntry> written = new ArrayList<>();
                for (ArchiveEntry entry : pages) {
                    token.throwIfCancelled("extracting " + sourceName);
                    byte[] data;
                    try {
                        data = archiveReader.readEntry(handle, entry);
                    } catch (CorruptEntryException e) {
                        skipEntry(sourceName, entry, e, strict, skipped);
                        continue;
                    }

                    RenamedEntry renamed = new RenamedEntry(entry.name(), chapter, written.size() + 1, entry.extension());
                    Path target = validator.resolveWithin(renamed.targetName());
                    writeNew(target, data);
                    files.add(target);
                    written.add(renamed);
                    log.debug("{}: {} → {}", sourceName, entry.name(), renamed.targetName());

                    reporter.publish(reporter.latest().toBuilder()
                            .entriesExtracted(written.size())
                            .currentFile(entry.name())
                            .build());
                }

                if (written.isEmpty()) {
                    throw new EmptyArchiveException("No image entries of " + sourceName + " survived extraction ("
                            + pages.size() + " skipped)");
                }
                reporter.publish(reporter.latest().toBuilder()
                        .currentFile(null)
                        .phase(MergePhase.DONE)
                        .build());
                log.info("📦 Extracted {} pages from [{}] as chapter {}", written.size(), sourceName, chapter);
                return new ChapterGroup(chapter, sourceName, written, destinationDir);
            }
        } catch (MergeException e) {
            deleteWritten(files);
            MergePhase phase = e instanceof MergeCancelledException ? MergePhase.CANCELLED : MergePhase.FAILED;
            reporter.publish(reporter.latest().toBuilder()
                    .currentFile(null)
                    .phase(phase)
                    .errorMessage(e.getMessage())
                    .build());
            throw e;
        } catch (RuntimeException e) {
            deleteWritten(files);
            throw e;
        }
    }

    /**
     * Entries of {@code formats} that pass path validation, in natural order.
     *
     * @throws EmptyArchiveException  when nothing is left
     * @throws PathRejectedException  in strict mode, for the first unsafe name
     */
    List<ArchiveEntry> selectPages(ArchiveHandle handle,
                                   Set<ImageFormat> formats,
                                   PathValidator validator,
                                   boolean strict,
                                   List<SkippedItem> skipped) {
        List<ArchiveEntry> accepted = new ArrayList<>();
        for (ArchiveEntry entry : archiveReader.listImageEntries(handle, formats)) {
            PathValidator.Validation validation = validator.validate(entry.name());
            if (!validation.ok()) {
                skipEntry(handle.displayName(), entry, new PathRejectedException(validation.reason()), strict, skipped);
                continue;
            }
            accepted.add(entry);
        }
        if (accepted.isEmpty()) {
            throw new EmptyArchiveException("No safe image entries in " + handle.displayName());
        }
        NaturalSorter.sort(accepted, ArchiveEntry::name);
        return accepted;
    }

    static void skipEntry(String sourceName, ArchiveEntry entry, MergeException e, boolean strict, List<SkippedItem> skipped) {
        if (strict) {
            throw e;
        }
        log.warn("⚠️ Skipping {} in {}: {}", entry.name(), sourceName, e.getMessage());
        skipped.add(SkippedItem.ofEntry(sourceName, entry.name(), e));
    }

    private static void createDirectories(Path directory) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new MergeIOException("Cannot create " + directory + ": " + e.getMessage(), e);
        }
    }

    /**
     * Removes the pages of a failed or cancelled run so the destination can be reused.
     */
    private static void deleteWritten(List<Path> files) {
        for (Path file : files) {
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                log.warn("⚠️ Failed to delete partial page {}: {}", file, e.getMessage());
            }
        }
    }

    private static void writeNew(Path target, byte[] data) {
        try {
            Files.write(target, data, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (FileAlreadyExistsException e) {
            throw new MergeIOException("Refusing to overwrite existing file " + target, e);
        } catch (IOException e) {
            throw new MergeIOException("Cannot write " + target + ": " + e.getMessage(), e);
        }
    }
}
