package com.paxkun.binder.service.merge;

import com.paxkun.binder.service.merge.exception.CorruptEntryException;
import com.paxkun.binder.service.merge.exception.EmptyArchiveException;
import com.paxkun.binder.service.merge.exception.MergeCancelledException;
import com.paxkun.binder.service.merge.exception.MergeException;
import com.paxkun.binder.service.merge.exception.MergeIOException;
import com.paxkun.binder.service.merge.exception.NoFormatsSelectedException;
import com.paxkun.binder.service.merge.exception.OperationInProgressException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Merges an ordered list of CBZ and ZIP sources into one CBZ.
 * <p>
 * Source order is chapter order. CBZ sources are read directly; ZIP sources
 * are extracted through {@link ImageExtractor} into a staging area first.
 * Output is written to a hidden sibling file and moved into place only after
 * every source has been handled, so a failed or cancelled merge never leaves
 * a file at the destination.
 * <p>
 * One operation at a time per engine: a concurrent call fails with
 * {@link OperationInProgressException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MergeEngine {

    // Fixed entry timestamp keeps repeated merges byte-identical.
    private static final LocalDateTime ENTRY_TIME = LocalDateTime.of(2000, 1, 1, 0, 0);

    private final ArchiveReader archiveReader;
    private final ImageExtractor imageExtractor;
    private final AtomicBoolean busy = new AtomicBoolean();

    public MergeResult merge(List<SourceEntry> sources, MergeOptions options) {
        return merge(sources, options, ProgressObserver.none(), CancellationToken.create());
    }

    public MergeResult merge(List<SourceEntry> sources,
                             MergeOptions options,
                             ProgressObserver<MergeProgress> observer,
                             CancellationToken token) {
        acquire();
        try {
            return new MergeRun(sources, options, observer, token).execute();
        } finally {
            busy.set(false);
        }
    }

    /**
     * Single-source extraction under the same one-operation guard as {@link #merge}.
     */
    public ChapterGroup extract(Path source,
                                int chapter,
                                Set<ImageFormat> formats,
                                Path destinationDir,
                                boolean strict,
                                List<SkippedItem> skipped,
                                ProgressObserver<ExtractionProgress> observer,
                                CancellationToken token) {
        acquire();
        try {
            return imageExtractor.extract(source, chapter, formats, destinationDir, strict, skipped, observer, token);
        } finally {
            busy.set(false);
        }
    }

    public boolean isBusy() {
        return busy.get();
    }

    private void acquire() {
        if (!busy.compareAndSet(false, true)) {
            throw new OperationInProgressException("Another merge or extraction is already running");
        }
    }

    /**
     * State of one merge invocation.
     */
    private final class MergeRun {

        private final List<SourceEntry> sources;
        private final MergeOptions options;
        private final CancellationToken token;
        private final ProgressReporter<MergeProgress> reporter;
        private final List<SkippedItem> skipped = new ArrayList<>();
        private final Set<String> usedNames = new HashSet<>();
        private final MergeResult.MergeResultBuilder result = MergeResult.builder();

        private int streamPosition;
        private int chaptersMerged;
        private byte[] comicInfo;

        private MergeRun(List<SourceEntry> sources,
                         MergeOptions options,
                         ProgressObserver<MergeProgress> observer,
                         CancellationToken token) {
            if (sources == null || sources.isEmpty()) {
                throw new IllegalArgumentException("At least one source is required");
            }
            this.sources = List.copyOf(sources);
            this.options = options;
            this.token = token != null ? token : CancellationToken.create();
            this.reporter = new ProgressReporter<>(observer, MergeProgress.validating(sources.size()));
        }

        private MergeResult execute() {
            reporter.publish(reporter.latest());
            try {
                Path output = prepareOutput();
                List<SourceEntry> accepted = validateSources();
                log.info("🚀 Merging {} sources into [{}]", accepted.size(), output.getFileName());

                try (StagingArea staging = StagingArea.create(options.getStagingRoot())) {
                    Path temp = OutputPaths.temporarySibling(output);
                    try {
                        writeArchive(temp, accepted, staging);
                        reporter.publish(reporter.latest().toBuilder()
                                .phase(MergePhase.FINALIZING)
                                .currentSource(null)
                                .build());
                        moveIntoPlace(temp, output);
                    } finally {
                        deleteQuietly(temp);
                    }
                }

                reporter.publish(reporter.latest().withPhase(MergePhase.DONE));
                log.info("✅ Merged {} pages from {} sources into [{}]", streamPosition, chaptersMerged, output);
                return result.outputPath(output)
                        .totalPages(streamPosition)
                        .comicInfoIncluded(comicInfo != null)
                        .skipped(skipped)
                        .build();
            } catch (MergeException e) {
                fail(e);
                throw e.withSkipped(skipped);
            }
        }

        private void fail(MergeException e) {
            boolean cancelled = e instanceof MergeCancelledException;
            MergePhase phase = cancelled ? MergePhase.CANCELLED : MergePhase.FAILED;
            reporter.publish(reporter.latest().failed(phase, e.getMessage()));
            if (cancelled) {
                log.info("🛑 Merge cancelled: {}", e.getMessage());
            } else {
                log.error("❌ Merge failed: {}", e.getMessage());
            }
        }

        private Path prepareOutput() {
            if (options.getSelectedFormats() == null || options.getSelectedFormats().isEmpty()) {
                throw new NoFormatsSelectedException();
            }
            Path output = OutputPaths.ensureCbzExtension(options.getOutputPath().toAbsolutePath().normalize());
            if (Files.isDirectory(output)) {
                throw new MergeIOException("Output path is a directory: " + output);
            }
            if (Files.exists(output) && !options.isOverwrite()) {
                throw new MergeIOException("Output already exists: " + output);
            }
            for (SourceEntry source : sources) {
                if (source.path().toAbsolutePath().normalize().equals(output)) {
                    throw new MergeIOException("Output would overwrite source " + source.displayName());
                }
            }
            try {
                Path parent = output.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
            } catch (IOException e) {
                throw new MergeIOException("Cannot create output directory: " + e.getMessage(), e);
            }
            return output;
        }

        private List<SourceEntry> validateSources() {
            List<SourceEntry> accepted = new ArrayList<>();
            int totalEntries = 0;
            int rejected = 0;
            for (SourceEntry source : sources) {
                token.throwIfCancelled("validating sources");
                try {
                    totalEntries += archiveReader.countImages(source.path(), formatsFor(source));
                    accepted.add(source);
                } catch (MergeException e) {
                    skipSource(source, e);
                    rejected++;
                }
            }
            if (accepted.isEmpty()) {
                throw new EmptyArchiveException("None of the " + sources.size() + " sources can be merged");
            }
            // rejected sources count as done so the final snapshot reaches totalSources
            reporter.publish(reporter.latest().toBuilder()
                    .totalEntries(totalEntries)
                    .sourcesCompleted(rejected)
                    .build());
            return accepted;
        }

        private void writeArchive(Path temp, List<SourceEntry> accepted, StagingArea staging) {
            try (OutputStream out = Files.newOutputStream(temp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                 ZipOutputStream zip = new ZipOutputStream(out)) {
                for (SourceEntry source : accepted) {
                    mergeSource(source, zip, staging);
                }
                if (chaptersMerged == 0) {
                    throw new EmptyArchiveException("None of the " + sources.size() + " sources could be merged");
                }
                if (comicInfo != null) {
                    writeEntry(zip, ComicInfoXml.ENTRY_NAME, comicInfo);
                }
            } catch (IOException e) {
                throw new MergeIOException("Failed to write output archive: " + e.getMessage(), e);
            }
        }

        private void mergeSource(SourceEntry source, ZipOutputStream zip, StagingArea staging) throws IOException {
            int chapter = source.chapterIndex();
            String name = source.displayName();
            reporter.publish(reporter.latest().toBuilder()
                    .currentSource(name)
                    .phase(source.kind() == SourceKind.CBZ ? MergePhase.READING : MergePhase.EXTRACTING)
                    .build());

            try {
                int pages = source.kind() == SourceKind.CBZ
                        ? copyCbz(source, chapter, zip, staging)
                        : copyExtracted(source, chapter, zip, staging);
                chaptersMerged++;
                result.chapter(new MergeResult.ChapterSummary(chapter, name, pages));
                log.info("📥 Chapter {} from [{}]: {} pages", chapter, name, pages);
            } catch (MergeCancelledException | MergeIOException e) {
                throw e;
            } catch (MergeException e) {
                skipSource(source, e);
            }

            reporter.publish(reporter.latest().toBuilder()
                    .sourcesCompleted(reporter.latest().getSourcesCompleted() + 1)
                    .build());
        }

        private int copyCbz(SourceEntry source, int chapter, ZipOutputStream zip, StagingArea staging) throws IOException {
            PathValidator validator = PathValidator.within(staging.root());
            try (ArchiveHandle handle = archiveReader.open(source.path())) {
                List<ArchiveEntry> entries = imageExtractor.selectPages(handle, ImageFormat.all(), validator, options.isStrictMode(), skipped);
                byte[] metadata = pendingComicInfo(handle);

                int page = 0;
                for (ArchiveEntry entry : entries) {
                    token.throwIfCancelled("merging " + source.displayName());
                    byte[] data;
                    try {
                        data = archiveReader.readEntry(handle, entry);
                    } catch (CorruptEntryException e) {
                        ImageExtractor.skipEntry(source.displayName(), entry, e, options.isStrictMode(), skipped);
                        continue;
                    }
                    page++;
                    writePage(zip, new RenamedEntry(entry.name(), chapter, page, entry.extension()), data);
                }
                if (page == 0) {
                    throw new EmptyArchiveException("No image entries of " + source.displayName() + " could be read");
                }
                commitComicInfo(metadata);
                return page;
            }
        }

        private int copyExtracted(SourceEntry source, int chapter, ZipOutputStream zip, StagingArea staging) throws IOException {
            ChapterGroup group = imageExtractor.extract(
                    source.path(),
                    chapter,
                    options.getSelectedFormats(),
                    staging.chapterDirectory(source),
                    options.isStrictMode(),
                    skipped,
                    this::onExtractionProgress,
                    token);

            byte[] metadata = null;
            if (needsComicInfo()) {
                try (ArchiveHandle handle = archiveReader.open(source.path())) {
                    metadata = pendingComicInfo(handle);
                }
            }

            for (RenamedEntry entry : group.entries()) {
                token.throwIfCancelled("merging " + source.displayName());
                Path staged = group.fileOf(entry);
                byte[] data;
                try {
                    data = Files.readAllBytes(staged);
                    Files.delete(staged);
                } catch (IOException e) {
                    throw new MergeIOException("Cannot read staged page " + staged + ": " + e.getMessage(), e);
                }
                writePage(zip, entry, data);
            }
            commitComicInfo(metadata);
            return group.size();
        }

        private void onExtractionProgress(ExtractionProgress extraction) {
            MergeProgress current = reporter.latest();
            if (extraction.getPhase() == MergePhase.EXTRACTING && current.getPhase() != MergePhase.EXTRACTING) {
                reporter.publish(current.toBuilder()
                        .phase(MergePhase.EXTRACTING)
                        .currentSource(extraction.getSourceName())
                        .build());
            }
        }

        private void writePage(ZipOutputStream zip, RenamedEntry entry, byte[] data) throws IOException {
            streamPosition++;
            RenamedEntry target = entry;
            if (usedNames.contains(target.targetName())) {
                target = entry.withPage(streamPosition);
                log.warn("⚠️ Name {} already used, renumbering {} as {}", entry.targetName(), entry.originalName(), target.targetName());
            }
            String targetName = target.targetName();
            if (usedNames.contains(targetName)) {
                throw new IllegalStateException("Duplicate output entry after renumbering: " + targetName);
            }
            PathValidator.Validation validation = PathValidator.checkName(targetName);
            if (!validation.ok()) {
                throw new IllegalStateException(validation.reason());
            }

            writeEntry(zip, targetName, data);
            usedNames.add(targetName);

            MergeProgress current = reporter.latest();
            MergeProgress next = current.toBuilder()
                    .entriesWritten(current.getEntriesWritten() + 1)
                    .phase(MergePhase.WRITING)
                    .build();
            int batch = Math.max(1, options.getProgressBatchSize());
            if (next.getEntriesWritten() % batch == 0) {
                reporter.publish(next);
            } else {
                reporter.publishQuietly(next);
            }
        }

        private void writeEntry(ZipOutputStream zip, String name, byte[] data) throws IOException {
            ZipEntry zipEntry = new ZipEntry(name);
            zipEntry.setTimeLocal(ENTRY_TIME);
            zip.putNextEntry(zipEntry);
            zip.write(data);
            zip.closeEntry();
        }

        private boolean needsComicInfo() {
            return options.isIncludeComicInfo() && comicInfo == null && chaptersMerged == 0;
        }

        private byte[] pendingComicInfo(ArchiveHandle handle) {
            if (!needsComicInfo()) {
                return null;
            }
            Optional<byte[]> xml = archiveReader.readComicInfo(handle);
            return xml.filter(ComicInfoXml::isWellFormed).orElse(null);
        }

        // Kept only once the source that carried it has merged successfully.
        private void commitComicInfo(byte[] metadata) {
            if (metadata != null && comicInfo == null) {
                comicInfo = metadata;
            }
        }

        private void skipSource(SourceEntry source, MergeException e) {
            if (options.isStrictMode() || e instanceof MergeCancelledException || e instanceof MergeIOException) {
                throw e;
            }
            log.warn("⚠️ Skipping source [{}]: {}", source.displayName(), e.getMessage());
            skipped.add(SkippedItem.ofSource(source.displayName(), e));
        }

        private Set<ImageFormat> formatsFor(SourceEntry source) {
            return source.kind() == SourceKind.CBZ ? ImageFormat.all() : options.getSelectedFormats();
        }

        private void moveIntoPlace(Path temp, Path output) {
            try {
                if (options.isOverwrite()) {
                    try {
                        Files.move(temp, output, StandardCopyOption.ATOMIC_MOVE);
                    } catch (AtomicMoveNotSupportedException e) {
                        Files.move(temp, output, StandardCopyOption.REPLACE_EXISTING);
                    }
                } else {
                    Files.move(temp, output);
                }
            } catch (FileAlreadyExistsException e) {
                throw new MergeIOException("Output appeared while merging: " + output, e);
            } catch (IOException e) {
                throw new MergeIOException("Cannot move merged archive into place: " + e.getMessage(), e);
            }
        }

        private void deleteQuietly(Path temp) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException e) {
                log.warn("⚠️ Failed to delete temporary output {}: {}", temp, e.getMessage());
            }
        }
    }
}
