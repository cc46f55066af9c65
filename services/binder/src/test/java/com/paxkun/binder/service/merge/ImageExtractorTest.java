package com.paxkun.binder.service.merge;

import com.paxkun.binder.service.merge.exception.CorruptEntryException;
import com.paxkun.binder.service.merge.exception.EmptyArchiveException;
import com.paxkun.binder.service.merge.exception.MergeCancelledException;
import com.paxkun.binder.service.merge.exception.MergeFailure;
import com.paxkun.binder.service.merge.exception.NoFormatsSelectedException;
import com.paxkun.binder.service.merge.exception.PathRejectedException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageExtractorTest {

    private final ImageExtractor extractor = new ImageExtractor(new ArchiveReader());

    @TempDir
    Path tempDir;

    @Test
    void keepsOnlySelectedFormats() throws IOException {
        Path source = ZipFixtures.archive(tempDir.resolve("in"), "chapter.zip", "a.txt", "img1.jpg", "img2.gif");
        Path out = tempDir.resolve("out");

        ChapterGroup group = extractor.extract(source, 1, EnumSet.of(ImageFormat.JPG), out);

        assertThat(group.entries()).extracting(RenamedEntry::targetName).containsExactly("ch1_001.jpg");
        assertThat(listNames(out)).containsExactly("ch1_001.jpg");
        assertThat(Files.readString(out.resolve("ch1_001.jpg"))).isEqualTo("img1.jpg");
    }

    @Test
    void numbersPagesInNaturalOrder() throws IOException {
        Path source = ZipFixtures.archive(tempDir.resolve("in"), "chapter.zip", "10.png", "2.png", "1.png");
        Path out = tempDir.resolve("out");

        ChapterGroup group = extractor.extract(source, 4, EnumSet.of(ImageFormat.PNG), out);

        assertThat(group.chapter()).isEqualTo(4);
        assertThat(group.entries()).extracting(RenamedEntry::originalName).containsExactly("1.png", "2.png", "10.png");
        assertThat(group.entries()).extracting(RenamedEntry::targetName)
                .containsExactly("ch4_001.png", "ch4_002.png", "ch4_003.png");
        assertThat(Files.readString(group.fileOf(group.entries().get(2)))).isEqualTo("10.png");
    }

    @Test
    void repeatedExtractionProducesSameNames() throws IOException {
        Path source = ZipFixtures.archive(tempDir.resolve("in"), "chapter.zip", "b.jpg", "a.jpg", "c.jpeg");

        ChapterGroup first = extractor.extract(source, 2, ImageFormat.all(), tempDir.resolve("first"));
        ChapterGroup second = extractor.extract(source, 2, ImageFormat.all(), tempDir.resolve("second"));

        assertThat(second.entries()).isEqualTo(first.entries());
        assertThat(listNames(tempDir.resolve("second"))).isEqualTo(listNames(tempDir.resolve("first")));
    }

    @Test
    void emptyFormatSelectionIsRejected() throws IOException {
        Path source = ZipFixtures.archive(tempDir.resolve("in"), "chapter.zip", "1.jpg");

        assertThatThrownBy(() -> extractor.extract(source, 1, Set.of(), tempDir.resolve("out")))
                .isInstanceOf(NoFormatsSelectedException.class);
    }

    @Test
    void archiveWithoutSelectedFormatsIsEmpty() throws IOException {
        Path source = ZipFixtures.archive(tempDir.resolve("in"), "chapter.zip", "1.png", "notes.txt");

        assertThatThrownBy(() -> extractor.extract(source, 1, EnumSet.of(ImageFormat.JPG), tempDir.resolve("out")))
                .isInstanceOf(EmptyArchiveException.class);
    }

    @Test
    void lenientModeSkipsUnsafeNames() throws IOException {
        Path source = ZipFixtures.archive(tempDir.resolve("in"), "chapter.zip", "../../etc/passwd.jpg", "ok.jpg");
        Path out = tempDir.resolve("out");
        List<SkippedItem> skipped = new ArrayList<>();

        ChapterGroup group = extractor.extract(source, 1, EnumSet.of(ImageFormat.JPG), out, false, skipped,
                ProgressObserver.none(), CancellationToken.create());

        assertThat(group.entries()).extracting(RenamedEntry::targetName).containsExactly("ch1_001.jpg");
        assertThat(Files.readString(out.resolve("ch1_001.jpg"))).isEqualTo("ok.jpg");
        assertThat(skipped).singleElement().satisfies(item -> {
            assertThat(item.source()).isEqualTo("chapter.zip");
            assertThat(item.entry()).isEqualTo("../../etc/passwd.jpg");
            assertThat(item.failure()).isEqualTo(MergeFailure.PATH_REJECTED);
        });
        assertThat(Files.exists(tempDir.resolve("etc"))).isFalse();
    }

    @Test
    void strictModeFailsOnUnsafeNames() throws IOException {
        Path source = ZipFixtures.archive(tempDir.resolve("in"), "chapter.zip", "ok.jpg", "/abs.jpg");
        List<SkippedItem> skipped = new ArrayList<>();

        assertThatThrownBy(() -> extractor.extract(source, 1, EnumSet.of(ImageFormat.JPG), tempDir.resolve("out"),
                true, skipped, ProgressObserver.none(), CancellationToken.create()))
                .isInstanceOf(PathRejectedException.class);
        assertThat(skipped).isEmpty();
    }

    @Test
    void reportsProgressUntilDone() throws IOException {
        Path source = ZipFixtures.archive(tempDir.resolve("in"), "chapter.zip", "1.jpg", "2.jpg");
        List<ExtractionProgress> snapshots = new ArrayList<>();

        extractor.extract(source, 1, EnumSet.of(ImageFormat.JPG), tempDir.resolve("out"), false, new ArrayList<>(),
                snapshots::add, CancellationToken.create());

        assertThat(snapshots).first().satisfies(first -> {
            assertThat(first.getPhase()).isEqualTo(MergePhase.EXTRACTING);
            assertThat(first.getEntriesFound()).isEqualTo(2);
        });
        assertThat(snapshots).extracting(ExtractionProgress::getEntriesExtracted).contains(1, 2);
        assertThat(snapshots).last().satisfies(last -> {
            assertThat(last.getPhase()).isEqualTo(MergePhase.DONE);
            assertThat(last.getSourceName()).isEqualTo("chapter.zip");
        });
    }

    @Test
    void cancelledExtractionStopsAndReportsCancelled() throws IOException {
        Path source = ZipFixtures.archive(tempDir.resolve("in"), "chapter.zip", "1.jpg", "2.jpg", "3.jpg");
        CancellationToken token = CancellationToken.create();
        List<ExtractionProgress> snapshots = new ArrayList<>();

        assertThatThrownBy(() -> extractor.extract(source, 1, EnumSet.of(ImageFormat.JPG), tempDir.resolve("out"),
                false, new ArrayList<>(), snapshot -> {
                    snapshots.add(snapshot);
                    if (snapshot.getEntriesExtracted() == 1) {
                        token.cancel();
                    }
                }, token))
                .isInstanceOf(MergeCancelledException.class);

        assertThat(snapshots).last().extracting(ExtractionProgress::getPhase).isEqualTo(MergePhase.CANCELLED);
        assertThat(listNames(tempDir.resolve("out"))).isEmpty();
    }

    @Test
    void extractionIntoSameFolderSucceedsAfterCancel() throws IOException {
        Path source = ZipFixtures.archive(tempDir.resolve("in"), "chapter.zip", "1.jpg", "2.jpg", "3.jpg");
        Path out = tempDir.resolve("out");
        CancellationToken token = CancellationToken.create();

        assertThatThrownBy(() -> extractor.extract(source, 1, EnumSet.of(ImageFormat.JPG), out,
                false, new ArrayList<>(), snapshot -> {
                    if (snapshot.getEntriesExtracted() == 1) {
                        token.cancel();
                    }
                }, token))
                .isInstanceOf(MergeCancelledException.class);

        ChapterGroup retry = extractor.extract(source, 1, EnumSet.of(ImageFormat.JPG), out);

        assertThat(retry.size()).isEqualTo(3);
        assertThat(listNames(out)).containsExactly("ch1_001.jpg", "ch1_002.jpg", "ch1_003.jpg");
    }

    @Test
    void strictFailureRemovesPagesAlreadyWritten() throws IOException {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("1.jpg", "small".getBytes(StandardCharsets.UTF_8));
        entries.put("2.jpg", "far too large for the limit".getBytes(StandardCharsets.UTF_8));
        Path source = ZipFixtures.archive(tempDir.resolve("in"), "chapter.zip", entries);
        Path out = tempDir.resolve("out");
        ImageExtractor limited = new ImageExtractor(new ArchiveReader(10));

        assertThatThrownBy(() -> limited.extract(source, 1, EnumSet.of(ImageFormat.JPG), out, true,
                new ArrayList<>(), ProgressObserver.none(), CancellationToken.create()))
                .isInstanceOf(CorruptEntryException.class);

        assertThat(listNames(out)).isEmpty();
    }

    @Test
    void observerFailureDoesNotAbortExtraction() throws IOException {
        Path source = ZipFixtures.archive(tempDir.resolve("in"), "chapter.zip", "1.jpg");

        ChapterGroup group = extractor.extract(source, 1, EnumSet.of(ImageFormat.JPG), tempDir.resolve("out"), false,
                new ArrayList<>(), snapshot -> {
                    throw new IllegalStateException("broken observer");
                }, CancellationToken.create());

        assertThat(group.size()).isEqualTo(1);
    }

    private static List<String> listNames(Path directory) throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files.map(path -> path.getFileName().toString()).sorted().toList();
        }
    }
}
