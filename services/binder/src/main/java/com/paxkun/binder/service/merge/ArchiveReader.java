package com.paxkun.binder.service.merge;

import com.paxkun.binder.service.merge.exception.CorruptEntryException;
import com.paxkun.binder.service.merge.exception.EmptyArchiveException;
import com.paxkun.binder.service.merge.exception.MergeException;
import com.paxkun.binder.service.merge.exception.UnreadableArchiveException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

/**
 * Opens CBZ/ZIP sources and reads their image entries one at a time.
 */
@Slf4j
@Component
public class ArchiveReader {

    public static final long DEFAULT_MAX_ENTRY_BYTES = 100L * 1024 * 1024;

    private static final byte[] ZIP_MAGIC = {0x50, 0x4B, 0x03, 0x04};
    private static final byte[] EMPTY_ZIP_MAGIC = {0x50, 0x4B, 0x05, 0x06};
    private static final String COMIC_INFO = "comicinfo.xml";
    private static final String MAC_RESOURCE_DIR = "__macosx/";
    // Older archivers wrote names in the DOS code page.
    private static final Charset[] NAME_ENCODINGS = {StandardCharsets.UTF_8, Charset.forName("Cp437")};

    private final long maxEntryBytes;

    public ArchiveReader() {
        this(DEFAULT_MAX_ENTRY_BYTES);
    }

    @Autowired
    public ArchiveReader(@Value("${binder.max-entry-bytes:104857600}") long maxEntryBytes) {
        if (maxEntryBytes <= 0) {
            throw new IllegalArgumentException("binder.max-entry-bytes must be positive: " + maxEntryBytes);
        }
        this.maxEntryBytes = maxEntryBytes;
    }

    /**
     * @throws UnreadableArchiveException for a missing, empty, misnamed or unparsable file
     */
    public ArchiveHandle open(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new UnreadableArchiveException("File not found: " + path);
        }
        try {
            if (Files.size(path) == 0) {
                throw new UnreadableArchiveException("Archive is empty (0 bytes): " + path.getFileName());
            }
            if (!hasZipSignature(path)) {
                throw new UnreadableArchiveException("Not a ZIP archive: " + path.getFileName());
            }
        } catch (IOException e) {
            throw new UnreadableArchiveException("Cannot read " + path.getFileName() + ": " + e.getMessage(), e);
        }

        ZipException lastFailure = null;
        for (Charset charset : NAME_ENCODINGS) {
            try {
                return new ArchiveHandle(path, new ZipFile(path.toFile(), charset));
            } catch (ZipException e) {
                lastFailure = e;
                log.debug("Opening {} as {} failed: {}", path.getFileName(), charset, e.getMessage());
            } catch (IOException e) {
                throw new UnreadableArchiveException("Cannot open " + path.getFileName() + ": " + e.getMessage(), e);
            }
        }
        throw new UnreadableArchiveException("Corrupt ZIP archive " + path.getFileName() + ": " + lastFailure.getMessage(), lastFailure);
    }

    /**
     * Image entries in archive order, any supported format.
     *
     * @throws EmptyArchiveException when the archive holds no images
     */
    public List<ArchiveEntry> listImageEntries(ArchiveHandle handle) {
        return listImageEntries(handle, ImageFormat.all());
    }

    /**
     * Image entries in archive order whose extension is in {@code formats}.
     *
     * @throws EmptyArchiveException when nothing qualifies
     */
    public List<ArchiveEntry> listImageEntries(ArchiveHandle handle, Set<ImageFormat> formats) {
        List<ArchiveEntry> entries = new ArrayList<>();
        Enumeration<? extends ZipEntry> zipEntries = handle.zipFile().entries();
        int index = 0;
        while (zipEntries.hasMoreElements()) {
            ZipEntry zipEntry = zipEntries.nextElement();
            int position = index++;
            if (zipEntry.isDirectory() || !isContentEntry(zipEntry.getName())) {
                continue;
            }
            String extension = ImageFormat.extensionOf(zipEntry.getName());
            Optional<ImageFormat> format = ImageFormat.fromExtension(extension);
            if (format.isPresent() && formats.contains(format.get())) {
                entries.add(new ArchiveEntry(zipEntry.getName(), extension, zipEntry.getSize(), position));
            }
        }
        if (entries.isEmpty()) {
            throw new EmptyArchiveException("No " + describe(formats) + " images in " + handle.displayName());
        }
        return entries;
    }

    /**
     * @throws CorruptEntryException when the entry is missing, oversized or fails its CRC
     */
    public byte[] readEntry(ArchiveHandle handle, ArchiveEntry entry) {
        ZipEntry zipEntry = handle.zipFile().getEntry(entry.name());
        if (zipEntry == null) {
            throw new CorruptEntryException("Entry disappeared from " + handle.displayName() + ": " + entry.name());
        }
        if (zipEntry.getSize() > maxEntryBytes) {
            throw new CorruptEntryException("Entry " + entry.name() + " exceeds " + maxEntryBytes + " bytes");
        }
        try (InputStream in = handle.zipFile().getInputStream(zipEntry)) {
            byte[] data = in.readNBytes((int) Math.min(maxEntryBytes + 1, Integer.MAX_VALUE - 8));
            if (data.length > maxEntryBytes) {
                throw new CorruptEntryException("Entry " + entry.name() + " exceeds " + maxEntryBytes + " bytes");
            }
            return data;
        } catch (IOException e) {
            throw new CorruptEntryException("Cannot read " + entry.name() + " from " + handle.displayName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * The root-level ComicInfo.xml, when present and readable.
     */
    public Optional<byte[]> readComicInfo(ArchiveHandle handle) {
        Enumeration<? extends ZipEntry> zipEntries = handle.zipFile().entries();
        while (zipEntries.hasMoreElements()) {
            ZipEntry zipEntry = zipEntries.nextElement();
            if (zipEntry.isDirectory() || !zipEntry.getName().toLowerCase(Locale.ROOT).equals(COMIC_INFO)) {
                continue;
            }
            try (InputStream in = handle.zipFile().getInputStream(zipEntry)) {
                return Optional.of(in.readNBytes((int) Math.min(maxEntryBytes, Integer.MAX_VALUE - 8)));
            } catch (IOException e) {
                log.warn("⚠️ Unreadable ComicInfo.xml in {}: {}", handle.displayName(), e.getMessage());
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Opens the archive and counts the images a merge would take from it.
     *
     * @throws MergeException when the source cannot be used
     */
    public int countImages(Path path, Set<ImageFormat> formats) {
        try (ArchiveHandle handle = open(path)) {
            return listImageEntries(handle, formats).size();
        }
    }

    /**
     * Like {@link #countImages(Path, Set)} but reports problems instead of throwing.
     */
    public SourceInspection inspect(Path path, SourceKind kind, Set<ImageFormat> formats) {
        long size = sizeOf(path);
        try {
            return SourceInspection.valid(path.toString(), kind, countImages(path, formats), size);
        } catch (MergeException e) {
            return SourceInspection.invalid(path.toString(), kind, size, e.getFailure(), e.getMessage());
        }
    }

    private static long sizeOf(Path path) {
        try {
            return Files.isRegularFile(path) ? Files.size(path) : 0L;
        } catch (IOException e) {
            return 0L;
        }
    }

    private static boolean hasZipSignature(Path path) throws IOException {
        byte[] header = new byte[4];
        int read;
        try (InputStream in = Files.newInputStream(path)) {
            read = in.readNBytes(header, 0, header.length);
        }
        return read == header.length && (startsWith(header, ZIP_MAGIC) || startsWith(header, EMPTY_ZIP_MAGIC));
    }

    private static boolean startsWith(byte[] buffer, byte[] magic) {
        for (int i = 0; i < magic.length; i++) {
            if (buffer[i] != magic[i]) {
                return false;
            }
        }
        return true;
    }

    private static boolean isContentEntry(String name) {
        String normalized = name.replace('\\', '/').toLowerCase(Locale.ROOT);
        if (normalized.startsWith(MAC_RESOURCE_DIR) || normalized.contains("/" + MAC_RESOURCE_DIR)) {
            return false;
        }
        String fileName = normalized.substring(normalized.lastIndexOf('/') + 1);
        return !fileName.startsWith(".");
    }

    private static String describe(Set<ImageFormat> formats) {
        if (formats.size() == ImageFormat.values().length) {
            return "supported";
        }
        List<String> names = new ArrayList<>();
        for (ImageFormat format : formats) {
            names.add(format.extension());
        }
        return String.join("/", names);
    }
}
