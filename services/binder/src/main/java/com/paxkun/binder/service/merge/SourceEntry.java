package com.paxkun.binder.service.merge;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One input archive as accepted from the caller. List order is merge order.
 *
 * @param path     archive location
 * @param ordinal  0-based position in the caller's list
 * @param kind     declared or detected kind
 * @param chapter  explicit chapter number, or {@code null} to use {@code ordinal + 1}
 */
public record SourceEntry(Path path, int ordinal, SourceKind kind, Integer chapter) {

    public SourceEntry {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(kind, "kind");
        if (ordinal < 0) {
            throw new IllegalArgumentException("ordinal must not be negative: " + ordinal);
        }
        if (chapter != null && chapter < 1) {
            throw new IllegalArgumentException("chapter must be 1 or greater: " + chapter);
        }
    }

    /**
     * Builds an entry whose kind comes from the file extension.
     *
     * @throws IllegalArgumentException when the extension is neither .cbz nor .zip
     */
    public static SourceEntry of(Path path, int ordinal) {
        SourceKind kind = SourceKind.detect(path)
                .orElseThrow(() -> new IllegalArgumentException("Not a .cbz or .zip file: " + path));
        return new SourceEntry(path, ordinal, kind, null);
    }

    public int chapterIndex() {
        return chapter != null ? chapter : ordinal + 1;
    }

    public String displayName() {
        Path fileName = path.getFileName();
        return fileName != null ? fileName.toString() : path.toString();
    }
}
