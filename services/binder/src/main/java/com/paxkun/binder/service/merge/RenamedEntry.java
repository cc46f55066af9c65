package com.paxkun.binder.service.merge;

import java.util.Locale;

/**
 * An entry after chapter renaming.
 *
 * @param originalName entry name in the source archive
 * @param chapter      1-based chapter index
 * @param page         1-based page within the chapter (or position in the merged stream after a collision)
 * @param extension    lower-case extension without the dot
 */
public record RenamedEntry(String originalName, int chapter, int page, String extension) {

    public static String targetName(int chapter, int page, String extension) {
        return String.format(Locale.ROOT, "ch%d_%03d.%s", chapter, page, extension);
    }

    public String targetName() {
        return targetName(chapter, page, extension);
    }

    public RenamedEntry withPage(int newPage) {
        return new RenamedEntry(originalName, chapter, newPage, extension);
    }
}
