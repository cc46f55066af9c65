package com.paxkun.binder.service.merge;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Naming rules for merged output files.
 */
public final class OutputPaths {

    public static final String CBZ_EXTENSION = ".cbz";
    private static final String ILLEGAL_CHARS = "<>:\"/\\|?*";

    private OutputPaths() {
    }

    public static Path ensureCbzExtension(Path output) {
        String fileName = output.getFileName().toString();
        if (fileName.toLowerCase(Locale.ROOT).endsWith(CBZ_EXTENSION)) {
            return output;
        }
        return output.resolveSibling(fileName + CBZ_EXTENSION);
    }

    /**
     * Replaces characters no common file system accepts and trims leading or
     * trailing dots and spaces. Never returns an empty name.
     */
    public static String sanitizeFileName(String fileName) {
        if (fileName == null) {
            return "unnamed";
        }
        StringBuilder cleaned = new StringBuilder(fileName.length());
        for (char c : fileName.toCharArray()) {
            cleaned.append(ILLEGAL_CHARS.indexOf(c) >= 0 || Character.isISOControl(c) ? '_' : c);
        }
        String trimmed = cleaned.toString().replaceAll("^[ .]+|[ .]+$", "");
        return trimmed.isEmpty() ? "unnamed" : trimmed;
    }

    /**
     * {@code merged_<stem of the first source>.cbz}.
     */
    public static String defaultOutputName(List<SourceEntry> sources) {
        if (sources == null || sources.isEmpty()) {
            return "merged_comic" + CBZ_EXTENSION;
        }
        String first = sources.get(0).displayName();
        int dot = first.lastIndexOf('.');
        String stem = dot > 0 ? first.substring(0, dot) : first;
        return "merged_" + sanitizeFileName(stem) + CBZ_EXTENSION;
    }

    /**
     * {@code directory/name.cbz}, or {@code name_1.cbz}, {@code name_2.cbz}, ...
     * when the name is taken.
     */
    public static Path uniquePath(Path directory, String fileName) {
        String name = sanitizeFileName(fileName);
        if (!name.toLowerCase(Locale.ROOT).endsWith(CBZ_EXTENSION)) {
            name = name + CBZ_EXTENSION;
        }
        String base = name.substring(0, name.length() - CBZ_EXTENSION.length());
        Path candidate = directory.resolve(name);
        int counter = 1;
        while (Files.exists(candidate)) {
            candidate = directory.resolve(base + "_" + counter + CBZ_EXTENSION);
            counter++;
        }
        return candidate;
    }

    /**
     * {@code parent/name}, or {@code name_1}, {@code name_2}, ... when a file or folder
     * of that name already exists.
     */
    public static Path uniqueDirectory(Path parent, String name) {
        String base = sanitizeFileName(name);
        Path candidate = parent.resolve(base);
        int counter = 1;
        while (Files.exists(candidate)) {
            candidate = parent.resolve(base + "_" + counter);
            counter++;
        }
        return candidate;
    }

    /**
     * Hidden scratch file next to the output, so the final move stays on one file system.
     */
    static Path temporarySibling(Path output) {
        return output.resolveSibling("." + output.getFileName() + "." + UUID.randomUUID() + ".part");
    }
}
