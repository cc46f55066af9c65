package com.paxkun.binder.service.merge;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * The image formats an archive entry may carry.
 */
public enum ImageFormat {
    JPG("jpg"),
    JPEG("jpeg"),
    PNG("png"),
    WEBP("webp"),
    GIF("gif"),
    BMP("bmp");

    private final String extension;

    ImageFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    public static Optional<ImageFormat> fromExtension(String extension) {
        if (extension == null) {
            return Optional.empty();
        }
        String normalized = extension.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        for (ImageFormat format : values()) {
            if (format.extension.equals(normalized)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

    /**
     * Extension of an entry name without the dot, lower-cased; empty when there is none.
     */
    public static String extensionOf(String entryName) {
        String fileName = entryName.replace('\\', '/');
        fileName = fileName.substring(fileName.lastIndexOf('/') + 1);
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    public static Set<ImageFormat> all() {
        return EnumSet.allOf(ImageFormat.class);
    }

    /**
     * Parses extension names ({@code "jpg"}, {@code ".PNG"}), ignoring unknown ones.
     * Falls back to {@link #JPG} when nothing usable is given.
     */
    public static Set<ImageFormat> parse(Collection<String> extensions) {
        Set<ImageFormat> formats = EnumSet.noneOf(ImageFormat.class);
        if (extensions != null) {
            for (String extension : extensions) {
                fromExtension(extension).ifPresent(formats::add);
            }
        }
        if (formats.isEmpty()) {
            formats.add(JPG);
        }
        return formats;
    }

    /**
     * Comma separated variant of {@link #parse(Collection)}, e.g. {@code "jpg,png,webp"}.
     */
    public static Set<ImageFormat> parse(String commaSeparated) {
        if (commaSeparated == null || commaSeparated.isBlank()) {
            return EnumSet.of(JPG);
        }
        return parse(Arrays.asList(commaSeparated.split(",")));
    }
}
