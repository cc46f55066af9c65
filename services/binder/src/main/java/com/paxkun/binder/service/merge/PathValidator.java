package com.paxkun.binder.service.merge;

import com.paxkun.binder.service.merge.exception.PathRejectedException;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Guards every name read from an archive before it becomes a file or an
 * archive entry. A name is rejected when it contains a {@code ..} segment, an
 * absolute root, a drive specifier, a NUL character, or when it would
 * resolve outside the base directory (symbolic links included).
 */
public final class PathValidator {

    private static final Pattern DRIVE_SPECIFIER = Pattern.compile("^[A-Za-z]:.*", Pattern.DOTALL);

    private final Path baseDir;

    private PathValidator(Path baseDir) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
    }

    public static PathValidator within(@NotNull Path baseDir) {
        return new PathValidator(Objects.requireNonNull(baseDir, "baseDir"));
    }

    public Path baseDir() {
        return baseDir;
    }

    /**
     * Checks a name against the syntax rules only, without a base directory.
     */
    @Contract(pure = true)
    public static Validation checkName(String entryName) {
        if (entryName == null || entryName.isBlank()) {
            return Validation.reject("Entry name is empty");
        }
        if (entryName.indexOf('\0') >= 0) {
            return Validation.reject("Entry name contains a NUL character");
        }
        if (entryName.startsWith("/") || entryName.startsWith("\\")) {
            return Validation.reject("Absolute entry path: " + entryName);
        }
        if (DRIVE_SPECIFIER.matcher(entryName).matches()) {
            return Validation.reject("Drive specifier in entry path: " + entryName);
        }
        for (String segment : entryName.split("[/\\\\]")) {
            if (segment.equals("..")) {
                return Validation.reject("Parent directory segment in entry path: " + entryName);
            }
        }
        return Validation.accept();
    }

    /**
     * Full check: syntax rules plus containment in the base directory.
     */
    public Validation validate(String entryName) {
        Validation syntax = checkName(entryName);
        if (!syntax.ok()) {
            return syntax;
        }

        Path resolved;
        try {
            resolved = baseDir.resolve(entryName).normalize();
        } catch (InvalidPathException e) {
            return Validation.reject("Invalid entry path: " + entryName);
        }
        if (!resolved.startsWith(baseDir) || resolved.equals(baseDir)) {
            return Validation.reject("Entry path escapes " + baseDir + ": " + entryName);
        }
        return checkLinks(resolved, entryName);
    }

    /**
     * Resolves a name inside the base directory.
     *
     * @throws PathRejectedException when {@link #validate(String)} rejects the name
     */
    public Path resolveWithin(String entryName) {
        Validation validation = validate(entryName);
        if (!validation.ok()) {
            throw new PathRejectedException(validation.reason());
        }
        return baseDir.resolve(entryName).normalize();
    }

    // The nearest existing ancestor must still be inside the real base directory.
    private Validation checkLinks(Path resolved, String entryName) {
        if (!Files.exists(baseDir)) {
            return Validation.accept();
        }
        try {
            Path realBase = baseDir.toRealPath();
            Path existing = resolved;
            while (existing != null && !Files.exists(existing)) {
                existing = existing.getParent();
            }
            if (existing == null) {
                return Validation.accept();
            }
            if (!existing.toRealPath().startsWith(realBase)) {
                return Validation.reject("Entry path escapes " + baseDir + " through a link: " + entryName);
            }
            return Validation.accept();
        } catch (IOException e) {
            return Validation.reject("Cannot resolve entry path " + entryName + ": " + e.getMessage());
        }
    }

    /**
     * Outcome of a check: {@code ok} or rejected with a reason.
     */
    public record Validation(boolean ok, String reason) {

        private static final Validation OK = new Validation(true, null);

        public static Validation accept() {
            return OK;
        }

        public static Validation reject(String reason) {
            return new Validation(false, reason);
        }
    }
}
