package com.paxkun.binder.service.merge;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Kind of an input archive. CBZ sources are read directly, ZIP sources are
 * extracted and renamed through the staging area first.
 */
public enum SourceKind {
    CBZ,
    ZIP;

    public static Optional<SourceKind> detect(Path path) {
        if (path == null || path.getFileName() == null) {
            return Optional.empty();
        }
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".cbz")) {
            return Optional.of(CBZ);
        }
        if (name.endsWith(".zip")) {
            return Optional.of(ZIP);
        }
        return Optional.empty();
    }
}
