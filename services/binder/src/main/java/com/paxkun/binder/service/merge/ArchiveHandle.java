package com.paxkun.binder.service.merge;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.zip.ZipFile;

/**
 * An open source archive. Always used in try-with-resources so the file is
 * released on success, on an empty listing and on every error.
 */
@Slf4j
public final class ArchiveHandle implements AutoCloseable {

    private final Path path;
    private final ZipFile zipFile;
    private boolean closed;

    ArchiveHandle(Path path, ZipFile zipFile) {
        this.path = path;
        this.zipFile = zipFile;
    }

    public Path path() {
        return path;
    }

    public String displayName() {
        Path fileName = path.getFileName();
        return fileName != null ? fileName.toString() : path.toString();
    }

    ZipFile zipFile() {
        if (closed) {
            throw new IllegalStateException("Archive already closed: " + path);
        }
        return zipFile;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            zipFile.close();
        } catch (IOException e) {
            log.warn("⚠️ Failed to close archive {}: {}", path, e.getMessage());
        }
    }
}
