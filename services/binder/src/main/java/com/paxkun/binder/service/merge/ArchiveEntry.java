package com.paxkun.binder.service.merge;

/**
 * Read-only view of one image inside an open archive. Bytes are fetched
 * through {@link ArchiveReader#readEntry(ArchiveHandle, ArchiveEntry)}.
 *
 * @param name      original entry name, as stored in the archive
 * @param extension lower-case extension without the dot
 * @param size      uncompressed size in bytes, {@code -1} when unknown
 * @param index     position of the entry in the archive's central directory
 */
public record ArchiveEntry(String name, String extension, long size, int index) {
}
