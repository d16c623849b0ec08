package com.ticketflow.orchestrator.store;

import java.time.Instant;

/**
 * One top-level entry of a run's {@code artifacts/} directory.
 *
 * @param name         file or directory name
 * @param path         path relative to the run directory
 * @param type         FILE or DIRECTORY
 * @param size         size in bytes; for directories the sum of the contained files
 * @param itemCount    1 for files, number of contained files for directories
 * @param lastModified modification time of the entry
 */
public record ArtifactEntry(String name, String path, Type type, long size, int itemCount, Instant lastModified) {

    public enum Type { FILE, DIRECTORY }
}
