package com.pickshot.service;

import java.nio.file.Path;
import java.util.Map;

/**
 * Out-of-process reader/writer of embedded file metadata.
 */
public interface MetadataTool extends AutoCloseable {

    /**
     * Reads the rating-related tags of a file. Absent tags are simply missing
     * from the map.
     */
    Map<String, Object> readTags(Path file) throws MetadataToolException;

    /**
     * Overwrites the given tags in place, without keeping a backup copy.
     */
    void writeTags(Path file, Map<String, Object> tags) throws MetadataToolException;

    /**
     * False once the underlying process has died and a new tool is needed.
     */
    default boolean isAlive() {
        return true;
    }

    @Override
    void close();

    /**
     * Creates tool instances. A failure here means the tool cannot be used at
     * all.
     */
    @FunctionalInterface
    interface Factory {
        MetadataTool create() throws MetadataToolException;
    }
}
