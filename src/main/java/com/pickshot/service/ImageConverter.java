package com.pickshot.service;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Re-encodes a source image into a decodable target file.
 */
@FunctionalInterface
public interface ImageConverter {

    /**
     * @param quality JPEG quality in 0..1
     */
    void convert(Path source, Path target, double quality) throws IOException;
}
