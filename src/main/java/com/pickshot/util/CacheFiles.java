package com.pickshot.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Naming and freshness rules shared by the rendition and transcode caches.
 */
public final class CacheFiles {

    private CacheFiles() {
    }

    /**
     * Deterministic cache key for a source file: SHA-1 hex of its absolute
     * path. The key depends on the path only, never on file content.
     */
    public static String keyFor(Path source) {
        String absPath = source.toAbsolutePath().normalize().toString();
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(md.digest(absPath.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-1
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }

    /**
     * Scratch file a cache entry is written to before being moved into place.
     * The extension is kept last, since converters pick the output format
     * from it.
     */
    public static Path tempFor(Path target) {
        String name = target.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String tempName = dot < 0 ? name + ".tmp" : name.substring(0, dot) + ".tmp" + name.substring(dot);
        return target.resolveSibling(tempName);
    }

    /**
     * A cached file is fresh when it exists, is non-empty and is not older
     * than its source.
     *
     * @param sourceModifiedAt source modification time in epoch millis
     */
    public static boolean isFresh(Path cached, long sourceModifiedAt) {
        try {
            BasicFileAttributes attrs = Files.readAttributes(cached, BasicFileAttributes.class);
            return attrs.isRegularFile()
                    && attrs.size() > 0
                    && attrs.lastModifiedTime().toMillis() >= sourceModifiedAt;
        } catch (IOException e) {
            return false;
        }
    }
}
