package com.pickshot.util;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * URLs under which sources and renditions are served to the browser.
 */
public final class MediaUrls {

    public static final String SOURCE_PATH = "/api/media/source";
    public static final String THUMBNAIL_PATH = "/api/media/thumbnails/";

    private MediaUrls() {
    }

    public static String sourceUrl(Path source) {
        return SOURCE_PATH + "?path="
                + URLEncoder.encode(source.toAbsolutePath().toString(), StandardCharsets.UTF_8);
    }

    /**
     * Renditions are addressed by their cache file name only.
     */
    public static String thumbnailUrl(Path rendition) {
        return THUMBNAIL_PATH + rendition.getFileName().toString();
    }
}
