package com.pickshot.service;

import java.nio.file.Path;

/**
 * Work item for one photo's renditions. Jobs are deduplicated by their base
 * rendition path.
 */
public final class ThumbnailJob {

    private final String photoId;
    private final Path sourcePath;
    private final Path baseCachePath;
    private final Path retinaCachePath;
    private final long sourceModifiedAt;

    public ThumbnailJob(String photoId, Path sourcePath, Path baseCachePath, Path retinaCachePath,
            long sourceModifiedAt) {
        this.photoId = photoId;
        this.sourcePath = sourcePath;
        this.baseCachePath = baseCachePath;
        this.retinaCachePath = retinaCachePath;
        this.sourceModifiedAt = sourceModifiedAt;
    }

    public String getPhotoId() {
        return photoId;
    }

    public Path getSourcePath() {
        return sourcePath;
    }

    public Path getBaseCachePath() {
        return baseCachePath;
    }

    public Path getRetinaCachePath() {
        return retinaCachePath;
    }

    public long getSourceModifiedAt() {
        return sourceModifiedAt;
    }

    @Override
    public String toString() {
        return "ThumbnailJob{" + sourcePath + "}";
    }
}
