package com.pickshot.dto;

/**
 * One image found by a directory scan.
 *
 * The id is the absolute source path. Thumbnail URLs start out pointing at
 * whatever is displayable right now and are updated once renditions are
 * ready.
 */
public class PhotoRecord {

    private String id;
    private String displayName;
    private String sourcePath;
    private String sourceUrl;
    private volatile String thumbnailUrl;
    private volatile String thumbnailRetinaUrl;
    private long byteSize;
    private long modifiedAt;

    public PhotoRecord() {
    }

    // ───────────── getters / setters ─────────────

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public String getSourcePath() {
        return sourcePath;
    }

    public void setSourcePath(String sourcePath) {
        this.sourcePath = sourcePath;
    }

    public String getSourceUrl() {
        return sourceUrl;
    }

    public void setSourceUrl(String sourceUrl) {
        this.sourceUrl = sourceUrl;
    }

    public String getThumbnailUrl() {
        return thumbnailUrl;
    }

    public void setThumbnailUrl(String thumbnailUrl) {
        this.thumbnailUrl = thumbnailUrl;
    }

    public String getThumbnailRetinaUrl() {
        return thumbnailRetinaUrl;
    }

    public void setThumbnailRetinaUrl(String thumbnailRetinaUrl) {
        this.thumbnailRetinaUrl = thumbnailRetinaUrl;
    }

    public long getByteSize() {
        return byteSize;
    }

    public void setByteSize(long byteSize) {
        this.byteSize = byteSize;
    }

    /** Source modification time in epoch millis. */
    public long getModifiedAt() {
        return modifiedAt;
    }

    public void setModifiedAt(long modifiedAt) {
        this.modifiedAt = modifiedAt;
    }
}
