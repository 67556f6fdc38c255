package com.pickshot.entity;

import jakarta.persistence.*;

/**
 * A cached star rating for one photo, keyed by the photo's absolute path.
 *
 * {@code sourceModifiedAt} is the source file's modification time (epoch
 * millis) at the point the rating was last known to match the file's own
 * metadata. Null means the rating has never been verified against the file.
 */
@Entity
@Table(name = "ratings")
public class RatingEntity {

    @Id
    @Column(name = "id", length = 4096)
    private String id;

    @Column(name = "rating", nullable = false)
    private int rating;

    @Column(name = "updated_at", nullable = false)
    private long updatedAt;

    @Column(name = "source_modified_at")
    private Long sourceModifiedAt;

    public RatingEntity() {
    }

    // ───────────── getters / setters ─────────────

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public int getRating() {
        return rating;
    }

    public void setRating(int rating) {
        this.rating = rating;
    }

    public long getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(long updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Long getSourceModifiedAt() {
        return sourceModifiedAt;
    }

    public void setSourceModifiedAt(Long sourceModifiedAt) {
        this.sourceModifiedAt = sourceModifiedAt;
    }
}
