package com.pickshot.dto;

import java.util.Objects;

/**
 * Read-only view of one stored rating.
 */
public class RatingCacheEntry {

    private final int rating;
    private final long updatedAt;
    private final Long sourceModifiedAt;

    public RatingCacheEntry(int rating, long updatedAt, Long sourceModifiedAt) {
        this.rating = rating;
        this.updatedAt = updatedAt;
        this.sourceModifiedAt = sourceModifiedAt;
    }

    public int getRating() {
        return rating;
    }

    public long getUpdatedAt() {
        return updatedAt;
    }

    /**
     * @return source modification time the rating was verified against, or
     *         null when it still needs checking against the file
     */
    public Long getSourceModifiedAt() {
        return sourceModifiedAt;
    }

    public boolean isVerifiedAgainst(long modifiedAt) {
        return sourceModifiedAt != null && sourceModifiedAt == modifiedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RatingCacheEntry))
            return false;
        RatingCacheEntry other = (RatingCacheEntry) o;
        return rating == other.rating && updatedAt == other.updatedAt
                && Objects.equals(sourceModifiedAt, other.sourceModifiedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rating, updatedAt, sourceModifiedAt);
    }

    @Override
    public String toString() {
        return "RatingCacheEntry{rating=" + rating + ", updatedAt=" + updatedAt
                + ", sourceModifiedAt=" + sourceModifiedAt + "}";
    }
}
