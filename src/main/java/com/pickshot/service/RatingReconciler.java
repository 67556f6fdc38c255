package com.pickshot.service;

import com.pickshot.dto.PhotoRecord;
import com.pickshot.dto.RatingCacheEntry;
import com.pickshot.util.RatingNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Brings cached ratings in line with the ratings embedded in the files.
 *
 * For each photo whose cache entry is missing or was verified against an
 * older file version:
 * 1. A locally set rating that was never mirrored is written into the file,
 * and the entry is stamped with the file's new modification time.
 * 2. Otherwise the file's own rating (none counts as 0) replaces the cached
 * one.
 *
 * A {@link RatingsRefreshedEvent} is published whenever the rating changes.
 * The walk stops as soon as metadata sync is disabled.
 */
@Service
public class RatingReconciler {

    private static final Logger log = LoggerFactory.getLogger(RatingReconciler.class);

    private final RatingStore ratingStore;
    private final MetadataSyncService metadataSync;
    private final ApplicationEventPublisher eventPublisher;

    public RatingReconciler(RatingStore ratingStore, MetadataSyncService metadataSync,
            ApplicationEventPublisher eventPublisher) {
        this.ratingStore = ratingStore;
        this.metadataSync = metadataSync;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Runs {@link #reconcile(List)} on the metadata executor.
     */
    @Async("metadataExecutor")
    public void reconcileInBackground(List<PhotoRecord> photos) {
        reconcile(photos);
    }

    /**
     * @return number of photos whose rating changed
     */
    public int reconcile(List<PhotoRecord> photos) {
        int changed = 0;
        for (PhotoRecord photo : photos) {
            if (!metadataSync.isEnabled()) {
                log.debug("Metadata sync disabled; stopping rating refresh");
                break;
            }
            try {
                if (reconcileOne(photo)) {
                    changed++;
                }
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to refresh rating metadata for {}: {}", photo.getDisplayName(), e.getMessage());
            }
        }
        if (changed > 0) {
            log.info("Rating refresh updated {} of {} photos", changed, photos.size());
        }
        return changed;
    }

    private boolean reconcileOne(PhotoRecord photo) throws IOException {
        // re-read: a rating update may have landed since the scan
        Optional<RatingCacheEntry> entry = ratingStore.find(photo.getId());
        if (entry.isPresent() && entry.get().isVerifiedAgainst(photo.getModifiedAt())) {
            return false;
        }
        int previous = entry.map(RatingCacheEntry::getRating).orElse(0);
        Path file = Paths.get(photo.getSourcePath());

        if (entry.isPresent() && entry.get().getSourceModifiedAt() == null && previous > 0) {
            int rating = RatingNormalizer.clamp(previous);
            if (!metadataSync.writeRating(file, rating)) {
                // skipped (slow volume or sync off); stays pending for the next load
                return false;
            }
            BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
            photo.setModifiedAt(attrs.lastModifiedTime().toMillis());
            photo.setByteSize(attrs.size());
            ratingStore.upsert(photo.getId(), rating, photo.getModifiedAt());
            return publishIfChanged(photo.getId(), previous, rating);
        }

        Integer fromFile = metadataSync.readRating(file);
        if (fromFile == null && !metadataSync.isEnabled()) {
            // the read was a no-op, not an answer
            return false;
        }
        int rating = fromFile == null ? 0 : RatingNormalizer.clamp(fromFile);
        ratingStore.upsert(photo.getId(), rating, photo.getModifiedAt());
        return publishIfChanged(photo.getId(), previous, rating);
    }

    private boolean publishIfChanged(String id, int previous, int rating) {
        if (previous == rating) {
            return false;
        }
        eventPublisher.publishEvent(new RatingsRefreshedEvent(this, Collections.singletonMap(id, rating)));
        return true;
    }

    /**
     * Published when reconciliation changed one or more ratings.
     */
    public static class RatingsRefreshedEvent extends ApplicationEvent {
        private final Map<String, Integer> ratings;

        public RatingsRefreshedEvent(Object source, Map<String, Integer> ratings) {
            super(source);
            this.ratings = ratings;
        }

        public Map<String, Integer> getRatings() {
            return ratings;
        }
    }
}
