package com.pickshot.service;

import com.pickshot.dto.ActionResult;
import com.pickshot.dto.PhotoCollection;
import com.pickshot.dto.PhotoRecord;
import com.pickshot.dto.RatingCacheEntry;
import com.pickshot.dto.RenameResult;
import com.pickshot.util.RatingNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.Desktop;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operations offered to the UI layer: opening a directory, rating, deleting
 * and renaming photos.
 *
 * User actions never throw; failures come back as a result with
 * {@code success=false} and a readable message.
 */
@Service
public class PhotoLibraryService {

    private static final Logger log = LoggerFactory.getLogger(PhotoLibraryService.class);

    private final DirectoryScanner directoryScanner;
    private final ThumbnailService thumbnailService;
    private final RatingStore ratingStore;
    private final MetadataSyncService metadataSync;
    private final RatingReconciler ratingReconciler;

    public PhotoLibraryService(DirectoryScanner directoryScanner,
            ThumbnailService thumbnailService,
            RatingStore ratingStore,
            MetadataSyncService metadataSync,
            RatingReconciler ratingReconciler) {
        this.directoryScanner = directoryScanner;
        this.thumbnailService = thumbnailService;
        this.ratingStore = ratingStore;
        this.metadataSync = metadataSync;
        this.ratingReconciler = ratingReconciler;
    }

    /**
     * Scans a directory and joins the photos with their cached ratings.
     * Photos whose cached rating has not been verified against the current
     * file are reconciled in the background after this returns.
     *
     * @throws IllegalArgumentException if {@code directory} is not a directory
     */
    public PhotoCollection openDirectory(String directory) {
        Path dir = Paths.get(directory).toAbsolutePath().normalize();
        if (!Files.isDirectory(dir)) {
            throw new IllegalArgumentException("Not a directory: " + dir);
        }

        List<PhotoRecord> photos = directoryScanner.scan(dir);
        photos.sort(Comparator.comparing(PhotoRecord::getDisplayName, String.CASE_INSENSITIVE_ORDER));

        Map<String, RatingCacheEntry> cached = ratingStore.getAll();
        Map<String, Integer> ratings = new LinkedHashMap<>();
        List<PhotoRecord> needsRefresh = new ArrayList<>();
        for (PhotoRecord photo : photos) {
            RatingCacheEntry entry = cached.get(photo.getId());
            if (entry != null && entry.getRating() > 0) {
                ratings.put(photo.getId(), entry.getRating());
            }
            if (entry == null || !entry.isVerifiedAgainst(photo.getModifiedAt())) {
                needsRefresh.add(photo);
            }
        }

        if (!needsRefresh.isEmpty() && metadataSync.isEnabled()) {
            log.debug("Queueing rating refresh for {} photos", needsRefresh.size());
            ratingReconciler.reconcileInBackground(needsRefresh);
        }
        return new PhotoCollection(dir.toString(), photos, ratings);
    }

    /**
     * Stores a rating; 0 clears it. The file's own metadata is updated on the
     * next directory load.
     */
    public ActionResult updateRating(String id, int rating) {
        int value = RatingNormalizer.clamp(rating);
        try {
            if (value > 0) {
                ratingStore.upsert(id, value, null);
            } else {
                ratingStore.delete(id);
            }
            return ActionResult.ok();
        } catch (RuntimeException e) {
            log.error("Failed to update rating for {}: {}", id, e.getMessage());
            return ActionResult.failure(messageOf(e));
        }
    }

    /**
     * Moves the file to the trash where the desktop offers one, otherwise
     * deletes it, then forgets its rating and renditions.
     */
    public ActionResult deleteSourceFile(String id) {
        Path file = Paths.get(id).toAbsolutePath().normalize();
        if (!Files.exists(file)) {
            return ActionResult.failure("File not found: " + file.getFileName());
        }
        try {
            moveToTrash(file);
            ratingStore.delete(file.toString());
        } catch (IOException | RuntimeException e) {
            log.error("Failed to delete photo {}: {}", file, e.getMessage());
            return ActionResult.failure(messageOf(e));
        }
        thumbnailService.deleteRenditions(file);
        log.info("Deleted photo {}", file);
        return ActionResult.ok();
    }

    /**
     * Renames a file within its directory and moves its rating along.
     * If the rating cannot be moved the file is put back under its old name.
     */
    public RenameResult renameSourceFile(String id, String newName) {
        Path file = Paths.get(id).toAbsolutePath().normalize();
        if (!Files.exists(file)) {
            return RenameResult.rejected("File not found: " + file.getFileName());
        }

        String currentName = file.getFileName().toString();
        String sanitized = newName == null ? "" : newName.trim();
        if (sanitized.isEmpty()) {
            return RenameResult.rejected("File name must not be empty");
        }
        if (sanitized.equals(".") || sanitized.equals("..")) {
            return RenameResult.rejected("Invalid file name: " + sanitized);
        }
        if (sanitized.contains("/") || sanitized.contains("\\")) {
            return RenameResult.rejected("File name must not contain path separators");
        }

        Path target = file.resolveSibling(sanitized);
        boolean caseOnly = sanitized.equalsIgnoreCase(currentName);
        if (!target.equals(file) && Files.exists(target) && !caseOnly) {
            return RenameResult.rejected("A file named " + sanitized + " already exists");
        }

        Path result = file;
        if (!target.equals(file)) {
            try {
                move(file, target);
            } catch (IOException e) {
                log.error("Failed to rename {} to {}: {}", file, sanitized, e.getMessage());
                return RenameResult.rejected(messageOf(e));
            }
            try {
                ratingStore.renameId(file.toString(), target.toString());
            } catch (RuntimeException e) {
                log.error("Failed to move rating of {} to {}; restoring file name", file, target, e);
                try {
                    move(target, file);
                } catch (IOException revertError) {
                    log.error("Could not restore {} after failed rename: {}", file, revertError.getMessage());
                }
                return RenameResult.rejected(messageOf(e));
            }
            thumbnailService.relocateRenditions(file, target);
            result = target;
        }

        try {
            BasicFileAttributes attrs = Files.readAttributes(result, BasicFileAttributes.class);
            PhotoRecord photo = directoryScanner.toPhotoRecord(result, attrs);
            thumbnailService.scheduleIfStale(photo);
            return RenameResult.renamed(photo);
        } catch (IOException e) {
            log.error("Failed to read renamed photo {}: {}", result, e.getMessage());
            return RenameResult.rejected(messageOf(e));
        }
    }

    /**
     * Opens the system file browser at the photo.
     */
    public ActionResult revealSourceFile(String id) {
        Path file = Paths.get(id).toAbsolutePath().normalize();
        if (!Files.exists(file)) {
            return ActionResult.failure("File not found: " + file.getFileName());
        }
        try {
            if (!Desktop.isDesktopSupported()
                    || !Desktop.getDesktop().isSupported(Desktop.Action.BROWSE_FILE_DIR)) {
                return ActionResult.failure("Revealing files is not supported on this system");
            }
            Desktop.getDesktop().browseFileDirectory(file.toFile());
            return ActionResult.ok();
        } catch (RuntimeException e) {
            log.error("Failed to reveal photo {}: {}", file, e.getMessage());
            return ActionResult.failure(messageOf(e));
        }
    }

    private static void moveToTrash(Path file) throws IOException {
        if (Desktop.isDesktopSupported() && Desktop.getDesktop().isSupported(Desktop.Action.MOVE_TO_TRASH)) {
            if (Desktop.getDesktop().moveToTrash(file.toFile())) {
                return;
            }
            throw new IOException("Could not move " + file.getFileName() + " to the trash");
        }
        Files.delete(file);
    }

    /**
     * Renames in place. A rename that only changes letter case goes through a
     * temporary name, since case-insensitive file systems treat the target as
     * the source itself.
     */
    private static void move(Path from, Path to) throws IOException {
        if (Files.exists(to) && Files.isSameFile(from, to)) {
            Path temp = from.resolveSibling(".pickshot-rename-" + System.nanoTime());
            Files.move(from, temp);
            Files.move(temp, to);
            return;
        }
        Files.move(from, to);
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
