package com.pickshot.service;

import com.pickshot.dto.PhotoRecord;
import com.pickshot.util.MediaUrls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Walks a directory tree and turns every supported image into a
 * {@link PhotoRecord}.
 *
 * Traversal is depth-first over an explicit stack. Entries whose name starts
 * with a dot are skipped together with their subtrees, and symbolic links are
 * not followed. Unreadable directories and files that cannot be stat'd are
 * skipped. Every record found is handed to the {@link ThumbnailService} so
 * stale renditions start regenerating right away.
 */
@Service
public class DirectoryScanner {

    private static final Logger log = LoggerFactory.getLogger(DirectoryScanner.class);

    private final ThumbnailService thumbnailService;

    public DirectoryScanner(ThumbnailService thumbnailService) {
        this.thumbnailService = thumbnailService;
    }

    /**
     * Scans {@code root} recursively. Ordering of the result is unspecified.
     */
    public List<PhotoRecord> scan(Path root) {
        Path start = root.toAbsolutePath().normalize();
        List<PhotoRecord> photos = new ArrayList<>();
        Deque<Path> pending = new ArrayDeque<>();
        pending.push(start);

        while (!pending.isEmpty()) {
            Path dir = pending.pop();
            try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
                scanEntries(dir, entries, pending, photos);
            } catch (IOException | DirectoryIteratorException e) {
                log.debug("Skipping unreadable directory {}: {}", dir, e.getMessage());
            }
        }

        for (PhotoRecord photo : photos) {
            thumbnailService.scheduleIfStale(photo);
        }
        log.info("Scanned {}: {} photos", start, photos.size());
        return photos;
    }

    /**
     * Sorts the entries of one directory into subdirectories to visit and
     * photos. An entry the listing fails on is skipped; two failures in a row
     * end the listing.
     */
    void scanEntries(Path dir, Iterable<Path> entries, Deque<Path> pending, List<PhotoRecord> photos) {
        Iterator<Path> it = entries.iterator();
        boolean lastFailed = false;
        while (true) {
            Path entry;
            try {
                if (!it.hasNext()) {
                    return;
                }
                entry = it.next();
                lastFailed = false;
            } catch (DirectoryIteratorException e) {
                if (lastFailed) {
                    log.debug("Giving up on listing {}: {}", dir, e.getCause().getMessage());
                    return;
                }
                log.debug("Skipping unreadable entry in {}: {}", dir, e.getCause().getMessage());
                lastFailed = true;
                continue;
            }
            if (isHidden(entry)) {
                continue;
            }
            BasicFileAttributes attrs;
            try {
                attrs = Files.readAttributes(entry, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
            } catch (IOException e) {
                log.debug("Skipping {}: {}", entry, e.getMessage());
                continue;
            }
            if (attrs.isDirectory()) {
                pending.push(entry);
            } else if (attrs.isRegularFile() && thumbnailService.isSupportedImage(entry)) {
                photos.add(toPhotoRecord(entry, attrs));
            }
        }
    }

    /**
     * Builds the record for a single file. Thumbnail URLs start at the source
     * URL until the renditions have been resolved.
     */
    public PhotoRecord toPhotoRecord(Path file, BasicFileAttributes attrs) {
        Path absolute = file.toAbsolutePath().normalize();
        PhotoRecord photo = new PhotoRecord();
        photo.setId(absolute.toString());
        photo.setDisplayName(absolute.getFileName().toString());
        photo.setSourcePath(absolute.toString());
        photo.setSourceUrl(MediaUrls.sourceUrl(absolute));
        photo.setThumbnailUrl(photo.getSourceUrl());
        photo.setThumbnailRetinaUrl(photo.getSourceUrl());
        photo.setByteSize(attrs.size());
        photo.setModifiedAt(attrs.lastModifiedTime().toMillis());
        return photo;
    }

    private static boolean isHidden(Path entry) {
        Path name = entry.getFileName();
        return name != null && name.toString().startsWith(".");
    }
}
