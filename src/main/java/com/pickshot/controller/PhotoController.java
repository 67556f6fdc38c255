package com.pickshot.controller;

import com.pickshot.dto.ActionResult;
import com.pickshot.dto.PhotoCollection;
import com.pickshot.dto.RatingUpdateRequest;
import com.pickshot.dto.RenameRequest;
import com.pickshot.dto.RenameResult;
import com.pickshot.service.PhotoLibraryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST controller for browsing, rating and managing photos.
 *
 * Endpoints:
 * POST /api/photos/open: scan a directory, returns photos and known ratings
 * PUT /api/photos/rating: set or clear a rating
 * POST /api/photos/delete: trash a photo
 * POST /api/photos/rename: rename a photo within its directory
 * POST /api/photos/reveal: show a photo in the system file browser
 */
@RestController
@RequestMapping("/api/photos")
public class PhotoController {

    private static final Logger log = LoggerFactory.getLogger(PhotoController.class);

    private final PhotoLibraryService libraryService;

    public PhotoController(PhotoLibraryService libraryService) {
        this.libraryService = libraryService;
    }

    /**
     * Body: { "directory": "/path/to/photos" }
     */
    @PostMapping("/open")
    public ResponseEntity<?> openDirectory(@RequestBody(required = false) Map<String, String> body) {
        String directory = body != null ? body.get("directory") : null;
        if (directory == null || directory.isBlank()) {
            return ResponseEntity.ok(PhotoCollection.empty());
        }
        try {
            return ResponseEntity.ok(libraryService.openDirectory(directory));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Failed to open directory {}: {}", directory, e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "Failed to open directory: " + e.getMessage()));
        }
    }

    @PutMapping("/rating")
    public ResponseEntity<ActionResult> updateRating(@RequestBody RatingUpdateRequest request) {
        if (request.getId() == null || request.getId().isBlank()) {
            return ResponseEntity.badRequest().body(ActionResult.failure("Photo id is required"));
        }
        return ResponseEntity.ok(libraryService.updateRating(request.getId(), request.getRating()));
    }

    /**
     * Body: { "id": "/path/to/photo.jpg" }
     */
    @PostMapping("/delete")
    public ResponseEntity<ActionResult> deletePhoto(@RequestBody Map<String, String> body) {
        String id = body.get("id");
        if (id == null || id.isBlank()) {
            return ResponseEntity.badRequest().body(ActionResult.failure("Photo id is required"));
        }
        return ResponseEntity.ok(libraryService.deleteSourceFile(id));
    }

    @PostMapping("/rename")
    public ResponseEntity<RenameResult> renamePhoto(@RequestBody RenameRequest request) {
        if (request.getId() == null || request.getId().isBlank()) {
            return ResponseEntity.badRequest().body(RenameResult.rejected("Photo id is required"));
        }
        return ResponseEntity.ok(libraryService.renameSourceFile(request.getId(), request.getNewName()));
    }

    @PostMapping("/reveal")
    public ResponseEntity<ActionResult> revealPhoto(@RequestBody Map<String, String> body) {
        String id = body.get("id");
        if (id == null || id.isBlank()) {
            return ResponseEntity.badRequest().body(ActionResult.failure("Photo id is required"));
        }
        return ResponseEntity.ok(libraryService.revealSourceFile(id));
    }
}
