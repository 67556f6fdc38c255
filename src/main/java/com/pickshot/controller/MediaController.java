package com.pickshot.controller;

import com.pickshot.service.ThumbnailService;
import com.pickshot.service.TranscodeCache;
import com.pickshot.service.TranscodeRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Serves image bytes referenced by photo URLs.
 *
 * GET /api/media/thumbnails/{fileName}: a cached rendition
 * GET /api/media/source?path=...: a source image; HEIF sources are served
 * from their transcoded copy so browsers can display them
 */
@RestController
@RequestMapping("/api/media")
public class MediaController {

    private static final Logger log = LoggerFactory.getLogger(MediaController.class);
    private static final Pattern RENDITION_NAME = Pattern.compile("[0-9a-f]{40}-w\\d+\\.jpg");

    private final ThumbnailService thumbnailService;
    private final TranscodeCache transcodeCache;

    public MediaController(ThumbnailService thumbnailService, TranscodeCache transcodeCache) {
        this.thumbnailService = thumbnailService;
        this.transcodeCache = transcodeCache;
    }

    @GetMapping("/thumbnails/{fileName:.+}")
    public ResponseEntity<byte[]> getThumbnail(@PathVariable String fileName) {
        if (!RENDITION_NAME.matcher(fileName).matches()) {
            return ResponseEntity.notFound().build();
        }
        Path rendition = thumbnailService.getThumbDir().resolve(fileName);
        if (!Files.isRegularFile(rendition)) {
            return ResponseEntity.notFound().build();
        }
        try {
            return ResponseEntity.ok()
                    .contentType(MediaType.IMAGE_JPEG)
                    .cacheControl(CacheControl.maxAge(1, TimeUnit.HOURS))
                    .body(Files.readAllBytes(rendition));
        } catch (IOException e) {
            log.warn("Failed to read rendition {}: {}", fileName, e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
        }
    }

    @GetMapping("/source")
    public ResponseEntity<byte[]> getSource(@RequestParam("path") String path) {
        Path source = Paths.get(path).toAbsolutePath().normalize();
        if (!thumbnailService.isSupportedImage(source) || !Files.isRegularFile(source)) {
            return ResponseEntity.notFound().build();
        }
        try {
            Path servable = source;
            Optional<TranscodeRule> rule = TranscodeRule.forFile(source);
            if (rule.isPresent()) {
                long modifiedAt = Files.getLastModifiedTime(source).toMillis();
                servable = transcodeCache.ensureNow(source, modifiedAt, rule.get());
            }
            MediaType mediaType = MediaTypeFactory.getMediaType(servable.getFileName().toString())
                    .orElse(MediaType.APPLICATION_OCTET_STREAM);
            return ResponseEntity.ok().contentType(mediaType).body(Files.readAllBytes(servable));
        } catch (IOException e) {
            log.warn("Failed to serve {}: {}", source.getFileName(), e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
        }
    }
}
