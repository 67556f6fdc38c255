package com.pickshot.service;

import com.pickshot.dto.PhotoRecord;
import com.pickshot.service.ThumbnailService.ThumbnailsReadyEvent;
import com.pickshot.util.MediaUrls;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class ThumbnailServiceTest {

    // lossless VP8L, 64x48, a single colour
    private static final String SOLID_WEBP_64X48 = "UklGRhgAAABXRUJQVlA4TAwAAAAvP8ALAChekYvS/wA=";

    @TempDir
    Path tempDir;

    private Path thumbDir;
    private ApplicationEventPublisher publisher;
    private TranscodeCache transcodeCache;
    private DirectoryScanner scanner;

    @BeforeEach
    void setUp() throws Exception {
        thumbDir = Files.createDirectory(tempDir.resolve("thumbs"));
        publisher = mock(ApplicationEventPublisher.class);
        transcodeCache = mock(TranscodeCache.class);
    }

    private ThumbnailService serviceWith(Executor executor) {
        ThumbnailService service = new ThumbnailService(thumbDir, 320, 480, 0.8, 2, transcodeCache,
                new DecoderCapabilities(), publisher, executor);
        scanner = new DirectoryScanner(service);
        return service;
    }

    private PhotoRecord photo(Path file) throws Exception {
        return scanner.toPhotoRecord(file, Files.readAttributes(file, BasicFileAttributes.class));
    }

    private static Path writePng(Path file, int width, int height) throws Exception {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        g.setColor(Color.ORANGE);
        g.fillRect(0, 0, width, height);
        g.dispose();
        ImageIO.write(image, "png", file.toFile());
        return file;
    }

    @Test
    void freshRenditionsAreNotRescheduledUntilSourceChanges() throws Exception {
        List<Runnable> parked = new ArrayList<>();
        ThumbnailService service = serviceWith(parked::add);
        Path source = Files.write(tempDir.resolve("a.jpg"), new byte[] { 1 });
        Files.setLastModifiedTime(source, FileTime.fromMillis(1_000_000));

        ThumbnailService.Renditions renditions = service.resolve(source, 1_000_000);
        for (Path rendition : List.of(renditions.getBasePath(), renditions.getRetinaPath())) {
            Files.write(rendition, new byte[] { 1, 2 });
            Files.setLastModifiedTime(rendition, FileTime.fromMillis(2_000_000));
        }

        PhotoRecord photo = photo(source);
        assertFalse(service.scheduleIfStale(photo));
        assertTrue(parked.isEmpty());
        assertEquals(MediaUrls.thumbnailUrl(renditions.getBasePath()), photo.getThumbnailUrl());
        assertEquals(MediaUrls.thumbnailUrl(renditions.getRetinaPath()), photo.getThumbnailRetinaUrl());

        Files.setLastModifiedTime(source, FileTime.fromMillis(3_000_000));
        PhotoRecord touched = photo(source);
        assertTrue(service.scheduleIfStale(touched));
        assertEquals(1, parked.size());
        assertEquals(touched.getSourceUrl(), touched.getThumbnailUrl());
        assertEquals(touched.getSourceUrl(), touched.getThumbnailRetinaUrl());
    }

    @Test
    void staleRetinaAloneIsEnoughToSchedule() throws Exception {
        List<Runnable> parked = new ArrayList<>();
        ThumbnailService service = serviceWith(parked::add);
        Path source = Files.write(tempDir.resolve("a.jpg"), new byte[] { 1 });
        Files.setLastModifiedTime(source, FileTime.fromMillis(1_000_000));
        Path base = service.resolve(source, 1_000_000).getBasePath();
        Files.write(base, new byte[] { 1 });

        PhotoRecord photo = photo(source);
        assertTrue(service.scheduleIfStale(photo));
        // retina falls back to the base rendition
        assertEquals(MediaUrls.thumbnailUrl(base), photo.getThumbnailRetinaUrl());
    }

    @Test
    void rendersBothRenditionsAndAnnouncesThem() throws Exception {
        ThumbnailService service = serviceWith(Runnable::run);
        Path source = writePng(tempDir.resolve("sunset.png"), 800, 600);
        PhotoRecord photo = photo(source);

        assertTrue(service.scheduleIfStale(photo));

        ThumbnailService.Renditions renditions = service.resolve(source, photo.getModifiedAt());
        assertTrue(renditions.isBaseFresh());
        assertTrue(renditions.isRetinaFresh());
        assertEquals(320, ImageIO.read(renditions.getBasePath().toFile()).getWidth());
        assertEquals(480, ImageIO.read(renditions.getRetinaPath().toFile()).getWidth());
        assertEquals(360, ImageIO.read(renditions.getRetinaPath().toFile()).getHeight());

        ArgumentCaptor<ThumbnailsReadyEvent> event = ArgumentCaptor.forClass(ThumbnailsReadyEvent.class);
        verify(publisher).publishEvent(event.capture());
        assertEquals(photo.getId(), event.getValue().getPhotoId());
        assertEquals(MediaUrls.thumbnailUrl(renditions.getBasePath()), event.getValue().getThumbnailUrl());
        assertEquals(MediaUrls.thumbnailUrl(renditions.getRetinaPath()), event.getValue().getThumbnailRetinaUrl());
        assertEquals(0, service.getQueue().getActiveCount());
    }

    @Test
    void webpSourcesGetRenditions() throws Exception {
        ThumbnailService service = serviceWith(Runnable::run);
        Path source = Files.write(tempDir.resolve("leaf.webp"), Base64.getDecoder().decode(SOLID_WEBP_64X48));
        PhotoRecord photo = photo(source);

        assertTrue(service.isRenderable(source));
        assertTrue(service.scheduleIfStale(photo));

        ThumbnailService.Renditions renditions = service.resolve(source, photo.getModifiedAt());
        assertTrue(renditions.isBaseFresh());
        assertTrue(renditions.isRetinaFresh());
        BufferedImage base = ImageIO.read(renditions.getBasePath().toFile());
        assertEquals(64, base.getWidth());
        assertEquals(48, base.getHeight());
        verify(publisher).publishEvent(any(ThumbnailsReadyEvent.class));
    }

    @Test
    void formatsWithoutReaderAreShownFromTheSource() throws Exception {
        List<Runnable> parked = new ArrayList<>();
        ThumbnailService service = serviceWith(parked::add);
        Path svg = Files.writeString(tempDir.resolve("logo.svg"), "<svg xmlns=\"http://www.w3.org/2000/svg\"/>");
        Path avif = Files.write(tempDir.resolve("photo.avif"), new byte[] { 0, 0, 0, 28, 'f', 't', 'y', 'p' });

        for (Path source : List.of(svg, avif)) {
            PhotoRecord photo = photo(source);
            assertFalse(service.isRenderable(source));
            assertFalse(service.scheduleIfStale(photo));
            assertEquals(photo.getSourceUrl(), photo.getThumbnailUrl());
            assertEquals(photo.getSourceUrl(), photo.getThumbnailRetinaUrl());
        }
        assertTrue(parked.isEmpty());
    }

    @Test
    void smallSourcesAreNotUpscaled() throws Exception {
        ThumbnailService service = serviceWith(Runnable::run);
        Path source = writePng(tempDir.resolve("icon.png"), 200, 100);

        service.scheduleIfStale(photo(source));

        ThumbnailService.Renditions renditions = service.resolve(source, 0);
        assertEquals(200, ImageIO.read(renditions.getBasePath().toFile()).getWidth());
        assertEquals(200, ImageIO.read(renditions.getRetinaPath().toFile()).getWidth());
    }

    @Test
    void undecodableSourceProducesNoEventAndNoFiles() throws Exception {
        ThumbnailService service = serviceWith(Runnable::run);
        Path source = Files.write(tempDir.resolve("broken.jpg"), "not an image".getBytes());

        service.scheduleIfStale(photo(source));

        verify(publisher, never()).publishEvent(any(ThumbnailsReadyEvent.class));
        try (var files = Files.list(thumbDir)) {
            assertEquals(0, files.count());
        }
        assertEquals(0, service.getQueue().getActiveCount());
    }

    @Test
    void deleteRenditionsRemovesBothFiles() throws Exception {
        ThumbnailService service = serviceWith(Runnable::run);
        Path source = writePng(tempDir.resolve("a.png"), 600, 400);
        service.scheduleIfStale(photo(source));
        ThumbnailService.Renditions renditions = service.resolve(source, 0);
        assertTrue(Files.exists(renditions.getBasePath()));

        service.deleteRenditions(source);

        assertFalse(Files.exists(renditions.getBasePath()));
        assertFalse(Files.exists(renditions.getRetinaPath()));
    }

    @Test
    void relocatedRenditionsStayFreshUnderTheNewName() throws Exception {
        ThumbnailService service = serviceWith(Runnable::run);
        Path source = writePng(tempDir.resolve("a.png"), 600, 400);
        service.scheduleIfStale(photo(source));
        Path renamed = Files.move(source, tempDir.resolve("b.png"));

        service.relocateRenditions(source, renamed);

        long modifiedAt = Files.getLastModifiedTime(renamed).toMillis();
        ThumbnailService.Renditions moved = service.resolve(renamed, modifiedAt);
        assertTrue(moved.isBaseFresh());
        assertTrue(moved.isRetinaFresh());
        assertFalse(Files.exists(service.resolve(source, modifiedAt).getBasePath()));
    }

    @Test
    void supportedExtensionsAreCaseInsensitive() {
        ThumbnailService service = serviceWith(Runnable::run);

        assertTrue(service.isSupportedImage(tempDir.resolve("A.JPG")));
        assertTrue(service.isSupportedImage(tempDir.resolve("b.heic")));
        assertTrue(service.isSupportedImage(tempDir.resolve("c.webp")));
        assertFalse(service.isSupportedImage(tempDir.resolve("notes.txt")));
        assertFalse(service.isSupportedImage(tempDir.resolve("raw.cr2")));
    }
}
