package com.pickshot.service;

import com.drew.imaging.FileType;
import com.drew.imaging.FileTypeDetector;
import com.pickshot.config.AppConfig;
import com.pickshot.dto.PhotoRecord;
import com.pickshot.util.CacheFiles;
import com.pickshot.util.DecodeFailures;
import com.pickshot.util.MediaUrls;
import net.coobird.thumbnailator.Thumbnails;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import javax.imageio.ImageIO;
import javax.imageio.stream.ImageInputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Creates and manages the two JPEG renditions shown in the grid.
 *
 * Each source gets a base and a retina rendition, named
 * {@code {hash}-w{width}.jpg} after a hash of its absolute path. Stale
 * renditions are regenerated in the background through a bounded
 * {@link ThumbnailQueue}; when a job leaves at least one fresh rendition
 * behind a {@link ThumbnailsReadyEvent} is published.
 */
@Service
public class ThumbnailService {

    private static final Logger log = LoggerFactory.getLogger(ThumbnailService.class);
    private static final String[] SUPPORTED_EXTENSIONS = { "jpg", "jpeg", "png", "gif", "webp", "bmp", "tiff", "tif",
            "svg", "avif", "heic", "heif" };

    private final Path thumbDir;
    private final int baseWidth;
    private final int retinaWidth;
    private final double quality;
    private final TranscodeCache transcodeCache;
    private final DecoderCapabilities capabilities;
    private final ApplicationEventPublisher eventPublisher;
    private final ThumbnailQueue queue;

    @Autowired
    public ThumbnailService(AppConfig appConfig, TranscodeCache transcodeCache, DecoderCapabilities capabilities,
            ApplicationEventPublisher eventPublisher, @Qualifier("thumbnailExecutor") Executor executor) {
        this(Paths.get(appConfig.getThumbDir()), appConfig.getThumbBaseWidth(), appConfig.getThumbRetinaWidth(),
                appConfig.getThumbQuality(), appConfig.getThumbConcurrency(),
                transcodeCache, capabilities, eventPublisher, executor);
    }

    public ThumbnailService(Path thumbDir, int baseWidth, int retinaWidth, double quality, int concurrency,
            TranscodeCache transcodeCache, DecoderCapabilities capabilities,
            ApplicationEventPublisher eventPublisher, Executor executor) {
        this.thumbDir = thumbDir.toAbsolutePath().normalize();
        this.baseWidth = baseWidth;
        this.retinaWidth = retinaWidth;
        this.quality = quality;
        this.transcodeCache = transcodeCache;
        this.capabilities = capabilities;
        this.eventPublisher = eventPublisher;
        this.queue = new ThumbnailQueue(Math.max(1, concurrency), executor, this::generate);
    }

    @PostConstruct
    public void init() throws IOException {
        Files.createDirectories(thumbDir);
    }

    /**
     * Returns true if the file has a supported image extension.
     */
    public boolean isSupportedImage(Path path) {
        if (path == null || path.getFileName() == null)
            return false;
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        for (String ext : SUPPORTED_EXTENSIONS) {
            if (name.endsWith("." + ext))
                return true;
        }
        return false;
    }

    /**
     * True if renditions can be produced for the file, in-process or through
     * a transcode rule. Other formats (SVG, AVIF) are shown from the source.
     */
    public boolean isRenderable(Path source) {
        if (TranscodeRule.forFile(source).isPresent()) {
            return true;
        }
        String name = source.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 && capabilities.hasReaderForSuffix(name.substring(dot + 1));
    }

    /**
     * Locates both renditions of a source and checks whether they are fresh.
     *
     * @param sourceModifiedAt source modification time in epoch millis
     */
    public Renditions resolve(Path source, long sourceModifiedAt) {
        Path base = renditionPath(source, baseWidth);
        Path retina = renditionPath(source, retinaWidth);
        return new Renditions(base, retina,
                CacheFiles.isFresh(base, sourceModifiedAt),
                CacheFiles.isFresh(retina, sourceModifiedAt));
    }

    /**
     * Points the photo's thumbnail URLs at whatever is usable now and queues
     * regeneration when either rendition is stale.
     *
     * @return true if a job was queued by this call
     */
    public boolean scheduleIfStale(PhotoRecord photo) {
        Path source = Paths.get(photo.getSourcePath());
        if (!isRenderable(source)) {
            photo.setThumbnailUrl(photo.getSourceUrl());
            photo.setThumbnailRetinaUrl(photo.getSourceUrl());
            return false;
        }
        Renditions renditions = resolve(source, photo.getModifiedAt());

        String thumbnailUrl = renditions.isBaseFresh()
                ? MediaUrls.thumbnailUrl(renditions.getBasePath())
                : photo.getSourceUrl();
        photo.setThumbnailUrl(thumbnailUrl);
        photo.setThumbnailRetinaUrl(renditions.isRetinaFresh()
                ? MediaUrls.thumbnailUrl(renditions.getRetinaPath())
                : thumbnailUrl);

        if (renditions.isBaseFresh() && renditions.isRetinaFresh()) {
            return false;
        }
        return queue.schedule(new ThumbnailJob(photo.getId(), source, renditions.getBasePath(),
                renditions.getRetinaPath(), photo.getModifiedAt()));
    }

    /**
     * Deletes both renditions and any transcoded copy of a source.
     */
    public void deleteRenditions(Path source) {
        for (Path rendition : new Path[] { renditionPath(source, baseWidth), renditionPath(source, retinaWidth) }) {
            try {
                Files.deleteIfExists(rendition);
            } catch (IOException e) {
                log.warn("Failed to delete rendition {}: {}", rendition.getFileName(), e.getMessage());
            }
        }
        TranscodeRule.forFile(source).ifPresent(rule -> transcodeCache.evict(source, rule));
    }

    /**
     * Moves existing renditions over to a renamed source so they stay usable.
     * Renaming keeps the modification time, so moved renditions remain fresh.
     */
    public void relocateRenditions(Path oldSource, Path newSource) {
        for (int width : new int[] { baseWidth, retinaWidth }) {
            Path from = renditionPath(oldSource, width);
            if (!Files.isRegularFile(from)) {
                continue;
            }
            try {
                Files.move(from, renditionPath(newSource, width), StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                log.debug("Could not carry rendition {} over to {}: {}", from.getFileName(),
                        newSource.getFileName(), e.getMessage());
            }
        }
        TranscodeRule.forFile(oldSource).ifPresent(rule -> transcodeCache.evict(oldSource, rule));
    }

    public Path getThumbDir() {
        return thumbDir;
    }

    ThumbnailQueue getQueue() {
        return queue;
    }

    /**
     * Renders whatever is stale for the job, then announces the result if at
     * least one rendition is usable.
     */
    void generate(ThumbnailJob job) {
        long sourceModifiedAt = job.getSourceModifiedAt();
        boolean baseFresh = CacheFiles.isFresh(job.getBaseCachePath(), sourceModifiedAt);
        boolean retinaFresh = CacheFiles.isFresh(job.getRetinaCachePath(), sourceModifiedAt);

        if (!baseFresh || !retinaFresh) {
            try {
                BufferedImage image = decode(job);
                if (!retinaFresh) {
                    writeRendition(image, job.getRetinaCachePath(), retinaWidth);
                }
                if (!baseFresh) {
                    writeRendition(image, job.getBaseCachePath(), baseWidth);
                }
            } catch (IOException e) {
                log.warn("Failed to create thumbnails for {}: {}", job.getSourcePath().getFileName(), e.getMessage());
            }
        }

        baseFresh = CacheFiles.isFresh(job.getBaseCachePath(), sourceModifiedAt);
        retinaFresh = CacheFiles.isFresh(job.getRetinaCachePath(), sourceModifiedAt);
        if (!baseFresh && !retinaFresh) {
            return;
        }
        String thumbnailUrl = MediaUrls.thumbnailUrl(baseFresh ? job.getBaseCachePath() : job.getRetinaCachePath());
        String retinaUrl = retinaFresh ? MediaUrls.thumbnailUrl(job.getRetinaCachePath()) : thumbnailUrl;
        eventPublisher.publishEvent(new ThumbnailsReadyEvent(this, job.getPhotoId(), thumbnailUrl, retinaUrl));
    }

    private BufferedImage decode(ThumbnailJob job) throws IOException {
        Path source = job.getSourcePath();
        Optional<TranscodeRule> rule = detectRule(source);
        if (rule.isPresent() && needsFallback(rule.get(), source)) {
            return readImage(transcodeCache.ensureNow(source, job.getSourceModifiedAt(), rule.get()));
        }
        try {
            return readImage(source);
        } catch (IOException e) {
            if (rule.isEmpty() || !DecodeFailures.isCapabilityFailure(e)) {
                throw e;
            }
            capabilities.markFastDecoderUnavailable(rule.get().getFamily());
            return readImage(transcodeCache.ensureNow(source, job.getSourceModifiedAt(), rule.get()));
        }
    }

    /**
     * Finds the transcode rule for a source by extension, or by sniffing its
     * header when the extension does not give it away.
     */
    private Optional<TranscodeRule> detectRule(Path source) {
        Optional<TranscodeRule> byExtension = TranscodeRule.forFile(source);
        if (byExtension.isPresent()) {
            return byExtension;
        }
        try (BufferedInputStream in = new BufferedInputStream(Files.newInputStream(source))) {
            FileType type = FileTypeDetector.detectFileType(in);
            return type == FileType.Heif ? Optional.of(TranscodeRule.HEIF) : Optional.empty();
        } catch (IOException e) {
            log.debug("Could not sniff file type of {}: {}", source.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * The first source of a family is checked for an in-process reader; the
     * answer is then reused for every later source of that family.
     */
    private boolean needsFallback(TranscodeRule rule, Path source) {
        if (!rule.isTrustPrimaryDecoder()) {
            return true;
        }
        Optional<Boolean> known = capabilities.fastDecoderSupport(rule.getFamily());
        if (known.isPresent()) {
            return !known.get();
        }
        boolean supported = hasImageReader(source);
        capabilities.recordLookup(rule.getFamily(), supported);
        return !supported;
    }

    private static boolean hasImageReader(Path source) {
        try (ImageInputStream in = ImageIO.createImageInputStream(source.toFile())) {
            return in != null && ImageIO.getImageReaders(in).hasNext();
        } catch (IOException e) {
            return false;
        }
    }

    private static BufferedImage readImage(Path file) throws IOException {
        BufferedImage image = Thumbnails.of(file.toFile())
                .scale(1.0)
                .useExifOrientation(true)
                .asBufferedImage();
        return image.getColorModel().hasAlpha() ? flatten(image) : image;
    }

    // JPEG has no alpha channel
    private static BufferedImage flatten(BufferedImage image) {
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, image.getWidth(), image.getHeight());
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    private void writeRendition(BufferedImage image, Path target, int width) throws IOException {
        Files.createDirectories(target.getParent());
        int targetWidth = Math.min(width, image.getWidth());
        Path temp = CacheFiles.tempFor(target);
        try {
            try (OutputStream out = Files.newOutputStream(temp)) {
                Thumbnails.of(image)
                        .width(targetWidth)
                        .imageType(BufferedImage.TYPE_INT_RGB)
                        .outputFormat("jpg")
                        .outputQuality(quality)
                        .toOutputStream(out);
            }
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
    }

    private Path renditionPath(Path source, int width) {
        return thumbDir.resolve(CacheFiles.keyFor(source) + "-w" + width + ".jpg");
    }

    /**
     * Location and freshness of a source's two renditions.
     */
    public static final class Renditions {

        private final Path basePath;
        private final Path retinaPath;
        private final boolean baseFresh;
        private final boolean retinaFresh;

        public Renditions(Path basePath, Path retinaPath, boolean baseFresh, boolean retinaFresh) {
            this.basePath = basePath;
            this.retinaPath = retinaPath;
            this.baseFresh = baseFresh;
            this.retinaFresh = retinaFresh;
        }

        public Path getBasePath() {
            return basePath;
        }

        public Path getRetinaPath() {
            return retinaPath;
        }

        public boolean isBaseFresh() {
            return baseFresh;
        }

        public boolean isRetinaFresh() {
            return retinaFresh;
        }
    }

    /**
     * Published when a photo has usable renditions.
     */
    public static class ThumbnailsReadyEvent extends ApplicationEvent {
        private final String photoId;
        private final String thumbnailUrl;
        private final String thumbnailRetinaUrl;

        public ThumbnailsReadyEvent(Object source, String photoId, String thumbnailUrl, String thumbnailRetinaUrl) {
            super(source);
            this.photoId = photoId;
            this.thumbnailUrl = thumbnailUrl;
            this.thumbnailRetinaUrl = thumbnailRetinaUrl;
        }

        public String getPhotoId() {
            return photoId;
        }

        public String getThumbnailUrl() {
            return thumbnailUrl;
        }

        public String getThumbnailRetinaUrl() {
            return thumbnailRetinaUrl;
        }
    }
}
