package com.pickshot.service;

import com.pickshot.util.CacheFiles;
import net.coobird.thumbnailator.Thumbnails;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * In-process conversion through Thumbnailator/ImageIO at full size, with EXIF
 * orientation applied. Fails with Thumbnailator's
 * {@code UnsupportedFormatException} when no ImageIO reader handles the
 * source.
 */
public class ThumbnailatorConverter implements ImageConverter {

    @Override
    public void convert(Path source, Path target, double quality) throws IOException {
        Files.createDirectories(target.getParent());
        Path temp = CacheFiles.tempFor(target);
        try (OutputStream out = Files.newOutputStream(temp)) {
            Thumbnails.of(source.toFile())
                    .scale(1.0)
                    .useExifOrientation(true)
                    .imageType(BufferedImage.TYPE_INT_RGB)
                    .outputFormat("jpg")
                    .outputQuality(quality)
                    .toOutputStream(out);
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
