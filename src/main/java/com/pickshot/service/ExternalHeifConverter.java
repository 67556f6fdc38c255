package com.pickshot.service;

import com.pickshot.util.CacheFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.TimeUnit;

/**
 * Converts HEIC/HEIF files with libheif's {@code heif-convert}, which applies
 * the image's rotation and mirroring while decoding.
 */
public class ExternalHeifConverter implements ImageConverter {

    private static final Logger log = LoggerFactory.getLogger(ExternalHeifConverter.class);

    private final String command;
    private final long timeoutMs;

    public ExternalHeifConverter(String command, long timeoutMs) {
        this.command = command;
        this.timeoutMs = timeoutMs;
    }

    @Override
    public void convert(Path source, Path target, double quality) throws IOException {
        Files.createDirectories(target.getParent());
        Path temp = CacheFiles.tempFor(target);
        try {
            run(source, temp, quality);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
        log.debug("Converted {} with {}", source.getFileName(), command);
    }

    private void run(Path source, Path outputFile, double quality) throws IOException {
        int q = (int) Math.round(quality * 100);
        Process process = new ProcessBuilder(command, "-q", String.valueOf(q),
                source.toAbsolutePath().toString(), outputFile.toAbsolutePath().toString())
                .redirectErrorStream(true)
                .start();
        try {
            if (!process.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new IOException(command + " timed out after " + timeoutMs + "ms for " + source.getFileName());
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while converting " + source.getFileName(), e);
        }

        String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8).trim();
        if (process.exitValue() != 0) {
            throw new IOException(command + " failed (exit " + process.exitValue() + "): " + output);
        }
        if (!Files.isRegularFile(outputFile) || Files.size(outputFile) == 0) {
            throw new IOException(command + " produced no output for " + source.getFileName());
        }
    }
}
