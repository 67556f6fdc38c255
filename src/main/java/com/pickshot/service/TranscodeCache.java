package com.pickshot.service;

import com.pickshot.config.AppConfig;
import com.pickshot.util.CacheFiles;
import com.pickshot.util.DecodeFailures;
import com.pickshot.util.SingleFlight;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * Cache of decodable copies of sources the primary image library may not read
 * (HEIC/HEIF today).
 *
 * Entries are named by a hash of the source path plus the rule's target
 * extension. A conversion first tries the in-process decoder unless the
 * format family is already known to be unsupported; a failure that shows a
 * missing decoder flips that flag and hands the job to the isolated fallback
 * worker. Concurrent requests for the same entry share one conversion.
 */
@Service
public class TranscodeCache {

    private static final Logger log = LoggerFactory.getLogger(TranscodeCache.class);

    private final Path cacheDir;
    private final ImageConverter primary;
    private final FallbackDecodeWorker fallback;
    private final DecoderCapabilities capabilities;
    private final Executor executor;
    private final SingleFlight<Path, Path> inFlight = new SingleFlight<>();

    @Autowired
    public TranscodeCache(AppConfig appConfig, DecoderCapabilities capabilities,
            @Qualifier("transcodeExecutor") Executor executor) {
        this(Paths.get(appConfig.getTranscodeDir()),
                new ThumbnailatorConverter(),
                new FallbackDecodeWorker(new ExternalHeifConverter(
                        appConfig.getHeifConverterCommand(), appConfig.getHeifConverterTimeoutMs())),
                capabilities,
                executor);
    }

    public TranscodeCache(Path cacheDir, ImageConverter primary, FallbackDecodeWorker fallback,
            DecoderCapabilities capabilities, Executor executor) {
        this.cacheDir = cacheDir.toAbsolutePath().normalize();
        this.primary = primary;
        this.fallback = fallback;
        this.capabilities = capabilities;
        this.executor = executor;
    }

    @PostConstruct
    public void init() throws IOException {
        Files.createDirectories(cacheDir);
    }

    /**
     * Returns a fresh cached copy of {@code source}, converting it first if
     * needed.
     *
     * @param sourceModifiedAt source modification time in epoch millis
     */
    public CompletableFuture<Path> ensure(Path source, long sourceModifiedAt, TranscodeRule rule) {
        Path target = targetFor(source, rule);
        // a running conversion may be replacing the entry; wait for it
        if (!inFlight.isInFlight(target) && CacheFiles.isFresh(target, sourceModifiedAt)) {
            return CompletableFuture.completedFuture(target);
        }
        return inFlight.execute(target, () -> convert(source, target, rule))
                .handle((path, error) -> {
                    if (error == null) {
                        return CompletableFuture.completedFuture(path);
                    }
                    // a racing caller may have produced the entry meanwhile
                    if (CacheFiles.isFresh(target, sourceModifiedAt)) {
                        return CompletableFuture.completedFuture(target);
                    }
                    return CompletableFuture.<Path>failedFuture(unwrap(error));
                })
                .thenCompose(f -> f);
    }

    /**
     * Blocking variant of {@link #ensure} for callers already running on a
     * worker thread.
     */
    public Path ensureNow(Path source, long sourceModifiedAt, TranscodeRule rule) throws IOException {
        try {
            return ensure(source, sourceModifiedAt, rule).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while transcoding " + source.getFileName(), e);
        } catch (ExecutionException e) {
            Throwable cause = unwrap(e.getCause());
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new IOException("Transcode failed for " + source.getFileName() + ": " + cause.getMessage(), cause);
        }
    }

    public Path targetFor(Path source, TranscodeRule rule) {
        return cacheDir.resolve(CacheFiles.keyFor(source) + "." + rule.getTargetExtension());
    }

    /**
     * Removes the cached copy for a source, if any.
     */
    public void evict(Path source, TranscodeRule rule) {
        try {
            Files.deleteIfExists(targetFor(source, rule));
        } catch (IOException e) {
            log.warn("Failed to delete transcoded copy of {}: {}", source.getFileName(), e.getMessage());
        }
    }

    private CompletableFuture<Path> convert(Path source, Path target, TranscodeRule rule) {
        CompletableFuture<Boolean> primaryDone;
        if (rule.isTrustPrimaryDecoder() && !capabilities.isFastDecoderUnavailable(rule.getFamily())) {
            primaryDone = CompletableFuture.supplyAsync(() -> tryPrimary(source, target, rule), executor);
        } else {
            primaryDone = CompletableFuture.completedFuture(false);
        }

        return primaryDone
                .thenCompose(done -> done
                        ? CompletableFuture.completedFuture(target)
                        : fallback.submit(source, target, rule.getQuality()).thenApply(v -> target))
                .whenComplete((path, error) -> {
                    if (error != null) {
                        deletePartial(target);
                        log.warn("Failed to transcode {}: {}", source.getFileName(), unwrap(error).getMessage());
                    } else {
                        log.debug("Transcoded {} -> {}", source.getFileName(), target.getFileName());
                    }
                });
    }

    /**
     * @return true if converted, false if the decoder lacks support and the
     *         fallback should run
     */
    private boolean tryPrimary(Path source, Path target, TranscodeRule rule) {
        try {
            primary.convert(source, target, rule.getQuality());
            return true;
        } catch (IOException | RuntimeException e) {
            if (DecodeFailures.isCapabilityFailure(e)) {
                capabilities.markFastDecoderUnavailable(rule.getFamily());
                return false;
            }
            if (e instanceof IOException) {
                throw new UncheckedIOException((IOException) e);
            }
            throw (RuntimeException) e;
        }
    }

    private static void deletePartial(Path target) {
        try {
            Files.deleteIfExists(target);
            Files.deleteIfExists(CacheFiles.tempFor(target));
        } catch (IOException e) {
            log.debug("Could not remove partial transcode {}: {}", target.getFileName(), e.getMessage());
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof UncheckedIOException
                || current instanceof ExecutionException) && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    @PreDestroy
    public void shutdown() {
        fallback.close();
    }
}
