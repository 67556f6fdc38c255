package com.pickshot.service;

import com.pickshot.config.AppConfig;
import com.pickshot.util.RatingNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mirrors star ratings into the files' own metadata through an external tool.
 *
 * Every tool call is bounded by a task timeout and retried a few times.
 * Timeouts (including the tool process dying mid-call) are transient: the call
 * fails but the tool stays in use. Any other failure that survives the retries
 * counts against the tool, and once more than the configured tolerance has
 * been seen, or the tool cannot even be started, metadata sync is switched off
 * for the rest of the process. There is no way back from that state.
 *
 * Writes are also skipped for directories whose first stat took longer than
 * the slow-volume threshold, so one slow network share cannot stall the sync.
 */
@Service
public class MetadataSyncService {

    private static final Logger log = LoggerFactory.getLogger(MetadataSyncService.class);

    @FunctionalInterface
    private interface ToolCall<T> {
        T apply(MetadataTool tool) throws MetadataToolException;
    }

    private final MetadataTool.Factory toolFactory;
    private final long taskTimeoutMs;
    private final int taskRetries;
    private final int failureTolerance;
    private final long slowVolumeThresholdMs;

    // Calls go through a single thread; the tool process is serial anyway
    private final ExecutorService toolExecutor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "metadata-tool");
        t.setDaemon(true);
        return t;
    });

    private final AtomicBoolean enabled;
    private final AtomicBoolean disableLogged = new AtomicBoolean(false);
    private final AtomicInteger permanentFailures = new AtomicInteger(0);
    private final Map<Path, Boolean> slowDirectories = new ConcurrentHashMap<>();

    private MetadataTool tool;

    @Autowired
    public MetadataSyncService(AppConfig appConfig) {
        this(() -> ExifToolMetadataTool.start(appConfig.getExiftoolCommand()),
                appConfig.isMetadataEnabled(),
                appConfig.getMetadataTaskTimeoutMs(),
                appConfig.getMetadataTaskRetries(),
                appConfig.getMetadataFailureTolerance(),
                appConfig.getSlowVolumeThresholdMs());
    }

    public MetadataSyncService(MetadataTool.Factory toolFactory, boolean enabled, long taskTimeoutMs,
            int taskRetries, int failureTolerance, long slowVolumeThresholdMs) {
        this.toolFactory = toolFactory;
        this.enabled = new AtomicBoolean(enabled);
        this.taskTimeoutMs = taskTimeoutMs;
        this.taskRetries = Math.max(0, taskRetries);
        this.failureTolerance = Math.max(0, failureTolerance);
        this.slowVolumeThresholdMs = slowVolumeThresholdMs;
        if (!enabled) {
            log.info("Metadata sync disabled by configuration");
        }
    }

    public boolean isEnabled() {
        return enabled.get();
    }

    /**
     * Reads the star rating stored in a file.
     *
     * @return the normalized rating, or null if none is stored, the read
     *         failed, or sync is disabled
     */
    public Integer readRating(Path file) {
        if (!isEnabled()) {
            return null;
        }
        try {
            Map<String, Object> tags = call("read", file, t -> t.readTags(file));
            return tags == null ? null : RatingNormalizer.extract(tags);
        } catch (MetadataToolException e) {
            log.warn("Failed to read rating metadata from {}: {}", file.getFileName(), e.getMessage());
            return null;
        }
    }

    /**
     * Writes a star rating into a file, setting both the star and the
     * percentage field.
     *
     * @return true if the file was written; false if the write was skipped
     *         because sync is disabled or the file sits on a slow volume
     * @throws MetadataToolException if the tool failed to write
     */
    public boolean writeRating(Path file, int rating) throws MetadataToolException {
        if (!isEnabled() || isLikelySlowVolume(file)) {
            return false;
        }
        int normalized = RatingNormalizer.clamp(rating);
        Map<String, Object> tags = new LinkedHashMap<>();
        tags.put("Rating", normalized);
        tags.put("RatingPercent", RatingNormalizer.toPercent(normalized));
        try {
            Boolean written = call("write", file, t -> {
                t.writeTags(file, tags);
                return Boolean.TRUE;
            });
            return written != null;
        } catch (MetadataToolException e) {
            log.error("Failed to write rating metadata to {}: {}", file.getFileName(), e.getMessage());
            throw e;
        }
    }

    /**
     * Runs one tool call with timeout and retries, and updates the breaker.
     *
     * @return the call's result, or null if sync got disabled before it ran
     */
    private <T> T call(String context, Path file, ToolCall<T> call) throws MetadataToolException {
        MetadataToolException last = null;
        for (int attempt = 0; attempt <= taskRetries; attempt++) {
            MetadataTool current = acquireTool();
            if (current == null) {
                return null;
            }
            try {
                return runBounded(current, call);
            } catch (MetadataToolException e) {
                last = e;
                if (attempt < taskRetries) {
                    log.debug("Metadata {} attempt {}/{} failed for {}: {}",
                            context, attempt + 1, taskRetries + 1, file.getFileName(), e.getMessage());
                }
            }
        }

        if (!isTimeoutFailure(last)) {
            int failures = permanentFailures.incrementAndGet();
            if (failures > failureTolerance) {
                disable(context, last);
            }
        }
        throw last;
    }

    private <T> T runBounded(MetadataTool current, ToolCall<T> call) throws MetadataToolException {
        Future<T> future = toolExecutor.submit(() -> call.apply(current));
        try {
            return future.get(taskTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            // a hung process is replaced on the next call
            discardTool(current);
            throw new MetadataTimeoutException("Metadata task timeout after " + taskTimeoutMs + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new MetadataTimeoutException("Interrupted while waiting for metadata task", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof MetadataToolException) {
                if (!current.isAlive()) {
                    discardTool(current);
                }
                throw (MetadataToolException) cause;
            }
            throw new MetadataToolException(String.valueOf(cause.getMessage()), cause);
        }
    }

    private synchronized MetadataTool acquireTool() {
        if (!isEnabled()) {
            return null;
        }
        if (tool != null && !tool.isAlive()) {
            discardTool(tool);
        }
        if (tool == null) {
            try {
                tool = toolFactory.create();
            } catch (MetadataToolException | RuntimeException e) {
                disable("initialize", e);
                return null;
            }
        }
        return tool;
    }

    private synchronized void discardTool(MetadataTool stale) {
        if (tool == stale) {
            tool = null;
        }
        closeQuietly(stale);
    }

    private void disable(String context, Throwable error) {
        if (!enabled.compareAndSet(true, false)) {
            return;
        }
        if (disableLogged.compareAndSet(false, true)) {
            log.warn("Disabling metadata integration due to persistent errors ({}): {}",
                    context, error != null ? error.getMessage() : "unknown");
        }
        synchronized (this) {
            if (tool != null) {
                closeQuietly(tool);
                tool = null;
            }
        }
    }

    /**
     * Stats the file once per directory and remembers whether that directory
     * answered slower than the threshold. A failed stat counts as fast.
     */
    boolean isLikelySlowVolume(Path file) {
        Path directory = file.toAbsolutePath().getParent();
        if (directory == null) {
            return false;
        }
        return slowDirectories.computeIfAbsent(directory, dir -> {
            long start = System.nanoTime();
            try {
                Files.readAttributes(file, BasicFileAttributes.class);
            } catch (IOException e) {
                return false;
            }
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            boolean slow = elapsedMs >= slowVolumeThresholdMs;
            if (slow) {
                log.info("Skipping metadata writes on slow volume {} ({}ms)", dir, elapsedMs);
            }
            return slow;
        });
    }

    /**
     * True for failures that should be retried later rather than held against
     * the tool.
     */
    static boolean isTimeoutFailure(Throwable error) {
        if (error instanceof MetadataTimeoutException || error instanceof TimeoutException) {
            return true;
        }
        String message = error == null ? null : error.getMessage();
        if (message == null) {
            return false;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        return normalized.contains("process terminated before task completed")
                || normalized.contains("task timeout")
                || normalized.contains("waited ");
    }

    private static void closeQuietly(MetadataTool t) {
        try {
            t.close();
        } catch (RuntimeException e) {
            log.debug("Error while closing metadata tool: {}", e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        synchronized (this) {
            if (tool != null) {
                closeQuietly(tool);
                tool = null;
            }
        }
        toolExecutor.shutdownNow();
    }
}
