package com.pickshot.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * FIFO queue of thumbnail jobs feeding a fixed number of worker slots.
 *
 * A job is handed to the executor only while a slot is free. Whatever the
 * outcome, finishing a job releases its slot and pulls the next one, so a
 * failing job never holds up the rest of the queue. A job whose base path is
 * already queued or running is ignored.
 */
public class ThumbnailQueue {

    private static final Logger log = LoggerFactory.getLogger(ThumbnailQueue.class);

    @FunctionalInterface
    public interface JobRunner {
        void run(ThumbnailJob job) throws Exception;
    }

    private final int concurrency;
    private final Executor executor;
    private final JobRunner runner;

    // guarded by this
    private final Deque<ThumbnailJob> queue = new ArrayDeque<>();
    private final Set<Path> scheduledTargets = new HashSet<>();
    private int activeJobs = 0;

    public ThumbnailQueue(int concurrency, Executor executor, JobRunner runner) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("Concurrency must be at least 1: " + concurrency);
        }
        this.concurrency = concurrency;
        this.executor = executor;
        this.runner = runner;
    }

    /**
     * @return false if a job for the same base path is already queued or
     *         running
     */
    public boolean schedule(ThumbnailJob job) {
        synchronized (this) {
            if (!scheduledTargets.add(job.getBaseCachePath())) {
                return false;
            }
            queue.addLast(job);
        }
        pump();
        return true;
    }

    public synchronized boolean isScheduled(Path baseCachePath) {
        return scheduledTargets.contains(baseCachePath);
    }

    public synchronized int getActiveCount() {
        return activeJobs;
    }

    public synchronized int getQueuedCount() {
        return queue.size();
    }

    private void pump() {
        List<ThumbnailJob> toStart = new ArrayList<>();
        synchronized (this) {
            while (activeJobs < concurrency && !queue.isEmpty()) {
                toStart.add(queue.pollFirst());
                activeJobs++;
            }
        }
        for (ThumbnailJob job : toStart) {
            try {
                executor.execute(() -> runJob(job));
            } catch (RejectedExecutionException e) {
                log.error("Thumbnail executor rejected job for {}: {}", job.getSourcePath().getFileName(), e.getMessage());
                release(job);
            }
        }
    }

    private void runJob(ThumbnailJob job) {
        try {
            runner.run(job);
        } catch (Exception e) {
            log.error("Failed to generate thumbnails for {}: {}", job.getSourcePath().getFileName(), e.getMessage());
        } finally {
            release(job);
            pump();
        }
    }

    private synchronized void release(ThumbnailJob job) {
        scheduledTargets.remove(job.getBaseCachePath());
        activeJobs--;
    }
}
