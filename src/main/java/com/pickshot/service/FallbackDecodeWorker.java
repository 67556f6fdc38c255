package com.pickshot.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs fallback conversions on a dedicated worker thread, away from the
 * thumbnail and request threads.
 *
 * Callers post a request tagged with a monotonically increasing id and get a
 * future back; the worker answers with a response carrying the same id, which
 * resolves or rejects the matching future. If the worker thread dies every
 * request still waiting on it is rejected, and a fresh worker is started on
 * the next submission.
 */
public class FallbackDecodeWorker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FallbackDecodeWorker.class);

    /**
     * The worker went away before answering.
     */
    public static class WorkerCrashedException extends IOException {
        public WorkerCrashedException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    private static final class ConversionRequest {
        private final long id;
        private final Path source;
        private final Path target;
        private final double quality;

        private ConversionRequest(long id, Path source, Path target, double quality) {
            this.id = id;
            this.source = source;
            this.target = target;
            this.quality = quality;
        }
    }

    private static final class ConversionResponse {
        private final long id;
        private final Exception error;

        private ConversionResponse(long id, Exception error) {
            this.id = id;
            this.error = error;
        }
    }

    private final ImageConverter converter;
    private final AtomicLong nextRequestId = new AtomicLong(0);
    private final AtomicInteger workersStarted = new AtomicInteger(0);

    private Worker worker;
    private boolean closed = false;

    public FallbackDecodeWorker(ImageConverter converter) {
        this.converter = converter;
    }

    /**
     * Queues a conversion.
     *
     * @return completes when the target file has been written
     */
    public CompletableFuture<Void> submit(Path source, Path target, double quality) {
        ConversionRequest request = new ConversionRequest(nextRequestId.incrementAndGet(), source, target, quality);
        // a worker that died between lookup and send gets replaced once
        for (int attempt = 0; attempt < 2; attempt++) {
            Worker current = currentWorker();
            if (current == null) {
                return CompletableFuture.failedFuture(new IllegalStateException("Fallback worker is closed"));
            }
            CompletableFuture<Void> future = current.send(request);
            if (future != null) {
                return future;
            }
        }
        return CompletableFuture.failedFuture(
                new WorkerCrashedException("Fallback worker unavailable for request " + request.id, null));
    }

    /** Number of worker threads started so far. */
    public int getWorkersStarted() {
        return workersStarted.get();
    }

    private synchronized Worker currentWorker() {
        if (closed) {
            return null;
        }
        if (worker == null || !worker.isAlive()) {
            worker = new Worker(workersStarted.incrementAndGet());
            worker.start();
        }
        return worker;
    }

    @Override
    public void close() {
        Worker current;
        synchronized (this) {
            closed = true;
            current = worker;
            worker = null;
        }
        if (current != null) {
            current.stop();
        }
    }

    private final class Worker implements Runnable {

        private final BlockingQueue<ConversionRequest> inbox = new LinkedBlockingQueue<>();
        private final Map<Long, CompletableFuture<Void>> pending = new ConcurrentHashMap<>();
        private final Thread thread;
        private boolean alive = true;

        private Worker(int generation) {
            this.thread = new Thread(this, "fallback-decode-" + generation);
            this.thread.setDaemon(true);
        }

        private void start() {
            thread.start();
        }

        private synchronized boolean isAlive() {
            return alive;
        }

        /**
         * @return the pending future, or null if this worker has already died
         */
        private synchronized CompletableFuture<Void> send(ConversionRequest request) {
            if (!alive) {
                return null;
            }
            CompletableFuture<Void> future = new CompletableFuture<>();
            pending.put(request.id, future);
            inbox.add(request);
            return future;
        }

        private void stop() {
            thread.interrupt();
        }

        @Override
        public void run() {
            Throwable crash = null;
            try {
                while (!Thread.currentThread().isInterrupted()) {
                    ConversionRequest request = inbox.take();
                    deliver(handle(request));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (Throwable t) {
                crash = t;
                log.error("Fallback decode worker {} died: {}", thread.getName(), t.toString());
            } finally {
                synchronized (this) {
                    alive = false;
                }
                rejectPending(crash);
            }
        }

        private ConversionResponse handle(ConversionRequest request) {
            try {
                converter.convert(request.source, request.target, request.quality);
                return new ConversionResponse(request.id, null);
            } catch (IOException | RuntimeException e) {
                return new ConversionResponse(request.id, e);
            }
        }

        private void deliver(ConversionResponse response) {
            CompletableFuture<Void> future = pending.remove(response.id);
            if (future == null) {
                log.debug("Dropping response for unknown request {}", response.id);
                return;
            }
            if (response.error != null) {
                future.completeExceptionally(response.error);
            } else {
                future.complete(null);
            }
        }

        private void rejectPending(Throwable crash) {
            List<Long> ids = new ArrayList<>(pending.keySet());
            for (Long id : ids) {
                CompletableFuture<Void> future = pending.remove(id);
                if (future != null) {
                    future.completeExceptionally(new WorkerCrashedException(
                            "Fallback worker exited before completing request " + id, crash));
                }
            }
        }
    }
}
