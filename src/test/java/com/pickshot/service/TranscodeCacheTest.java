package com.pickshot.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TranscodeCacheTest {

    @TempDir
    Path tempDir;

    private Path cacheDir;
    private Path source;
    private long sourceModifiedAt;
    private ExecutorService executor;
    private DecoderCapabilities capabilities;
    private final AtomicInteger fallbackCalls = new AtomicInteger();
    private FallbackDecodeWorker fallback;

    @BeforeEach
    void setUp() throws Exception {
        cacheDir = Files.createDirectory(tempDir.resolve("transcoded"));
        source = Files.write(tempDir.resolve("IMG_0001.HEIC"), new byte[] { 0, 0, 0, 24, 'f', 't', 'y', 'p' });
        sourceModifiedAt = System.currentTimeMillis() - 60_000;
        Files.setLastModifiedTime(source, FileTime.fromMillis(sourceModifiedAt));
        executor = Executors.newFixedThreadPool(4);
        capabilities = new DecoderCapabilities();
        fallback = new FallbackDecodeWorker((s, t, q) -> {
            fallbackCalls.incrementAndGet();
            Files.write(t, new byte[] { 1, 2, 3 });
        });
    }

    @AfterEach
    void tearDown() {
        fallback.close();
        executor.shutdownNow();
    }

    private TranscodeCache cacheWith(ImageConverter primary) {
        return new TranscodeCache(cacheDir, primary, fallback, capabilities, executor);
    }

    @Test
    void concurrentEnsureRunsOneConversion() throws Exception {
        AtomicInteger conversions = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        TranscodeCache cache = cacheWith((s, t, q) -> {
            conversions.incrementAndGet();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            Files.write(t, new byte[] { 9, 9, 9 });
        });

        List<CompletableFuture<Path>> callers = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            callers.add(cache.ensure(source, sourceModifiedAt, TranscodeRule.HEIF));
        }
        release.countDown();

        Path expected = cache.targetFor(source, TranscodeRule.HEIF);
        for (CompletableFuture<Path> caller : callers) {
            assertEquals(expected, caller.get(5, TimeUnit.SECONDS));
        }
        assertEquals(1, conversions.get());
        assertTrue(expected.getFileName().toString().endsWith(".jpg"));
    }

    @Test
    void freshEntryIsReturnedWithoutWork() throws Exception {
        AtomicInteger conversions = new AtomicInteger();
        TranscodeCache cache = cacheWith((s, t, q) -> conversions.incrementAndGet());
        Path target = Files.write(cache.targetFor(source, TranscodeRule.HEIF), new byte[] { 1 });

        CompletableFuture<Path> result = cache.ensure(source, sourceModifiedAt, TranscodeRule.HEIF);

        assertTrue(result.isDone());
        assertEquals(target, result.get());
        assertEquals(0, conversions.get());
    }

    @Test
    void staleEntryIsConvertedAgain() throws Exception {
        AtomicInteger conversions = new AtomicInteger();
        TranscodeCache cache = cacheWith((s, t, q) -> {
            conversions.incrementAndGet();
            Files.write(t, new byte[] { 7 });
        });
        Path target = Files.write(cache.targetFor(source, TranscodeRule.HEIF), new byte[] { 1 });
        Files.setLastModifiedTime(target, FileTime.fromMillis(sourceModifiedAt - 1_000));

        cache.ensureNow(source, sourceModifiedAt, TranscodeRule.HEIF);

        assertEquals(1, conversions.get());
    }

    @Test
    void missingDecoderSwitchesFamilyToFallback() throws Exception {
        AtomicInteger primaryCalls = new AtomicInteger();
        TranscodeCache cache = cacheWith((s, t, q) -> {
            primaryCalls.incrementAndGet();
            throw new IOException("No decoding plugin installed for this compression format");
        });

        Path first = cache.ensureNow(source, sourceModifiedAt, TranscodeRule.HEIF);
        assertTrue(capabilities.isFastDecoderUnavailable("heif"));
        assertEquals(1, fallbackCalls.get());

        Files.delete(first);
        cache.ensureNow(source, sourceModifiedAt, TranscodeRule.HEIF);

        assertEquals(1, primaryCalls.get());
        assertEquals(2, fallbackCalls.get());
    }

    @Test
    void otherPrimaryErrorsFailTheConversionAndRemovePartialOutput() throws Exception {
        TranscodeCache cache = cacheWith((s, t, q) -> {
            Files.write(t, new byte[] { 1, 2 });
            throw new IOException("No space left on device");
        });

        IOException error = assertThrows(IOException.class,
                () -> cache.ensureNow(source, sourceModifiedAt, TranscodeRule.HEIF));

        assertEquals("No space left on device", error.getMessage());
        assertFalse(Files.exists(cache.targetFor(source, TranscodeRule.HEIF)));
        assertFalse(capabilities.isFastDecoderUnavailable("heif"));
        assertEquals(0, fallbackCalls.get());
    }

    @Test
    void entryStillBeingWrittenIsNeverHandedOut() throws Exception {
        CountDownLatch writing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        FallbackDecodeWorker crashingMidWrite = new FallbackDecodeWorker((s, t, q) -> {
            Files.write(t, new byte[] { 1, 2 });
            writing.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            throw new IOException("heif-convert crashed mid-write");
        });
        try {
            TranscodeCache cache = new TranscodeCache(cacheDir, (s, t, q) -> {
                throw new IOException("No decoding plugin installed for this compression format");
            }, crashingMidWrite, capabilities, executor);

            CompletableFuture<Path> first = cache.ensure(source, sourceModifiedAt, TranscodeRule.HEIF);
            assertTrue(writing.await(5, TimeUnit.SECONDS));
            CompletableFuture<Path> second = cache.ensure(source, sourceModifiedAt, TranscodeRule.HEIF);

            assertFalse(second.isDone());
            release.countDown();

            assertThrows(ExecutionException.class, () -> first.get(5, TimeUnit.SECONDS));
            assertThrows(ExecutionException.class, () -> second.get(5, TimeUnit.SECONDS));
            assertFalse(Files.exists(cache.targetFor(source, TranscodeRule.HEIF)));
        } finally {
            crashingMidWrite.close();
        }
    }

    @Test
    void evictRemovesCachedCopy() throws Exception {
        TranscodeCache cache = cacheWith((s, t, q) -> Files.write(t, new byte[] { 1 }));
        Path target = cache.ensureNow(source, sourceModifiedAt, TranscodeRule.HEIF);

        cache.evict(source, TranscodeRule.HEIF);

        assertFalse(Files.exists(target));
    }

    @Test
    void heifRuleMatchesExtensionsCaseInsensitively() {
        assertEquals(TranscodeRule.HEIF, TranscodeRule.forFile(source).orElseThrow());
        assertTrue(TranscodeRule.forFile(tempDir.resolve("a.heif")).isPresent());
        assertFalse(TranscodeRule.forFile(tempDir.resolve("a.jpg")).isPresent());
        assertFalse(TranscodeRule.forFile(tempDir.resolve("README")).isPresent());
    }
}
