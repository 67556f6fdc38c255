package com.pickshot.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetadataSyncServiceTest {

    @TempDir
    Path tempDir;

    private MetadataSyncService service;

    /**
     * In-memory tool. The first {@code failures} calls throw the supplied
     * error; later calls work on a tag map.
     */
    private static final class ScriptedTool implements MetadataTool {
        private final int failures;
        private final MetadataToolException error;
        private final AtomicInteger calls = new AtomicInteger();
        private final Map<String, Object> tags = new HashMap<>();
        private boolean closed = false;

        ScriptedTool(int failures, MetadataToolException error) {
            this.failures = failures;
            this.error = error;
        }

        @Override
        public Map<String, Object> readTags(Path file) throws MetadataToolException {
            maybeFail();
            return new HashMap<>(tags);
        }

        @Override
        public void writeTags(Path file, Map<String, Object> values) throws MetadataToolException {
            maybeFail();
            tags.putAll(values);
        }

        private void maybeFail() throws MetadataToolException {
            if (calls.incrementAndGet() <= failures) {
                throw error;
            }
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    @AfterEach
    void tearDown() {
        if (service != null) {
            service.shutdown();
        }
    }

    private MetadataSyncService serviceFor(MetadataTool tool) {
        service = new MetadataSyncService(() -> tool, true, 5_000, 2, 0, 60_000);
        return service;
    }

    @Test
    void timeoutsFollowedBySuccessKeepSyncEnabled() throws Exception {
        ScriptedTool tool = new ScriptedTool(2, new MetadataTimeoutException("Metadata task timeout"));
        tool.tags.put("Rating", 3);
        Path photo = Files.createFile(tempDir.resolve("a.jpg"));

        assertEquals(3, serviceFor(tool).readRating(photo));
        assertTrue(service.isEnabled());
        assertEquals(3, tool.calls.get());
    }

    @Test
    void exhaustedTimeoutsNeverTripTheBreaker() throws Exception {
        ScriptedTool tool = new ScriptedTool(5,
                new MetadataToolException("exiftool process terminated before task completed"));
        tool.tags.put("RatingPercent", 80);
        Path photo = Files.createFile(tempDir.resolve("a.jpg"));
        serviceFor(tool);

        assertNull(service.readRating(photo));
        assertTrue(service.isEnabled());
        assertEquals(4, service.readRating(photo));
        assertTrue(service.isEnabled());
    }

    @Test
    void persistentErrorDisablesSyncForGood() throws Exception {
        ScriptedTool tool = new ScriptedTool(Integer.MAX_VALUE, new MetadataToolException("Unknown file type"));
        Path photo = Files.createFile(tempDir.resolve("a.jpg"));
        serviceFor(tool);

        assertNull(service.readRating(photo));

        assertFalse(service.isEnabled());
        assertTrue(tool.closed);
        int callsWhenDisabled = tool.calls.get();
        assertNull(service.readRating(photo));
        assertFalse(service.writeRating(photo, 4));
        assertEquals(callsWhenDisabled, tool.calls.get());
    }

    @Test
    void failureToleranceIsHonoured() throws Exception {
        ScriptedTool tool = new ScriptedTool(Integer.MAX_VALUE, new MetadataToolException("Unknown file type"));
        Path photo = Files.createFile(tempDir.resolve("a.jpg"));
        service = new MetadataSyncService(() -> tool, true, 5_000, 0, 2, 60_000);

        service.readRating(photo);
        service.readRating(photo);
        assertTrue(service.isEnabled());

        service.readRating(photo);
        assertFalse(service.isEnabled());
    }

    @Test
    void toolThatCannotStartDisablesSync() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        service = new MetadataSyncService(() -> {
            attempts.incrementAndGet();
            throw new MetadataToolException("exiftool: command not found");
        }, true, 5_000, 2, 0, 60_000);
        Path photo = Files.createFile(tempDir.resolve("a.jpg"));

        assertNull(service.readRating(photo));
        assertFalse(service.isEnabled());
        assertNull(service.readRating(photo));
        assertEquals(1, attempts.get());
    }

    @Test
    void writeSetsStarsAndPercent() throws Exception {
        ScriptedTool tool = new ScriptedTool(0, null);
        Path photo = Files.createFile(tempDir.resolve("a.jpg"));

        assertTrue(serviceFor(tool).writeRating(photo, 4));

        assertEquals(4, tool.tags.get("Rating"));
        assertEquals(80, tool.tags.get("RatingPercent"));
    }

    @Test
    void writeErrorsReachTheCaller() throws Exception {
        ScriptedTool tool = new ScriptedTool(Integer.MAX_VALUE, new MetadataToolException("Error: file is read-only"));
        Path photo = Files.createFile(tempDir.resolve("a.jpg"));

        MetadataToolException error = assertThrows(MetadataToolException.class,
                () -> serviceFor(tool).writeRating(photo, 2));
        assertEquals("Error: file is read-only", error.getMessage());
        assertFalse(service.isEnabled());
    }

    @Test
    void slowVolumesSkipWritesButNotReads() throws Exception {
        ScriptedTool tool = new ScriptedTool(0, null);
        tool.tags.put("Rating", 2);
        Path photo = Files.createFile(tempDir.resolve("a.jpg"));
        // every stat takes at least 0ms
        service = new MetadataSyncService(() -> tool, true, 5_000, 2, 0, 0);

        assertFalse(service.writeRating(photo, 5));
        assertEquals(2, tool.tags.get("Rating"));
        assertEquals(2, service.readRating(photo));
        assertTrue(service.isEnabled());
    }

    @Test
    void slowVolumeVerdictIsCachedPerDirectory() throws Exception {
        Path photo = Files.createFile(tempDir.resolve("a.jpg"));
        service = new MetadataSyncService(() -> new ScriptedTool(0, null), true, 5_000, 2, 0, 0);

        assertTrue(service.isLikelySlowVolume(photo));
        assertTrue(service.isLikelySlowVolume(tempDir.resolve("not-even-there.jpg")));
    }

    @Test
    void hungCallTimesOutWithoutTrippingTheBreaker() throws Exception {
        Path photo = Files.createFile(tempDir.resolve("a.jpg"));
        AtomicInteger created = new AtomicInteger();
        service = new MetadataSyncService(() -> {
            created.incrementAndGet();
            return new MetadataTool() {
                @Override
                public Map<String, Object> readTags(Path file) throws MetadataToolException {
                    try {
                        Thread.sleep(10_000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    throw new MetadataToolException("interrupted");
                }

                @Override
                public void writeTags(Path file, Map<String, Object> tags) {
                }

                @Override
                public void close() {
                }
            };
        }, true, 100, 1, 0, 60_000);

        assertNull(service.readRating(photo));
        assertTrue(service.isEnabled());
        // each timed-out tool is discarded and replaced
        assertEquals(2, created.get());
    }

    @Test
    void disabledByConfigurationNeverStartsTheTool() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        service = new MetadataSyncService(() -> {
            attempts.incrementAndGet();
            return new ScriptedTool(0, null);
        }, false, 5_000, 2, 0, 60_000);
        Path photo = Files.createFile(tempDir.resolve("a.jpg"));

        assertNull(service.readRating(photo));
        assertFalse(service.writeRating(photo, 3));
        assertEquals(0, attempts.get());
    }

    @Test
    void timeoutClassificationMatchesToolMessages() {
        assertTrue(MetadataSyncService.isTimeoutFailure(new MetadataTimeoutException("x")));
        assertTrue(MetadataSyncService.isTimeoutFailure(new MetadataToolException("Waited 45000ms")));
        assertTrue(MetadataSyncService.isTimeoutFailure(new MetadataToolException("BatchCluster task timeout")));
        assertFalse(MetadataSyncService.isTimeoutFailure(new MetadataToolException("Unknown file type")));
        assertFalse(MetadataSyncService.isTimeoutFailure(null));
    }
}
