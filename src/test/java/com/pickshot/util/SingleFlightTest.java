package com.pickshot.util;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SingleFlightTest {

    @Test
    void concurrentCallersShareOneComputation() throws Exception {
        SingleFlight<String, String> flight = new SingleFlight<>();
        CompletableFuture<String> work = new CompletableFuture<>();
        AtomicInteger starts = new AtomicInteger();

        CompletableFuture<String> first = flight.execute("k", () -> {
            starts.incrementAndGet();
            return work;
        });
        CompletableFuture<String> second = flight.execute("k", () -> {
            starts.incrementAndGet();
            return CompletableFuture.completedFuture("other");
        });

        assertTrue(flight.isInFlight("k"));
        assertEquals(2, flight.callerCount("k"));

        work.complete("done");

        assertEquals("done", first.get());
        assertEquals("done", second.get());
        assertEquals(1, starts.get());
        assertFalse(flight.isInFlight("k"));
        assertEquals(0, flight.inFlightCount());
    }

    @Test
    void keyIsReleasedAfterCompletion() throws Exception {
        SingleFlight<String, Integer> flight = new SingleFlight<>();
        AtomicInteger starts = new AtomicInteger();

        flight.execute("k", () -> CompletableFuture.completedFuture(starts.incrementAndGet())).get();
        int second = flight.execute("k", () -> CompletableFuture.completedFuture(starts.incrementAndGet())).get();

        assertEquals(2, second);
    }

    @Test
    void failuresReachEveryCaller() {
        SingleFlight<String, String> flight = new SingleFlight<>();
        CompletableFuture<String> work = new CompletableFuture<>();

        CompletableFuture<String> first = flight.execute("k", () -> work);
        CompletableFuture<String> second = flight.execute("k", () -> work);
        work.completeExceptionally(new IllegalStateException("boom"));

        ExecutionException e1 = assertThrows(ExecutionException.class, first::get);
        ExecutionException e2 = assertThrows(ExecutionException.class, second::get);
        assertInstanceOf(IllegalStateException.class, e1.getCause());
        assertInstanceOf(IllegalStateException.class, e2.getCause());
        assertFalse(flight.isInFlight("k"));
    }

    @Test
    void throwingSupplierFailsTheCallAndFreesTheKey() {
        SingleFlight<String, String> flight = new SingleFlight<>();

        CompletableFuture<String> call = flight.execute("k", () -> {
            throw new IllegalArgumentException("bad");
        });

        assertTrue(call.isCompletedExceptionally());
        assertFalse(flight.isInFlight("k"));
    }
}
