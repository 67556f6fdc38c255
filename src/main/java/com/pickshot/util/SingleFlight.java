package com.pickshot.util;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Collapses concurrent requests for the same key onto one computation.
 *
 * The first caller for a key starts the work; callers arriving while it runs
 * receive the same result. The key is released as soon as the work finishes,
 * so a later call starts afresh.
 */
public class SingleFlight<K, V> {

    private static final class Call<V> {
        private final CompletableFuture<V> result = new CompletableFuture<>();
        private final AtomicInteger callers = new AtomicInteger(1);
    }

    private final ConcurrentMap<K, Call<V>> calls = new ConcurrentHashMap<>();

    /**
     * Joins the in-flight computation for {@code key}, or starts one with
     * {@code work}.
     */
    public CompletableFuture<V> execute(K key, Supplier<CompletableFuture<V>> work) {
        Call<V> created = new Call<>();
        Call<V> existing = calls.putIfAbsent(key, created);
        if (existing != null) {
            existing.callers.incrementAndGet();
            return existing.result.copy();
        }

        CompletableFuture<V> started;
        try {
            started = work.get();
        } catch (RuntimeException e) {
            started = CompletableFuture.failedFuture(e);
        }
        started.whenComplete((value, error) -> {
            calls.remove(key, created);
            if (error != null) {
                created.result.completeExceptionally(error);
            } else {
                created.result.complete(value);
            }
        });
        return created.result.copy();
    }

    public boolean isInFlight(K key) {
        return calls.containsKey(key);
    }

    /**
     * Number of callers sharing the computation for {@code key}, or 0 when
     * nothing is in flight.
     */
    public int callerCount(K key) {
        Call<V> call = calls.get(key);
        return call == null ? 0 : call.callers.get();
    }

    public int inFlightCount() {
        return calls.size();
    }
}
