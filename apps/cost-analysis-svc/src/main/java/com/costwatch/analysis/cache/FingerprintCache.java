package com.costwatch.analysis.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * In-memory results keyed by an input fingerprint, with a TTL and an entry cap. A key that differs in
 * any input never shares an entry, so a hit is always the result the caller would have computed.
 * Each key has at most one writer: concurrent misses on the same key wait for the first loader.
 */
public class FingerprintCache<V> {

    // guarded by "this"; eviction and the entry cap are applied under the same lock as the write
    private final Map<String, Entry<V>> entries = new HashMap<>();
    private final ConcurrentMap<String, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final int maxEntries;
    private final Clock clock;

    public FingerprintCache(Duration ttl, int maxEntries, Clock clock) {
        this.ttl = Objects.requireNonNull(ttl);
        this.clock = Objects.requireNonNull(clock);
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive");
        }
        this.maxEntries = maxEntries;
    }

    public synchronized Optional<V> get(String fingerprint) {
        Entry<V> entry = entries.get(fingerprint);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(ttl, clock.instant())) {
            entries.remove(fingerprint);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    public synchronized void put(String fingerprint, V value) {
        Instant now = clock.instant();
        entries.values().removeIf(entry -> entry.isExpired(ttl, now));
        if (!entries.containsKey(fingerprint) && entries.size() >= maxEntries) {
            entries.entrySet().stream()
                    .min(Comparator.comparing(entry -> entry.getValue().storedAt()))
                    .map(Map.Entry::getKey)
                    .ifPresent(entries::remove);
        }
        entries.put(fingerprint, new Entry<>(value, now));
    }

    /**
     * Returns the cached value or computes and stores it. Only one caller runs {@code loader} for a
     * given key; the others block until it finishes and share its value or its exception.
     */
    public V getOrCompute(String fingerprint, Supplier<V> loader) {
        Optional<V> cached = get(fingerprint);
        if (cached.isPresent()) {
            return cached.get();
        }
        CompletableFuture<V> pending = new CompletableFuture<>();
        CompletableFuture<V> running = inFlight.putIfAbsent(fingerprint, pending);
        if (running != null) {
            return await(running);
        }
        try {
            // a loader that finished between the first lookup and claiming the key has already stored its value
            V value = get(fingerprint).orElseGet(() -> {
                V loaded = loader.get();
                put(fingerprint, loaded);
                return loaded;
            });
            pending.complete(value);
            return value;
        } catch (RuntimeException | Error ex) {
            pending.completeExceptionally(ex);
            throw ex;
        } finally {
            inFlight.remove(fingerprint, pending);
        }
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }

    private static <V> V await(CompletableFuture<V> running) {
        try {
            return running.join();
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            if (ex.getCause() instanceof Error error) {
                throw error;
            }
            throw ex;
        }
    }

    private record Entry<V>(V value, Instant storedAt) {
        boolean isExpired(Duration ttl, Instant now) {
            return !storedAt.plus(ttl).isAfter(now);
        }
    }
}
