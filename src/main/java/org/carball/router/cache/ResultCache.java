package org.carball.router.cache;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.base.Ticker;
import com.google.common.cache.CacheStats;
import com.google.common.cache.RemovalCause;
import com.google.common.util.concurrent.ExecutionError;
import com.google.common.util.concurrent.UncheckedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.carball.router.catalog.CatalogSnapshot;
import org.carball.router.exception.ErrorKind;
import org.carball.router.exception.RouterException;

import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Size-bounded cache of query results keyed by {@link QueryFingerprint}.
 *
 * <p>Concurrent requests for the same fingerprint are collapsed: the first
 * caller computes, the others block on that computation and share its result
 * (or its failure). Failed computations are not cached. With a positive TTL,
 * entries also expire that long after they were written.
 */
@Slf4j
public class ResultCache {

    /**
     * Result of {@link #getOrCompute}: the entry and whether this caller computed it.
     */
    public record Lookup(CacheEntry entry, boolean computed) {
    }

    private final Cache<String, CacheEntry> cache;
    private final long capacity;
    private final AtomicLong corruptEntries = new AtomicLong();
    private final AtomicLong computations = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final AtomicLong expirations = new AtomicLong();

    public ResultCache(long capacity) {
        this(capacity, 0);
    }

    public ResultCache(long capacity, long ttlMs) {
        this(capacity, ttlMs, Ticker.systemTicker());
    }

    ResultCache(long capacity, long ttlMs, Ticker ticker) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Cache capacity must be positive: " + capacity);
        }
        if (ttlMs < 0) {
            throw new IllegalArgumentException("Cache TTL must not be negative: " + ttlMs);
        }
        this.capacity = capacity;
        CacheBuilder<Object, Object> builder = CacheBuilder.newBuilder()
                .maximumSize(capacity)
                .ticker(ticker)
                .recordStats();
        if (ttlMs > 0) {
            builder.expireAfterWrite(ttlMs, TimeUnit.MILLISECONDS);
        }
        this.cache = builder.<String, CacheEntry>removalListener(notification -> {
            if (notification.getCause() == RemovalCause.EXPIRED) {
                expirations.incrementAndGet();
            } else if (notification.getCause() == RemovalCause.SIZE) {
                evictions.incrementAndGet();
            }
        }).build();
    }

    /**
     * Returns a valid entry for the fingerprint. Entries failing validation
     * against the current catalog are dropped and reported as a miss.
     */
    public Optional<CacheEntry> get(String fingerprint, CatalogSnapshot catalog) {
        CacheEntry entry = cache.getIfPresent(fingerprint);
        if (entry == null) {
            return Optional.empty();
        }
        Optional<String> problem = validate(fingerprint, entry, catalog);
        if (problem.isPresent()) {
            corruptEntries.incrementAndGet();
            cache.invalidate(fingerprint);
            log.warn("{}", new RouterException(ErrorKind.CACHE_CORRUPTION,
                    "Dropped cache entry " + shortId(fingerprint) + ": " + problem.get()).getMessage());
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    public void put(String fingerprint, CacheEntry entry) {
        if (!fingerprint.equals(entry.fingerprint())) {
            throw new IllegalArgumentException("Entry fingerprint " + shortId(entry.fingerprint())
                    + " does not match key " + shortId(fingerprint));
        }
        cache.put(fingerprint, entry);
    }

    /**
     * Returns the cached entry or computes it, with at most one computation per
     * fingerprint in flight.
     */
    public Lookup getOrCompute(String fingerprint, CatalogSnapshot catalog, Callable<CacheEntry> loader) {
        Optional<CacheEntry> cached = get(fingerprint, catalog);
        if (cached.isPresent()) {
            return new Lookup(cached.get(), false);
        }

        AtomicBoolean computedHere = new AtomicBoolean(false);
        try {
            CacheEntry entry = cache.get(fingerprint, () -> {
                computedHere.set(true);
                computations.incrementAndGet();
                return loader.call();
            });
            return new Lookup(entry, computedHere.get());
        } catch (ExecutionException | UncheckedExecutionException e) {
            throw propagate(e.getCause());
        } catch (ExecutionError e) {
            throw e;
        }
    }

    public void invalidateAll() {
        cache.invalidateAll();
        log.info("Result cache cleared");
    }

    public long size() {
        return cache.size();
    }

    public ResultCacheStats stats() {
        // pending expirations are only applied during cache maintenance
        cache.cleanUp();
        CacheStats stats = cache.stats();
        return new ResultCacheStats(cache.size(), capacity, stats.hitCount(), stats.missCount(),
                evictions.get(), expirations.get(), corruptEntries.get(), computations.get());
    }

    private static Optional<String> validate(String fingerprint, CacheEntry entry, CatalogSnapshot catalog) {
        if (!fingerprint.equals(entry.fingerprint())) {
            return Optional.of("stored under a different fingerprint");
        }
        if (entry.result() == null || entry.pruningResult() == null) {
            return Optional.of("incomplete entry");
        }
        for (String identity : entry.pruningResult().partitionIdentities()) {
            if (!catalog.contains(identity)) {
                return Optional.of("partition " + identity + " is no longer in the catalog");
            }
        }
        return Optional.empty();
    }

    private static RuntimeException propagate(Throwable cause) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new RouterException(ErrorKind.BACKEND_EXECUTION_FAILED,
                "Result computation failed: " + cause.getMessage(), cause);
    }

    private static String shortId(String fingerprint) {
        return fingerprint.length() > 12 ? fingerprint.substring(0, 12) : fingerprint;
    }
}
