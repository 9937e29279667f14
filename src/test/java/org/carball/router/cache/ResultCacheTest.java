package org.carball.router.cache;

import com.google.common.base.Ticker;
import org.carball.router.catalog.CatalogSnapshot;
import org.carball.router.exception.ErrorKind;
import org.carball.router.exception.RouterException;
import org.carball.router.model.partition.DataFile;
import org.carball.router.model.partition.Partition;
import org.carball.router.model.partition.PruningResult;
import org.carball.router.model.query.QueryResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ResultCacheTest {

    private CatalogSnapshot catalog;
    private ResultCache cache;

    @BeforeEach
    void setUp() {
        catalog = new CatalogSnapshot(List.of(partition("date=2024-11-01"), partition("date=2024-11-02")),
                "v1", List.of(), Instant.now());
        cache = new ResultCache(4);
    }

    @Test
    void shouldReturnStoredEntry() {
        // Given
        String fingerprint = QueryFingerprint.of("SELECT 1", "v1", List.of("date=2024-11-01"));
        cache.put(fingerprint, entry(fingerprint, "date=2024-11-01"));

        // When / Then
        assertThat(cache.get(fingerprint, catalog)).isPresent();
        assertThat(cache.stats().hits()).isEqualTo(1);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void shouldChangeFingerprintWithCatalogVersion() {
        String before = QueryFingerprint.of("SELECT 1", "v1", List.of("date=2024-11-01"));
        String after = QueryFingerprint.of("SELECT 1", "v2", List.of("date=2024-11-01"));

        assertThat(before).isNotEqualTo(after).hasSize(64);
        assertThat(QueryFingerprint.of("SELECT 1", "v1", List.of("date=2024-11-01"))).isEqualTo(before);
        assertThat(QueryFingerprint.of("SELECT 2", "v1", List.of("date=2024-11-01"))).isNotEqualTo(before);
    }

    @Test
    void shouldDropEntriesReferencingVanishedPartitions() {
        // Given
        String fingerprint = QueryFingerprint.of("SELECT 1", "v1", List.of("date=2024-10-31"));
        cache.put(fingerprint, entry(fingerprint, "date=2024-10-31"));

        // When / Then
        assertThat(cache.get(fingerprint, catalog)).isEmpty();
        assertThat(cache.size()).isZero();
        assertThat(cache.stats().corruptEntriesDropped()).isEqualTo(1);
    }

    @Test
    void shouldRejectEntryUnderForeignKey() {
        String fingerprint = QueryFingerprint.of("SELECT 1", "v1", List.of());

        assertThatThrownBy(() -> cache.put("other", entry(fingerprint)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldEvictLeastRecentlyUsedEntry() {
        // Given
        ResultCache small = new ResultCache(2);
        small.put("a", entry("a"));
        small.put("b", entry("b"));
        small.get("a", catalog);

        // When
        small.put("c", entry("c"));

        // Then
        assertThat(small.get("a", catalog)).isPresent();
        assertThat(small.get("b", catalog)).isEmpty();
        assertThat(small.get("c", catalog)).isPresent();
        assertThat(small.stats().evictions()).isEqualTo(1);
        assertThat(small.stats().capacity()).isEqualTo(2);
    }

    @Test
    void shouldExpireEntriesAfterTtl() {
        // Given
        FakeTicker ticker = new FakeTicker();
        ResultCache expiring = new ResultCache(4, 1_000, ticker);
        String fingerprint = QueryFingerprint.of("SELECT 1", "v1", List.of("date=2024-11-01"));
        expiring.put(fingerprint, entry(fingerprint, "date=2024-11-01"));
        ticker.advance(999);
        assertThat(expiring.get(fingerprint, catalog)).isPresent();

        // When
        ticker.advance(2);

        // Then
        assertThat(expiring.get(fingerprint, catalog)).isEmpty();
        ResultCacheStats stats = expiring.stats();
        assertThat(stats.expirations()).isEqualTo(1);
        assertThat(stats.evictions()).isZero();
        assertThat(stats.size()).isZero();
    }

    @Test
    void shouldKeepEntriesWithoutTtl() {
        FakeTicker ticker = new FakeTicker();
        ResultCache unbounded = new ResultCache(4, 0, ticker);
        unbounded.put("a", entry("a"));

        ticker.advance(TimeUnit.DAYS.toMillis(30));

        assertThat(unbounded.get("a", catalog)).isPresent();
        assertThat(unbounded.stats().expirations()).isZero();
    }

    @Test
    void shouldRejectNegativeTtl() {
        assertThatThrownBy(() -> new ResultCache(4, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldValidateAgainstLargeCatalog() {
        // Given
        List<Partition> partitions = new ArrayList<>();
        for (int day = 1; day <= 28; day++) {
            partitions.add(partition(String.format("date=2024-02-%02d", day)));
        }
        CatalogSnapshot month = new CatalogSnapshot(partitions, "v2", List.of(), Instant.now());
        String fingerprint = QueryFingerprint.of("SELECT 1", "v2", List.of("date=2024-02-28"));
        cache.put(fingerprint, entry(fingerprint, "date=2024-02-28", "date=2024-02-01"));

        // When / Then
        assertThat(month.identities()).hasSize(28).contains("date=2024-02-28");
        assertThat(month.contains("date=2024-03-01")).isFalse();
        assertThat(cache.get(fingerprint, month)).isPresent();
        assertThat(cache.get(fingerprint, catalog)).isEmpty();
    }

    @Test
    void shouldComputeOnceAndThenServeFromCache() {
        // Given
        AtomicInteger loads = new AtomicInteger();
        Callable<CacheEntry> loader = () -> {
            loads.incrementAndGet();
            return entry("k");
        };

        // When
        ResultCache.Lookup first = cache.getOrCompute("k", catalog, loader);
        ResultCache.Lookup second = cache.getOrCompute("k", catalog, loader);

        // Then
        assertThat(first.computed()).isTrue();
        assertThat(second.computed()).isFalse();
        assertThat(second.entry()).isSameAs(first.entry());
        assertThat(loads).hasValue(1);
    }

    @Test
    void shouldCollapseConcurrentComputationsOfSameFingerprint() throws Exception {
        // Given
        int callers = 8;
        AtomicInteger loads = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        List<Future<ResultCache.Lookup>> futures = new ArrayList<>();

        // When
        try {
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return cache.getOrCompute("k", catalog, () -> {
                        loads.incrementAndGet();
                        Thread.sleep(200);
                        return entry("k");
                    });
                }));
            }
            start.countDown();

            // Then
            int computed = 0;
            for (Future<ResultCache.Lookup> future : futures) {
                ResultCache.Lookup lookup = future.get(10, TimeUnit.SECONDS);
                computed += lookup.computed() ? 1 : 0;
            }
            assertThat(loads).hasValue(1);
            assertThat(computed).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void shouldPropagateFailureAndNotCacheIt() {
        // Given
        Callable<CacheEntry> failing = () -> {
            throw new RouterException(ErrorKind.BACKEND_EXECUTION_FAILED, "boom");
        };

        // When / Then
        assertThatThrownBy(() -> cache.getOrCompute("k", catalog, failing))
                .isInstanceOf(RouterException.class)
                .hasMessageContaining("boom");
        assertThat(cache.size()).isZero();
        assertThat(cache.getOrCompute("k", catalog, () -> entry("k")).computed()).isTrue();
    }

    @Test
    void shouldClearAllEntries() {
        cache.put("a", entry("a"));
        cache.put("b", entry("b"));

        cache.invalidateAll();

        assertThat(cache.size()).isZero();
    }

    private static CacheEntry entry(String fingerprint, String... partitions) {
        List<Partition> surviving = new ArrayList<>();
        for (String identity : partitions) {
            surviving.add(partition(identity));
        }
        PruningResult pruning = new PruningResult(surviving, 2, 20, 10L * surviving.size(), List.of(), 0, 0.0);
        QueryResult result = QueryResult.builder()
                .rows(List.of(Map.of("n", 1)))
                .build();
        return new CacheEntry(fingerprint, result, Instant.now(), pruning);
    }

    private static final class FakeTicker extends Ticker {
        private final AtomicLong nanos = new AtomicLong();

        void advance(long millis) {
            nanos.addAndGet(TimeUnit.MILLISECONDS.toNanos(millis));
        }

        @Override
        public long read() {
            return nanos.get();
        }
    }

    private static Partition partition(String identity) {
        Path directory = Path.of("/data", identity);
        String[] keyValue = identity.split("=");
        return new Partition(identity, directory, Map.of(keyValue[0], keyValue[1]),
                List.of(DataFile.of(directory.resolve("part-0.parquet"), 10)));
    }
}
