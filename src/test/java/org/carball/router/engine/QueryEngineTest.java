package org.carball.router.engine;

import org.carball.router.config.RouterConfig;
import org.carball.router.exception.BackendExecutionException;
import org.carball.router.exception.ErrorKind;
import org.carball.router.exception.RouterException;
import org.carball.router.model.cost.Backend;
import org.carball.router.model.query.NormalizedQuery;
import org.carball.router.model.query.QueryResult;
import org.carball.router.model.telemetry.ExecutionOutcome;
import org.carball.router.model.telemetry.ExecutionRecord;
import org.carball.router.parser.SqlQueryParser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.assertj.core.api.Assertions.within;

public class QueryEngineTest {

    private static final String TWO_DAY_QUERY = "SELECT count(*) FROM events "
            + "WHERE event_date >= '2024-11-02' AND event_date <= '2024-11-03'";

    @TempDir
    Path dataRoot;

    private StubBackend duckdb;
    private StubBackend polars;
    private QueryEngine engine;

    @BeforeEach
    void setUp() throws IOException {
        for (int day = 1; day <= 5; day++) {
            writeFile("event_date=2024-11-0" + day + "/part-0.parquet", 100);
        }
        duckdb = new StubBackend(Backend.DUCKDB);
        polars = new StubBackend(Backend.POLARS);
        engine = new QueryEngine(config(dataRoot), new SqlQueryParser(), List.of(duckdb, polars));
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void shouldServeRepeatedQueryFromCache() {
        // When
        QueryResult first = engine.execute(TWO_DAY_QUERY);
        QueryResult second = engine.execute(TWO_DAY_QUERY);

        // Then
        assertThat(first.isFromCache()).isFalse();
        assertThat(first.getBackendUsed()).isEqualTo(Backend.DUCKDB);
        assertThat(first.getPartitionsScanned()).isEqualTo(2);
        assertThat(first.getTotalPartitions()).isEqualTo(5);
        assertThat(second.isFromCache()).isTrue();
        assertThat(second.getRows()).isEqualTo(first.getRows());
        assertThat(second.getRoutingDecision().fingerprint()).isEqualTo(first.getRoutingDecision().fingerprint());
        assertThat(duckdb.calls.get()).isEqualTo(1);

        assertThat(engine.recentExecutions(10))
                .extracting(ExecutionRecord::outcome)
                .containsExactly(ExecutionOutcome.CACHE_HIT, ExecutionOutcome.EXECUTED);
        assertThat(engine.recentExecutions(1).get(0).backend()).isEqualTo(Backend.DUCKDB);
        assertThat(engine.cacheStats().hits()).isEqualTo(1);
    }

    @Test
    void shouldHandOnlyPrunedFilesToBackend() {
        // When
        engine.execute(TWO_DAY_QUERY);

        // Then
        assertThat(duckdb.filesSeen).hasSize(1);
        assertThat(duckdb.filesSeen.get(0))
                .hasSize(2)
                .allSatisfy(file -> assertThat(file.toString()).contains("event_date=2024-11-0"))
                .noneSatisfy(file -> assertThat(file.toString()).contains("2024-11-01"));
    }

    @Test
    void shouldScanEveryPartitionForSelfJoin() {
        // When
        engine.execute("SELECT a.id FROM events a JOIN events b ON a.id = b.id WHERE a.event_date = '2024-11-01'");

        // Then
        assertThat(duckdb.filesSeen.get(0)).hasSize(5);
    }

    @Test
    void shouldScanEveryPartitionWhenSubqueryReadsSameTable() {
        // When
        QueryResult result = engine.execute("SELECT id FROM events WHERE event_date = '2024-11-01' "
                + "AND id IN (SELECT id FROM events WHERE event_date = '2024-11-04')");

        // Then
        assertThat(duckdb.filesSeen.get(0)).hasSize(5)
                .anySatisfy(file -> assertThat(file.toString()).contains("2024-11-04"));
        assertThat(result.getPartitionsScanned()).isEqualTo(5);
    }

    @Test
    void shouldMissCacheAfterCatalogChanges() throws IOException {
        // Given
        QueryResult before = engine.execute(TWO_DAY_QUERY);
        writeFile("event_date=2024-11-06/part-0.parquet", 100);

        // When
        engine.refreshCatalog();
        QueryResult after = engine.execute(TWO_DAY_QUERY);

        // Then
        assertThat(after.isFromCache()).isFalse();
        assertThat(after.getTotalPartitions()).isEqualTo(6);
        assertThat(after.getRoutingDecision().catalogVersion())
                .isNotEqualTo(before.getRoutingDecision().catalogVersion());
        assertThat(duckdb.calls.get()).isEqualTo(2);
    }

    @Test
    void shouldBypassCacheWhenAsked() {
        // Given
        QueryRequest request = QueryRequest.builder().sql(TWO_DAY_QUERY).bypassCache(true).build();

        // When
        engine.execute(request);
        QueryResult second = engine.execute(request);

        // Then
        assertThat(second.isFromCache()).isFalse();
        assertThat(duckdb.calls.get()).isEqualTo(2);
        assertThat(engine.cacheStats().size()).isZero();
    }

    @Test
    void shouldFallBackToNextCheapestBackend() {
        // Given
        duckdb.failing = true;

        // When
        QueryResult result = engine.execute(TWO_DAY_QUERY);

        // Then
        assertThat(result.getBackendUsed()).isEqualTo(Backend.POLARS);
        assertThat(result.getWarnings()).anyMatch(w -> w.startsWith("BACKEND_EXECUTION_FAILED"));
        assertThat(duckdb.calls.get()).isEqualTo(1);
        assertThat(polars.calls.get()).isEqualTo(1);

        ExecutionRecord record = engine.recentExecutions(1).get(0);
        assertThat(record.outcome()).isEqualTo(ExecutionOutcome.EXECUTED);
        assertThat(record.backend()).isEqualTo(Backend.POLARS);
        assertThat(record.attempts()).isEqualTo(2);
        assertThat(engine.getHistory().size()).isEqualTo(1);
    }

    @Test
    void shouldFailAfterFallbackAlsoFails() {
        // Given
        duckdb.failing = true;
        polars.failing = true;

        // When
        RouterException error = catchThrowableOfType(() -> engine.execute(TWO_DAY_QUERY), RouterException.class);

        // Then
        assertThat(error.getKind()).isEqualTo(ErrorKind.BACKEND_EXECUTION_FAILED);
        assertThat(engine.recentExecutions(10)).hasSize(1);
        ExecutionRecord record = engine.recentExecutions(1).get(0);
        assertThat(record.outcome()).isEqualTo(ExecutionOutcome.FAILED);
        assertThat(record.attempts()).isEqualTo(2);
        assertThat(engine.cacheStats().size()).isZero();
    }

    @Test
    void shouldFallBackWhenBackendReturnsNoResult() {
        // Given
        duckdb.returnsNull = true;

        // When
        QueryResult result = engine.execute(TWO_DAY_QUERY);

        // Then
        assertThat(result.getBackendUsed()).isEqualTo(Backend.POLARS);
        assertThat(result.getWarnings()).anyMatch(w -> w.startsWith("BACKEND_EXECUTION_FAILED"));
        assertThat(engine.recentExecutions(10)).hasSize(1);
        ExecutionRecord record = engine.recentExecutions(1).get(0);
        assertThat(record.outcome()).isEqualTo(ExecutionOutcome.EXECUTED);
        assertThat(record.backend()).isEqualTo(Backend.POLARS);
        assertThat(record.attempts()).isEqualTo(2);
    }

    @Test
    void shouldRecordFailureWhenPinnedBackendReturnsNoResult() {
        // Given
        polars.returnsNull = true;
        QueryRequest request = QueryRequest.builder().sql(TWO_DAY_QUERY).pinnedBackend(Backend.POLARS).build();

        // When
        RouterException error = catchThrowableOfType(() -> engine.execute(request), RouterException.class);

        // Then
        assertThat(error.getKind()).isEqualTo(ErrorKind.BACKEND_EXECUTION_FAILED);
        assertThat(error.getMessage()).contains("returned no result");
        assertThat(engine.recentExecutions(10)).singleElement()
                .extracting(ExecutionRecord::outcome)
                .isEqualTo(ExecutionOutcome.FAILED);
        assertThat(engine.cacheStats().size()).isZero();
    }

    @Test
    void shouldNotFallBackForPinnedBackend() {
        // Given
        polars.failing = true;
        QueryRequest request = QueryRequest.builder().sql(TWO_DAY_QUERY).pinnedBackend(Backend.POLARS).build();

        // When
        RouterException error = catchThrowableOfType(() -> engine.execute(request), RouterException.class);

        // Then
        assertThat(error.getKind()).isEqualTo(ErrorKind.BACKEND_EXECUTION_FAILED);
        assertThat(duckdb.calls.get()).isZero();
        assertThat(engine.recentExecutions(1).get(0).attempts()).isEqualTo(1);
    }

    @Test
    void shouldHonorPinnedBackendOverCost() {
        QueryRequest request = QueryRequest.builder().sql(TWO_DAY_QUERY).pinnedBackend(Backend.POLARS).build();

        QueryResult result = engine.execute(request);

        assertThat(result.getBackendUsed()).isEqualTo(Backend.POLARS);
        assertThat(result.getRoutingDecision().pinned()).isTrue();
        assertThat(duckdb.calls.get()).isZero();
    }

    @Test
    void shouldRejectPinnedBackendWithoutExecutor() {
        QueryRequest request = QueryRequest.builder().sql(TWO_DAY_QUERY).pinnedBackend(Backend.SPARK).build();

        RouterException error = catchThrowableOfType(() -> engine.execute(request), RouterException.class);

        assertThat(error.getKind()).isEqualTo(ErrorKind.NO_BACKEND_AVAILABLE);
        assertThat(engine.recentExecutions(10)).isEmpty();
    }

    @Test
    void shouldTimeOutWithoutRetrying() {
        // Given
        duckdb.delayMs = 5_000;
        QueryRequest request = QueryRequest.builder().sql(TWO_DAY_QUERY).timeoutMs(100L).build();

        // When
        RouterException error = catchThrowableOfType(() -> engine.execute(request), RouterException.class);

        // Then
        assertThat(error.getKind()).isEqualTo(ErrorKind.BACKEND_TIMEOUT);
        assertThat(polars.calls.get()).isZero();
        ExecutionRecord record = engine.recentExecutions(1).get(0);
        assertThat(record.outcome()).isEqualTo(ExecutionOutcome.TIMED_OUT);
        assertThat(record.observedMs()).isEqualTo(100.0);
        assertThat(record.backend()).isEqualTo(Backend.DUCKDB);
        assertThat(engine.cacheStats().size()).isZero();
    }

    @Test
    void shouldExecuteConcurrentIdenticalQueriesOnce() throws Exception {
        // Given
        duckdb.delayMs = 300;
        int callers = 6;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<QueryResult>> futures = new ArrayList<>();

        // When
        for (int i = 0; i < callers; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                return engine.execute(TWO_DAY_QUERY);
            }));
        }
        start.countDown();
        List<QueryResult> results = new ArrayList<>();
        for (Future<QueryResult> future : futures) {
            results.add(future.get(10, TimeUnit.SECONDS));
        }
        pool.shutdown();

        // Then
        assertThat(duckdb.calls.get()).isEqualTo(1);
        assertThat(results).filteredOn(r -> !r.isFromCache()).hasSize(1);
        Map<ExecutionOutcome, Long> outcomes = engine.getHistory().outcomeCounts();
        assertThat(outcomes).containsEntry(ExecutionOutcome.EXECUTED, 1L)
                .containsEntry(ExecutionOutcome.CACHE_HIT, (long) callers - 1);
    }

    @Test
    void shouldRecomputeWhenSharedComputationIsAbandoned() throws Exception {
        // Given - a first caller is stuck on a slow backend
        duckdb.delayMs = 500;
        ExecutorService pool = Executors.newFixedThreadPool(2);
        Future<QueryResult> first = pool.submit(() -> engine.execute(TWO_DAY_QUERY));
        awaitCalls(duckdb, 1);
        Future<QueryResult> second = pool.submit(() -> engine.execute(TWO_DAY_QUERY));
        Thread.sleep(100);

        // When - the first caller gives up while the second waits on its computation
        first.cancel(true);
        QueryResult result = second.get(10, TimeUnit.SECONDS);
        pool.shutdownNow();

        // Then
        assertThat(result.isFromCache()).isFalse();
        assertThat(result.getBackendUsed()).isEqualTo(Backend.DUCKDB);
        assertThat(duckdb.calls.get()).isEqualTo(2);
        Map<ExecutionOutcome, Long> outcomes = engine.getHistory().outcomeCounts();
        assertThat(outcomes).containsEntry(ExecutionOutcome.EXECUTED, 1L)
                .containsEntry(ExecutionOutcome.FAILED, 1L);
    }

    @Test
    void shouldStopCancelledQueryWithoutRecording() {
        // Given
        QueryRequest request = QueryRequest.builder().sql(TWO_DAY_QUERY).build();
        request.getCancellationToken().cancel();

        // When
        RouterException error = catchThrowableOfType(() -> engine.execute(request), RouterException.class);

        // Then
        assertThat(error.getKind()).isEqualTo(ErrorKind.QUERY_CANCELLED);
        assertThat(duckdb.calls.get()).isZero();
        assertThat(engine.recentExecutions(10)).isEmpty();
    }

    @Test
    void shouldRejectNonSelectStatements() {
        RouterException error = catchThrowableOfType(
                () -> engine.execute("DELETE FROM events WHERE event_date = '2024-11-01'"), RouterException.class);

        assertThat(error.getKind()).isEqualTo(ErrorKind.INVALID_QUERY);
        assertThat(engine.recentExecutions(10)).isEmpty();
    }

    @Test
    void shouldReportMissingDataset() {
        // Given
        QueryEngine orphan = new QueryEngine(config(dataRoot.resolve("missing")), new SqlQueryParser(),
                List.of(new StubBackend(Backend.DUCKDB)));

        // When
        RouterException error = catchThrowableOfType(() -> orphan.execute(TWO_DAY_QUERY), RouterException.class);
        orphan.close();

        // Then
        assertThat(error.getKind()).isEqualTo(ErrorKind.CATALOG_UNAVAILABLE);
    }

    @Test
    void shouldExplainWithoutExecutingOrCaching() {
        // When
        RoutingDecision decision = engine.explain(QueryRequest.of(TWO_DAY_QUERY));

        // Then
        assertThat(decision.selected()).isEqualTo(Backend.DUCKDB);
        assertThat(decision.ranking()).containsExactly(Backend.DUCKDB, Backend.POLARS);
        assertThat(decision.fallback()).contains(Backend.POLARS);
        assertThat(decision.pruningResult().partitionsScanned()).isEqualTo(2);
        assertThat(decision.fingerprint()).hasSize(64);
        assertThat(duckdb.calls.get()).isZero();
        assertThat(engine.cacheStats().size()).isZero();
        assertThat(engine.recentExecutions(10)).isEmpty();
    }

    @Test
    void shouldFeedExecutionsToLearner() {
        // Given - a near-instant run reads as faster than estimated
        engine.execute(TWO_DAY_QUERY);
        engine.execute(TWO_DAY_QUERY);

        // When
        engine.getLearner().flush();

        // Then
        assertThat(engine.getLearner().getProcessedCount()).isEqualTo(1);
        assertThat(engine.costModel().version()).isEqualTo(1);
        assertThat(engine.costModel().coefficients(Backend.DUCKDB).scanCoefficient()).isCloseTo(0.95, within(1e-9));
        assertThat(engine.costModel().coefficients(Backend.POLARS).scanCoefficient()).isEqualTo(1.0);
    }

    @Test
    void shouldAcceptPreNormalizedQueries() {
        // Given
        NormalizedQuery query = new SqlQueryParser().parse(TWO_DAY_QUERY);

        // When
        QueryResult result = engine.execute(QueryRequest.of(query));

        // Then
        assertThat(result.getPartitionsScanned()).isEqualTo(2);
    }

    private static RouterConfig config(Path root) {
        return RouterConfig.builder()
                .dataPath(root.toString())
                .availableCores(4)
                .clusterWorkers(16)
                .learnerFlushIntervalMs(0)
                .build();
    }

    private static void awaitCalls(StubBackend backend, int expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (backend.calls.get() < expected && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(backend.calls.get()).isEqualTo(expected);
    }

    private void writeFile(String relative, int bytes) throws IOException {
        Path file = dataRoot.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.write(file, new byte[bytes]);
    }

    private static final class StubBackend implements BackendExecutor {
        private final Backend backend;
        private final AtomicInteger calls = new AtomicInteger();
        private final List<List<Path>> filesSeen = new CopyOnWriteArrayList<>();
        private volatile boolean failing;
        private volatile long delayMs;
        private volatile boolean returnsNull;

        StubBackend(Backend backend) {
            this.backend = backend;
        }

        @Override
        public Backend backend() {
            return backend;
        }

        @Override
        public QueryResult execute(NormalizedQuery query, List<Path> prunedFiles) throws BackendExecutionException {
            calls.incrementAndGet();
            filesSeen.add(prunedFiles);
            if (delayMs > 0) {
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new BackendExecutionException(backend + " interrupted", e);
                }
            }
            if (failing) {
                throw new BackendExecutionException(backend + " unavailable");
            }
            if (returnsNull) {
                return null;
            }
            return QueryResult.builder()
                    .rows(List.of(Map.of("count", (Object) prunedFiles.size())))
                    .rowsProcessed(prunedFiles.size())
                    .build();
        }
    }
}
