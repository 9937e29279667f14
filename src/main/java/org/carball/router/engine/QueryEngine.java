package org.carball.router.engine;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.extern.slf4j.Slf4j;
import org.carball.router.cache.CacheEntry;
import org.carball.router.cache.ResultCache;
import org.carball.router.cache.ResultCacheStats;
import org.carball.router.catalog.CatalogSnapshot;
import org.carball.router.config.RouterConfig;
import org.carball.router.exception.BackendExecutionException;
import org.carball.router.exception.ErrorKind;
import org.carball.router.exception.RouterException;
import org.carball.router.learning.AdaptiveLearner;
import org.carball.router.learning.ExecutionHistory;
import org.carball.router.learning.LearnerSettings;
import org.carball.router.model.cost.Backend;
import org.carball.router.model.cost.CostModel;
import org.carball.router.model.query.QueryResult;
import org.carball.router.model.telemetry.ExecutionOutcome;
import org.carball.router.model.telemetry.ExecutionRecord;
import org.carball.router.parser.QueryParser;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Serves queries end to end: plan the route, answer from cache when possible,
 * otherwise execute on the chosen backend (with one fallback), store the
 * result and report exactly one {@link ExecutionRecord} per finished query.
 */
@Slf4j
public class QueryEngine implements AutoCloseable {

    private final RouterConfig config;
    private final RoutingPlanner planner;
    private final Map<Backend, BackendExecutor> executors;
    private final ResultCache cache;
    private final AdaptiveLearner learner;
    private final ExecutionHistory history;
    private final ExecutorService executionPool;

    public QueryEngine(RouterConfig config, QueryParser parser, Collection<BackendExecutor> backends) {
        config.validate();
        this.config = config;
        this.executors = new EnumMap<>(Backend.class);
        for (BackendExecutor executor : backends) {
            if (executors.put(executor.backend(), executor) != null) {
                throw new IllegalArgumentException("Two executors registered for " + executor.backend());
            }
        }
        this.planner = RoutingPlanner.fromConfig(config, parser, executors.keySet());
        this.cache = new ResultCache(config.getCacheCapacity(), config.getCacheTtlMs());
        this.learner = new AdaptiveLearner(planner.getCostEstimator(), LearnerSettings.from(config));
        this.history = new ExecutionHistory(config.getHistoryRetention());
        this.executionPool = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                .setNameFormat("router-exec-%d")
                .setDaemon(true)
                .build());
        learner.start();

        log.info("Query engine ready with backends {} ({})", executors.keySet(), config.getProfileName());
    }

    public QueryResult execute(QueryRequest request) {
        RoutingPlan plan = planner.plan(request);
        RoutingDecision decision = plan.decision();
        CancellationToken token = request.getCancellationToken();
        long timeoutMs = request.getTimeoutMs() != null ? request.getTimeoutMs() : config.getExecutionTimeoutMs();

        if (request.isBypassCache()) {
            AtomicReference<ExecutionRecord> outcome = new AtomicReference<>();
            try {
                QueryResult result = executeWithFallback(plan, timeoutMs, token, outcome);
                log.debug("Query state: {}", QueryState.DONE);
                return result;
            } finally {
                emit(outcome.get());
            }
        }

        token.throwIfCancelled(QueryState.CACHE_CHECK);
        log.debug("Query state: {}", QueryState.CACHE_CHECK);
        long lookupStart = System.nanoTime();
        AtomicReference<ExecutionRecord> outcome = new AtomicReference<>();
        try {
            ResultCache.Lookup lookup = lookupShared(plan, timeoutMs, token, outcome);
            if (lookup.computed()) {
                log.debug("Query state: {}", QueryState.DONE);
                return lookup.entry().result();
            }

            double retrievalMs = elapsedMs(lookupStart);
            log.debug("Query state: {}", QueryState.CACHE_HIT);
            log.debug("Cache hit for {} in {} ms", shortId(decision.fingerprint()), String.format("%.3f", retrievalMs));
            outcome.set(record(decision, decision.selected(), ExecutionOutcome.CACHE_HIT, retrievalMs, 0));

            QueryResult cached = lookup.entry().result();
            return cached.toBuilder()
                    .fromCache(true)
                    .executionTimeMs(retrievalMs)
                    .routingDecision(decision)
                    .warnings(new ArrayList<>(cached.getWarnings()))
                    .build();
        } catch (RuntimeException e) {
            if (outcome.get() == null && !isCancellation(e)) {
                // shared the failure of a concurrent identical query
                outcome.set(record(decision, decision.selected(), ExecutionOutcome.FAILED, elapsedMs(lookupStart), 0));
            }
            throw e;
        } finally {
            emit(outcome.get());
        }
    }

    /**
     * Cache lookup that collapses identical in-flight queries. A caller that was
     * not itself cancelled looks up again when the computation it waited on was
     * cancelled by its own caller.
     */
    private ResultCache.Lookup lookupShared(RoutingPlan plan, long timeoutMs, CancellationToken token,
                                            AtomicReference<ExecutionRecord> outcome) {
        RoutingDecision decision = plan.decision();
        while (true) {
            try {
                return cache.getOrCompute(decision.fingerprint(), plan.catalog(), () -> {
                    QueryResult result = executeWithFallback(plan, timeoutMs, token, outcome);
                    log.debug("Query state: {}", QueryState.RESULT_STORED);
                    return new CacheEntry(decision.fingerprint(), result, Instant.now(), decision.pruningResult());
                });
            } catch (RouterException e) {
                if (!isCancellation(e) || outcome.get() != null || token.isCancelled()) {
                    throw e;
                }
                log.debug("Computation of {} was cancelled by another caller, looking up again",
                        shortId(decision.fingerprint()));
            }
        }
    }

    private static boolean isCancellation(RuntimeException e) {
        return e instanceof RouterException routerException && routerException.getKind() == ErrorKind.QUERY_CANCELLED;
    }

    public QueryResult execute(String sql) {
        return execute(QueryRequest.of(sql));
    }

    /**
     * Routing decision for a query without executing it or consulting the cache.
     */
    public RoutingDecision explain(QueryRequest request) {
        return planner.plan(request).decision();
    }

    private QueryResult executeWithFallback(RoutingPlan plan, long timeoutMs, CancellationToken token,
                                            AtomicReference<ExecutionRecord> outcome) {
        RoutingDecision decision = plan.decision();
        token.throwIfCancelled(QueryState.EXECUTING);

        List<Backend> attempts = new ArrayList<>();
        attempts.add(decision.selected());
        decision.fallback().ifPresent(attempts::add);

        List<String> warnings = new ArrayList<>(decision.warnings());
        BackendExecutionException lastFailure = null;
        for (int attempt = 1; attempt <= attempts.size(); attempt++) {
            Backend backend = attempts.get(attempt - 1);
            BackendExecutor executor = executors.get(backend);
            log.debug("Query state: {} on {} (attempt {})", QueryState.EXECUTING, backend, attempt);

            long start = System.nanoTime();
            Future<QueryResult> future = executionPool.submit(() -> {
                QueryResult result = executor.execute(plan.query(), decision.pruningResult().prunedFiles());
                if (result == null) {
                    throw new BackendExecutionException(backend + " returned no result");
                }
                return result;
            });
            try {
                QueryResult result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
                double elapsed = elapsedMs(start);
                outcome.set(record(decision, backend, ExecutionOutcome.EXECUTED, elapsed, attempt));
                log.info("Executed on {} in {} ms", backend, String.format("%.1f", elapsed));
                return complete(result, backend, elapsed, decision, warnings);
            } catch (TimeoutException e) {
                future.cancel(true);
                outcome.set(record(decision, backend, ExecutionOutcome.TIMED_OUT, timeoutMs, attempt));
                log.warn("{} did not finish within {} ms; not retrying", backend, timeoutMs);
                throw new RouterException(ErrorKind.BACKEND_TIMEOUT,
                        backend + " did not finish within " + timeoutMs + " ms");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                outcome.set(record(decision, backend, ExecutionOutcome.FAILED, elapsedMs(start), attempt));
                throw new RouterException(ErrorKind.QUERY_CANCELLED, "Interrupted while waiting for " + backend, e);
            } catch (ExecutionException e) {
                lastFailure = asBackendFailure(backend, e.getCause());
                if (attempt < attempts.size()) {
                    log.warn("{} failed ({}), retrying on {}", backend, lastFailure.getMessage(), attempts.get(attempt));
                    warnings.add(ErrorKind.BACKEND_EXECUTION_FAILED + ": " + backend + " failed, answered by "
                            + attempts.get(attempt));
                } else {
                    outcome.set(record(decision, backend, ExecutionOutcome.FAILED, elapsedMs(start), attempt));
                }
            }
        }

        log.error("Query failed on {}: {}", attempts, lastFailure.getMessage());
        throw new RouterException(ErrorKind.BACKEND_EXECUTION_FAILED,
                "Execution failed on " + attempts + ": " + lastFailure.getMessage(), lastFailure);
    }

    private static BackendExecutionException asBackendFailure(Backend backend, Throwable cause) {
        if (cause instanceof BackendExecutionException failure) {
            return failure;
        }
        return new BackendExecutionException(backend + " raised " + cause, cause);
    }

    private static QueryResult complete(QueryResult result, Backend backend, double elapsedMs,
                                        RoutingDecision decision, List<String> warnings) {
        List<String> allWarnings = new ArrayList<>(warnings);
        if (result.getWarnings() != null) {
            allWarnings.addAll(result.getWarnings());
        }
        return result.toBuilder()
                .backendUsed(backend)
                .executionTimeMs(elapsedMs)
                .partitionsScanned(decision.pruningResult().partitionsScanned())
                .totalPartitions(decision.pruningResult().totalPartitions())
                .fromCache(false)
                .pruningResult(decision.pruningResult())
                .routingDecision(decision)
                .warnings(allWarnings)
                .build();
    }

    private static ExecutionRecord record(RoutingDecision decision, Backend backend, ExecutionOutcome outcome,
                                          double observedMs, int attempts) {
        return new ExecutionRecord(decision.fingerprint(), backend, outcome, decision.estimatedCost(backend),
                observedMs, Instant.now(), attempts);
    }

    private void emit(ExecutionRecord record) {
        if (record == null) {
            return;
        }
        history.record(record);
        try {
            learner.record(record);
        } catch (RuntimeException e) {
            log.error("Telemetry delivery failed for {}", shortId(record.fingerprint()), e);
        }
    }

    public CatalogSnapshot refreshCatalog() {
        return planner.refreshCatalog();
    }

    public ResultCacheStats cacheStats() {
        return cache.stats();
    }

    public void clearCache() {
        cache.invalidateAll();
    }

    public List<ExecutionRecord> recentExecutions(int limit) {
        return history.recent(limit);
    }

    public CostModel costModel() {
        return planner.getCostEstimator().currentModel();
    }

    public AdaptiveLearner getLearner() {
        return learner;
    }

    public ExecutionHistory getHistory() {
        return history;
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    private static String shortId(String fingerprint) {
        return fingerprint.length() > 12 ? fingerprint.substring(0, 12) : fingerprint;
    }

    @Override
    public void close() {
        learner.close();
        executionPool.shutdownNow();
        log.info("Query engine closed");
    }
}
