package org.carball.router.learning;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.extern.slf4j.Slf4j;
import org.carball.router.cost.CostEstimator;
import org.carball.router.model.cost.Backend;
import org.carball.router.model.cost.BackendCoefficients;
import org.carball.router.model.cost.CostModel;
import org.carball.router.model.telemetry.ExecutionRecord;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Recalibrates per-backend cost coefficients from observed execution times.
 *
 * <p>Records are queued without blocking and processed in batches on a single
 * background thread, either when {@code batchSize} records are waiting or on
 * the flush interval. For each backend in a batch:
 * <pre>
 *   ratio  = mean(clamp(observedMs / (estimatedCost * costUnitMillis), clampMin, clampMax))
 *   factor = 1 + smoothingWeight * (ratio - 1)
 * </pre>
 * and the backend's scan and compute coefficients are multiplied by {@code factor}
 * (never below the floor). Failures are logged and never reach query serving.
 */
@Slf4j
public class AdaptiveLearner implements TelemetrySink, AutoCloseable {

    private final CostEstimator estimator;
    private final LearnerSettings settings;
    private final BlockingQueue<ExecutionRecord> queue;
    private final ScheduledExecutorService worker;
    private final AtomicBoolean drainScheduled = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong batches = new AtomicLong();

    public AdaptiveLearner(CostEstimator estimator, LearnerSettings settings) {
        if (settings.getBatchSize() <= 0 || settings.getQueueCapacity() <= 0) {
            throw new IllegalArgumentException("Learner batch size and queue capacity must be positive");
        }
        this.estimator = estimator;
        this.settings = settings;
        this.queue = new LinkedBlockingQueue<>(settings.getQueueCapacity());
        this.worker = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("router-learner-%d")
                .setDaemon(true)
                .build());
    }

    /**
     * Starts the interval-based flush. Size-triggered batches run regardless.
     */
    public void start() {
        if (started.compareAndSet(false, true) && settings.getFlushIntervalMs() > 0) {
            worker.scheduleWithFixedDelay(this::drainSafely, settings.getFlushIntervalMs(),
                    settings.getFlushIntervalMs(), TimeUnit.MILLISECONDS);
            log.info("Adaptive learner started (batch size {}, interval {} ms)",
                    settings.getBatchSize(), settings.getFlushIntervalMs());
        }
    }

    @Override
    public void record(ExecutionRecord record) {
        if (!record.outcome().isBackendSample()) {
            return;
        }
        if (!queue.offer(record)) {
            long total = dropped.incrementAndGet();
            log.warn("Learner queue full, dropped telemetry for {} ({} dropped so far)", record.backend(), total);
            return;
        }
        if (queue.size() >= settings.getBatchSize() && drainScheduled.compareAndSet(false, true)) {
            try {
                worker.execute(this::drainSafely);
            } catch (RejectedExecutionException e) {
                drainScheduled.set(false);
                log.warn("Learner is shut down, telemetry left unprocessed: {}", e.getMessage());
            }
        }
    }

    /**
     * Processes everything queued so far and waits until it is applied.
     */
    public void flush() {
        try {
            Future<?> pending = worker.submit(this::drainSafely);
            pending.get(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while flushing learner");
        } catch (ExecutionException | TimeoutException | RejectedExecutionException e) {
            log.error("Learner flush failed", e);
        }
    }

    private void drainSafely() {
        drainScheduled.set(false);
        try {
            List<ExecutionRecord> batch = new ArrayList<>();
            queue.drainTo(batch);
            if (!batch.isEmpty()) {
                apply(batch);
            }
        } catch (RuntimeException e) {
            log.error("Adaptive learner failed to process a batch; coefficients left unchanged", e);
        }
    }

    /**
     * Applies one batch to the estimator. Visible for tests.
     */
    void apply(List<ExecutionRecord> batch) {
        Map<Backend, Double> factors = correctionFactors(batch);
        processed.addAndGet(batch.size());
        batches.incrementAndGet();
        if (factors.isEmpty()) {
            return;
        }

        CostModel updated = estimator.updateModel(model -> {
            CostModel next = model;
            for (Map.Entry<Backend, Double> entry : factors.entrySet()) {
                BackendCoefficients current = next.coefficients(entry.getKey());
                next = next.withCoefficients(entry.getKey(),
                        current.scaled(entry.getValue(), settings.getCoefficientFloor()));
            }
            return next;
        });

        factors.forEach((backend, factor) -> {
            BackendCoefficients now = updated.coefficients(backend);
            log.info("Recalibrated {} by x{}: scan={}, compute={} (model v{})", backend,
                    String.format("%.4f", factor), String.format("%.4f", now.scanCoefficient()),
                    String.format("%.4f", now.computeCoefficient()), updated.version());
        });
    }

    Map<Backend, Double> correctionFactors(List<ExecutionRecord> batch) {
        Map<Backend, double[]> sums = new EnumMap<>(Backend.class);
        for (ExecutionRecord record : batch) {
            if (!record.outcome().isBackendSample() || record.backend() == null) {
                continue;
            }
            double expectedMs = record.estimatedCost() * settings.getCostUnitMillis();
            if (expectedMs <= 0 || record.observedMs() < 0) {
                log.debug("Skipping unusable sample for {}: estimate {}, observed {} ms",
                        record.backend(), record.estimatedCost(), record.observedMs());
                continue;
            }
            double ratio = clamp(record.observedMs() / expectedMs);
            double[] acc = sums.computeIfAbsent(record.backend(), b -> new double[2]);
            acc[0] += ratio;
            acc[1]++;
        }

        Map<Backend, Double> factors = new EnumMap<>(Backend.class);
        sums.forEach((backend, acc) -> {
            double meanRatio = acc[0] / acc[1];
            factors.put(backend, 1.0 + settings.getSmoothingWeight() * (meanRatio - 1.0));
        });
        return factors;
    }

    private double clamp(double ratio) {
        return Math.max(settings.getClampMin(), Math.min(settings.getClampMax(), ratio));
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public long getProcessedCount() {
        return processed.get();
    }

    public long getBatchCount() {
        return batches.get();
    }

    public int pendingCount() {
        return queue.size();
    }

    @Override
    public void close() {
        if (worker.isShutdown()) {
            return;
        }
        flush();
        worker.shutdown();
        try {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            worker.shutdownNow();
        }
    }
}
