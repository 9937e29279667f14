package org.carball.router.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.carball.router.model.cost.Backend;
import org.carball.router.model.cost.BackendCoefficients;
import org.carball.router.model.cost.CostModel;

import java.util.EnumMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@Slf4j
public class RouterConfig {

    // Dataset
    @Builder.Default
    private String dataPath = "./data";

    @Builder.Default
    private String dataFileSuffix = ".parquet";

    // Parallelism
    @Builder.Default
    private int availableCores = Runtime.getRuntime().availableProcessors();

    @Builder.Default
    private int clusterWorkers = 16;

    // Per-backend coefficients
    @Builder.Default
    private double duckdbScanCoefficient = Backend.DUCKDB.getDefaultScanCoefficient();

    @Builder.Default
    private double duckdbComputeCoefficient = Backend.DUCKDB.getDefaultComputeCoefficient();

    @Builder.Default
    private double duckdbFixedOverhead = Backend.DUCKDB.getDefaultFixedOverhead();

    @Builder.Default
    private double polarsScanCoefficient = Backend.POLARS.getDefaultScanCoefficient();

    @Builder.Default
    private double polarsComputeCoefficient = Backend.POLARS.getDefaultComputeCoefficient();

    @Builder.Default
    private double polarsFixedOverhead = Backend.POLARS.getDefaultFixedOverhead();

    @Builder.Default
    private double sparkScanCoefficient = Backend.SPARK.getDefaultScanCoefficient();

    @Builder.Default
    private double sparkComputeCoefficient = Backend.SPARK.getDefaultComputeCoefficient();

    @Builder.Default
    private double sparkFixedOverhead = Backend.SPARK.getDefaultFixedOverhead();

    // Query-shape weights
    @Builder.Default
    private double joinCoefficient = 2.0;

    @Builder.Default
    private double aggregationCoefficient = 0.5;

    @Builder.Default
    private double windowCoefficient = 1.0;

    // Row estimation
    @Builder.Default
    private int averageRowWidthBytes = 100;

    @Builder.Default
    private double aggregationReductionFactor = 0.1;

    // Cache and execution
    @Builder.Default
    private int cacheCapacity = 256;

    // 0 keeps entries until evicted or invalidated
    @Builder.Default
    private long cacheTtlMs = 0;

    @Builder.Default
    private long executionTimeoutMs = 300_000;

    // Adaptive learning
    @Builder.Default
    private int learnerBatchSize = 20;

    @Builder.Default
    private long learnerFlushIntervalMs = 60_000;

    @Builder.Default
    private double learnerSmoothingWeight = 0.1;

    @Builder.Default
    private double learnerClampMin = 0.5;

    @Builder.Default
    private double learnerClampMax = 2.0;

    @Builder.Default
    private double coefficientFloor = 1e-6;

    @Builder.Default
    private double costUnitMillis = 1000.0;

    @Builder.Default
    private int learnerQueueCapacity = 10_000;

    @Builder.Default
    private int historyRetention = 1_000;

    // Profile information
    @Builder.Default
    private String profileName = "default";

    @Builder.Default
    private String profileDescription = "Default balanced routing";

    /**
     * Creates defaults suitable for a single workstation next to a small cluster.
     */
    public static RouterConfig defaults() {
        return RouterConfig.builder().build();
    }

    /**
     * Rejects settings the router cannot run with and logs warnings for
     * settings that are legal but probably unintended.
     */
    public void validate() {
        if (cacheCapacity <= 0) {
            throw new IllegalArgumentException("Cache capacity must be positive: " + cacheCapacity);
        }
        if (cacheTtlMs < 0) {
            throw new IllegalArgumentException("Cache TTL must not be negative: " + cacheTtlMs);
        }
        if (executionTimeoutMs <= 0) {
            throw new IllegalArgumentException("Execution timeout must be positive: " + executionTimeoutMs);
        }
        if (learnerBatchSize <= 0) {
            throw new IllegalArgumentException("Learner batch size must be positive: " + learnerBatchSize);
        }
        if (learnerQueueCapacity <= 0) {
            throw new IllegalArgumentException("Learner queue capacity must be positive: " + learnerQueueCapacity);
        }
        if (learnerClampMin <= 0 || learnerClampMin > learnerClampMax) {
            throw new IllegalArgumentException(String.format(
                    "Learner clamp bounds must satisfy 0 < min <= max, got [%s, %s]",
                    learnerClampMin, learnerClampMax));
        }
        if (learnerSmoothingWeight <= 0 || learnerSmoothingWeight > 1) {
            throw new IllegalArgumentException("Learner smoothing weight must be in (0, 1]: " + learnerSmoothingWeight);
        }
        if (coefficientFloor <= 0) {
            throw new IllegalArgumentException("Coefficient floor must be positive: " + coefficientFloor);
        }
        if (costUnitMillis <= 0) {
            throw new IllegalArgumentException("Cost unit must be positive: " + costUnitMillis);
        }
        if (averageRowWidthBytes <= 0) {
            throw new IllegalArgumentException("Average row width must be positive: " + averageRowWidthBytes);
        }
        // Building the cost model validates the per-backend coefficients
        initialCostModel();

        if (availableCores <= 0) {
            log.warn("Available cores ({}) should be positive, treating as 1", availableCores);
        }
        if (clusterWorkers <= 0) {
            log.warn("Cluster workers ({}) should be positive, treating as 1", clusterWorkers);
        }
        if (aggregationReductionFactor <= 0 || aggregationReductionFactor > 1) {
            log.warn("Aggregation reduction factor ({}) is usually in (0, 1]", aggregationReductionFactor);
        }
        if (sparkFixedOverhead < polarsFixedOverhead || polarsFixedOverhead < duckdbFixedOverhead) {
            log.warn("Fixed overheads are not ordered duckdb <= polars <= spark ({} / {} / {})",
                    duckdbFixedOverhead, polarsFixedOverhead, sparkFixedOverhead);
        }
        if (learnerSmoothingWeight > 0.5) {
            log.warn("Learner smoothing weight ({}) above 0.5 lets single outliers move routing", learnerSmoothingWeight);
        }

        log.debug("Using config - cores: {}, workers: {}, cache: {}, profile: {}",
                availableCores, clusterWorkers, cacheCapacity, profileName);
    }

    public BackendCoefficients coefficientsFor(Backend backend) {
        switch (backend) {
            case DUCKDB:
                return new BackendCoefficients(duckdbScanCoefficient, duckdbComputeCoefficient, duckdbFixedOverhead);
            case POLARS:
                return new BackendCoefficients(polarsScanCoefficient, polarsComputeCoefficient, polarsFixedOverhead);
            case SPARK:
                return new BackendCoefficients(sparkScanCoefficient, sparkComputeCoefficient, sparkFixedOverhead);
            default:
                throw new IllegalArgumentException("No coefficients configured for " + backend);
        }
    }

    /**
     * Cost model the estimator starts from before any learning has happened.
     */
    public CostModel initialCostModel() {
        Map<Backend, BackendCoefficients> backends = new EnumMap<>(Backend.class);
        for (Backend backend : Backend.values()) {
            backends.put(backend, coefficientsFor(backend));
        }
        return new CostModel(0, backends, joinCoefficient, aggregationCoefficient, windowCoefficient);
    }

    /**
     * Returns a description of the current configuration for user feedback.
     */
    public String getConfigurationSummary() {
        return String.format("Profile: %s | Cores: %d | Workers: %d | Cache: %d | Timeout: %dms | Overheads: %.2f/%.2f/%.2f",
                profileName, availableCores, clusterWorkers, cacheCapacity, executionTimeoutMs,
                duckdbFixedOverhead, polarsFixedOverhead, sparkFixedOverhead);
    }
}
