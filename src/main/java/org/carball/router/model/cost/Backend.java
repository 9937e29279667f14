package org.carball.router.model.cost;

/**
 * Execution engines the router can send a query to. Declaration order is the
 * tie-break preference: cheaper to operate first.
 */
public enum Backend {
    DUCKDB("DuckDB", "Embedded single-node engine", Parallelism.SINGLE_NODE,
            1.0, 1.0, 0.05),
    POLARS("Polars", "In-process multi-core dataframe engine", Parallelism.LOCAL_CORES,
            1.0, 0.5, 1.0),
    SPARK("Spark", "Distributed cluster engine", Parallelism.CLUSTER,
            1.0, 0.25, 20.0);

    /**
     * How a backend spreads a scan.
     */
    public enum Parallelism {
        SINGLE_NODE,
        LOCAL_CORES,
        CLUSTER
    }

    private final String displayName;
    private final String description;
    private final Parallelism parallelism;
    private final double defaultScanCoefficient;
    private final double defaultComputeCoefficient;
    private final double defaultFixedOverhead;

    Backend(String displayName, String description, Parallelism parallelism,
            double defaultScanCoefficient, double defaultComputeCoefficient, double defaultFixedOverhead) {
        this.displayName = displayName;
        this.description = description;
        this.parallelism = parallelism;
        this.defaultScanCoefficient = defaultScanCoefficient;
        this.defaultComputeCoefficient = defaultComputeCoefficient;
        this.defaultFixedOverhead = defaultFixedOverhead;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    public Parallelism getParallelism() {
        return parallelism;
    }

    public double getDefaultScanCoefficient() {
        return defaultScanCoefficient;
    }

    public double getDefaultComputeCoefficient() {
        return defaultComputeCoefficient;
    }

    public double getDefaultFixedOverhead() {
        return defaultFixedOverhead;
    }

    public int effectiveParallelism(int availableCores, int clusterWorkers) {
        switch (parallelism) {
            case LOCAL_CORES:
                return Math.max(1, availableCores);
            case CLUSTER:
                return Math.max(1, clusterWorkers);
            default:
                return 1;
        }
    }

    public static Backend fromName(String name) {
        for (Backend backend : values()) {
            if (backend.name().equalsIgnoreCase(name) || backend.displayName.equalsIgnoreCase(name)) {
                return backend;
            }
        }
        throw new IllegalArgumentException("Unknown backend: " + name);
    }
}
