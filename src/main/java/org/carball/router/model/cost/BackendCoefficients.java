package org.carball.router.model.cost;

/**
 * Per-backend tunables: cost per scanned GB (before dividing by parallelism),
 * multiplier on query-shape work, and the fixed dispatch cost.
 */
public record BackendCoefficients(
        double scanCoefficient,
        double computeCoefficient,
        double fixedOverhead
) {

    public BackendCoefficients {
        if (scanCoefficient <= 0 || computeCoefficient <= 0) {
            throw new IllegalArgumentException("Scan and compute coefficients must be positive");
        }
        if (fixedOverhead < 0) {
            throw new IllegalArgumentException("Fixed overhead must not be negative");
        }
    }

    public BackendCoefficients scaled(double factor, double floor) {
        return new BackendCoefficients(
                Math.max(floor, scanCoefficient * factor),
                Math.max(floor, computeCoefficient * factor),
                fixedOverhead);
    }
}
