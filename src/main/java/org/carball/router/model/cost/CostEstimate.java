package org.carball.router.model.cost;

/**
 * Relative, unitless cost of running one query on one backend.
 */
public record CostEstimate(
        Backend backend,
        double scanCost,
        double computeCost,
        double overhead,
        String reasoning
) {

    public CostEstimate {
        if (scanCost < 0 || computeCost < 0 || overhead < 0) {
            throw new IllegalArgumentException(String.format(
                    "Negative cost component for %s: scan=%f compute=%f overhead=%f",
                    backend, scanCost, computeCost, overhead));
        }
    }

    public double total() {
        return scanCost + computeCost + overhead;
    }
}
