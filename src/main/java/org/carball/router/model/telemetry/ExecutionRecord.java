package org.carball.router.model.telemetry;

import org.carball.router.model.cost.Backend;

import java.time.Instant;

/**
 * One telemetry sample per finished query. For cache hits the backend is the
 * one routing selected, but the outcome keeps the learner from training on it.
 */
public record ExecutionRecord(
        String fingerprint,
        Backend backend,
        ExecutionOutcome outcome,
        double estimatedCost,
        double observedMs,
        Instant timestamp,
        int attempts
) {

    public boolean isCacheHit() {
        return outcome == ExecutionOutcome.CACHE_HIT;
    }
}
