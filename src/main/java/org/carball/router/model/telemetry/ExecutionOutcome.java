package org.carball.router.model.telemetry;

public enum ExecutionOutcome {
    EXECUTED,
    CACHE_HIT,
    TIMED_OUT,
    FAILED;

    /**
     * Whether a record with this outcome says something about backend speed.
     */
    public boolean isBackendSample() {
        return this == EXECUTED || this == TIMED_OUT;
    }
}
