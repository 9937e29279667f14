package org.carball.router.engine;

/**
 * Steps a query goes through inside the engine.
 */
public enum QueryState {
    RECEIVED,
    PRUNING,
    FEATURE_EXTRACTION,
    COST_ESTIMATION,
    BACKEND_SELECTED,
    CACHE_CHECK,
    CACHE_HIT,
    EXECUTING,
    RESULT_STORED,
    DONE
}
