package org.carball.router.exception;

/**
 * Failure kinds raised while routing a query. Non-fatal kinds degrade the
 * answer (and are reported as warnings) but never abort a query.
 */
public enum ErrorKind {
    CATALOG_UNAVAILABLE(true),
    PARTIAL_CATALOG(false),
    PRUNING_AMBIGUOUS(false),
    NO_BACKEND_AVAILABLE(true),
    BACKEND_EXECUTION_FAILED(true),
    BACKEND_TIMEOUT(true),
    CACHE_CORRUPTION(false),
    INVALID_QUERY(true),
    QUERY_CANCELLED(true);

    private final boolean fatal;

    ErrorKind(boolean fatal) {
        this.fatal = fatal;
    }

    public boolean isFatal() {
        return fatal;
    }
}
