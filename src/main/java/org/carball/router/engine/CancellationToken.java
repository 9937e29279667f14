package org.carball.router.engine;

import org.carball.router.exception.ErrorKind;
import org.carball.router.exception.RouterException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lets a caller abandon a query. Honored between pipeline steps; once the query
 * is dispatched to a backend it can no longer be stopped.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    void throwIfCancelled(QueryState state) {
        if (cancelled.get()) {
            throw new RouterException(ErrorKind.QUERY_CANCELLED, "Query cancelled at " + state);
        }
    }
}
