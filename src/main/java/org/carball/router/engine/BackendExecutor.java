package org.carball.router.engine;

import org.carball.router.exception.BackendExecutionException;
import org.carball.router.model.cost.Backend;
import org.carball.router.model.query.NormalizedQuery;
import org.carball.router.model.query.QueryResult;

import java.nio.file.Path;
import java.util.List;

/**
 * Bridge to one execution engine.
 *
 * <p>The router only ever hands over the files that survived pruning, never the
 * dataset root. Implementations should respond to thread interruption, which is
 * how a timed-out execution is abandoned.
 */
public interface BackendExecutor {

    Backend backend();

    QueryResult execute(NormalizedQuery query, List<Path> prunedFiles) throws BackendExecutionException;
}
