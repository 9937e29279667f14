package org.carball.router.cache;

import org.carball.router.model.partition.PruningResult;
import org.carball.router.model.query.QueryResult;

import java.time.Instant;

/**
 * A cached query answer together with the pruning that produced it.
 */
public record CacheEntry(
        String fingerprint,
        QueryResult result,
        Instant createdAt,
        PruningResult pruningResult
) {
}
