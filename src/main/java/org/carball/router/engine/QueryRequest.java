package org.carball.router.engine;

import lombok.Builder;
import lombok.Value;
import org.carball.router.model.cost.Backend;
import org.carball.router.model.query.NormalizedQuery;

/**
 * A query submitted to the engine, either as SQL text or already normalized.
 */
@Value
@Builder
public class QueryRequest {
    String sql;
    NormalizedQuery normalizedQuery;
    /** Skips cost-based selection and the fallback attempt. */
    Backend pinnedBackend;
    /** Neither reads nor writes the result cache. */
    boolean bypassCache;
    /** Overrides the configured execution timeout when set. */
    Long timeoutMs;
    @Builder.Default
    CancellationToken cancellationToken = new CancellationToken();

    public static QueryRequest of(String sql) {
        return QueryRequest.builder().sql(sql).build();
    }

    public static QueryRequest of(NormalizedQuery query) {
        return QueryRequest.builder().normalizedQuery(query).build();
    }
}
