package org.carball.router.model.query;

import lombok.Builder;
import lombok.Value;

/**
 * Shape of a query as seen by the cost model.
 */
@Value
@Builder(toBuilder = true)
public class QueryFeatures {
    int numJoins;
    int numAggregations;
    boolean distinct;
    boolean windowFunctions;
    boolean groupBy;
    int filterColumns;
    long estimatedRows;

    public static QueryFeatures empty() {
        return QueryFeatures.builder().estimatedRows(1).build();
    }

    public String describe() {
        return String.format("joins=%d, aggregations=%d, distinct=%s, window=%s, groupBy=%s, rows~%,d",
                numJoins, numAggregations, distinct, windowFunctions, groupBy, estimatedRows);
    }
}
