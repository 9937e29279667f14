package org.carball.router.model.query;

import lombok.Builder;
import lombok.Data;
import org.carball.router.model.cost.Backend;
import org.carball.router.model.partition.PruningResult;
import org.carball.router.engine.RoutingDecision;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Materialized answer to a query. Backends fill in the rows; the engine adds
 * the routing details before returning it.
 */
@Data
@Builder(toBuilder = true)
public class QueryResult {
    @Builder.Default
    private List<Map<String, Object>> rows = new ArrayList<>();
    private long rowsProcessed;
    private Backend backendUsed;
    private double executionTimeMs;
    private int partitionsScanned;
    private int totalPartitions;
    private boolean fromCache;
    private PruningResult pruningResult;
    private RoutingDecision routingDecision;
    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    public int rowCount() {
        return rows == null ? 0 : rows.size();
    }
}
