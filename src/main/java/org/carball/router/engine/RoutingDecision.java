package org.carball.router.engine;

import org.carball.router.model.cost.Backend;
import org.carball.router.model.cost.CostEstimate;
import org.carball.router.model.partition.PruningResult;
import org.carball.router.model.query.QueryFeatures;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything the router decided about a query before executing it.
 *
 * @param ranking          candidate backends from cheapest to most expensive
 * @param pinned           whether {@code selected} was forced by the caller
 * @param costModelVersion version of the coefficient snapshot the estimates used
 * @param warnings         degradations met on the way (partial catalog, ambiguous pruning)
 */
public record RoutingDecision(
        String canonicalSql,
        String catalogVersion,
        String fingerprint,
        PruningResult pruningResult,
        QueryFeatures features,
        Map<Backend, CostEstimate> costs,
        List<Backend> ranking,
        Backend selected,
        boolean pinned,
        long costModelVersion,
        List<String> warnings
) {

    public RoutingDecision {
        EnumMap<Backend, CostEstimate> orderedCosts = new EnumMap<>(Backend.class);
        orderedCosts.putAll(costs);
        costs = Collections.unmodifiableMap(orderedCosts);
        ranking = List.copyOf(ranking);
        warnings = List.copyOf(warnings);
    }

    public CostEstimate selectedEstimate() {
        return costs.get(selected);
    }

    public double estimatedCost(Backend backend) {
        CostEstimate estimate = costs.get(backend);
        return estimate == null ? 0.0 : estimate.total();
    }

    /**
     * Next-best backend by cost, used when the selected one fails. Pinned
     * queries have none.
     */
    public Optional<Backend> fallback() {
        if (pinned) {
            return Optional.empty();
        }
        return ranking.stream().filter(backend -> backend != selected).findFirst();
    }
}
