package org.carball.router.routing;

import lombok.extern.slf4j.Slf4j;
import org.carball.router.exception.ErrorKind;
import org.carball.router.exception.RouterException;
import org.carball.router.model.cost.Backend;
import org.carball.router.model.cost.CostEstimate;

import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Picks the cheapest backend. Equal totals go to the backend declared first in
 * {@link Backend}, i.e. the one that is cheaper to operate.
 */
@Slf4j
public class BackendSelector {

    private static final Comparator<CostEstimate> BY_COST_THEN_PREFERENCE =
            Comparator.comparingDouble(CostEstimate::total)
                    .thenComparingInt(estimate -> estimate.backend().ordinal());

    private final EnumSet<Backend> candidates;

    public BackendSelector() {
        this(EnumSet.allOf(Backend.class));
    }

    /**
     * @param candidates backends that can actually run queries
     */
    public BackendSelector(Set<Backend> candidates) {
        this.candidates = candidates.isEmpty() ? EnumSet.noneOf(Backend.class) : EnumSet.copyOf(candidates);
    }

    public Backend select(Map<Backend, CostEstimate> costs) {
        return select(costs, null);
    }

    /**
     * @param pinned backend forced by the caller, returned as is; {@code null} to choose by cost
     */
    public Backend select(Map<Backend, CostEstimate> costs, Backend pinned) {
        if (pinned != null) {
            log.debug("Backend pinned to {}, skipping selection", pinned);
            return pinned;
        }
        List<Backend> ranking = rank(costs);
        if (ranking.isEmpty()) {
            throw new RouterException(ErrorKind.NO_BACKEND_AVAILABLE,
                    "No candidate backend among " + costs.keySet() + " (available: " + candidates + ")");
        }
        return ranking.get(0);
    }

    /**
     * All candidate backends from cheapest to most expensive.
     */
    public List<Backend> rank(Map<Backend, CostEstimate> costs) {
        return costs.values().stream()
                .filter(estimate -> candidates.contains(estimate.backend()))
                .sorted(BY_COST_THEN_PREFERENCE)
                .map(CostEstimate::backend)
                .collect(Collectors.toList());
    }

    public Set<Backend> getCandidates() {
        return EnumSet.copyOf(candidates);
    }
}
