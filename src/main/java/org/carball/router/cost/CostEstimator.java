package org.carball.router.cost;

import lombok.extern.slf4j.Slf4j;
import org.carball.router.model.cost.Backend;
import org.carball.router.model.cost.BackendCoefficients;
import org.carball.router.model.cost.CostEstimate;
import org.carball.router.model.cost.CostModel;
import org.carball.router.model.partition.PruningResult;
import org.carball.router.model.query.QueryFeatures;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Scores every backend for one query:
 * <pre>
 *   scan     = prunedGB * scanCoefficient / parallelism
 *   compute  = (joins * join + aggregations * aggregation + window * windowCoefficient) * computeCoefficient
 *   overhead = fixedOverhead
 * </pre>
 * Each estimate reads a single {@link CostModel} snapshot, so coefficient
 * updates never mix into a half-finished estimate.
 */
@Slf4j
public class CostEstimator {

    private final AtomicReference<CostModel> model;
    private final int availableCores;
    private final int clusterWorkers;

    public CostEstimator(CostModel initialModel, int availableCores, int clusterWorkers) {
        this.model = new AtomicReference<>(initialModel);
        this.availableCores = availableCores;
        this.clusterWorkers = clusterWorkers;
    }

    public Map<Backend, CostEstimate> estimate(PruningResult pruningResult, QueryFeatures features) {
        return estimate(model.get(), pruningResult, features);
    }

    /**
     * Estimates against an explicit snapshot, e.g. one already read by the caller.
     */
    public Map<Backend, CostEstimate> estimate(CostModel snapshot, PruningResult pruningResult, QueryFeatures features) {
        Map<Backend, CostEstimate> estimates = new EnumMap<>(Backend.class);
        for (Backend backend : Backend.values()) {
            estimates.put(backend, estimateBackend(snapshot, backend, pruningResult.prunedGigabytes(), features));
        }
        return Collections.unmodifiableMap(estimates);
    }

    private CostEstimate estimateBackend(CostModel snapshot, Backend backend, double prunedGb, QueryFeatures features) {
        BackendCoefficients coefficients = snapshot.coefficients(backend);
        int parallelism = backend.effectiveParallelism(availableCores, clusterWorkers);

        double scan = prunedGb * coefficients.scanCoefficient() / parallelism;
        double work = features.getNumJoins() * snapshot.joinCoefficient()
                + features.getNumAggregations() * snapshot.aggregationCoefficient()
                + (features.isWindowFunctions() ? snapshot.windowCoefficient() : 0.0);
        double compute = work * coefficients.computeCoefficient();
        double overhead = coefficients.fixedOverhead();

        String reasoning = String.format("%s: %.3f GB / %d-way scan = %.3f, compute %.3f, overhead %.3f (model v%d)",
                backend.getDisplayName(), prunedGb, parallelism, scan, compute, overhead, snapshot.version());
        log.debug(reasoning);
        return new CostEstimate(backend, scan, compute, overhead, reasoning);
    }

    public CostModel currentModel() {
        return model.get();
    }

    /**
     * Atomically replaces the coefficient snapshot. Only the adaptive learner
     * calls this; estimates in flight keep the snapshot they started with.
     */
    public CostModel updateModel(UnaryOperator<CostModel> update) {
        return model.updateAndGet(update);
    }

    public int getAvailableCores() {
        return availableCores;
    }

    public int getClusterWorkers() {
        return clusterWorkers;
    }
}
