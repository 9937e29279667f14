package org.carball.router.engine;

import lombok.extern.slf4j.Slf4j;
import org.carball.router.analyzer.FeatureExtractor;
import org.carball.router.cache.QueryFingerprint;
import org.carball.router.catalog.CatalogSnapshot;
import org.carball.router.catalog.PartitionCatalog;
import org.carball.router.config.RouterConfig;
import org.carball.router.cost.CostEstimator;
import org.carball.router.exception.ErrorKind;
import org.carball.router.exception.RouterException;
import org.carball.router.model.cost.Backend;
import org.carball.router.model.cost.CostEstimate;
import org.carball.router.model.cost.CostModel;
import org.carball.router.model.partition.PruningResult;
import org.carball.router.model.query.NormalizedQuery;
import org.carball.router.model.query.QueryFeatures;
import org.carball.router.parser.QueryParser;
import org.carball.router.pruning.PartitionPruner;
import org.carball.router.routing.BackendSelector;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the decision half of the pipeline: prune, extract features, estimate,
 * select. Never executes anything and never touches the result cache.
 */
@Slf4j
public class RoutingPlanner {

    private final PartitionCatalog catalog;
    private final QueryParser parser;
    private final PartitionPruner pruner;
    private final FeatureExtractor featureExtractor;
    private final CostEstimator costEstimator;
    private final BackendSelector selector;
    private final AtomicBoolean catalogLoaded = new AtomicBoolean(false);

    public RoutingPlanner(PartitionCatalog catalog, QueryParser parser, PartitionPruner pruner,
                          FeatureExtractor featureExtractor, CostEstimator costEstimator,
                          BackendSelector selector) {
        this.catalog = catalog;
        this.parser = parser;
        this.pruner = pruner;
        this.featureExtractor = featureExtractor;
        this.costEstimator = costEstimator;
        this.selector = selector;
    }

    /**
     * Wires a planner from configuration.
     *
     * @param candidates backends the selector may choose from
     */
    public static RoutingPlanner fromConfig(RouterConfig config, QueryParser parser, Set<Backend> candidates) {
        return new RoutingPlanner(
                new PartitionCatalog(Path.of(config.getDataPath()), config.getDataFileSuffix()),
                parser,
                new PartitionPruner(),
                new FeatureExtractor(config.getAverageRowWidthBytes(), config.getAggregationReductionFactor()),
                new CostEstimator(config.initialCostModel(), config.getAvailableCores(), config.getClusterWorkers()),
                new BackendSelector(candidates));
    }

    public RoutingPlan plan(QueryRequest request) {
        CancellationToken token = request.getCancellationToken();

        enter(QueryState.RECEIVED, token);
        NormalizedQuery query = normalize(request);

        enter(QueryState.PRUNING, token);
        CatalogSnapshot snapshot = catalogSnapshot();
        PruningResult pruning = pruner.prune(snapshot.partitions(), query.predicates());

        List<String> warnings = new ArrayList<>();
        for (String warning : snapshot.warnings()) {
            warnings.add(ErrorKind.PARTIAL_CATALOG + ": " + warning);
        }
        if (pruning.ambiguousComparisons() > 0) {
            warnings.add(ErrorKind.PRUNING_AMBIGUOUS + ": " + pruning.ambiguousComparisons()
                    + " partition value(s) could not be compared and were kept");
        }

        enter(QueryState.FEATURE_EXTRACTION, token);
        QueryFeatures features = featureExtractor.extract(query, pruning.bytesAfter());

        enter(QueryState.COST_ESTIMATION, token);
        CostModel model = costEstimator.currentModel();
        Map<Backend, CostEstimate> costs = costEstimator.estimate(model, pruning, features);

        enter(QueryState.BACKEND_SELECTED, token);
        Backend pinned = request.getPinnedBackend();
        if (pinned != null && !selector.getCandidates().contains(pinned)) {
            throw new RouterException(ErrorKind.NO_BACKEND_AVAILABLE,
                    "Pinned backend " + pinned + " is not available (available: " + selector.getCandidates() + ")");
        }
        List<Backend> ranking = selector.rank(costs);
        Backend selected = selector.select(costs, pinned);

        String fingerprint = QueryFingerprint.of(query.canonicalSql(), snapshot.version(), pruning.partitionIdentities());
        RoutingDecision decision = new RoutingDecision(query.canonicalSql(), snapshot.version(), fingerprint,
                pruning, features, costs, ranking, selected, pinned != null, model.version(), warnings);

        log.info("Routed query to {} (cost {}, {}/{} partitions, {})", selected,
                String.format("%.3f", decision.estimatedCost(selected)), pruning.partitionsScanned(),
                pruning.totalPartitions(), features.describe());
        return new RoutingPlan(query, snapshot, decision);
    }

    /**
     * Current catalog, discovering it on first use.
     */
    public CatalogSnapshot catalogSnapshot() {
        if (!catalogLoaded.get()) {
            synchronized (catalogLoaded) {
                if (!catalogLoaded.get()) {
                    refreshCatalog();
                }
            }
        }
        return catalog.snapshot();
    }

    public CatalogSnapshot refreshCatalog() {
        CatalogSnapshot snapshot = catalog.refresh();
        catalogLoaded.set(true);
        return snapshot;
    }

    private NormalizedQuery normalize(QueryRequest request) {
        if (request.getNormalizedQuery() != null) {
            return request.getNormalizedQuery();
        }
        if (request.getSql() == null) {
            throw new RouterException(ErrorKind.INVALID_QUERY, "Request carries neither SQL nor a normalized query");
        }
        return parser.parse(request.getSql());
    }

    private static void enter(QueryState state, CancellationToken token) {
        token.throwIfCancelled(state);
        log.debug("Query state: {}", state);
    }

    public PartitionCatalog getCatalog() {
        return catalog;
    }

    public CostEstimator getCostEstimator() {
        return costEstimator;
    }

    public BackendSelector getSelector() {
        return selector;
    }
}
