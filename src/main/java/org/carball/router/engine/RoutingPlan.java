package org.carball.router.engine;

import org.carball.router.catalog.CatalogSnapshot;
import org.carball.router.model.query.NormalizedQuery;

/**
 * A routing decision together with the query and catalog snapshot it was made against.
 */
public record RoutingPlan(NormalizedQuery query, CatalogSnapshot catalog, RoutingDecision decision) {
}
