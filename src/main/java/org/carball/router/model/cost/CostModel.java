package org.carball.router.model.cost;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable coefficient snapshot. The estimator reads one snapshot per query;
 * the learner publishes replacements with a higher version.
 */
public record CostModel(
        long version,
        Map<Backend, BackendCoefficients> backends,
        double joinCoefficient,
        double aggregationCoefficient,
        double windowCoefficient
) {

    public CostModel {
        EnumMap<Backend, BackendCoefficients> copy = new EnumMap<>(Backend.class);
        copy.putAll(backends);
        for (Backend backend : Backend.values()) {
            if (!copy.containsKey(backend)) {
                throw new IllegalArgumentException("Cost model has no coefficients for " + backend);
            }
        }
        backends = Collections.unmodifiableMap(copy);
    }

    public BackendCoefficients coefficients(Backend backend) {
        return backends.get(backend);
    }

    public CostModel withCoefficients(Backend backend, BackendCoefficients coefficients) {
        EnumMap<Backend, BackendCoefficients> updated = new EnumMap<>(backends);
        updated.put(backend, coefficients);
        return new CostModel(version + 1, updated, joinCoefficient, aggregationCoefficient, windowCoefficient);
    }
}
