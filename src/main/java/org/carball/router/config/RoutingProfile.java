package org.carball.router.config;

import lombok.Getter;

import java.util.Arrays;
import java.util.stream.Collectors;

@Getter
public enum RoutingProfile {

    BALANCED("balanced", "Balanced routing - default settings for most deployments",
            0, 16, 1.0, 1.0),

    LAPTOP("laptop", "Single laptop - distributed engine only for very large scans",
            4, 8, 1.5, 3.0),

    WORKSTATION("workstation", "Many-core workstation - prefer in-process parallelism",
            32, 16, 0.5, 2.0),

    CLUSTER_FIRST("cluster-first", "Warm shared cluster - low dispatch cost for the distributed engine",
            0, 64, 1.0, 0.25) {
        @Override
        public RouterConfig buildConfig() {
            RouterConfig base = super.buildConfig();
            return base.toBuilder()
                    .executionTimeoutMs(900_000) // Long-running cluster jobs
                    .build();
        }
    };

    private final String name;
    private final String description;
    private final int availableCores;
    private final int clusterWorkers;
    private final double parallelOverheadMultiplier;
    private final double distributedOverheadMultiplier;

    RoutingProfile(String name, String description, int availableCores, int clusterWorkers,
                   double parallelOverheadMultiplier, double distributedOverheadMultiplier) {
        this.name = name;
        this.description = description;
        this.availableCores = availableCores;
        this.clusterWorkers = clusterWorkers;
        this.parallelOverheadMultiplier = parallelOverheadMultiplier;
        this.distributedOverheadMultiplier = distributedOverheadMultiplier;
    }

    /**
     * Creates a RouterConfig based on this profile's settings. A core count of
     * 0 keeps the detected processor count.
     */
    public RouterConfig buildConfig() {
        RouterConfig defaults = RouterConfig.defaults();
        RouterConfig.RouterConfigBuilder builder = defaults.toBuilder()
                .profileName(name)
                .profileDescription(description)
                .clusterWorkers(clusterWorkers)
                .polarsFixedOverhead(defaults.getPolarsFixedOverhead() * parallelOverheadMultiplier)
                .sparkFixedOverhead(defaults.getSparkFixedOverhead() * distributedOverheadMultiplier);
        if (availableCores > 0) {
            builder.availableCores(availableCores);
        }
        return builder.build();
    }

    public static RoutingProfile fromName(String name) {
        for (RoutingProfile profile : values()) {
            if (profile.name.equalsIgnoreCase(name) || profile.name().equalsIgnoreCase(name)) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Unknown routing profile: " + name
                + ". Available profiles: " + Arrays.stream(values())
                .map(RoutingProfile::getName)
                .collect(Collectors.joining(", ")));
    }
}
