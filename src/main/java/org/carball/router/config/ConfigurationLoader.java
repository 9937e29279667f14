package org.carball.router.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    static final String CLI_PREFIX = "--router.";
    static final String ENV_PREFIX = "IROUTER_";

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > defaults
     */
    public RouterConfig loadConfiguration(String[] args) {
        log.debug("Loading configuration");
        return overlay(RouterConfig.defaults().toBuilder(), null, args);
    }

    /**
     * Loads configuration from a specific profile.
     */
    public RouterConfig loadProfile(String profileName) {
        try {
            RoutingProfile profile = RoutingProfile.fromName(profileName);
            RouterConfig config = profile.buildConfig();
            log.info("Loaded profile '{}': {}", profileName, config.getConfigurationSummary());
            return config;
        } catch (IllegalArgumentException e) {
            log.error("Unknown profile: {}. {}", profileName, e.getMessage());
            throw e;
        }
    }

    /**
     * Loads a profile (or defaults when {@code profileName} is null), then
     * overlays a YAML file, environment variables and CLI arguments in that order.
     */
    public RouterConfig loadConfiguration(String profileName, Path yamlFile, String[] args) throws IOException {
        RouterConfig base = profileName == null ? RouterConfig.defaults() : loadProfile(profileName);
        return overlay(base.toBuilder(), yamlFile, args);
    }

    private RouterConfig overlay(RouterConfig.RouterConfigBuilder builder, Path yamlFile, String[] args) {
        if (yamlFile != null) {
            applyYamlFile(builder, yamlFile);
        }
        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        RouterConfig config = builder.build();
        config.validate();

        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    private void applyYamlFile(RouterConfig.RouterConfigBuilder builder, Path yamlFile) {
        if (!Files.exists(yamlFile)) {
            throw new IllegalArgumentException("Router config file not found: " + yamlFile);
        }
        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            JsonNode root = mapper.readTree(yamlFile.toFile());
            if (root == null || !root.isObject()) {
                log.warn("Router config file {} is empty or not a mapping, ignoring", yamlFile);
                return;
            }
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String key = field.getKey().toLowerCase(Locale.ROOT).replace('_', '-');
                apply(builder, key, field.getValue().asText(), "config file");
            }
            log.info("Loaded router configuration from: {}", yamlFile);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read router config " + yamlFile + ": " + e.getMessage(), e);
        }
    }

    private void applyEnvironmentVariables(RouterConfig.RouterConfigBuilder builder) {
        for (Map.Entry<String, String> entry : environment.entrySet()) {
            if (entry.getKey().startsWith(ENV_PREFIX)) {
                String key = entry.getKey().substring(ENV_PREFIX.length())
                        .toLowerCase(Locale.ROOT).replace('_', '-');
                apply(builder, key, entry.getValue(), "environment");
            }
        }
    }

    private void applyCLIArguments(RouterConfig.RouterConfigBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if (args[i].startsWith(CLI_PREFIX)) {
                apply(builder, args[i].substring(CLI_PREFIX.length()), args[i + 1], "command line");
            }
        }
    }

    private void apply(RouterConfig.RouterConfigBuilder builder, String key, String value, String source) {
        try {
            switch (key) {
                case "data-path":
                    builder.dataPath(value);
                    break;
                case "file-suffix":
                    builder.dataFileSuffix(value);
                    break;
                case "cores":
                    builder.availableCores(Integer.parseInt(value));
                    break;
                case "cluster-workers":
                    builder.clusterWorkers(Integer.parseInt(value));
                    break;
                case "duckdb-scan":
                    builder.duckdbScanCoefficient(Double.parseDouble(value));
                    break;
                case "duckdb-compute":
                    builder.duckdbComputeCoefficient(Double.parseDouble(value));
                    break;
                case "duckdb-overhead":
                    builder.duckdbFixedOverhead(Double.parseDouble(value));
                    break;
                case "polars-scan":
                    builder.polarsScanCoefficient(Double.parseDouble(value));
                    break;
                case "polars-compute":
                    builder.polarsComputeCoefficient(Double.parseDouble(value));
                    break;
                case "polars-overhead":
                    builder.polarsFixedOverhead(Double.parseDouble(value));
                    break;
                case "spark-scan":
                    builder.sparkScanCoefficient(Double.parseDouble(value));
                    break;
                case "spark-compute":
                    builder.sparkComputeCoefficient(Double.parseDouble(value));
                    break;
                case "spark-overhead":
                    builder.sparkFixedOverhead(Double.parseDouble(value));
                    break;
                case "join-coefficient":
                    builder.joinCoefficient(Double.parseDouble(value));
                    break;
                case "aggregation-coefficient":
                    builder.aggregationCoefficient(Double.parseDouble(value));
                    break;
                case "window-coefficient":
                    builder.windowCoefficient(Double.parseDouble(value));
                    break;
                case "row-width":
                    builder.averageRowWidthBytes(Integer.parseInt(value));
                    break;
                case "aggregation-reduction":
                    builder.aggregationReductionFactor(Double.parseDouble(value));
                    break;
                case "cache-capacity":
                    builder.cacheCapacity(Integer.parseInt(value));
                    break;
                case "cache-ttl-ms":
                    builder.cacheTtlMs(Long.parseLong(value));
                    break;
                case "timeout-ms":
                    builder.executionTimeoutMs(Long.parseLong(value));
                    break;
                case "learner-batch-size":
                    builder.learnerBatchSize(Integer.parseInt(value));
                    break;
                case "learner-interval-ms":
                    builder.learnerFlushIntervalMs(Long.parseLong(value));
                    break;
                case "learner-smoothing":
                    builder.learnerSmoothingWeight(Double.parseDouble(value));
                    break;
                case "learner-clamp-min":
                    builder.learnerClampMin(Double.parseDouble(value));
                    break;
                case "learner-clamp-max":
                    builder.learnerClampMax(Double.parseDouble(value));
                    break;
                case "coefficient-floor":
                    builder.coefficientFloor(Double.parseDouble(value));
                    break;
                case "cost-unit-ms":
                    builder.costUnitMillis(Double.parseDouble(value));
                    break;
                case "learner-queue-capacity":
                    builder.learnerQueueCapacity(Integer.parseInt(value));
                    break;
                case "history-retention":
                    builder.historyRetention(Integer.parseInt(value));
                    break;
                default:
                    log.debug("Ignoring unknown setting '{}' from {}", key, source);
            }
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {} from {}: {}", key, source, value);
        }
    }

    /**
     * Returns help text for router configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Router Configuration Options:

            CLI Arguments (also accepted as IROUTER_<KEY> env vars and YAML keys):
              --router.data-path <dir>             Dataset root directory
              --router.file-suffix <suffix>        Data file suffix (default .parquet)
              --router.cores <num>                 Cores available to the parallel engine
              --router.cluster-workers <num>       Workers available to the distributed engine
              --router.<backend>-scan <num>        Scan coefficient (backend: duckdb|polars|spark)
              --router.<backend>-compute <num>     Compute coefficient
              --router.<backend>-overhead <num>    Fixed dispatch overhead
              --router.join-coefficient <num>      Cost weight per join
              --router.aggregation-coefficient <num> Cost weight per aggregate
              --router.window-coefficient <num>    Cost weight for window functions
              --router.row-width <bytes>           Average row width for row estimates
              --router.aggregation-reduction <num> Output/input row ratio under GROUP BY
              --router.cache-capacity <num>        Result cache entries (LRU)
              --router.cache-ttl-ms <num>          Expire cached results after this long (0 = never)
              --router.timeout-ms <num>            Backend execution timeout
              --router.learner-batch-size <num>    Records per learner batch
              --router.learner-interval-ms <num>   Learner flush interval
              --router.learner-smoothing <num>     Weight toward the observed ratio
              --router.learner-clamp-min <num>     Lowest observed/estimated ratio applied
              --router.learner-clamp-max <num>     Highest observed/estimated ratio applied
              --router.learner-queue-capacity <num> Pending records before new ones are dropped
              --router.coefficient-floor <num>     Smallest value a learned coefficient may take
              --router.cost-unit-ms <num>          Milliseconds per cost unit
              --router.history-retention <num>     Execution records kept for inspection

            Environment Variables:
              IROUTER_CACHE_CAPACITY               Same as --router.cache-capacity
              IROUTER_TIMEOUT_MS                   Same as --router.timeout-ms
              (any key above, upper-cased with '-' replaced by '_')

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. YAML config file
              4. Profile defaults or built-in defaults
            """;
    }
}
