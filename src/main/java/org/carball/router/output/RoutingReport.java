package org.carball.router.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.router.cache.ResultCacheStats;
import org.carball.router.catalog.CatalogSnapshot;
import org.carball.router.engine.RoutingDecision;
import org.carball.router.model.cost.Backend;
import org.carball.router.model.cost.CostEstimate;
import org.carball.router.model.partition.Partition;
import org.carball.router.model.partition.PruningResult;
import org.carball.router.model.query.QueryFeatures;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
public class RoutingReport {

    private final RoutingDecision decision;
    private final ResultCacheStats cacheStats;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public RoutingReport(RoutingDecision decision) {
        this(decision, null);
    }

    public RoutingReport(RoutingDecision decision, ResultCacheStats cacheStats) {
        this.decision = decision;
        this.cacheStats = cacheStats;
        this.timestamp = LocalDateTime.now();

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (Exception e) {
            log.error("Error generating JSON report", e);
            throw new RuntimeException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();
        PruningResult pruning = decision.pruningResult();
        QueryFeatures features = decision.features();

        md.append("# Query Routing Report\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n");
        md.append("**Catalog Version:** `").append(decision.catalogVersion()).append("`  \n");
        md.append("**Cost Model Version:** ").append(decision.costModelVersion()).append("  \n\n");

        md.append("```sql\n").append(decision.canonicalSql()).append("\n```\n\n");

        md.append("## Decision\n\n");
        md.append("Selected **").append(decision.selected().getDisplayName()).append("**");
        md.append(decision.pinned() ? " (pinned by caller)" : " (lowest estimated cost)").append(".\n\n");

        md.append("## Partition Pruning\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Partitions Scanned | ").append(pruning.partitionsScanned())
                .append(" / ").append(pruning.totalPartitions()).append(" |\n");
        md.append("| Files To Read | ").append(pruning.fileCount()).append(" |\n");
        md.append("| Data To Scan | ").append(String.format("%.3f GB", pruning.prunedGigabytes())).append(" |\n");
        md.append("| Data Skipped | ").append(String.format("%.1f%%", pruning.pruningRatio() * 100)).append(" |\n");
        md.append("| Predicates Applied | ").append(pruning.predicatesApplied().size()).append(" |\n");
        md.append("| Ambiguous Comparisons | ").append(pruning.ambiguousComparisons()).append(" |\n\n");

        md.append("## Query Shape\n\n");
        md.append("- **Joins:** ").append(features.getNumJoins()).append("\n");
        md.append("- **Aggregations:** ").append(features.getNumAggregations()).append("\n");
        md.append("- **Distinct:** ").append(features.isDistinct()).append("\n");
        md.append("- **Window Functions:** ").append(features.isWindowFunctions()).append("\n");
        md.append("- **Group By:** ").append(features.isGroupBy()).append("\n");
        md.append("- **Estimated Rows:** ").append(features.getEstimatedRows()).append("\n\n");

        md.append("## Backend Costs\n\n");
        md.append("| Rank | Backend | Scan | Compute | Overhead | Total |\n");
        md.append("|------|---------|------|---------|----------|-------|\n");
        int rank = 1;
        for (Backend backend : decision.ranking()) {
            CostEstimate estimate = decision.costs().get(backend);
            md.append("| ").append(rank++).append(" | ").append(backend.getDisplayName())
                    .append(backend == decision.selected() ? " ✓" : "")
                    .append(String.format(" | %.4f | %.4f | %.4f | %.4f |%n", estimate.scanCost(),
                            estimate.computeCost(), estimate.overhead(), estimate.total()));
        }
        md.append("\n");

        if (!decision.warnings().isEmpty()) {
            md.append("## Warnings\n\n");
            decision.warnings().forEach(warning -> md.append("- ").append(warning).append("\n"));
            md.append("\n");
        }

        if (cacheStats != null) {
            md.append("## Result Cache\n\n");
            md.append("| Entries | Capacity | Hits | Misses | Hit Rate | Evictions | Expired |\n");
            md.append("|---------|----------|------|--------|----------|-----------|---------|\n");
            md.append(String.format("| %d | %d | %d | %d | %.1f%% | %d | %d |%n%n", cacheStats.size(),
                    cacheStats.capacity(), cacheStats.hits(), cacheStats.misses(),
                    cacheStats.hitRate() * 100, cacheStats.evictions(), cacheStats.expirations()));
        }

        md.append("---\n\n");
        md.append("*Generated by Query Router*\n");
        return md.toString();
    }

    /**
     * Plain-text listing of a catalog snapshot.
     */
    public static String describeCatalog(CatalogSnapshot snapshot) {
        StringBuilder text = new StringBuilder();
        text.append(String.format("Catalog version %s: %d partitions, %d files, %.3f GB%n",
                snapshot.version(), snapshot.partitions().size(), snapshot.totalFiles(),
                snapshot.totalBytes() / (1024.0 * 1024 * 1024)));
        if (!snapshot.partitionKeys().isEmpty()) {
            text.append("Partition keys: ").append(String.join(", ", snapshot.partitionKeys())).append("\n");
        }
        for (Partition partition : snapshot.partitions()) {
            text.append(String.format("  %-50s %6d file(s) %14d bytes%n",
                    partition.identity(), partition.fileCount(), partition.sizeBytes()));
        }
        snapshot.warnings().forEach(warning -> text.append("  ! ").append(warning).append("\n"));
        return text.toString();
    }

    private ReportData buildReportData() {
        ReportData report = new ReportData();
        report.setGeneratedAt(timestamp);
        report.setQuery(decision.canonicalSql());
        report.setFingerprint(decision.fingerprint());
        report.setCatalogVersion(decision.catalogVersion());
        report.setCostModelVersion(decision.costModelVersion());
        report.setSelectedBackend(decision.selected().name());
        report.setPinned(decision.pinned());

        PruningResult pruning = decision.pruningResult();
        PruningSection pruningSection = new PruningSection();
        pruningSection.setPartitionsScanned(pruning.partitionsScanned());
        pruningSection.setTotalPartitions(pruning.totalPartitions());
        pruningSection.setFilesToRead(pruning.fileCount());
        pruningSection.setBytesBefore(pruning.bytesBefore());
        pruningSection.setBytesAfter(pruning.bytesAfter());
        pruningSection.setPruningRatio(pruning.pruningRatio());
        pruningSection.setPredicatesApplied(pruning.predicatesApplied().stream()
                .map(Object::toString)
                .collect(Collectors.toList()));
        pruningSection.setAmbiguousComparisons(pruning.ambiguousComparisons());
        pruningSection.setPartitions(pruning.partitionIdentities());
        report.setPruning(pruningSection);

        report.setFeatures(decision.features());

        report.setCosts(decision.ranking().stream()
                .map(backend -> {
                    CostEstimate estimate = decision.costs().get(backend);
                    BackendCost cost = new BackendCost();
                    cost.setBackend(backend.name());
                    cost.setScan(estimate.scanCost());
                    cost.setCompute(estimate.computeCost());
                    cost.setOverhead(estimate.overhead());
                    cost.setTotal(estimate.total());
                    cost.setReasoning(estimate.reasoning());
                    return cost;
                })
                .collect(Collectors.toList()));

        report.setWarnings(decision.warnings().isEmpty() ? null : decision.warnings());
        report.setCache(cacheStats);
        return report;
    }

    // Inner classes for JSON structure
    @lombok.Data
    private static class ReportData {
        private LocalDateTime generatedAt;
        private String query;
        private String fingerprint;
        private String catalogVersion;
        private long costModelVersion;
        private String selectedBackend;
        private boolean pinned;
        private PruningSection pruning;
        private QueryFeatures features;
        private List<BackendCost> costs;
        private List<String> warnings;
        private ResultCacheStats cache;
    }

    @lombok.Data
    private static class PruningSection {
        private int partitionsScanned;
        private int totalPartitions;
        private int filesToRead;
        private long bytesBefore;
        private long bytesAfter;
        private double pruningRatio;
        private List<String> predicatesApplied;
        private int ambiguousComparisons;
        private List<String> partitions;
    }

    @lombok.Data
    private static class BackendCost {
        private String backend;
        private double scan;
        private double compute;
        private double overhead;
        private double total;
        private String reasoning;
    }
}
