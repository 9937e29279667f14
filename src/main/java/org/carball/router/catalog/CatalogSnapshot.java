package org.carball.router.catalog;

import org.carball.router.model.partition.Partition;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One complete, immutable view of the dataset's partitions. Readers hold a
 * snapshot for the whole query; refresh swaps in a new one.
 *
 * @param partitions  partitions ordered by identity
 * @param version     token that differs whenever the partition set differs
 * @param warnings    directories or files skipped during discovery
 * @param refreshedAt when discovery finished
 * @param identities  identities of {@code partitions}, always derived from them
 */
public record CatalogSnapshot(
        List<Partition> partitions,
        String version,
        List<String> warnings,
        Instant refreshedAt,
        Set<String> identities
) {

    public static final String EMPTY_VERSION = "empty";

    public CatalogSnapshot {
        partitions = List.copyOf(partitions);
        warnings = List.copyOf(warnings);
        identities = partitions.stream().map(Partition::identity).collect(Collectors.toUnmodifiableSet());
    }

    public CatalogSnapshot(List<Partition> partitions, String version, List<String> warnings, Instant refreshedAt) {
        this(partitions, version, warnings, refreshedAt, Set.of());
    }

    public static CatalogSnapshot empty() {
        return new CatalogSnapshot(List.of(), EMPTY_VERSION, List.of(), Instant.EPOCH);
    }

    /**
     * True when some directories could not be read; the snapshot then covers
     * only the readable subset.
     */
    public boolean isPartial() {
        return !warnings.isEmpty();
    }

    public long totalBytes() {
        return partitions.stream().mapToLong(Partition::sizeBytes).sum();
    }

    public int totalFiles() {
        return partitions.stream().mapToInt(Partition::fileCount).sum();
    }

    public Set<String> partitionKeys() {
        Set<String> keys = new LinkedHashSet<>();
        partitions.forEach(p -> keys.addAll(p.values().keySet()));
        return keys;
    }

    public boolean contains(String identity) {
        return identities.contains(identity);
    }
}
