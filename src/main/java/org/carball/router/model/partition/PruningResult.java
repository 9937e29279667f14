package org.carball.router.model.partition;

import org.carball.router.model.query.Predicate;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Partitions that survived pruning, with before/after volume figures.
 */
public record PruningResult(
        List<Partition> survivingPartitions,
        int totalPartitions,
        long bytesBefore,
        long bytesAfter,
        List<Predicate> predicatesApplied,
        int ambiguousComparisons,
        double pruningTimeMs
) {

    private static final double BYTES_PER_GB = 1024.0 * 1024 * 1024;

    public PruningResult {
        survivingPartitions = List.copyOf(survivingPartitions);
        predicatesApplied = List.copyOf(predicatesApplied);
        if (bytesAfter > bytesBefore) {
            throw new IllegalStateException("Pruned volume " + bytesAfter
                    + " exceeds unpruned volume " + bytesBefore);
        }
    }

    public int partitionsScanned() {
        return survivingPartitions.size();
    }

    /**
     * Fraction of bytes skipped: {@code 1 - after / before}, 0 for an empty dataset.
     */
    public double pruningRatio() {
        if (bytesBefore == 0) {
            return 0.0;
        }
        return 1.0 - ((double) bytesAfter / bytesBefore);
    }

    public double prunedGigabytes() {
        return bytesAfter / BYTES_PER_GB;
    }

    public int fileCount() {
        return survivingPartitions.stream().mapToInt(Partition::fileCount).sum();
    }

    public List<Path> prunedFiles() {
        return survivingPartitions.stream()
                .flatMap(p -> p.files().stream())
                .map(DataFile::path)
                .collect(Collectors.toList());
    }

    public List<String> partitionIdentities() {
        return survivingPartitions.stream()
                .map(Partition::identity)
                .collect(Collectors.toList());
    }

    public double speedupEstimate() {
        if (survivingPartitions.isEmpty()) {
            return 1.0;
        }
        return (double) totalPartitions / survivingPartitions.size();
    }

    public String summary() {
        return String.format(
                "Partition Pruning Results:%n"
                        + "  Partitions to scan: %d/%d%n"
                        + "  Data to scan: %.2f GB%n"
                        + "  Files to read: %d%n"
                        + "  Data skipped: %.1f%%%n"
                        + "  Estimated speedup: %.1fx%n"
                        + "  Predicates applied: %d",
                partitionsScanned(), totalPartitions, prunedGigabytes(), fileCount(),
                pruningRatio() * 100, speedupEstimate(), predicatesApplied.size());
    }
}
