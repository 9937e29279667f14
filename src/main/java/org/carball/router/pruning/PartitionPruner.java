package org.carball.router.pruning;

import lombok.extern.slf4j.Slf4j;
import org.carball.router.model.partition.Partition;
import org.carball.router.model.partition.PruningResult;
import org.carball.router.model.query.Predicate;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Keeps the partitions that can satisfy a conjunction of predicates, using
 * partition directory values only. No file is opened.
 *
 * <p>Pruning never excludes a partition it cannot prove irrelevant: predicates
 * on non-partition columns are ignored and failed coercions keep the partition.
 */
@Slf4j
public class PartitionPruner {

    public PruningResult prune(List<Partition> partitions, List<Predicate> predicates) {
        long start = System.nanoTime();

        List<Predicate> applicable = predicates.stream()
                .filter(p -> partitions.stream().anyMatch(partition -> partition.hasKey(p.column())))
                .collect(Collectors.toList());
        if (applicable.size() < predicates.size()) {
            log.debug("{} of {} predicates reference non-partition columns and are not used for pruning",
                    predicates.size() - applicable.size(), predicates.size());
        }

        List<Partition> surviving = new ArrayList<>();
        long bytesBefore = 0;
        long bytesAfter = 0;
        int ambiguous = 0;

        for (Partition partition : partitions) {
            long size = partition.sizeBytes();
            bytesBefore += size;

            boolean excluded = false;
            for (Predicate predicate : applicable) {
                if (!partition.hasKey(predicate.column())) {
                    continue;
                }
                MatchResult result = PartitionValueMatcher.match(partition.valueOf(predicate.column()), predicate);
                if (result == MatchResult.AMBIGUOUS) {
                    ambiguous++;
                    log.debug("Keeping partition {}: cannot compare value '{}' with {}",
                            partition.identity(), partition.valueOf(predicate.column()), predicate);
                } else if (result.excludes()) {
                    excluded = true;
                    break;
                }
            }

            if (!excluded) {
                surviving.add(partition);
                bytesAfter += size;
            }
        }

        if (ambiguous > 0) {
            log.warn("{} partition comparison(s) could not be coerced; those partitions were kept", ambiguous);
        }

        double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;
        PruningResult result = new PruningResult(surviving, partitions.size(), bytesBefore, bytesAfter,
                applicable, ambiguous, elapsedMs);
        log.debug("Pruned {} -> {} partitions ({} -> {} bytes) in {} ms",
                partitions.size(), surviving.size(), bytesBefore, bytesAfter, String.format("%.3f", elapsedMs));
        return result;
    }
}
