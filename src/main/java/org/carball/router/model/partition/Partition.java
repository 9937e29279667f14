package org.carball.router.model.partition;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * One Hive-style partition directory such as {@code date=2024-11-01/region=US}.
 * Immutable; the catalog rebuilds partitions wholesale on refresh.
 *
 * @param identity  path of the directory relative to the dataset root, '/'-separated
 * @param directory absolute directory path
 * @param values    partition key to raw string value, in path order
 * @param files     data files in the directory
 */
public record Partition(
        String identity,
        Path directory,
        Map<String, String> values,
        List<DataFile> files
) {

    /** Hive's marker for a NULL partition value. */
    public static final String HIVE_DEFAULT_PARTITION = "__HIVE_DEFAULT_PARTITION__";

    public Partition {
        if (identity == null || identity.isEmpty()) {
            throw new IllegalArgumentException("Partition identity must not be empty");
        }
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        files = List.copyOf(files);
    }

    /**
     * Partition keys match column names case-insensitively, as Hive does.
     */
    public boolean hasKey(String column) {
        return rawValue(column) != null;
    }

    /**
     * Returns the value for a column, or {@code null} when the column is not a
     * partition key here or holds Hive's default-partition marker.
     */
    public String valueOf(String column) {
        String value = rawValue(column);
        return HIVE_DEFAULT_PARTITION.equals(value) ? null : value;
    }

    private String rawValue(String column) {
        for (Map.Entry<String, String> entry : values.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(column)) {
                return entry.getValue();
            }
        }
        return null;
    }

    public long sizeBytes() {
        return files.stream().mapToLong(DataFile::sizeBytes).sum();
    }

    public int fileCount() {
        return files.size();
    }

    /**
     * Sum of the files' row hints, present only if every file carries one.
     */
    public OptionalLong rowCountHint() {
        long total = 0;
        for (DataFile file : files) {
            if (file.rowCountHint() == null) {
                return OptionalLong.empty();
            }
            total += file.rowCountHint();
        }
        return files.isEmpty() ? OptionalLong.empty() : OptionalLong.of(total);
    }
}
