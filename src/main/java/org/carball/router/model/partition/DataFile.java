package org.carball.router.model.partition;

import java.nio.file.Path;

/**
 * A single data file inside a partition directory.
 *
 * @param path         absolute path of the file
 * @param sizeBytes    size on disk
 * @param rowCountHint row count when known from metadata, otherwise {@code null}
 */
public record DataFile(
        Path path,
        long sizeBytes,
        Long rowCountHint
) {

    public DataFile {
        if (path == null) {
            throw new IllegalArgumentException("Data file path must not be null");
        }
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("Negative file size for " + path + ": " + sizeBytes);
        }
    }

    public static DataFile of(Path path, long sizeBytes) {
        return new DataFile(path, sizeBytes, null);
    }
}
