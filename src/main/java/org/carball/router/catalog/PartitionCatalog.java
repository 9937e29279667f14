package org.carball.router.catalog;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import lombok.extern.slf4j.Slf4j;
import org.carball.router.exception.ErrorKind;
import org.carball.router.exception.RouterException;
import org.carball.router.model.partition.DataFile;
import org.carball.router.model.partition.Partition;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Discovers Hive-style {@code key=value} directories under a dataset root.
 *
 * <p>Refresh builds a complete new snapshot off to the side and publishes it
 * with a single reference swap, so readers never see a half-built catalog.
 * Refreshes are serialized.
 */
@Slf4j
public class PartitionCatalog {

    /** Identity used for data files sitting directly in the dataset root. */
    static final String ROOT_IDENTITY = ".";

    private final Path root;
    private final String fileSuffix;
    private final AtomicReference<CatalogSnapshot> current = new AtomicReference<>(CatalogSnapshot.empty());
    private final ReentrantLock refreshLock = new ReentrantLock();

    public PartitionCatalog(Path root, String fileSuffix) {
        this.root = root;
        this.fileSuffix = fileSuffix == null ? "" : fileSuffix;
    }

    /**
     * Rediscovers all partitions and swaps them in.
     *
     * @throws RouterException with {@link ErrorKind#CATALOG_UNAVAILABLE} when the
     *                         dataset root is missing or unreadable; the previous
     *                         snapshot stays in place
     */
    public CatalogSnapshot refresh() {
        refreshLock.lock();
        try {
            if (!Files.isDirectory(root) || !Files.isReadable(root)) {
                throw new RouterException(ErrorKind.CATALOG_UNAVAILABLE,
                        "Dataset root is not a readable directory: " + root);
            }

            List<Partition> partitions = new ArrayList<>();
            List<String> warnings = new ArrayList<>();
            walk(root, new LinkedHashMap<>(), partitions, warnings);
            partitions.sort(Comparator.comparing(Partition::identity));

            CatalogSnapshot previous = current.get();
            CatalogSnapshot snapshot = new CatalogSnapshot(partitions, computeVersion(partitions), warnings, Instant.now());
            current.set(snapshot);

            if (!snapshot.version().equals(previous.version())) {
                log.info("Catalog refreshed: {} partitions, {} files, {} bytes (version {} -> {})",
                        partitions.size(), snapshot.totalFiles(), snapshot.totalBytes(),
                        previous.version(), snapshot.version());
            } else {
                log.debug("Catalog refreshed with no changes (version {})", snapshot.version());
            }
            if (snapshot.isPartial()) {
                log.warn("Catalog is partial: {} location(s) skipped under {}", warnings.size(), root);
            }
            return snapshot;
        } finally {
            refreshLock.unlock();
        }
    }

    public CatalogSnapshot snapshot() {
        return current.get();
    }

    public List<Partition> allPartitions() {
        return current.get().partitions();
    }

    public String version() {
        return current.get().version();
    }

    public Set<String> partitionKeys() {
        return current.get().partitionKeys();
    }

    public Path getRoot() {
        return root;
    }

    private void walk(Path directory, Map<String, String> values, List<Partition> partitions, List<String> warnings) {
        List<DataFile> files = new ArrayList<>();
        List<Path> children = new ArrayList<>();

        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path entry : stream) {
                if (isHidden(entry)) {
                    continue;
                }
                if (Files.isDirectory(entry)) {
                    children.add(entry);
                } else if (Files.isRegularFile(entry) && entry.getFileName().toString().endsWith(fileSuffix)) {
                    DataFile file = describeFile(entry, warnings);
                    if (file != null) {
                        files.add(file);
                    }
                }
            }
        } catch (IOException | SecurityException e) {
            String warning = "Unreadable partition directory " + relativize(directory) + ": " + e.getMessage();
            log.warn(warning);
            warnings.add(warning);
            return;
        }

        if (!files.isEmpty()) {
            String identity = values.isEmpty() ? ROOT_IDENTITY : relativize(directory);
            partitions.add(new Partition(identity, directory, values, files));
        }

        children.sort(Comparator.naturalOrder());
        for (Path child : children) {
            String segment = child.getFileName().toString();
            int separator = segment.indexOf('=');
            if (separator <= 0 || separator == segment.length() - 1) {
                String warning = "Skipping malformed partition directory " + relativize(child)
                        + " (expected key=value)";
                log.warn(warning);
                warnings.add(warning);
                continue;
            }
            String key = unescapePathName(segment.substring(0, separator));
            if (values.containsKey(key)) {
                String warning = "Skipping partition directory " + relativize(child)
                        + " (key '" + key + "' repeated in path)";
                log.warn(warning);
                warnings.add(warning);
                continue;
            }
            Map<String, String> childValues = new LinkedHashMap<>(values);
            childValues.put(key, unescapePathName(segment.substring(separator + 1)));
            walk(child, childValues, partitions, warnings);
        }
    }

    private DataFile describeFile(Path file, List<String> warnings) {
        try {
            return DataFile.of(file, Files.size(file));
        } catch (IOException e) {
            String warning = "Unreadable data file " + relativize(file) + ": " + e.getMessage();
            log.warn(warning);
            warnings.add(warning);
            return null;
        }
    }

    private static boolean isHidden(Path entry) {
        String name = entry.getFileName().toString();
        return name.startsWith(".") || name.startsWith("_");
    }

    private String relativize(Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }

    private static String computeVersion(List<Partition> partitions) {
        if (partitions.isEmpty()) {
            return CatalogSnapshot.EMPTY_VERSION;
        }
        Hasher hasher = Hashing.sha256().newHasher();
        for (Partition partition : partitions) {
            hasher.putString(partition.identity(), StandardCharsets.UTF_8).putChar('\n');
            for (DataFile file : partition.files()) {
                hasher.putString(file.path().getFileName().toString(), StandardCharsets.UTF_8)
                        .putLong(file.sizeBytes())
                        .putChar('\n');
            }
        }
        return hasher.hash().toString().substring(0, 16);
    }

    /**
     * Reverses Hive's %XX escaping of partition path segments.
     */
    static String unescapePathName(String segment) {
        if (segment.indexOf('%') < 0) {
            return segment;
        }
        StringBuilder sb = new StringBuilder(segment.length());
        for (int i = 0; i < segment.length(); i++) {
            char c = segment.charAt(i);
            if (c == '%' && i + 2 < segment.length()) {
                try {
                    sb.append((char) Integer.parseInt(segment.substring(i + 1, i + 3), 16));
                    i += 2;
                    continue;
                } catch (NumberFormatException e) {
                    log.debug("Literal '%' in partition segment {}", segment);
                }
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
