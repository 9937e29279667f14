package org.carball.router.cache;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Cache key for a query against one dataset state. The catalog version is part
 * of the hash, so a catalog change makes every older key unreachable at once.
 */
public final class QueryFingerprint {

    private QueryFingerprint() {
        // Utility class - prevent instantiation
    }

    public static String of(String canonicalSql, String catalogVersion, List<String> partitionIdentities) {
        Hasher hasher = Hashing.sha256().newHasher()
                .putString(canonicalSql, StandardCharsets.UTF_8)
                .putChar('\u0000')
                .putString(catalogVersion, StandardCharsets.UTF_8)
                .putChar('\u0000');
        for (String identity : partitionIdentities) {
            hasher.putString(identity, StandardCharsets.UTF_8).putChar('\n');
        }
        return hasher.hash().toString();
    }
}
