// file: core/src/main/java/io/bitstore/core/delta/CompressionStats.java
package io.bitstore.core.delta;

import io.bitstore.core.DeltaRecord;
import io.bitstore.core.DeltaSet;
import io.bitstore.core.Gzip;
import io.bitstore.core.IntegrityException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Diagnostic report of how much gzip saves on the patches of one delta set.
 * Sizes are those of the plain edit script and of its gzip+hex form.
 */
public record CompressionStats(String saveId, Map<String, PathStats> byPath, double ratio) {

    public record PathStats(int uncompressed, int compressed) {
        public int saving() {
            return uncompressed - compressed;
        }
    }

    public CompressionStats {
        byPath = Collections.unmodifiableMap(new LinkedHashMap<>(byPath));
    }

    public static CompressionStats of(DeltaSet set) {
        Map<String, PathStats> stats = new LinkedHashMap<>();
        long totalPlain = 0;
        long totalPacked = 0;
        for (DeltaRecord d : set.deltas()) {
            if (!d.hasPatch()) continue;
            String plain = d.compressed() ? unpack(d) : d.patch();
            String packed = d.compressed() ? d.patch() : Gzip.compressToHex(plain);
            int plainSize = plain.getBytes(StandardCharsets.UTF_8).length;
            int packedSize = packed.length();
            stats.put(d.path(), new PathStats(plainSize, packedSize));
            totalPlain += plainSize;
            totalPacked += packedSize;
        }
        double ratio = totalPlain == 0 ? 0.0 : (double) totalPacked / totalPlain;
        return new CompressionStats(set.saveId(), stats, ratio);
    }

    private static String unpack(DeltaRecord d) {
        try {
            return Gzip.decompressHex(d.patch());
        } catch (IOException e) {
            throw new IntegrityException("failed to decompress patch for " + d.path(), e);
        }
    }
}
