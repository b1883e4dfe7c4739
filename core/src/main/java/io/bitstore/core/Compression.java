// file: core/src/main/java/io/bitstore/core/Compression.java
package io.bitstore.core;

/**
 * Compression applied when writing blobs and patches.
 * <p>
 * Passed explicitly into every store call instead of living in a
 * process-wide flag. Reads never need it: blobs carry their own
 * compression marker and delta records carry {@code compressed}.
 */
public enum Compression {
    GZIP,
    NONE;

    public static final Compression DEFAULT = GZIP;

    public boolean enabled() {
        return this == GZIP;
    }
}
