// file: storage/src/main/java/io/bitstore/storage/RepositoryConfig.java
package io.bitstore.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.bitstore.core.Compression;
import io.bitstore.storage.fs.FileSystem;

import java.io.IOException;
import java.util.Locale;
import java.util.Objects;

/**
 * Tunables of one repository.
 * <p>
 *  - maxChainLength: delta hops allowed before a changed file is stored in
 *    full again (default 10; 0 turns forced checkpoints off).
 *  - compression:    applied to blobs and patches on write (default GZIP).
 */
public record RepositoryConfig(int maxChainLength, Compression compression) {

    public static final int DEFAULT_MAX_CHAIN_LENGTH = 10;
    public static final RepositoryConfig DEFAULTS =
            new RepositoryConfig(DEFAULT_MAX_CHAIN_LENGTH, Compression.DEFAULT);

    public RepositoryConfig {
        if (maxChainLength < 0) throw new IllegalArgumentException("maxChainLength must be >= 0");
        Objects.requireNonNull(compression, "compression");
    }

    public boolean checkpointsEnabled() {
        return maxChainLength > 0;
    }

    /** Read {@code layout.configFile()} if present, otherwise {@link #DEFAULTS}. */
    public static RepositoryConfig load(FileSystem fs, RepositoryLayout layout) {
        if (!fs.exists(layout.configFile())) {
            return DEFAULTS;
        }
        ObjectMapper mapper = Json.mapper();
        ConfigFile cfg;
        try {
            cfg = mapper.readValue(fs.readFile(layout.configFile()), ConfigFile.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("invalid config file " + layout.configFile() + ": " + e.getMessage(), e);
        }
        if (cfg == null) return DEFAULTS;

        int chain = cfg.maxChainLength != null ? cfg.maxChainLength : DEFAULT_MAX_CHAIN_LENGTH;
        Compression compression = Compression.DEFAULT;
        if (cfg.compression != null) {
            try {
                compression = Compression.valueOf(cfg.compression.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("unknown compression '" + cfg.compression
                        + "' in " + layout.configFile() + " (expected gzip or none)");
            }
        }
        return new RepositoryConfig(chain, compression);
    }
}
