// file: storage/src/main/java/io/bitstore/storage/SaveWriter.java
package io.bitstore.storage;

import io.bitstore.core.DeltaRecord;
import io.bitstore.core.SaveRecord;
import io.bitstore.core.delta.DeltaEngine;
import io.bitstore.storage.fs.FileSystem;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes the object-store side of one save.
 * <p>
 * For every tracked file:
 *  - new since the base save:   store a full blob and a "new" record,
 *  - present in the base save:  record a delta against the base; if the file
 *    changed and its chain already spans maxChainLength hops, also store a
 *    full blob so reconstruction never applies more than maxChainLength patches.
 * Files of the base manifest that are gone get a deletion record.
 * Finally the whole delta set is written in one piece.
 */
final class SaveWriter {
    private static final Logger log = Logger.getLogger(SaveWriter.class.getName());

    private final FileSystem fs;
    private final ObjectStore store;
    private final DeltaEngine engine;
    private final RepositoryConfig config;

    SaveWriter(FileSystem fs, ObjectStore store, DeltaEngine engine, RepositoryConfig config) {
        this.fs = fs;
        this.store = store;
        this.engine = engine;
        this.config = config;
    }

    /**
     * @param saveId   id of the save being written
     * @param files    manifest of the new save
     * @param base     latest save before this one, or null for the first save
     * @param resolver resolver over the catalog as it was before this save
     * @return the records written
     */
    List<DeltaRecord> write(String saveId, List<String> files, SaveRecord base, ChainResolver resolver) {
        List<DeltaRecord> deltas = new ArrayList<>(files.size());
        int checkpoints = 0;

        for (String file : files) {
            byte[] current = fs.readFile(file);

            if (base == null || !base.contains(file)) {
                deltas.add(engine.computeDelta(null, current, file, null));
                store.putBlob(saveId, file, current, config.compression());
                continue;
            }

            byte[] previous = resolver.resolve(file, base.id());
            DeltaRecord delta = engine.computeDelta(previous, current, file, base.id());
            deltas.add(delta);

            if (config.checkpointsEnabled() && delta.hasPatch()) {
                int hops = resolver.hopsToBlob(file, base.id());
                if (hops >= config.maxChainLength()) {
                    store.putBlob(saveId, file, current, config.compression());
                    checkpoints++;
                    log.log(Level.FINE, "checkpoint {0} at save {1} after {2} delta hops",
                            new Object[]{file, saveId, hops});
                }
            }
        }

        if (base != null) {
            Set<String> kept = new HashSet<>(files);
            for (String file : base.files()) {
                if (kept.contains(file)) continue;
                byte[] previous = resolver.resolve(file, base.id());
                deltas.add(engine.computeDelta(previous, null, file, base.id()));
            }
        }

        store.putDeltaSet(saveId, deltas, config.compression());
        log.log(Level.FINE, "save {0}: {1} delta records, {2} checkpoints",
                new Object[]{saveId, deltas.size(), checkpoints});
        return deltas;
    }
}
