// file: storage/src/main/java/io/bitstore/storage/ChainResolver.java
package io.bitstore.storage;

import io.bitstore.core.DeltaRecord;
import io.bitstore.core.DeltaSet;
import io.bitstore.core.IntegrityException;
import io.bitstore.core.NotFoundException;
import io.bitstore.core.SaveRecord;
import io.bitstore.core.delta.ContentResolver;
import io.bitstore.core.delta.DeltaEngine;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds file content at any save by walking delta chains back to the
 * nearest full blob.
 * <p>
 * Resolution of (path, saveId):
 *  1) a blob stored under the key is returned directly,
 *  2) otherwise the save's delta record for the path is replayed, which
 *     resolves its base save the same way.
 * <p>
 * Works over a snapshot of the catalog taken at construction; delta sets
 * are cached for the lifetime of the instance, so use one resolver per
 * operation. A hop limit (catalog size + 1) stops runaway recursion on
 * corrupted data.
 */
public final class ChainResolver implements ContentResolver {
    private final ObjectStore store;
    private final DeltaEngine engine;
    private final Map<String, SaveRecord> saves;
    private final Map<String, DeltaSet> deltaSets = new HashMap<>();
    private final int maxHops;

    public ChainResolver(ObjectStore store, DeltaEngine engine, List<SaveRecord> catalog) {
        this.store = store;
        this.engine = engine;
        this.saves = new LinkedHashMap<>();
        for (SaveRecord r : catalog) saves.put(r.id(), r);
        this.maxHops = catalog.size() + 1;
    }

    @Override
    public byte[] resolve(String path, String saveId) {
        return resolve(path, saveId, 0);
    }

    private byte[] resolve(String path, String saveId, int hops) {
        if (hops > maxHops) {
            throw new IntegrityException("delta chain for " + path + " exceeds " + maxHops
                    + " hops at save " + saveId + "; catalog is corrupt");
        }
        if (store.hasBlob(saveId, path)) {
            return store.getBlob(saveId, path);
        }
        if (!saves.containsKey(saveId)) {
            throw NotFoundException.save(saveId);
        }

        DeltaRecord record = deltaSet(saveId).find(path)
                .orElseThrow(() -> new NotFoundException("no delta record for " + path + " in save " + saveId));
        byte[] content = engine.applyDelta(record, (p, base) -> resolve(p, base, hops + 1));
        if (content == null) {
            throw NotFoundException.file(path, saveId);
        }
        return content;
    }

    /**
     * Delta hops between {@code saveId} and the nearest save holding a full
     * blob of {@code path}, following baseId links. Stops at the start of the
     * catalog when no blob is found.
     */
    public int hopsToBlob(String path, String saveId) {
        int count = 0;
        String current = saveId;
        while (current != null && count <= maxHops) {
            SaveRecord save = saves.get(current);
            if (save == null || store.hasBlob(current, path)) break;
            current = save.baseId();
            count++;
        }
        return count;
    }

    private DeltaSet deltaSet(String saveId) {
        DeltaSet set = deltaSets.get(saveId);
        if (set == null) {
            set = store.getDeltaSet(saveId);
            deltaSets.put(saveId, set);
        }
        return set;
    }
}
