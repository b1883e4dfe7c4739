// file: storage/src/main/java/io/bitstore/storage/ObjectStore.java
package io.bitstore.storage;

import io.bitstore.core.Compression;
import io.bitstore.core.DeltaRecord;
import io.bitstore.core.DeltaSet;

import java.util.List;

/**
 * Durable key-to-bytes storage for full file contents (blobs, keyed by
 * save id and path) and per-save delta sets (keyed by save id).
 * <p>
 * Semantics:
 *  - writes overwrite whatever was stored under the same key,
 *  - reads verify content hashes and fail rather than return corrupt data,
 *  - the store holds no reference back to the catalog.
 */
public interface ObjectStore {

    /** Frame, optionally compress, and store {@code content}. */
    void putBlob(String saveId, String path, byte[] content, Compression compression);

    default void putBlob(String saveId, String path, byte[] content) {
        putBlob(saveId, path, content, Compression.DEFAULT);
    }

    /**
     * @throws io.bitstore.core.NotFoundException  if no blob exists under the key
     * @throws io.bitstore.core.IntegrityException if the stored blob fails verification
     */
    byte[] getBlob(String saveId, String path);

    /** Existence check that does not read or verify the blob. */
    boolean hasBlob(String saveId, String path);

    /** Store all records of one save; plain patches are compressed per {@code compression}. */
    void putDeltaSet(String saveId, List<DeltaRecord> deltas, Compression compression);

    default void putDeltaSet(String saveId, List<DeltaRecord> deltas) {
        putDeltaSet(saveId, deltas, Compression.DEFAULT);
    }

    /**
     * Load a save's records with patches already decompressed
     * ({@link DeltaRecord#compressed()} is false on every returned record).
     *
     * @throws io.bitstore.core.NotFoundException if no delta set was written for the id
     */
    DeltaSet getDeltaSet(String saveId);
}
