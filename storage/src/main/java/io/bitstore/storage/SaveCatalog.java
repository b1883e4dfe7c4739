// file: storage/src/main/java/io/bitstore/storage/SaveCatalog.java
package io.bitstore.storage;

import io.bitstore.core.SaveRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only, chronologically ordered log of saves.
 * <p>
 * Invariants:
 *  - the last record is the most recent save,
 *  - every record's baseId is the id of the record before it (null for the first),
 *  - createdAt never decreases along the log,
 *  - records are never reordered or removed.
 */
public interface SaveCatalog {

    /**
     * Derive the id for a new save: first 12 hex chars of
     * SHA-256(label + createdAt + each path). Unique within this catalog.
     */
    String nextId(String label, Instant createdAt, List<String> files);

    /**
     * @throws IllegalArgumentException if the record does not extend the chain
     */
    void append(SaveRecord record);

    /** @throws io.bitstore.core.NotFoundException if no save has this id */
    SaveRecord find(String id);

    Optional<SaveRecord> latest();

    /** All saves in creation order. */
    List<SaveRecord> all();
}
