// file: core/src/main/java/io/bitstore/core/SaveRecord.java
package io.bitstore.core;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One entry of the save catalog: metadata only, no content.
 * <p>
 * Fields:
 *  - id:        12 hex chars derived from label, createdAt and the manifest.
 *  - label:     user-supplied free-text name.
 *  - createdAt: creation time, non-decreasing in catalog order.
 *  - files:     complete manifest of tracked paths (forward-slash, lexical order).
 *  - baseId:    id of the previous catalog entry, null for the first save.
 */
public record SaveRecord(
        @JsonProperty("id") String id,
        @JsonProperty("label") String label,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("files") List<String> files,
        @JsonProperty("baseId") String baseId
) {
    public SaveRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(createdAt, "createdAt");
        if (id.isBlank()) throw new IllegalArgumentException("id must not be blank");
        files = files == null ? List.of() : List.copyOf(files);
        if (baseId != null && baseId.isEmpty()) baseId = null;
    }

    public boolean contains(String path) {
        return files.contains(path);
    }
}
