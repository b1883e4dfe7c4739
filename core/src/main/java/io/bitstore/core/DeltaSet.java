// file: core/src/main/java/io/bitstore/core/DeltaSet.java
package io.bitstore.core;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** All delta records written for one save, persisted as a single unit. */
public record DeltaSet(
        @JsonProperty("saveId") String saveId,
        @JsonProperty("deltas") List<DeltaRecord> deltas
) {
    public DeltaSet {
        Objects.requireNonNull(saveId, "saveId");
        deltas = deltas == null ? List.of() : List.copyOf(deltas);
    }

    /**
     * Record for a path that still exists in the save. Deletion records are
     * skipped when a live record for the same path is present.
     */
    public Optional<DeltaRecord> find(String path) {
        DeltaRecord fallback = null;
        for (DeltaRecord d : deltas) {
            if (!d.path().equals(path)) continue;
            if (!d.isDeleted()) return Optional.of(d);
            fallback = d;
        }
        return Optional.ofNullable(fallback);
    }
}
