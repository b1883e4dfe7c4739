// file: core/src/main/java/io/bitstore/core/DeltaRecord.java
package io.bitstore.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * How one file changed in one save relative to the base save.
 * <p>
 * Kinds (mutually exclusive):
 *  - new:        {@code isNew}, no patch, no base. Full content is stored as a blob.
 *  - deleted:    {@code isDeleted}, no patch; hash is of the content before deletion.
 *  - unmodified: both flags false and no patch; content equals the base version.
 *  - modified:   both flags false with a patch against the base version.
 * <p>
 * {@code compressed} tells whether {@code patch} currently holds gzip+hex text
 * rather than the plain edit script.
 */
public record DeltaRecord(
        @JsonProperty("path") String path,
        @JsonProperty("isNew") boolean isNew,
        @JsonProperty("isDeleted") boolean isDeleted,
        @JsonProperty("baseId") String baseId,
        @JsonProperty("patch") String patch,
        @JsonProperty("contentHash") String contentHash,
        @JsonProperty("compressed") boolean compressed
) {
    public DeltaRecord {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(contentHash, "contentHash");
        if (isNew && isDeleted) throw new IllegalArgumentException("record cannot be both new and deleted: " + path);
        if (patch != null && patch.isEmpty()) patch = null;
        if (baseId != null && baseId.isEmpty()) baseId = null;
        if (patch != null && (isNew || isDeleted)) {
            throw new IllegalArgumentException("new/deleted records carry no patch: " + path);
        }
    }

    public static DeltaRecord created(String path, String contentHash) {
        return new DeltaRecord(path, true, false, null, null, contentHash, false);
    }

    public static DeltaRecord deleted(String path, String baseId, String contentHash) {
        return new DeltaRecord(path, false, true, baseId, null, contentHash, false);
    }

    public static DeltaRecord unmodified(String path, String baseId, String contentHash) {
        return new DeltaRecord(path, false, false, baseId, null, contentHash, false);
    }

    public static DeltaRecord modified(String path, String baseId, String patch, String contentHash) {
        return new DeltaRecord(path, false, false, baseId, Objects.requireNonNull(patch, "patch"), contentHash, false);
    }

    public boolean hasPatch() {
        return patch != null;
    }

    /** Modified or unmodified; neither new nor deleted. */
    @JsonIgnore
    public boolean isChange() {
        return !isNew && !isDeleted;
    }

    /** Same record with a different patch encoding. */
    public DeltaRecord withPatch(String newPatch, boolean nowCompressed) {
        return new DeltaRecord(path, isNew, isDeleted, baseId, newPatch, contentHash, nowCompressed);
    }
}
