// file: core/src/main/java/io/bitstore/core/delta/DeltaEngine.java
package io.bitstore.core.delta;

import io.bitstore.core.ContentHash;
import io.bitstore.core.DeltaRecord;
import io.bitstore.core.Gzip;
import io.bitstore.core.IntegrityException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Computes and replays per-file deltas.
 * <p>
 * Content is interpreted as ISO-8859-1 text for diffing: one char per byte,
 * so any byte sequence survives the round trip unchanged.
 * <p>
 * Stateless; one instance can be shared.
 */
public final class DeltaEngine {

    /**
     * Describe how {@code newContent} differs from {@code oldContent}.
     *
     * @param oldContent content at {@code baseId}, or null when the file is new
     * @param newContent current content, or null when the file was deleted
     * @param path       forward-slash path of the file
     * @param baseId     save the delta is expressed against (ignored for new files)
     */
    public DeltaRecord computeDelta(byte[] oldContent, byte[] newContent, String path, String baseId) {
        if (oldContent == null && newContent == null) {
            throw new IllegalArgumentException("old and new content are both absent for " + path);
        }
        if (oldContent == null) {
            return DeltaRecord.created(path, ContentHash.of(newContent));
        }
        if (newContent == null) {
            return DeltaRecord.deleted(path, baseId, ContentHash.of(oldContent));
        }

        String hash = ContentHash.of(newContent);
        if (Arrays.equals(oldContent, newContent)) {
            return DeltaRecord.unmodified(path, baseId, hash);
        }
        EditScript script = EditScript.between(asText(oldContent), asText(newContent));
        if (script.isEmpty()) {
            return DeltaRecord.unmodified(path, baseId, hash);
        }
        return DeltaRecord.modified(path, baseId, script.toText(), hash);
    }

    /**
     * Rebuild the content a delta describes.
     *
     * @return the content, or null for a deletion record
     * @throws IntegrityException if the result does not hash to {@code contentHash},
     *                            or a record that needs a base has none
     * @throws io.bitstore.core.PatchException if the patch cannot be parsed or applied
     */
    public byte[] applyDelta(DeltaRecord delta, ContentResolver resolve) {
        if (delta.isDeleted()) {
            return null;
        }
        if (delta.baseId() == null) {
            // New files are always stored in full and found before replay gets here.
            throw new IntegrityException("no stored content for " + describe(delta)
                    + " and no base save to rebuild it from");
        }
        if (!delta.hasPatch()) {
            return resolve.resolve(delta.path(), delta.baseId());
        }

        byte[] base = resolve.resolve(delta.path(), delta.baseId());
        String scriptText = delta.compressed() ? decompressPatch(delta) : delta.patch();
        String rebuilt = EditScript.parse(scriptText).applyTo(asText(base));
        byte[] result = rebuilt.getBytes(StandardCharsets.ISO_8859_1);

        String actual = ContentHash.of(result);
        if (!actual.equals(delta.contentHash())) {
            throw new IntegrityException("content hash mismatch after applying delta for "
                    + delta.path() + " against save " + delta.baseId()
                    + " (expected " + delta.contentHash() + ", got " + actual + ")");
        }
        return result;
    }

    private static String decompressPatch(DeltaRecord delta) {
        try {
            return Gzip.decompressHex(delta.patch());
        } catch (IOException e) {
            throw new IntegrityException("failed to decompress patch for " + delta.path(), e);
        }
    }

    private static String describe(DeltaRecord delta) {
        return (delta.isNew() ? "new file " : "file ") + delta.path();
    }

    static String asText(byte[] content) {
        return new String(content, StandardCharsets.ISO_8859_1);
    }
}
