// file: storage/src/main/java/io/bitstore/storage/FileObjectStore.java
package io.bitstore.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.bitstore.core.Compression;
import io.bitstore.core.DeltaRecord;
import io.bitstore.core.DeltaSet;
import io.bitstore.core.Gzip;
import io.bitstore.core.IntegrityException;
import io.bitstore.core.NotFoundException;
import io.bitstore.storage.fs.FileSystem;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link ObjectStore} keeping one file per blob and one JSON document per
 * delta set under the layout's objects directory.
 */
public final class FileObjectStore implements ObjectStore {
    private final FileSystem fs;
    private final RepositoryLayout layout;
    private final ObjectMapper mapper = Json.mapper();

    public FileObjectStore(FileSystem fs, RepositoryLayout layout) {
        this.fs = fs;
        this.layout = layout;
    }

    @Override
    public void putBlob(String saveId, String path, byte[] content, Compression compression) {
        String target = layout.blobPath(saveId, path);
        fs.createDirectories(FileSystem.parentOf(target));
        fs.writeFile(target, BlobCodec.encode(content, compression));
    }

    @Override
    public byte[] getBlob(String saveId, String path) {
        String target = layout.blobPath(saveId, path);
        if (!fs.exists(target) || fs.isDirectory(target)) {
            throw new NotFoundException("no stored blob for " + path + " in save " + saveId);
        }
        return BlobCodec.decode(fs.readFile(target), path + " in save " + saveId);
    }

    @Override
    public boolean hasBlob(String saveId, String path) {
        String target = layout.blobPath(saveId, path);
        return fs.exists(target) && !fs.isDirectory(target);
    }

    @Override
    public void putDeltaSet(String saveId, List<DeltaRecord> deltas, Compression compression) {
        List<DeltaRecord> stored = new ArrayList<>(deltas.size());
        for (DeltaRecord d : deltas) {
            if (d.hasPatch() && !d.compressed() && compression.enabled()) {
                stored.add(d.withPatch(Gzip.compressToHex(d.patch()), true));
            } else {
                stored.add(d);
            }
        }

        byte[] json;
        try {
            json = mapper.writeValueAsBytes(new DeltaSet(saveId, stored));
        } catch (IOException e) {
            throw new IllegalStateException("failed to serialize delta set for save " + saveId, e);
        }
        fs.createDirectories(layout.objectsDir());
        fs.writeFile(layout.deltaSetPath(saveId), json);
    }

    @Override
    public DeltaSet getDeltaSet(String saveId) {
        String source = layout.deltaSetPath(saveId);
        if (!fs.exists(source)) {
            throw new NotFoundException("no delta set for save " + saveId);
        }

        DeltaSet raw;
        try {
            raw = mapper.readValue(fs.readFile(source), DeltaSet.class);
        } catch (IOException e) {
            throw new IntegrityException("unreadable delta set for save " + saveId, e);
        }

        List<DeltaRecord> plain = new ArrayList<>(raw.deltas().size());
        for (DeltaRecord d : raw.deltas()) {
            if (!d.hasPatch() || !d.compressed()) {
                plain.add(d);
                continue;
            }
            try {
                plain.add(d.withPatch(Gzip.decompressHex(d.patch()), false));
            } catch (IOException e) {
                throw new IntegrityException("failed to decompress patch for " + d.path() + " in save " + saveId, e);
            }
        }
        return new DeltaSet(raw.saveId(), plain);
    }
}
