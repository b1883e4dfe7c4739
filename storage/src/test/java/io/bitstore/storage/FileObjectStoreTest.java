package io.bitstore.storage;

import io.bitstore.core.Compression;
import io.bitstore.core.DeltaRecord;
import io.bitstore.core.DeltaSet;
import io.bitstore.core.IntegrityException;
import io.bitstore.core.NotFoundException;
import io.bitstore.core.delta.DeltaEngine;
import io.bitstore.storage.fs.InMemoryFileSystem;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileObjectStoreTest {

    private final RepositoryLayout layout = RepositoryLayout.DEFAULT;
    private final InMemoryFileSystem fs = new InMemoryFileSystem();
    private final FileObjectStore store = new FileObjectStore(fs, layout);

    private static byte[] b(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void blob_is_stored_framed_under_save_and_path_key() {
        store.putBlob("abc123", "src/Main.java", b("class Main {}"));

        assertTrue(store.hasBlob("abc123", "src/Main.java"));
        assertFalse(store.hasBlob("abc123", "src"));
        assertFalse(store.hasBlob("other", "src/Main.java"));

        byte[] raw = fs.readFile(".bit/objects/abc123_src/Main.java");
        assertNotNull(BlobCodec.readHeader(raw));
        assertArrayEquals(b("class Main {}"), store.getBlob("abc123", "src/Main.java"));
    }

    @Test
    void put_overwrites_previous_blob() {
        store.putBlob("s", "f", b("one"));
        store.putBlob("s", "f", b("two"), Compression.NONE);

        assertArrayEquals(b("two"), store.getBlob("s", "f"));
    }

    @Test
    void missing_blob_is_not_found() {
        assertThrows(NotFoundException.class, () -> store.getBlob("nope", "f"));
    }

    @Test
    void corrupted_blob_is_never_returned() {
        store.putBlob("s", "f", b("precious content that must not rot"), Compression.NONE);
        byte[] raw = fs.readFile(".bit/objects/s_f");
        raw[raw.length - 1] ^= 0x01;
        fs.writeFile(".bit/objects/s_f", raw);

        assertThrows(IntegrityException.class, () -> store.getBlob("s", "f"));
    }

    @Test
    void legacy_unframed_blob_reads_back_raw() {
        fs.put(".bit/objects/old_f", "written before framing");

        assertArrayEquals(b("written before framing"), store.getBlob("old", "f"));
    }

    @Test
    void delta_set_patches_are_compressed_on_disk_and_plain_after_load() {
        DeltaEngine engine = new DeltaEngine();
        DeltaRecord modified = engine.computeDelta(b("a\nb\n"), b("a\nc\n"), "f", "base");
        DeltaRecord created = engine.computeDelta(null, b("new"), "g", null);

        store.putDeltaSet("s1", List.of(modified, created));

        String json = new String(fs.readFile(".bit/objects/delta_s1.json"), StandardCharsets.UTF_8);
        assertFalse(json.contains("hunks"), "patch must not be stored in plain text");
        assertTrue(json.contains("\"compressed\" : true"), json);

        DeltaSet loaded = store.getDeltaSet("s1");
        assertEquals("s1", loaded.saveId());
        assertEquals(List.of(modified, created), loaded.deltas());
    }

    @Test
    void delta_set_can_be_stored_uncompressed() {
        DeltaRecord modified = new DeltaEngine().computeDelta(b("x\n"), b("y\n"), "f", "base");

        store.putDeltaSet("s1", List.of(modified), Compression.NONE);

        String json = new String(fs.readFile(".bit/objects/delta_s1.json"), StandardCharsets.UTF_8);
        assertTrue(json.contains("hunks"));
        assertEquals(modified, store.getDeltaSet("s1").deltas().get(0));
    }

    @Test
    void missing_delta_set_is_not_found() {
        assertThrows(NotFoundException.class, () -> store.getDeltaSet("never-written"));
    }

    @Test
    void garbage_delta_set_is_an_integrity_error() {
        fs.put(".bit/objects/delta_bad.json", "{ not json");

        assertThrows(IntegrityException.class, () -> store.getDeltaSet("bad"));
    }
}
