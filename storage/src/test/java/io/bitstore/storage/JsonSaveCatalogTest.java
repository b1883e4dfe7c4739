package io.bitstore.storage;

import io.bitstore.core.NotFoundException;
import io.bitstore.core.SaveRecord;
import io.bitstore.storage.fs.InMemoryFileSystem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonSaveCatalogTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private InMemoryFileSystem fs;
    private JsonSaveCatalog catalog;

    @BeforeEach
    void setUp() {
        fs = new InMemoryFileSystem();
        fs.createDirectories(".bit");
        catalog = new JsonSaveCatalog(fs, RepositoryLayout.DEFAULT);
        catalog.initialize();
    }

    @Test
    void fresh_catalog_is_empty() {
        assertTrue(catalog.all().isEmpty());
        assertTrue(catalog.latest().isEmpty());
    }

    @Test
    void ids_are_twelve_hex_chars_and_deterministic() {
        String a = catalog.nextId("first", T0, List.of("a.txt", "b.txt"));
        String b = catalog.nextId("first", T0, List.of("a.txt", "b.txt"));
        String c = catalog.nextId("first", T0, List.of("a.txt"));

        assertTrue(a.matches("[0-9a-f]{12}"), a);
        assertEquals(a, b);
        assertNotEquals(a, c);
    }

    @Test
    void colliding_id_is_salted_until_unique() {
        String first = catalog.nextId("same", T0, List.of("f"));
        catalog.append(new SaveRecord(first, "same", T0, List.of("f"), null));

        String second = catalog.nextId("same", T0, List.of("f"));

        assertNotEquals(first, second);
        assertEquals(12, second.length());
    }

    @Test
    void append_keeps_order_and_survives_reload() {
        catalog.append(new SaveRecord("aaaaaaaaaaaa", "one", T0, List.of("f"), null));
        catalog.append(new SaveRecord("bbbbbbbbbbbb", "two", T0.plusSeconds(5), List.of("f", "g"), "aaaaaaaaaaaa"));

        var reloaded = new JsonSaveCatalog(fs, RepositoryLayout.DEFAULT);
        List<SaveRecord> all = reloaded.all();

        assertEquals(List.of("aaaaaaaaaaaa", "bbbbbbbbbbbb"), all.stream().map(SaveRecord::id).toList());
        assertEquals("bbbbbbbbbbbb", reloaded.latest().orElseThrow().id());
        assertEquals(T0.plusSeconds(5), reloaded.find("bbbbbbbbbbbb").createdAt());
        assertEquals(List.of("f", "g"), reloaded.find("bbbbbbbbbbbb").files());
        assertNull(reloaded.find("aaaaaaaaaaaa").baseId());
    }

    @Test
    void append_rejects_records_that_do_not_extend_the_chain() {
        catalog.append(new SaveRecord("aaaaaaaaaaaa", "one", T0, List.of("f"), null));

        assertThrows(IllegalArgumentException.class,
                () -> catalog.append(new SaveRecord("cccccccccccc", "x", T0, List.of("f"), null)));
        assertThrows(IllegalArgumentException.class,
                () -> catalog.append(new SaveRecord("cccccccccccc", "x", T0, List.of("f"), "zzzzzzzzzzzz")));
        assertThrows(IllegalArgumentException.class,
                () -> catalog.append(new SaveRecord("cccccccccccc", "x", T0.minusSeconds(1), List.of("f"), "aaaaaaaaaaaa")));
        assertEquals(1, catalog.all().size());
    }

    @Test
    void unknown_id_is_not_found() {
        assertThrows(NotFoundException.class, () -> catalog.find("deadbeef0000"));
    }

    @Test
    void catalog_document_uses_iso_timestamps() {
        catalog.append(new SaveRecord("aaaaaaaaaaaa", "one", T0, List.of("f"), null));

        String json = new String(fs.readFile(".bit/metadata.json"), StandardCharsets.UTF_8);
        assertTrue(json.contains("2024-05-01T10:00:00Z"), json);
    }
}
