package io.bitstore.core;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class GzipTest {

    @Test
    void hex_form_is_lower_case_hex_of_a_gzip_stream() throws Exception {
        String hex = Gzip.compressToHex("patch text");

        assertTrue(hex.matches("[0-9a-f]+"));
        // gzip magic 1f8b
        assertTrue(hex.startsWith("1f8b"));
        assertEquals("patch text", Gzip.decompressHex(hex));
    }

    @Test
    void decompress_rejects_non_gzip_input() {
        assertThrows(IOException.class, () -> Gzip.decompress("plain".getBytes(StandardCharsets.UTF_8)));
        assertThrows(IOException.class, () -> Gzip.decompressHex("zz-not-hex"));
    }

    @Test
    void content_hash_is_sha256_hex() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
                ContentHash.of(new byte[0]));
    }
}
