package io.bitstore.storage;

import io.bitstore.core.Compression;
import io.bitstore.core.ContentHash;
import io.bitstore.core.IntegrityException;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class BlobCodecTest {

    private static final byte[] CONTENT = "hello blob\nsecond line\n".getBytes(StandardCharsets.UTF_8);

    @Test
    void header_is_length_prefixed_json_with_hash() {
        byte[] framed = BlobCodec.encode(CONTENT, Compression.GZIP);

        int len = ByteBuffer.wrap(framed, 0, 4).getInt();
        String meta = new String(framed, 4, len, StandardCharsets.UTF_8);

        assertTrue(meta.contains("\"compressed\":true"), meta);
        assertTrue(meta.contains(ContentHash.of(CONTENT)), meta);
        // payload is a gzip stream
        assertEquals((byte) 0x1f, framed[4 + len]);
        assertEquals((byte) 0x8b, framed[4 + len + 1]);
    }

    @Test
    void decode_reverses_encode_for_both_modes() {
        assertArrayEquals(CONTENT, BlobCodec.decode(BlobCodec.encode(CONTENT, Compression.GZIP), "k"));
        assertArrayEquals(CONTENT, BlobCodec.decode(BlobCodec.encode(CONTENT, Compression.NONE), "k"));
        assertArrayEquals(new byte[0], BlobCodec.decode(BlobCodec.encode(new byte[0], Compression.NONE), "k"));
    }

    @Test
    void unframed_bytes_are_returned_unchanged() {
        byte[] legacy = "plain old file content".getBytes(StandardCharsets.UTF_8);

        assertNull(BlobCodec.readHeader(legacy));
        assertArrayEquals(legacy, BlobCodec.decode(legacy, "k"));
        assertArrayEquals(new byte[]{1, 2}, BlobCodec.decode(new byte[]{1, 2}, "k"));
    }

    @Test
    void flipped_payload_byte_is_an_integrity_error() {
        byte[] framed = BlobCodec.encode(CONTENT, Compression.NONE);
        framed[framed.length - 3] ^= 0x20;

        assertThrows(IntegrityException.class, () -> BlobCodec.decode(framed, "k"));
    }

    @Test
    void truncated_gzip_payload_is_an_integrity_error() {
        byte[] framed = BlobCodec.encode(CONTENT, Compression.GZIP);
        byte[] cut = Arrays.copyOf(framed, framed.length - 6);

        assertThrows(IntegrityException.class, () -> BlobCodec.decode(cut, "k"));
    }
}
