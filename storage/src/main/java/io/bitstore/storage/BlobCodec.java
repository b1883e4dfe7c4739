// file: storage/src/main/java/io/bitstore/storage/BlobCodec.java
package io.bitstore.storage;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.bitstore.core.Compression;
import io.bitstore.core.ContentHash;
import io.bitstore.core.Gzip;
import io.bitstore.core.IntegrityException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

/**
 * Integrity framing for stored blobs.
 * <p>
 * On-disk layout:
 * <p>
 *   [HEADER]
 *     - length   (4B, big-endian) = byte length of the metadata block
 *     - metadata (length bytes)   = JSON {"compressed":bool,"contentHash":hex}
 * <p>
 *   [PAYLOAD]
 *     - gzip stream of the content when compressed, raw content otherwise
 * <p>
 * A blob self-describes how to decode it, so changing the repository's
 * compression setting never strands older blobs. Bytes that do not carry a
 * recognizable header are returned unchanged (files written before framing
 * existed).
 */
final class BlobCodec {
    static final int MAX_METADATA_LENGTH = 1000;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    record Header(
            @JsonProperty("compressed") boolean compressed,
            @JsonProperty("contentHash") String contentHash
    ) {}

    private BlobCodec() {
        // utility
    }

    static byte[] encode(byte[] content, Compression compression) {
        byte[] payload = compression.enabled() ? Gzip.compress(content) : content;
        byte[] meta;
        try {
            meta = MAPPER.writeValueAsBytes(new Header(compression.enabled(), ContentHash.of(content)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("blob header serialization failed", e);
        }

        ByteBuffer out = ByteBuffer.allocate(4 + meta.length + payload.length).order(ByteOrder.BIG_ENDIAN);
        out.putInt(meta.length).put(meta).put(payload);
        return out.array();
    }

    /**
     * @param stored raw bytes as read from the object area
     * @param where  key used in error messages
     * @throws IntegrityException if a framed payload fails to decompress or hash-verify
     */
    static byte[] decode(byte[] stored, String where) {
        Header header = readHeader(stored);
        if (header == null) {
            return stored;
        }

        int offset = 4 + ByteBuffer.wrap(stored, 0, 4).order(ByteOrder.BIG_ENDIAN).getInt();
        byte[] payload = Arrays.copyOfRange(stored, offset, stored.length);
        byte[] content;
        if (header.compressed()) {
            try {
                content = Gzip.decompress(payload);
            } catch (IOException e) {
                throw new IntegrityException("failed to decompress blob " + where, e);
            }
        } else {
            content = payload;
        }

        String actual = ContentHash.of(content);
        if (!actual.equals(header.contentHash())) {
            throw new IntegrityException("content hash mismatch for blob " + where
                    + " (expected " + header.contentHash() + ", got " + actual + ")");
        }
        return content;
    }

    /** Parsed header, or null when the bytes are not framed. */
    static Header readHeader(byte[] stored) {
        if (stored.length < 4) return null;
        int len = ByteBuffer.wrap(stored, 0, 4).order(ByteOrder.BIG_ENDIAN).getInt();
        if (len <= 0 || len >= MAX_METADATA_LENGTH || 4 + len > stored.length) return null;
        try {
            Header h = MAPPER.readValue(stored, 4, len, Header.class);
            return h != null && h.contentHash() != null ? h : null;
        } catch (IOException notFramed) {
            return null;
        }
    }
}
