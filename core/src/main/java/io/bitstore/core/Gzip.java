// file: core/src/main/java/io/bitstore/core/Gzip.java
package io.bitstore.core;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Gzip helpers for blobs (raw bytes) and patches (hex text so they can sit
 * inside a JSON document).
 */
public final class Gzip {

    private static final HexFormat HEX = HexFormat.of();

    private Gzip() {
        // utility
    }

    public static byte[] compress(byte[] raw) {
        ByteArrayOutputStream bos = new ByteArrayOutputStream(Math.max(32, raw.length / 2));
        try (GZIPOutputStream gz = new GZIPOutputStream(bos)) {
            gz.write(raw);
        } catch (IOException e) {
            // in-memory streams do not fail
            throw new UncheckedIOException(e);
        }
        return bos.toByteArray();
    }

    /**
     * @throws IOException if the bytes are not a complete gzip stream
     */
    public static byte[] decompress(byte[] compressed) throws IOException {
        try (GZIPInputStream gz = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return gz.readAllBytes();
        }
    }

    /** Gzip the UTF-8 bytes of {@code text} and hex-encode the result. */
    public static String compressToHex(String text) {
        return HEX.formatHex(compress(text.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Inverse of {@link #compressToHex(String)}.
     *
     * @throws IOException if the text is not hex or does not hold a gzip stream
     */
    public static String decompressHex(String hex) throws IOException {
        byte[] compressed;
        try {
            compressed = HEX.parseHex(hex);
        } catch (IllegalArgumentException e) {
            throw new IOException("not a hex string", e);
        }
        return new String(decompress(compressed), StandardCharsets.UTF_8);
    }
}
