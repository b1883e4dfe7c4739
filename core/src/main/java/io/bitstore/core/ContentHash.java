// file: core/src/main/java/io/bitstore/core/ContentHash.java
package io.bitstore.core;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 helpers used for integrity checks and save id derivation.
 * Hashing here detects corruption; it is not meant to resist tampering.
 */
public final class ContentHash {

    private static final HexFormat HEX = HexFormat.of();

    private ContentHash() {
        // utility
    }

    /** Lower-case hex SHA-256 of the given bytes. */
    public static String of(byte[] content) {
        return HEX.formatHex(digest().digest(content));
    }

    /**
     * Hash of several UTF-8 strings fed one after another into a single digest,
     * with no separator between them.
     */
    public static String ofStrings(Iterable<String> parts) {
        MessageDigest md = digest();
        for (String part : parts) {
            md.update(part.getBytes(StandardCharsets.UTF_8));
        }
        return HEX.formatHex(md.digest());
    }

    static MessageDigest digest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // every JDK ships SHA-256
            throw new IllegalStateException(e);
        }
    }
}
