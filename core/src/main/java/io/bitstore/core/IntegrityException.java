// file: core/src/main/java/io/bitstore/core/IntegrityException.java
package io.bitstore.core;

/**
 * Stored or reconstructed content does not match its recorded hash, or a
 * framed payload cannot be decoded. Always fatal to the running operation.
 */
public final class IntegrityException extends BitException {

    public IntegrityException(String message) {
        super(message);
    }

    public IntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
