// file: core/src/main/java/io/bitstore/core/BitException.java
package io.bitstore.core;

/**
 * Root of every failure raised by the snapshot store.
 * <p>
 * All subclasses are unchecked and carry enough context (path, save id)
 * in their message to diagnose the failure. Nothing in the store retries
 * or recovers locally; callers map these to user-facing messages.
 */
public abstract class BitException extends RuntimeException {

    protected BitException(String message) {
        super(message);
    }

    protected BitException(String message, Throwable cause) {
        super(message, cause);
    }
}
