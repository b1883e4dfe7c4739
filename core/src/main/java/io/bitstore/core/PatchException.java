// file: core/src/main/java/io/bitstore/core/PatchException.java
package io.bitstore.core;

/** An edit script is malformed or does not apply to the given base content. */
public final class PatchException extends BitException {

    public PatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
