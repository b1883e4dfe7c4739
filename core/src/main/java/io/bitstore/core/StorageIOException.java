// file: core/src/main/java/io/bitstore/core/StorageIOException.java
package io.bitstore.core;

import java.io.IOException;

/** Underlying filesystem failure. */
public final class StorageIOException extends BitException {

    public StorageIOException(String message, IOException cause) {
        super(message, cause);
    }
}
