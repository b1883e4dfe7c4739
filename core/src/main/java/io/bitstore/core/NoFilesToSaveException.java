// file: core/src/main/java/io/bitstore/core/NoFilesToSaveException.java
package io.bitstore.core;

public final class NoFilesToSaveException extends BitException {

    public NoFilesToSaveException() {
        super("no files to save");
    }
}
