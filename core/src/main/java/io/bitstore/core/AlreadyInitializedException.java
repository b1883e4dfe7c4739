// file: core/src/main/java/io/bitstore/core/AlreadyInitializedException.java
package io.bitstore.core;

public final class AlreadyInitializedException extends BitException {

    public AlreadyInitializedException(String root) {
        super("repository already initialized at " + root);
    }
}
