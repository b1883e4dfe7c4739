// file: core/src/main/java/io/bitstore/core/NotInitializedException.java
package io.bitstore.core;

/** Raised when an operation needs a repository and none exists at the root. */
public final class NotInitializedException extends BitException {

    public NotInitializedException(String root) {
        super("repository not initialized at " + root + ", run 'bit init' first");
    }
}
