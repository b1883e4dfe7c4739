// file: core/src/main/java/io/bitstore/core/NotFoundException.java
package io.bitstore.core;

/**
 * A save id, a file within a save, a stored blob or a delta record is missing.
 */
public final class NotFoundException extends BitException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException save(String saveId) {
        return new NotFoundException("save with id " + saveId + " not found");
    }

    public static NotFoundException file(String path, String saveId) {
        return new NotFoundException("file " + path + " not found in save " + saveId);
    }
}
