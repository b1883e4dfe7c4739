// file: storage/src/main/java/io/bitstore/storage/fs/WalkAction.java
package io.bitstore.storage.fs;

/** Returned by a {@link FileSystem.Visitor} to steer a walk. */
public enum WalkAction {
    CONTINUE,
    /** Do not descend into the directory just visited. Same as CONTINUE for files. */
    SKIP_SUBTREE
}
