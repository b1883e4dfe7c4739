// file: storage/src/main/java/io/bitstore/storage/fs/FileSystem.java
package io.bitstore.storage.fs;

/**
 * Minimal filesystem contract the store depends on.
 * <p>
 * Paths are forward-slash strings relative to the filesystem root
 * ("a.txt", "src/Main.java"); "" and "." name the root itself. A leading
 * "./" is accepted and dropped.
 * <p>
 * Failures surface as {@link io.bitstore.core.StorageIOException}.
 */
public interface FileSystem {

    /** Callback for {@link #walk}. */
    @FunctionalInterface
    interface Visitor {
        WalkAction visit(String path, boolean isDirectory);
    }

    byte[] readFile(String path);

    /** Create or truncate the file. The parent directory must exist. */
    void writeFile(String path, byte[] data);

    /** @return true if a file was removed, false if nothing was there */
    boolean deleteFile(String path);

    void createDirectories(String path);

    boolean exists(String path);

    boolean isDirectory(String path);

    /**
     * Visit every entry below {@code dir} (not {@code dir} itself), parents
     * before children, siblings in lexical order.
     */
    void walk(String dir, Visitor visitor);

    /** Strip "./" prefixes, trailing '/', and convert backslashes. */
    static String normalize(String path) {
        String p = path.replace('\\', '/');
        while (p.startsWith("./")) p = p.substring(2);
        while (p.endsWith("/") && p.length() > 1) p = p.substring(0, p.length() - 1);
        return p.equals(".") ? "" : p;
    }

    /** Parent directory of a normalized path, "" for top-level entries. */
    static String parentOf(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? "" : path.substring(0, slash);
    }
}
