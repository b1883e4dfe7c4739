// file: storage/src/main/java/io/bitstore/storage/RepositoryLayout.java
package io.bitstore.storage;

/**
 * Where the store keeps its files, relative to the working-tree root.
 * <pre>
 *   .bit/                     metadata area, never tracked
 *   .bit/metadata.json        save catalog
 *   .bit/config.json          optional {@link RepositoryConfig}
 *   .bit/objects/             blobs ("&lt;saveId&gt;_&lt;path&gt;") and delta sets ("delta_&lt;saveId&gt;.json")
 *   .bitignore                ignore-spec file, always tracked when present
 * </pre>
 */
public record RepositoryLayout(
        String metaDir,
        String objectsDir,
        String catalogFile,
        String configFile,
        String ignoreFile
) {
    public static final RepositoryLayout DEFAULT = new RepositoryLayout(
            ".bit",
            ".bit/objects",
            ".bit/metadata.json",
            ".bit/config.json",
            ".bitignore"
    );

    /** True for the metadata directory itself and everything inside it. */
    public boolean isMetadata(String path) {
        return path.equals(metaDir) || path.startsWith(metaDir + "/");
    }

    public boolean isIgnoreFile(String path) {
        return path.equals(ignoreFile);
    }

    public String blobPath(String saveId, String path) {
        return objectsDir + "/" + saveId + "_" + path;
    }

    public String deltaSetPath(String saveId) {
        return objectsDir + "/delta_" + saveId + ".json";
    }
}
