// file: storage/src/main/java/io/bitstore/storage/fs/InMemoryFileSystem.java
package io.bitstore.storage.fs;

import io.bitstore.core.StorageIOException;

import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * {@link FileSystem} held entirely in memory.
 * <p>
 * Behaves like a disk where it matters to callers: writing below a missing
 * directory fails, and files and directories cannot share a path. Contents
 * are copied on the way in and out.
 */
public final class InMemoryFileSystem implements FileSystem {
    private final TreeMap<String, byte[]> files = new TreeMap<>();
    private final NavigableSet<String> dirs = new TreeSet<>();

    /** Test helper: write a file, creating parent directories. */
    public InMemoryFileSystem put(String path, String utf8) {
        return put(path, utf8.getBytes(StandardCharsets.UTF_8));
    }

    public InMemoryFileSystem put(String path, byte[] content) {
        String p = FileSystem.normalize(path);
        createDirectories(FileSystem.parentOf(p));
        writeFile(p, content);
        return this;
    }

    /** All files currently present, keyed by path. */
    public Map<String, byte[]> files() {
        Map<String, byte[]> copy = new TreeMap<>();
        files.forEach((k, v) -> copy.put(k, v.clone()));
        return copy;
    }

    @Override
    public byte[] readFile(String path) {
        String p = FileSystem.normalize(path);
        byte[] content = files.get(p);
        if (content == null) {
            throw new StorageIOException("failed to read " + p, new NoSuchFileException(p));
        }
        return content.clone();
    }

    @Override
    public void writeFile(String path, byte[] data) {
        String p = FileSystem.normalize(path);
        String parent = FileSystem.parentOf(p);
        if (!parent.isEmpty() && !dirs.contains(parent)) {
            throw new StorageIOException("failed to write " + p, new NoSuchFileException(parent));
        }
        if (dirs.contains(p)) {
            throw new StorageIOException("failed to write " + p, new FileAlreadyExistsException(p, null, "is a directory"));
        }
        files.put(p, Arrays.copyOf(data, data.length));
    }

    @Override
    public boolean deleteFile(String path) {
        return files.remove(FileSystem.normalize(path)) != null;
    }

    @Override
    public void createDirectories(String path) {
        String p = FileSystem.normalize(path);
        while (!p.isEmpty()) {
            if (files.containsKey(p)) {
                throw new StorageIOException("failed to create directory " + path,
                        new FileAlreadyExistsException(p, null, "is a file"));
            }
            dirs.add(p);
            p = FileSystem.parentOf(p);
        }
    }

    @Override
    public boolean exists(String path) {
        String p = FileSystem.normalize(path);
        return p.isEmpty() || files.containsKey(p) || dirs.contains(p);
    }

    @Override
    public boolean isDirectory(String path) {
        String p = FileSystem.normalize(path);
        return p.isEmpty() || dirs.contains(p);
    }

    @Override
    public void walk(String dir, Visitor visitor) {
        String base = FileSystem.normalize(dir);
        if (!isDirectory(base)) {
            throw new StorageIOException("failed to walk " + dir, new NoSuchFileException(base));
        }
        walkDir(base, visitor);
    }

    private void walkDir(String dir, Visitor visitor) {
        String prefix = dir.isEmpty() ? "" : dir + "/";
        TreeMap<String, Boolean> children = new TreeMap<>();
        for (String d : dirs.tailSet(prefix, false)) {
            if (!d.startsWith(prefix)) break;
            if (d.indexOf('/', prefix.length()) < 0) children.put(d, true);
        }
        for (String f : files.tailMap(prefix, false).keySet()) {
            if (!f.startsWith(prefix)) break;
            if (f.indexOf('/', prefix.length()) < 0) children.put(f, false);
        }
        List<Map.Entry<String, Boolean>> ordered = new ArrayList<>(children.entrySet());
        for (Map.Entry<String, Boolean> child : ordered) {
            WalkAction action = visitor.visit(child.getKey(), child.getValue());
            if (child.getValue() && action != WalkAction.SKIP_SUBTREE) {
                walkDir(child.getKey(), visitor);
            }
        }
    }
}
