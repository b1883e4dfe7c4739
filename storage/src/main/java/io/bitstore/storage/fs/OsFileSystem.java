// file: storage/src/main/java/io/bitstore/storage/fs/OsFileSystem.java
package io.bitstore.storage.fs;

import io.bitstore.core.StorageIOException;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** {@link FileSystem} backed by a directory on the local disk. */
public final class OsFileSystem implements FileSystem {
    private final Path root;

    public OsFileSystem(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    @Override
    public byte[] readFile(String path) {
        try {
            return Files.readAllBytes(resolve(path));
        } catch (IOException e) {
            throw new StorageIOException("failed to read " + path, e);
        }
    }

    @Override
    public void writeFile(String path, byte[] data) {
        try {
            Files.write(resolve(path), data);
        } catch (IOException e) {
            throw new StorageIOException("failed to write " + path, e);
        }
    }

    @Override
    public boolean deleteFile(String path) {
        try {
            return Files.deleteIfExists(resolve(path));
        } catch (IOException e) {
            throw new StorageIOException("failed to delete " + path, e);
        }
    }

    @Override
    public void createDirectories(String path) {
        try {
            Files.createDirectories(resolve(path));
        } catch (IOException e) {
            throw new StorageIOException("failed to create directory " + path, e);
        }
    }

    @Override
    public boolean exists(String path) {
        return Files.exists(resolve(path));
    }

    @Override
    public boolean isDirectory(String path) {
        return Files.isDirectory(resolve(path));
    }

    @Override
    public void walk(String dir, Visitor visitor) {
        try {
            walkDir(resolve(dir), visitor);
        } catch (IOException e) {
            throw new StorageIOException("failed to walk " + dir, e);
        }
    }

    private void walkDir(Path dir, Visitor visitor) throws IOException {
        List<Path> children;
        try (Stream<Path> s = Files.list(dir)) {
            children = s.sorted().collect(Collectors.toList());
        }
        for (Path child : children) {
            boolean isDir = Files.isDirectory(child);
            WalkAction action = visitor.visit(relative(child), isDir);
            if (isDir && action != WalkAction.SKIP_SUBTREE) {
                walkDir(child, visitor);
            }
        }
    }

    private Path resolve(String path) {
        String p = FileSystem.normalize(path);
        return p.isEmpty() ? root : root.resolve(p);
    }

    private String relative(Path p) {
        return root.relativize(p).toString().replace(File.separatorChar, '/');
    }
}
