// file: storage/src/test/java/io/bitstore/storage/fs/InMemoryFileSystemTest.java
package io.bitstore.storage.fs;

import io.bitstore.core.StorageIOException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryFileSystemTest {

    @Test
    void write_below_missing_directory_fails_like_a_disk() {
        var fs = new InMemoryFileSystem();

        assertThrows(StorageIOException.class, () -> fs.writeFile("missing/a.txt", new byte[]{1}));

        fs.createDirectories("missing");
        fs.writeFile("missing/a.txt", new byte[]{1});
        assertTrue(fs.exists("missing/a.txt"));
    }

    @Test
    void read_of_absent_file_is_a_storage_error() {
        assertThrows(StorageIOException.class, () -> new InMemoryFileSystem().readFile("nope"));
    }

    @Test
    void contents_are_copied_in_and_out() {
        var fs = new InMemoryFileSystem();
        byte[] data = "abc".getBytes(StandardCharsets.UTF_8);
        fs.writeFile("f", data);
        data[0] = 'z';

        byte[] read = fs.readFile("f");
        read[1] = 'z';

        assertEquals("abc", new String(fs.readFile("f"), StandardCharsets.UTF_8));
    }

    @Test
    void walk_visits_parents_first_in_lexical_order_and_honours_skip() {
        var fs = new InMemoryFileSystem()
                .put("b.txt", "b")
                .put("a/x.txt", "x")
                .put("a/deep/y.txt", "y")
                .put("skip/z.txt", "z")
                .put("a.txt", "a");

        List<String> seen = new ArrayList<>();
        fs.walk(".", (path, isDir) -> {
            seen.add(path + (isDir ? "/" : ""));
            return path.equals("skip") ? WalkAction.SKIP_SUBTREE : WalkAction.CONTINUE;
        });

        assertEquals(List.of("a/", "a/deep/", "a/deep/y.txt", "a/x.txt", "a.txt", "b.txt", "skip/"), seen);
    }

    @Test
    void delete_reports_whether_a_file_was_removed() {
        var fs = new InMemoryFileSystem().put("./dir/f.txt", "1");

        assertTrue(fs.deleteFile("dir/f.txt"));
        assertFalse(fs.deleteFile("dir/f.txt"));
        assertTrue(fs.isDirectory("dir"));
    }

    @Test
    void normalize_strips_dot_prefix_and_backslashes() {
        assertEquals("a/b.txt", FileSystem.normalize("./a\\b.txt"));
        assertEquals("", FileSystem.normalize("."));
        assertEquals("dir", FileSystem.normalize("dir/"));
        assertEquals("a/b", FileSystem.parentOf("a/b/c"));
        assertEquals("", FileSystem.parentOf("top"));
    }
}
