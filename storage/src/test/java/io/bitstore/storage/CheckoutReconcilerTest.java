package io.bitstore.storage;

import io.bitstore.core.SaveRecord;
import io.bitstore.core.delta.ContentResolver;
import io.bitstore.storage.fs.InMemoryFileSystem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CheckoutReconcilerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private InMemoryFileSystem fs;
    private CheckoutReconciler reconciler;

    private final Map<String, String> stored = Map.of(
            "a.txt", "a at target",
            "dir/b.txt", "b at target",
            "build/out.bin", "stale build output");
    private final ContentResolver resolver = (path, saveId) -> {
        String s = stored.get(path);
        if (s == null) throw new AssertionError("unexpected resolve of " + path);
        return s.getBytes(StandardCharsets.UTF_8);
    };

    @BeforeEach
    void setUp() {
        fs = new InMemoryFileSystem()
                .put(".bit/metadata.json", "{\"saves\":[]}")
                .put(".bitignore", "build/\n")
                .put("a.txt", "a now")
                .put("old.txt", "not in target")
                .put("build/out.bin", "fresh build output");
        reconciler = new CheckoutReconciler(fs, RepositoryLayout.DEFAULT);
    }

    private static String text(byte[] b) {
        return new String(b, StandardCharsets.UTF_8);
    }

    @Test
    void plan_lists_work_without_touching_the_tree() {
        var target = new SaveRecord("t1", "target", T0, List.of("a.txt", "build/out.bin", "dir/b.txt"), null);
        var before = Set.copyOf(fs.files().keySet());

        CheckoutPlan plan = reconciler.plan(target, resolver);

        assertEquals(List.of("old.txt"), plan.toDelete());
        assertEquals(List.of("a.txt", "dir/b.txt"), plan.toWrite());
        assertEquals(List.of("build/out.bin"), List.copyOf(plan.preserved().keySet()));
        assertFalse(plan.restoresIgnoreSpec());
        assertEquals(before, fs.files().keySet());
        assertEquals("a now", text(fs.readFile("a.txt")));
    }

    @Test
    void apply_converges_tree_and_keeps_ignored_bytes() {
        var target = new SaveRecord("t1", "target", T0, List.of("a.txt", "build/out.bin", "dir/b.txt"), null);

        reconciler.apply(reconciler.plan(target, resolver), resolver);

        assertEquals("a at target", text(fs.readFile("a.txt")));
        assertEquals("b at target", text(fs.readFile("dir/b.txt")));
        assertFalse(fs.exists("old.txt"));
        assertEquals("fresh build output", text(fs.readFile("build/out.bin")));
        assertEquals("build/\n", text(fs.readFile(".bitignore")));
        assertTrue(fs.exists(".bit/metadata.json"));
    }

    @Test
    void ignore_spec_of_the_target_wins_over_the_one_on_disk() {
        var target = new SaveRecord("t1", "target", T0, List.of(".bitignore", "a.txt"), null);
        ContentResolver withSpec = (path, saveId) -> path.equals(".bitignore")
                ? "*.txt\n".getBytes(StandardCharsets.UTF_8)
                : resolver.resolve(path, saveId);

        CheckoutPlan plan = reconciler.plan(target, withSpec);
        reconciler.apply(plan, withSpec);

        assertTrue(plan.restoresIgnoreSpec());
        assertEquals("*.txt\n", text(fs.readFile(".bitignore")));
        // *.txt is ignored under the target's rules, so text files are left alone
        assertEquals("a now", text(fs.readFile("a.txt")));
        assertEquals("not in target", text(fs.readFile("old.txt")));
        // build/ is no longer ignored and is absent from the target
        assertFalse(fs.exists("build/out.bin"));
    }

    @Test
    void ignore_spec_file_itself_is_never_deleted() {
        var target = new SaveRecord("t1", "target", T0, List.of("a.txt"), null);

        CheckoutPlan plan = reconciler.plan(target, resolver);

        assertFalse(plan.toDelete().contains(".bitignore"));
        assertFalse(plan.toDelete().stream().anyMatch(p -> p.startsWith(".bit/")));
    }
}
