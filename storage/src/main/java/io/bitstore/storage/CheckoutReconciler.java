// file: storage/src/main/java/io/bitstore/storage/CheckoutReconciler.java
package io.bitstore.storage;

import io.bitstore.core.SaveRecord;
import io.bitstore.core.delta.ContentResolver;
import io.bitstore.core.ignore.IgnoreRules;
import io.bitstore.storage.fs.FileSystem;
import io.bitstore.storage.fs.WalkAction;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Converges the working tree to a save's manifest without disturbing
 * ignored files.
 * <p>
 * Ignore rules come from the target save's ignore-spec file when it has
 * one, else from the file on disk. Ignored files (other than the ignore-spec
 * file) are never deleted, and whatever a checkout does to them they end
 * with the bytes they started with.
 * <p>
 * There is no rollback: a failure part way through leaves the tree
 * partially converged, and re-running the checkout finishes the job.
 */
public final class CheckoutReconciler {
    private static final Logger log = Logger.getLogger(CheckoutReconciler.class.getName());

    private final FileSystem fs;
    private final RepositoryLayout layout;

    public CheckoutReconciler(FileSystem fs, RepositoryLayout layout) {
        this.fs = fs;
        this.layout = layout;
    }

    /** Read-only: inspects the tree and the target save, changes nothing. */
    public CheckoutPlan plan(SaveRecord target, ContentResolver resolver) {
        List<String> current = listWorkingTree();

        byte[] ignoreSpec = null;
        String ignoreText = null;
        if (target.contains(layout.ignoreFile())) {
            ignoreSpec = resolver.resolve(layout.ignoreFile(), target.id());
            ignoreText = new String(ignoreSpec, StandardCharsets.UTF_8);
        } else if (fs.exists(layout.ignoreFile())) {
            ignoreText = new String(fs.readFile(layout.ignoreFile()), StandardCharsets.UTF_8);
        }
        IgnoreRules rules = ignoreText == null ? IgnoreRules.none() : IgnoreRules.compile(ignoreText);

        Map<String, byte[]> preserved = new LinkedHashMap<>();
        List<String> toDelete = new ArrayList<>();
        Set<String> manifest = new HashSet<>(target.files());
        for (String path : current) {
            if (layout.isIgnoreFile(path)) continue;
            if (rules.isIgnored(path)) {
                preserved.put(path, fs.readFile(path));
            } else if (!manifest.contains(path)) {
                toDelete.add(path);
            }
        }

        List<String> toWrite = new ArrayList<>();
        for (String path : target.files()) {
            if (layout.isMetadata(path) || layout.isIgnoreFile(path) || rules.isIgnored(path)) continue;
            toWrite.add(path);
        }

        return new CheckoutPlan(target, ignoreSpec, rules, toDelete, toWrite, preserved);
    }

    /** Carry out a plan made by {@link #plan} against the same tree. */
    public void apply(CheckoutPlan plan, ContentResolver resolver) {
        String saveId = plan.target().id();

        if (plan.restoresIgnoreSpec()) {
            fs.writeFile(layout.ignoreFile(), plan.ignoreSpec());
        }

        for (String path : plan.toDelete()) {
            fs.deleteFile(path);
            log.log(Level.FINE, "deleted {0}", path);
        }

        for (String path : plan.toWrite()) {
            byte[] content = resolver.resolve(path, saveId);
            fs.createDirectories(FileSystem.parentOf(path));
            fs.writeFile(path, content);
        }

        for (Map.Entry<String, byte[]> e : plan.preserved().entrySet()) {
            fs.createDirectories(FileSystem.parentOf(e.getKey()));
            fs.writeFile(e.getKey(), e.getValue());
            log.log(Level.FINE, "kept ignored file {0}", e.getKey());
        }
    }

    /** Every file in the tree, ignored ones included, outside the metadata area. */
    List<String> listWorkingTree() {
        List<String> out = new ArrayList<>();
        fs.walk("", (path, isDir) -> {
            if (layout.isMetadata(path)) return WalkAction.SKIP_SUBTREE;
            if (!isDir) out.add(path);
            return WalkAction.CONTINUE;
        });
        return out;
    }
}
