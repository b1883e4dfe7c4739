// file: storage/src/main/java/io/bitstore/storage/Repository.java
package io.bitstore.storage;

import io.bitstore.core.AlreadyInitializedException;
import io.bitstore.core.NoFilesToSaveException;
import io.bitstore.core.NotFoundException;
import io.bitstore.core.NotInitializedException;
import io.bitstore.core.SaveRecord;
import io.bitstore.core.delta.CompressionStats;
import io.bitstore.core.delta.DeltaEngine;
import io.bitstore.core.ignore.IgnoreRules;
import io.bitstore.storage.fs.FileSystem;
import io.bitstore.storage.fs.OsFileSystem;
import io.bitstore.storage.fs.WalkAction;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Snapshot repository over one working tree.
 * <p>
 * Responsibilities:
 *  - init:     create the metadata area and an empty catalog.
 *  - save:     capture every tracked file under a new save id. The latest
 *              save is the delta base; the catalog is appended last.
 *  - list:     saves in creation order.
 *  - checkout: converge the tree to a save, keeping ignored files intact.
 * <p>
 * Single-threaded and unsynchronized: one process per working tree. A crash
 * mid-save can leave a delta set without its catalog entry; a crash
 * mid-checkout leaves a mix of old and new files. Re-running fixes both.
 */
public final class Repository {
    private static final Logger log = Logger.getLogger(Repository.class.getName());

    private final FileSystem fs;
    private final RepositoryLayout layout;
    private final Clock clock;
    private final ObjectStore store;
    private final JsonSaveCatalog catalog;
    private final DeltaEngine engine = new DeltaEngine();
    private final CheckoutReconciler reconciler;

    public Repository(FileSystem fs) {
        this(fs, RepositoryLayout.DEFAULT, Clock.systemUTC());
    }

    public Repository(FileSystem fs, RepositoryLayout layout, Clock clock) {
        this.fs = fs;
        this.layout = layout;
        this.clock = clock;
        this.store = new FileObjectStore(fs, layout);
        this.catalog = new JsonSaveCatalog(fs, layout);
        this.reconciler = new CheckoutReconciler(fs, layout);
    }

    /** Repository rooted at a directory on disk. */
    public static Repository open(Path root) {
        return new Repository(new OsFileSystem(root));
    }

    public boolean isInitialized() {
        return fs.isDirectory(layout.metaDir());
    }

    public void init() {
        if (fs.exists(layout.metaDir())) {
            throw new AlreadyInitializedException(layout.metaDir());
        }
        fs.createDirectories(layout.objectsDir());
        catalog.initialize();
        log.info("initialized empty repository in " + layout.metaDir());
    }

    /**
     * Snapshot the tracked files.
     *
     * @return the new save's id
     * @throws NoFilesToSaveException if nothing is trackable
     */
    public String saveState(String label) {
        requireInitialized();
        RepositoryConfig config = RepositoryConfig.load(fs, layout);

        List<String> files = trackedFiles();
        if (files.isEmpty()) {
            throw new NoFilesToSaveException();
        }

        List<SaveRecord> history = catalog.all();
        SaveRecord base = history.isEmpty() ? null : history.get(history.size() - 1);

        Instant createdAt = clock.instant();
        if (base != null && createdAt.isBefore(base.createdAt())) {
            createdAt = base.createdAt();
        }
        String id = catalog.nextId(label, createdAt, files);

        ChainResolver resolver = new ChainResolver(store, engine, history);
        new SaveWriter(fs, store, engine, config).write(id, files, base, resolver);

        catalog.append(new SaveRecord(id, label, createdAt, files, base == null ? null : base.id()));
        log.info("saved '" + label + "' as " + id + " (" + files.size() + " files)");
        return id;
    }

    public List<SaveRecord> listSaves() {
        requireInitialized();
        return catalog.all();
    }

    /**
     * Converge the working tree to save {@code saveId}.
     *
     * @return the plan that was carried out
     * @throws NotFoundException if the id is unknown
     */
    public CheckoutPlan checkout(String saveId) {
        requireInitialized();
        List<SaveRecord> history = catalog.all();
        SaveRecord target = catalog.find(saveId);

        ChainResolver resolver = new ChainResolver(store, engine, history);
        CheckoutPlan plan = reconciler.plan(target, resolver);
        reconciler.apply(plan, resolver);

        log.info("checked out " + saveId + ": " + plan.toWrite().size() + " written, "
                + plan.toDelete().size() + " deleted, " + plan.preserved().size() + " ignored kept");
        return plan;
    }

    /** Check out the most recent save, if any. */
    public Optional<SaveRecord> checkoutLatest() {
        requireInitialized();
        Optional<SaveRecord> latest = catalog.latest();
        latest.ifPresent(save -> checkout(save.id()));
        return latest;
    }

    /** What {@link #checkout} would do, without touching the tree. */
    public CheckoutPlan planCheckout(String saveId) {
        requireInitialized();
        SaveRecord target = catalog.find(saveId);
        return reconciler.plan(target, new ChainResolver(store, engine, catalog.all()));
    }

    /**
     * Content of {@code path} as of save {@code saveId}.
     *
     * @throws NotFoundException if the save is unknown or does not contain the path
     */
    public byte[] readFile(String saveId, String path) {
        requireInitialized();
        String normalized = FileSystem.normalize(path);
        SaveRecord save = catalog.find(saveId);
        if (!save.contains(normalized)) {
            throw NotFoundException.file(normalized, saveId);
        }
        return new ChainResolver(store, engine, catalog.all()).resolve(normalized, saveId);
    }

    public CompressionStats compressionStats(String saveId) {
        requireInitialized();
        catalog.find(saveId);
        return CompressionStats.of(store.getDeltaSet(saveId));
    }

    /** For each path, whether the ignore-spec file on disk excludes it. */
    public Map<String, Boolean> checkIgnore(List<String> paths) {
        IgnoreRules rules = currentIgnoreRules();
        Map<String, Boolean> out = new LinkedHashMap<>();
        for (String p : paths) {
            out.put(p, rules.isIgnored(FileSystem.normalize(p)));
        }
        return out;
    }

    /**
     * Files a save would capture: everything outside the metadata area that
     * the ignore rules do not exclude, plus the ignore-spec file itself.
     * Sorted lexically.
     */
    List<String> trackedFiles() {
        IgnoreRules rules = currentIgnoreRules();
        List<String> files = new ArrayList<>();
        fs.walk("", (path, isDir) -> {
            if (layout.isMetadata(path)) return WalkAction.SKIP_SUBTREE;
            if (isDir) return WalkAction.CONTINUE;
            if (layout.isIgnoreFile(path) || !rules.isIgnored(path)) {
                files.add(path);
            }
            return WalkAction.CONTINUE;
        });
        Collections.sort(files);
        return files;
    }

    private IgnoreRules currentIgnoreRules() {
        if (!fs.exists(layout.ignoreFile())) {
            return IgnoreRules.none();
        }
        String text = new String(fs.readFile(layout.ignoreFile()), StandardCharsets.UTF_8);
        IgnoreRules rules = IgnoreRules.compile(text);
        log.log(Level.FINE, "loaded {0} ignore patterns", rules.patterns().size());
        return rules;
    }

    private void requireInitialized() {
        if (!isInitialized()) {
            throw new NotInitializedException(layout.metaDir());
        }
    }
}
