// file: core/src/main/java/io/bitstore/core/ignore/IgnoreRules.java
package io.bitstore.core.ignore;

import java.nio.file.FileSystems;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.PatternSyntaxException;

/**
 * Compiled ignore-spec patterns.
 * <p>
 * Rules for each line of the ignore-spec file:
 *  - blank lines and lines starting with '#' are skipped,
 *  - a trailing '/' roots a directory: "build/" matches everything below build,
 *  - a pattern without '/' matches the basename anywhere: "*.log" matches
 *    "a.log" and "x/y/a.log",
 *  - otherwise the glob is matched against the whole forward-slash path.
 */
public final class IgnoreRules {

    private static final IgnoreRules NONE = new IgnoreRules(List.of(), List.of());

    private final List<String> patterns;
    private final List<PathMatcher> matchers;

    private IgnoreRules(List<String> patterns, List<PathMatcher> matchers) {
        this.patterns = List.copyOf(patterns);
        this.matchers = List.copyOf(matchers);
    }

    public static IgnoreRules none() {
        return NONE;
    }

    /**
     * @throws IllegalArgumentException if a line is not a valid glob
     */
    public static IgnoreRules compile(String specText) {
        if (specText == null || specText.isBlank()) return NONE;

        List<String> globs = new ArrayList<>();
        List<PathMatcher> matchers = new ArrayList<>();
        for (String raw : specText.split("\r?\n")) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;

            String glob = line;
            if (glob.endsWith("/")) glob = glob + "**";
            if (!glob.contains("/")) glob = "**/" + glob;

            try {
                matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob));
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("invalid ignore pattern '" + line + "': " + e.getDescription(), e);
            }
            globs.add(glob);
        }
        return new IgnoreRules(globs, matchers);
    }

    /**
     * True when any pattern matches the path. Backslashes are normalized to
     * '/', and a "./" prefixed form is also tried so "**&#47;x" globs match
     * top-level entries.
     */
    public boolean isIgnored(String path) {
        if (matchers.isEmpty()) return false;
        String normalized = path.replace('\\', '/');
        Path plain;
        Path dotted;
        try {
            plain = Path.of(normalized);
            dotted = Path.of("./" + normalized);
        } catch (InvalidPathException e) {
            return false;
        }
        for (PathMatcher m : matchers) {
            if (m.matches(plain) || m.matches(dotted)) return true;
        }
        return false;
    }

    /** The compiled globs, after directory and basename expansion. */
    public List<String> patterns() {
        return patterns;
    }

    public boolean isEmpty() {
        return matchers.isEmpty();
    }
}
