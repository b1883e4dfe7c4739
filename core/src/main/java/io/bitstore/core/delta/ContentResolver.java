package io.bitstore.core.delta;

/**
 * Supplies the full content of {@code path} as of save {@code saveId}.
 * Used by {@link DeltaEngine#applyDelta} to fetch base content, and
 * implemented recursively by the storage layer.
 */
@FunctionalInterface
public interface ContentResolver {

    byte[] resolve(String path, String saveId);
}
