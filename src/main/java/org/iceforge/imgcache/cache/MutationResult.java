package org.iceforge.imgcache.cache;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a mutating {@link DiskCache} call.
 *
 * @param stored         false only for a store that was refused (payload larger than the budget)
 * @param removedKeys    keys dropped by the call (eviction victims, the removed key, or everything on clear)
 * @param undeletedFiles payload files that still exist because deleting them failed; their records are gone
 */
public record MutationResult(
        boolean stored,
        List<String> removedKeys,
        List<Path> undeletedFiles
) {
    public MutationResult {
        removedKeys = List.copyOf(removedKeys);
        undeletedFiles = List.copyOf(undeletedFiles);
    }

    public static MutationResult notStored() {
        return new MutationResult(false, List.of(), List.of());
    }

    public static MutationResult of(List<String> removedKeys, List<Path> undeletedFiles) {
        return new MutationResult(true, removedKeys, undeletedFiles);
    }

    public boolean hasWarnings() {
        return !undeletedFiles.isEmpty();
    }
}
