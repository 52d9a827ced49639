package org.iceforge.imgcache.cache;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Oldest-first victim selection, weighted by size. Ties on timestamp fall back to key
 * order so the outcome is deterministic.
 */
public final class EvictionPolicy {

    /** Share of the budget reclaimed whenever a store would overflow it. */
    public static final double RECLAIM_FRACTION = 0.3;

    static final Comparator<CacheRecord> OLDEST_FIRST =
            Comparator.comparingLong(CacheRecord::timestamp).thenComparing(CacheRecord::key);

    private EvictionPolicy() {}

    /**
     * Picks records, oldest first, until their sizes add up to at least {@code bytesToReclaim}.
     * When the whole cache is smaller than the target every record is returned.
     */
    public static List<CacheRecord> selectVictims(Collection<CacheRecord> records, long bytesToReclaim) {
        List<CacheRecord> victims = new ArrayList<>();
        if (bytesToReclaim <= 0L) return victims;

        List<CacheRecord> sorted = new ArrayList<>(records);
        sorted.sort(OLDEST_FIRST);

        long accumulated = 0L;
        for (CacheRecord r : sorted) {
            if (accumulated >= bytesToReclaim) break;
            accumulated += r.sizeBytes();
            victims.add(r);
        }
        return victims;
    }

    /** Bytes a store of {@code newSize} must free once {@code currentTotal + newSize} exceeds {@code maxBytes}. */
    public static long reclaimTarget(long maxBytes, long newSize) {
        return Math.max((long) (maxBytes * RECLAIM_FRACTION), newSize);
    }

    public static Optional<CacheRecord> oldest(Collection<CacheRecord> records) {
        return records.stream().min(OLDEST_FIRST);
    }
}
