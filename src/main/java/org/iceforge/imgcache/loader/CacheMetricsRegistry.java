package org.iceforge.imgcache.loader;

import java.util.concurrent.atomic.LongAdder;

/**
 * In-memory loader counters.
 * <p>
 * A hit is a request served from the disk cache, a miss one that went to the network.
 * Rejected counts duplicates turned away at admission.
 */
public class CacheMetricsRegistry {
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder rejected = new LongAdder();
    private final LongAdder failures = new LongAdder();

    public void recordHit() { hits.increment(); }
    public void recordMiss() { misses.increment(); }
    public void recordRejected() { rejected.increment(); }
    public void recordFailure() { failures.increment(); }

    public long hits() { return hits.sum(); }
    public long misses() { return misses.sum(); }
    public long rejected() { return rejected.sum(); }
    public long failures() { return failures.sum(); }
}
