package org.iceforge.imgcache.api;

import org.iceforge.imgcache.cache.DiskCache;
import org.iceforge.imgcache.cache.MutationResult;
import org.iceforge.imgcache.loader.CacheMetricsRegistry;
import org.iceforge.imgcache.loader.RequestArbitrator;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

@RestController
@RequestMapping("/api")
public class CacheStatsController {

    private final CacheMetricsRegistry metrics;
    private final DiskCache diskCache;
    private final RequestArbitrator arbitrator;

    public CacheStatsController(CacheMetricsRegistry metrics, DiskCache diskCache, RequestArbitrator arbitrator) {
        this.metrics = Objects.requireNonNull(metrics);
        this.diskCache = Objects.requireNonNull(diskCache);
        this.arbitrator = Objects.requireNonNull(arbitrator);
    }

    @GetMapping("/cache/stats")
    public Map<String, Object> stats() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("hits", metrics.hits());
        out.put("misses", metrics.misses());
        out.put("rejected", metrics.rejected());
        out.put("failures", metrics.failures());
        out.put("inFlight", arbitrator.activeCount());
        out.put("bytesUsed", diskCache.size());
        out.put("entryCount", diskCache.count());
        out.put("maxBytes", diskCache.maxBytes());
        out.put("cacheDir", diskCache.cacheDir().toString());
        return out;
    }

    @DeleteMapping("/cache")
    public Map<String, Object> clear() {
        return describe(diskCache.clear());
    }

    @DeleteMapping("/cache/entries")
    public Map<String, Object> remove(@RequestParam("key") String key) {
        return describe(diskCache.remove(key));
    }

    private static Map<String, Object> describe(MutationResult result) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("removed", result.removedKeys().size());
        out.put("undeletedFiles", result.undeletedFiles().stream().map(Object::toString).toList());
        return out;
    }
}
