package org.iceforge.imgcache.cache;

import org.iceforge.imgcache.transform.TransformationType;

import java.util.List;
import java.util.Objects;

/**
 * Metadata for one cached payload.
 *
 * @param key                    cache key (the source URL in practice)
 * @param fileName               bare file name inside the cache directory
 * @param sizeBytes              payload size on disk
 * @param timestamp              logical time of the last store or successful get
 * @param appliedTransformations transformations already baked into the stored bytes, in application order
 */
public record CacheRecord(
        String key,
        String fileName,
        long sizeBytes,
        long timestamp,
        List<TransformationType> appliedTransformations
) {
    public CacheRecord {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(fileName, "fileName");
        appliedTransformations = appliedTransformations == null ? List.of() : List.copyOf(appliedTransformations);
    }

    public CacheRecord withTimestamp(long newTimestamp) {
        return new CacheRecord(key, fileName, sizeBytes, newTimestamp, appliedTransformations);
    }

    public CacheRecord withSize(long newSize) {
        return new CacheRecord(key, fileName, newSize, timestamp, appliedTransformations);
    }
}
