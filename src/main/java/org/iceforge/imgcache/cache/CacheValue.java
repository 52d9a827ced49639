package org.iceforge.imgcache.cache;

import org.iceforge.imgcache.transform.TransformationType;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * What a cache hit hands back: where the bytes live and which transformations they already carry.
 */
public record CacheValue(
        String key,
        Path file,
        long sizeBytes,
        List<TransformationType> appliedTransformations
) {
    public CacheValue {
        appliedTransformations = appliedTransformations == null ? List.of() : List.copyOf(appliedTransformations);
    }

    public byte[] readBytes() throws IOException {
        return Files.readAllBytes(file);
    }
}
