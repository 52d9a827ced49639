package org.iceforge.imgcache.loader;

import org.iceforge.imgcache.transform.ImageTransformation;

import java.util.List;
import java.util.Objects;

public record LoadRequest(
        String key,
        List<ImageTransformation> transformations,
        SaveStrategy saveStrategy
) {
    public LoadRequest {
        Objects.requireNonNull(key, "key");
        transformations = transformations == null ? List.of() : List.copyOf(transformations);
        saveStrategy = saveStrategy == null ? SaveStrategy.SAVE_ORIGINAL : saveStrategy;
    }
}
