package org.iceforge.imgcache.loader;

import org.iceforge.imgcache.transform.TransformationType;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Outcome of one load.
 *
 * @param status         HIT (served from cache), LOADED (fetched), IN_PROGRESS (duplicate turned away) or FAILED
 * @param image          the final image; null unless HIT or LOADED
 * @param applied        transformations computed by this load
 * @param alreadyApplied requested transformations skipped because the cached bytes already carried them
 * @param error          failure description; null unless FAILED
 */
public record LoadResult(
        Status status,
        String key,
        BufferedImage image,
        List<TransformationType> applied,
        List<TransformationType> alreadyApplied,
        String error
) {
    public enum Status {
        HIT,
        LOADED,
        IN_PROGRESS,
        FAILED
    }

    public LoadResult {
        applied = applied == null ? List.of() : List.copyOf(applied);
        alreadyApplied = alreadyApplied == null ? List.of() : List.copyOf(alreadyApplied);
    }

    public static LoadResult hit(String key, BufferedImage image,
                                 List<TransformationType> applied, List<TransformationType> alreadyApplied) {
        return new LoadResult(Status.HIT, key, image, applied, alreadyApplied, null);
    }

    public static LoadResult loaded(String key, BufferedImage image, List<TransformationType> applied) {
        return new LoadResult(Status.LOADED, key, image, applied, List.of(), null);
    }

    public static LoadResult inProgress(String key) {
        return new LoadResult(Status.IN_PROGRESS, key, null, List.of(), List.of(), null);
    }

    public static LoadResult failed(String key, String error) {
        return new LoadResult(Status.FAILED, key, null, List.of(), List.of(), error);
    }
}
