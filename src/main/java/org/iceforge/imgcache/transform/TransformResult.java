package org.iceforge.imgcache.transform;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * @param image          final image
 * @param appliedNow     transformations actually computed by this call, in order
 * @param alreadyApplied requested transformations skipped because the input already carried them
 */
public record TransformResult(
        BufferedImage image,
        List<TransformationType> appliedNow,
        List<TransformationType> alreadyApplied
) {
    public TransformResult {
        appliedNow = List.copyOf(appliedNow);
        alreadyApplied = List.copyOf(alreadyApplied);
    }

}
