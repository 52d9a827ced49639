package org.iceforge.imgcache.transform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Runs a request's transformations in order, skipping kinds the input already carries.
 */
public class ImageTransformer {
    private static final Logger log = LoggerFactory.getLogger(ImageTransformer.class);

    public TransformResult apply(List<ImageTransformation> requested,
                                 BufferedImage input,
                                 Collection<TransformationType> alreadyApplied) {
        BufferedImage current = input;
        List<TransformationType> appliedNow = new ArrayList<>();
        List<TransformationType> skipped = new ArrayList<>();

        for (ImageTransformation t : requested) {
            if (alreadyApplied.contains(t.type())) {
                log.debug("Transformation {} already applied, skipping", t.type());
                skipped.add(t.type());
                continue;
            }
            log.debug("Applying transformation {}", t.type());
            current = t.transform(current);
            appliedNow.add(t.type());
        }
        return new TransformResult(current, appliedNow, skipped);
    }
}
