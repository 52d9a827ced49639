package org.iceforge.imgcache.transform;

import java.awt.image.BufferedImage;

/**
 * One idempotent, named image operation. At most one instance of each
 * {@link TransformationType} may appear in a request.
 */
public interface ImageTransformation {

    TransformationType type();

    BufferedImage transform(BufferedImage input);
}
