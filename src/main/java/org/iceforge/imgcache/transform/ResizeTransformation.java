package org.iceforge.imgcache.transform;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/** Scales to exactly {@code width x height}, ignoring aspect ratio. */
public record ResizeTransformation(int width, int height) implements ImageTransformation {

    public ResizeTransformation {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("resize dimensions must be positive: " + width + "x" + height);
        }
    }

    @Override
    public TransformationType type() {
        return TransformationType.RESIZE;
    }

    @Override
    public BufferedImage transform(BufferedImage input) {
        if (input.getWidth() == width && input.getHeight() == height) {
            return input;
        }
        BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = out.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(input, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return out;
    }
}
