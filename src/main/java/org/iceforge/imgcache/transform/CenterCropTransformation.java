package org.iceforge.imgcache.transform;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Scales the image so it covers {@code width x height}, then keeps the centred region of
 * exactly that size.
 */
public record CenterCropTransformation(int width, int height) implements ImageTransformation {

    public CenterCropTransformation {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("crop dimensions must be positive: " + width + "x" + height);
        }
    }

    @Override
    public TransformationType type() {
        return TransformationType.CENTER_CROP;
    }

    @Override
    public BufferedImage transform(BufferedImage input) {
        int srcW = input.getWidth();
        int srcH = input.getHeight();
        if (srcW == width && srcH == height) {
            return input;
        }

        double scale = Math.max((double) width / srcW, (double) height / srcH);
        double scaledW = srcW * scale;
        double scaledH = srcH * scale;
        double dx = (width - scaledW) / 2.0;
        double dy = (height - scaledH) / 2.0;

        BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = out.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(input,
                    (int) Math.round(dx), (int) Math.round(dy),
                    (int) Math.round(scaledW), (int) Math.round(scaledH),
                    null);
        } finally {
            g.dispose();
        }
        return out;
    }
}
