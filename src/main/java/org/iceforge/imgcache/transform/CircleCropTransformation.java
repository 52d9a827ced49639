package org.iceforge.imgcache.transform;

import java.awt.BasicStroke;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.Ellipse2D;
import java.awt.image.BufferedImage;
import java.util.Objects;

/** Masks a square image to a circle. Non-square input is rejected. */
public record CircleCropTransformation(CircleCropParams params) implements ImageTransformation {

    public CircleCropTransformation {
        Objects.requireNonNull(params, "params");
    }

    @Override
    public TransformationType type() {
        return TransformationType.CIRCLE_CROP;
    }

    @Override
    public BufferedImage transform(BufferedImage input) {
        if (input.getWidth() != input.getHeight()) {
            throw new IllegalArgumentException("circle crop needs a square image, got "
                    + input.getWidth() + "x" + input.getHeight());
        }
        int size = input.getWidth();

        BufferedImage out = new BufferedImage(size, size, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = out.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setPaint(params.backgroundColor());
            g.fillRect(0, 0, size, size);

            Ellipse2D circle = new Ellipse2D.Float(0f, 0f, size, size);
            g.setClip(circle);
            g.drawImage(input, 0, 0, size, size, null);

            if (params.hasStroke()) {
                g.setClip(null);
                g.setColor(params.strokeColor());
                g.setStroke(new BasicStroke(params.strokeWidth()));
                g.draw(circle);
            }
        } finally {
            g.dispose();
        }
        return out;
    }
}
