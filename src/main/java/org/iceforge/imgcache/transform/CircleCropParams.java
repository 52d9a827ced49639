package org.iceforge.imgcache.transform;

import java.awt.Color;
import java.util.Objects;

/**
 * @param backgroundColor colour painted outside the circle
 * @param strokeColor     border colour, or null for no border
 * @param strokeWidth     border width in pixels, ignored without a colour
 */
public record CircleCropParams(Color backgroundColor, Color strokeColor, float strokeWidth) {

    public CircleCropParams {
        Objects.requireNonNull(backgroundColor, "backgroundColor");
        if (strokeWidth < 0f) {
            throw new IllegalArgumentException("strokeWidth must not be negative: " + strokeWidth);
        }
    }

    public static CircleCropParams defaults() {
        return new CircleCropParams(Color.BLACK, null, 0f);
    }

    public CircleCropParams withBackground(Color color) {
        return new CircleCropParams(color, strokeColor, strokeWidth);
    }

    public CircleCropParams withStroke(float width, Color color) {
        return new CircleCropParams(backgroundColor, color, width);
    }

    public boolean hasStroke() {
        return strokeColor != null && strokeWidth > 0f;
    }
}
