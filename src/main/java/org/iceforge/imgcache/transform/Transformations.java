package org.iceforge.imgcache.transform;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered list of transformations for one request. Adding a second transformation of a
 * kind already present fails.
 */
public final class Transformations {
    private final List<ImageTransformation> items = new ArrayList<>();

    public static Transformations none() {
        return new Transformations();
    }

    public Transformations centerCrop(int width, int height) {
        return add(new CenterCropTransformation(width, height));
    }

    public Transformations resize(int width, int height) {
        return add(new ResizeTransformation(width, height));
    }

    public Transformations circleCrop(CircleCropParams params) {
        return add(new CircleCropTransformation(params));
    }

    public Transformations circleCrop() {
        return circleCrop(CircleCropParams.defaults());
    }

    public Transformations add(ImageTransformation t) {
        for (ImageTransformation existing : items) {
            if (existing.type() == t.type()) {
                throw new IllegalStateException(t.type() + " transformation already added");
            }
        }
        items.add(t);
        return this;
    }

    public List<ImageTransformation> list() {
        return List.copyOf(items);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
