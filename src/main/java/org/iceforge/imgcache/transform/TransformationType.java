package org.iceforge.imgcache.transform;

import java.util.Optional;

/**
 * Kinds of image transformation. The numeric id is what the cache ledger stores,
 * so existing ids must never be renumbered.
 */
public enum TransformationType {
    CENTER_CROP(0),
    RESIZE(1),
    CIRCLE_CROP(2);

    private final int id;

    TransformationType(int id) {
        this.id = id;
    }

    public int id() {
        return id;
    }

    public static Optional<TransformationType> fromId(int id) {
        for (TransformationType t : values()) {
            if (t.id == id) return Optional.of(t);
        }
        return Optional.empty();
    }
}
