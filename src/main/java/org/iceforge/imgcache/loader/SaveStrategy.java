package org.iceforge.imgcache.loader;

/** What a cache miss persists. */
public enum SaveStrategy {
    /** The fetched bytes, untouched. */
    SAVE_ORIGINAL,
    /** The transformed image as PNG, recorded with the transformations it carries. */
    SAVE_TRANSFORMED
}
