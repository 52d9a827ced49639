package org.iceforge.imgcache.loader;

/**
 * Receiver for {@link ImageLoader.RequestBuilder#into(ImageSink)}. The target behind a sink
 * may already be gone when the result arrives; implementations should then just return.
 */
public interface ImageSink {

    void onSuccess(LoadResult result);

    void onError(LoadResult result);

    /** Another request for the same key is already running. */
    default void onInProgress(LoadResult result) {
    }
}
