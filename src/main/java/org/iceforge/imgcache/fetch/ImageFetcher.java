package org.iceforge.imgcache.fetch;

import java.io.IOException;

/**
 * Network side of the loader. Implementations do not retry; a failed fetch simply fails
 * the request.
 */
public interface ImageFetcher {

    /**
     * @throws IOException when no response could be obtained at all
     */
    FetchResponse fetch(String url) throws IOException;
}
