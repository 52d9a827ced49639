package org.iceforge.imgcache.fetch;

import java.util.Optional;

public record FetchResponse(
        int statusCode,
        String contentType,
        byte[] body
) {
    public FetchResponse {
        body = body == null ? new byte[0] : body;
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public Optional<ImageFormat> format() {
        return ImageFormat.fromContentType(contentType);
    }
}
