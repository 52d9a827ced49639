package org.iceforge.imgcache.fetch;

import java.util.Locale;
import java.util.Optional;

/** Image content types the loader accepts. */
public enum ImageFormat {
    PNG,
    JPEG;

    public static Optional<ImageFormat> fromContentType(String contentType) {
        if (contentType == null) return Optional.empty();
        String mime = contentType;
        int semi = mime.indexOf(';');
        if (semi >= 0) mime = mime.substring(0, semi);
        mime = mime.trim().toLowerCase(Locale.ROOT);

        return switch (mime) {
            case "image/png" -> Optional.of(PNG);
            case "image/jpeg", "image/jpg" -> Optional.of(JPEG);
            default -> Optional.empty();
        };
    }
}
