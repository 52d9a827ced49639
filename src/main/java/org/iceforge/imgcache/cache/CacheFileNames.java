package org.iceforge.imgcache.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Payload file naming: {@code <id>_<first 16 hex chars of sha256(key)>.cached}.
 */
public final class CacheFileNames {
    static final String PAYLOAD_SUFFIX = ".cached";

    private CacheFileNames() {}

    public static String payloadName(long id, String key) {
        return id + "_" + sha256Hex(key).substring(0, 16) + PAYLOAD_SUFFIX;
    }

    static String sha256Hex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] dig = md.digest(s.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(dig.length * 2);
            for (byte b : dig) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (Exception e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
