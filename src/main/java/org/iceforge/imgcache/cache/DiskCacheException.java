package org.iceforge.imgcache.cache;

public class DiskCacheException extends RuntimeException {
    public DiskCacheException(String message, Throwable cause) { super(message, cause); }
    public DiskCacheException(String message) { super(message); }
}
