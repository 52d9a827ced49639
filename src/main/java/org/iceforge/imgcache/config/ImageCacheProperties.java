package org.iceforge.imgcache.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration for the disk cache and the loader in front of it.
 * <p>
 * Defaults are small and safe for local dev.
 */
@ConfigurationProperties(prefix = "imgcache")
public class ImageCacheProperties {

    /** Directory holding cached payloads and the ledger. */
    private String cacheDir = "./data/image-cache";

    /** Byte budget for all cached payloads, e.g. "96MB". */
    private String maxSize = "96MB";

    /** Worker threads running loads in parallel. */
    private int loaderThreads = 2;

    /** Capacity of the disk cache command queue; a full queue blocks callers. */
    private int commandQueueCapacity = 1024;

    /** Timeout for one image fetch. */
    private Duration fetchTimeout = Duration.ofSeconds(10);

    /** Largest response body the HTTP fetcher buffers, e.g. "16MB". */
    private String maxImageBytes = "16MB";

    public String getCacheDir() {
        return cacheDir;
    }

    public void setCacheDir(String cacheDir) {
        this.cacheDir = cacheDir;
    }

    public String getMaxSize() {
        return maxSize;
    }

    public void setMaxSize(String maxSize) {
        this.maxSize = maxSize;
    }

    public long getMaxSizeBytes() {
        return DataSizeParser.parseBytes(maxSize);
    }

    public int getLoaderThreads() {
        return loaderThreads;
    }

    public void setLoaderThreads(int loaderThreads) {
        this.loaderThreads = loaderThreads;
    }

    public int getCommandQueueCapacity() {
        return commandQueueCapacity;
    }

    public void setCommandQueueCapacity(int commandQueueCapacity) {
        this.commandQueueCapacity = commandQueueCapacity;
    }

    public Duration getFetchTimeout() {
        return fetchTimeout;
    }

    public void setFetchTimeout(Duration fetchTimeout) {
        this.fetchTimeout = fetchTimeout;
    }

    public String getMaxImageBytes() {
        return maxImageBytes;
    }

    public void setMaxImageBytes(String maxImageBytes) {
        this.maxImageBytes = maxImageBytes;
    }

    public int getMaxImageBytesValue() {
        long v = DataSizeParser.parseBytes(maxImageBytes);
        if (v > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("maxImageBytes out of range: " + maxImageBytes);
        }
        return (int) v;
    }
}
