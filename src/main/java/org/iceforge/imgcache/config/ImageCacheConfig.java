package org.iceforge.imgcache.config;

import org.iceforge.imgcache.cache.DiskCache;
import org.iceforge.imgcache.fetch.HttpImageFetcher;
import org.iceforge.imgcache.fetch.ImageFetcher;
import org.iceforge.imgcache.loader.CacheMetricsRegistry;
import org.iceforge.imgcache.loader.ImageLoader;
import org.iceforge.imgcache.loader.RequestArbitrator;
import org.iceforge.imgcache.transform.ImageTransformer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ImageCacheConfig {

    @Bean(destroyMethod = "close")
    public DiskCache diskCache(ImageCacheProperties props) {
        return new DiskCache(props.getMaxSizeBytes(), Path.of(props.getCacheDir()), props.getCommandQueueCapacity());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService loaderExecutor(ImageCacheProperties props) {
        int threads = Math.max(1, props.getLoaderThreads());
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "imgcache-loader");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public ImageFetcher imageFetcher(WebClient.Builder builder, ImageCacheProperties props) {
        return new HttpImageFetcher(builder, props.getFetchTimeout(), props.getMaxImageBytesValue());
    }

    @Bean
    public ImageTransformer imageTransformer() {
        return new ImageTransformer();
    }

    @Bean
    public RequestArbitrator requestArbitrator() {
        return new RequestArbitrator();
    }

    @Bean
    public CacheMetricsRegistry cacheMetricsRegistry() {
        return new CacheMetricsRegistry();
    }

    @Bean(destroyMethod = "close")
    public ImageLoader imageLoader(DiskCache diskCache,
                                   ImageFetcher imageFetcher,
                                   ImageTransformer imageTransformer,
                                   RequestArbitrator requestArbitrator,
                                   CacheMetricsRegistry cacheMetricsRegistry,
                                   ExecutorService loaderExecutor) {
        return new ImageLoader(diskCache, imageFetcher, imageTransformer, requestArbitrator,
                cacheMetricsRegistry, loaderExecutor);
    }
}
