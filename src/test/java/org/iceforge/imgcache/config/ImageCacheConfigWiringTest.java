package org.iceforge.imgcache.config;

import org.iceforge.imgcache.ImageCacheApplication;
import org.iceforge.imgcache.cache.DiskCache;
import org.iceforge.imgcache.fetch.HttpImageFetcher;
import org.iceforge.imgcache.fetch.ImageFetcher;
import org.iceforge.imgcache.loader.ImageLoader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

@SpringBootTest(
        classes = ImageCacheApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.NONE,
        properties = {
                "imgcache.max-size=2*1024*1024",
                "imgcache.loader-threads=3",
                "imgcache.fetch-timeout=3s"
        }
)
class ImageCacheConfigWiringTest {

    @TempDir
    static Path cacheRoot;

    @DynamicPropertySource
    static void cacheDir(DynamicPropertyRegistry registry) {
        registry.add("imgcache.cache-dir", () -> cacheRoot.resolve("images").toString());
    }

    @Test
    void contextBindsPropertiesAndWiresLoader(ApplicationContext ctx) {
        ImageCacheProperties props = ctx.getBean(ImageCacheProperties.class);
        assertThat(props.getMaxSizeBytes()).isEqualTo(2L * 1024 * 1024);
        assertThat(props.getLoaderThreads()).isEqualTo(3);

        DiskCache diskCache = ctx.getBean(DiskCache.class);
        assertThat(diskCache.maxBytes()).isEqualTo(2L * 1024 * 1024);
        assertThat(diskCache.cacheDir()).isEqualTo(cacheRoot.resolve("images").toAbsolutePath().normalize());

        assertThat(ctx.getBean(ImageFetcher.class)).isInstanceOf(HttpImageFetcher.class);
        assertThat(ctx.getBean(ImageLoader.class)).isNotNull();
    }

    @Test
    void maxImageBytesValue_parsesSizeExpression() {
        ImageCacheProperties props = new ImageCacheProperties();
        props.setMaxImageBytes("4MB");
        assertThat(props.getMaxImageBytesValue()).isEqualTo(4 * 1024 * 1024);

        props.setMaxImageBytes("4GB");
        assertThrows(IllegalArgumentException.class, props::getMaxImageBytesValue);
    }
}
