package org.iceforge.imgcache;

import org.iceforge.imgcache.config.ImageCacheProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ImageCacheProperties.class)
public class ImageCacheApplication {

	public static void main(String[] args) {
		SpringApplication.run(ImageCacheApplication.class, args);
	}
}
