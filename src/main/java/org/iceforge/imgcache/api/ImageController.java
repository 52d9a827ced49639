package org.iceforge.imgcache.api;

import org.iceforge.imgcache.loader.ImageLoader;
import org.iceforge.imgcache.loader.LoadResult;
import org.iceforge.imgcache.loader.SaveStrategy;
import org.iceforge.imgcache.transform.Transformations;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;

/**
 * Loads an image through the cache and returns it as PNG.
 * <p>
 * Transformations run in a fixed order: centerCrop, resize, circleCrop.
 */
@RestController
@RequestMapping("/api")
public class ImageController {

    static final String CACHE_HEADER = "X-Cache";

    private final ImageLoader loader;

    public ImageController(ImageLoader loader) {
        this.loader = Objects.requireNonNull(loader);
    }

    @GetMapping("/images")
    public ResponseEntity<byte[]> image(@RequestParam("url") String url,
                                        @RequestParam(value = "centerCrop", required = false) String centerCrop,
                                        @RequestParam(value = "resize", required = false) String resize,
                                        @RequestParam(value = "circleCrop", defaultValue = "false") boolean circleCrop,
                                        @RequestParam(value = "save", defaultValue = "original") String save) throws IOException {
        if (url.isBlank()) {
            return text(HttpStatus.BAD_REQUEST, "url must not be blank");
        }
        Transformations transformations = Transformations.none();
        SaveStrategy saveStrategy;
        try {
            if (centerCrop != null) {
                int[] wh = parseDimensions(centerCrop);
                transformations.centerCrop(wh[0], wh[1]);
            }
            if (resize != null) {
                int[] wh = parseDimensions(resize);
                transformations.resize(wh[0], wh[1]);
            }
            if (circleCrop) {
                transformations.circleCrop();
            }
            saveStrategy = parseSaveStrategy(save);
        } catch (IllegalArgumentException e) {
            return text(HttpStatus.BAD_REQUEST, e.getMessage());
        }

        LoadResult result = loader.newRequest()
                .load(url)
                .transformations(transformations)
                .saveStrategy(saveStrategy)
                .getAsync()
                .join();

        return switch (result.status()) {
            case HIT, LOADED -> ResponseEntity.ok()
                    .contentType(MediaType.IMAGE_PNG)
                    .header(CACHE_HEADER, result.status() == LoadResult.Status.HIT ? "HIT" : "MISS")
                    .body(ImageLoader.encodePng(result.image()));
            case IN_PROGRESS -> text(HttpStatus.CONFLICT, "request already in progress for " + url);
            case FAILED -> text(HttpStatus.BAD_GATEWAY, result.error());
        };
    }

    static int[] parseDimensions(String value) {
        String[] parts = value.toLowerCase(Locale.ROOT).split("x");
        if (parts.length != 2) {
            throw new IllegalArgumentException("expected WIDTHxHEIGHT, got " + value);
        }
        try {
            return new int[]{Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim())};
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("expected WIDTHxHEIGHT, got " + value, e);
        }
    }

    static SaveStrategy parseSaveStrategy(String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "original" -> SaveStrategy.SAVE_ORIGINAL;
            case "transformed" -> SaveStrategy.SAVE_TRANSFORMED;
            default -> throw new IllegalArgumentException("save must be 'original' or 'transformed', got " + value);
        };
    }

    private static ResponseEntity<byte[]> text(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .contentType(MediaType.TEXT_PLAIN)
                .body(String.valueOf(message).getBytes(StandardCharsets.UTF_8));
    }
}
