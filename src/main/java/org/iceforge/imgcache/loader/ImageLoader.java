package org.iceforge.imgcache.loader;

import org.iceforge.imgcache.cache.CacheValue;
import org.iceforge.imgcache.cache.DiskCache;
import org.iceforge.imgcache.cache.MutationResult;
import org.iceforge.imgcache.fetch.FetchResponse;
import org.iceforge.imgcache.fetch.ImageFetcher;
import org.iceforge.imgcache.transform.ImageTransformation;
import org.iceforge.imgcache.transform.ImageTransformer;
import org.iceforge.imgcache.transform.TransformResult;
import org.iceforge.imgcache.transform.Transformations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Get-or-populate front end over the {@link DiskCache}.
 *
 * <p>Per request: admission, cache lookup, then either the hit path (apply only the
 * transformations the cached bytes lack) or fetch, transform and persist. Requests for
 * different keys run in parallel on the worker pool. A duplicate for a key that is in
 * flight resolves to {@link LoadResult.Status#IN_PROGRESS} immediately.
 *
 * <p>No request ever completes exceptionally: failures become {@link LoadResult.Status#FAILED}.
 */
public class ImageLoader implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ImageLoader.class);

    private final DiskCache diskCache;
    private final ImageFetcher fetcher;
    private final ImageTransformer transformer;
    private final RequestArbitrator arbitrator;
    private final CacheMetricsRegistry metrics;
    private final ExecutorService loaderExecutor;
    private volatile boolean closed;

    public ImageLoader(DiskCache diskCache,
                       ImageFetcher fetcher,
                       ImageTransformer transformer,
                       RequestArbitrator arbitrator,
                       CacheMetricsRegistry metrics,
                       ExecutorService loaderExecutor) {
        this.diskCache = Objects.requireNonNull(diskCache);
        this.fetcher = Objects.requireNonNull(fetcher);
        this.transformer = Objects.requireNonNull(transformer);
        this.arbitrator = Objects.requireNonNull(arbitrator);
        this.metrics = Objects.requireNonNull(metrics);
        this.loaderExecutor = Objects.requireNonNull(loaderExecutor);
    }

    public RequestBuilder newRequest() {
        return new RequestBuilder();
    }

    /**
     * Admits and schedules a request. The returned future always completes normally.
     */
    public CompletableFuture<LoadResult> submit(LoadRequest request) {
        Objects.requireNonNull(request, "request");
        String key = request.key();

        if (!arbitrator.tryAdmit(key)) {
            metrics.recordRejected();
            return CompletableFuture.completedFuture(LoadResult.inProgress(key));
        }

        LoadTask task = new LoadTask(request);
        if (closed) {
            task.abort("loader shut down");
            return task.future;
        }
        try {
            loaderExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            task.abort("loader shut down");
        }
        return task.future;
    }

    /**
     * Stops the worker pool. Requests that never started, and those interrupted while running,
     * resolve to FAILED and release their keys.
     */
    @Override
    public void close() {
        if (closed) return;
        closed = true;
        for (Runnable r : loaderExecutor.shutdownNow()) {
            if (r instanceof LoadTask task) {
                task.abort("loader shut down");
            }
        }
        logger.info("Image loader shut down; {} request(s) were still active", arbitrator.activeCount());
    }

    LoadResult load(LoadRequest request) {
        String key = request.key();
        try {
            Optional<CacheValue> cached = diskCache.get(key);
            if (cached.isPresent()) {
                Optional<LoadResult> hit = fromCache(request, cached.get());
                if (hit.isPresent()) {
                    metrics.recordHit();
                    return hit.get();
                }
            }
            metrics.recordMiss();
            return fromNetwork(request);
        } catch (Exception e) {
            metrics.recordFailure();
            logger.warn("Image load failed key={}: {}", key, e.toString());
            return LoadResult.failed(key, e.toString());
        }
    }

    /**
     * Serves a hit. Bytes that cannot be read (the file may have been evicted after the lookup)
     * or decoded drop the entry and return empty, so the caller falls through to the network.
     */
    private Optional<LoadResult> fromCache(LoadRequest request, CacheValue value) {
        BufferedImage image;
        try {
            image = decode(value.readBytes());
        } catch (IOException e) {
            logger.warn("Cached file {} for key {} could not be read, dropping it: {}", value.file(), value.key(), e.toString());
            diskCache.remove(value.key());
            return Optional.empty();
        }
        if (image == null) {
            logger.warn("Cached file {} for key {} is not a readable image, dropping it", value.file(), value.key());
            diskCache.remove(value.key());
            return Optional.empty();
        }
        logger.debug("Cache hit key={} alreadyApplied={}", value.key(), value.appliedTransformations());

        TransformResult tr = transformer.apply(request.transformations(), image, value.appliedTransformations());
        return Optional.of(LoadResult.hit(request.key(), tr.image(), tr.appliedNow(), tr.alreadyApplied()));
    }

    private LoadResult fromNetwork(LoadRequest request) throws IOException {
        String key = request.key();
        logger.debug("Cache miss key={}, fetching", key);

        FetchResponse response = fetcher.fetch(key);
        if (response == null) {
            return fail(key, "no response");
        }
        if (!response.isSuccess()) {
            return fail(key, "HTTP status " + response.statusCode());
        }
        if (response.format().isEmpty()) {
            return fail(key, "unsupported content type " + response.contentType());
        }
        if (response.body().length == 0) {
            return fail(key, "empty body");
        }
        BufferedImage image = decode(response.body());
        if (image == null) {
            return fail(key, "could not decode image");
        }

        List<ImageTransformation> requested = request.transformations();
        TransformResult tr = transformer.apply(requested, image, List.of());

        MutationResult stored = switch (request.saveStrategy()) {
            case SAVE_ORIGINAL -> diskCache.store(key, response.body(), List.of());
            case SAVE_TRANSFORMED -> diskCache.store(key, encodePng(tr.image()), tr.appliedNow());
        };
        if (!stored.stored()) {
            logger.warn("Image for key={} was not cached (larger than the cache budget)", key);
        }
        if (stored.hasWarnings()) {
            logger.warn("Storing key={} left undeletable files behind: {}", key, stored.undeletedFiles());
        }
        return LoadResult.loaded(key, tr.image(), tr.appliedNow());
    }

    private LoadResult fail(String key, String reason) {
        metrics.recordFailure();
        logger.warn("Image load failed key={}: {}", key, reason);
        return LoadResult.failed(key, reason);
    }

    private static BufferedImage decode(byte[] bytes) throws IOException {
        return ImageIO.read(new ByteArrayInputStream(bytes));
    }

    public static byte[] encodePng(BufferedImage image) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (!ImageIO.write(image, "png", out)) {
            throw new IOException("No PNG writer available");
        }
        return out.toByteArray();
    }

    private final class LoadTask implements Runnable {
        private final LoadRequest request;
        private final CompletableFuture<LoadResult> future = new CompletableFuture<>();

        private LoadTask(LoadRequest request) {
            this.request = request;
        }

        @Override
        public void run() {
            LoadResult result;
            Error fatal = null;
            try {
                result = load(request);
            } catch (Error e) {
                fatal = e;
                metrics.recordFailure();
                logger.error("Image load aborted key={}", request.key(), e);
                result = LoadResult.failed(request.key(), e.toString());
            } finally {
                arbitrator.release(request.key());
            }
            future.complete(result);
            if (fatal != null) {
                throw fatal;
            }
        }

        void abort(String reason) {
            arbitrator.release(request.key());
            metrics.recordFailure();
            future.complete(LoadResult.failed(request.key(), reason));
        }
    }

    /**
     * Fluent request construction. {@link #getAsync()} and {@link #into(ImageSink)} are the two
     * delivery modes; both go through the same pipeline.
     */
    public final class RequestBuilder {
        private String url;
        private SaveStrategy saveStrategy = SaveStrategy.SAVE_ORIGINAL;
        private Transformations transformations = Transformations.none();

        private RequestBuilder() {}

        public RequestBuilder load(String url) {
            this.url = url;
            return this;
        }

        public RequestBuilder transformations(Transformations transformations) {
            this.transformations = Objects.requireNonNull(transformations, "transformations");
            return this;
        }

        public RequestBuilder saveStrategy(SaveStrategy saveStrategy) {
            this.saveStrategy = Objects.requireNonNull(saveStrategy, "saveStrategy");
            return this;
        }

        public LoadRequest build() {
            if (url == null || url.isBlank()) {
                throw new IllegalStateException("url is not set");
            }
            return new LoadRequest(url, transformations.list(), saveStrategy);
        }

        public CompletableFuture<LoadResult> getAsync() {
            return submit(build());
        }

        public void into(ImageSink sink) {
            Objects.requireNonNull(sink, "sink");
            submit(build()).thenAccept(result -> deliver(sink, result));
        }
    }

    private static void deliver(ImageSink sink, LoadResult result) {
        try {
            switch (result.status()) {
                case HIT, LOADED -> sink.onSuccess(result);
                case IN_PROGRESS -> sink.onInProgress(result);
                case FAILED -> sink.onError(result);
            }
        } catch (RuntimeException e) {
            logger.warn("Image sink failed for key={}", result.key(), e);
        }
    }
}
