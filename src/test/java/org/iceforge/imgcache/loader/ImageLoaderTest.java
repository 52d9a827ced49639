package org.iceforge.imgcache.loader;

import org.iceforge.imgcache.cache.CacheValue;
import org.iceforge.imgcache.cache.DiskCache;
import org.iceforge.imgcache.cache.MetadataStore;
import org.iceforge.imgcache.fetch.FetchResponse;
import org.iceforge.imgcache.fetch.ImageFetcher;
import org.iceforge.imgcache.transform.ImageTransformation;
import org.iceforge.imgcache.transform.ImageTransformer;
import org.iceforge.imgcache.transform.TransformationType;
import org.iceforge.imgcache.transform.Transformations;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mockito;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ImageLoaderTest {

    private static final String URL = "https://images.example.com/cat.png";

    @TempDir
    Path cacheDir;

    private DiskCache diskCache;
    private ImageFetcher fetcher;
    private RequestArbitrator arbitrator;
    private CacheMetricsRegistry metrics;
    private ExecutorService exec;
    private ImageLoader loader;

    @BeforeEach
    void setUp() {
        diskCache = new DiskCache(10L * 1024 * 1024, cacheDir);
        fetcher = Mockito.mock(ImageFetcher.class);
        arbitrator = new RequestArbitrator();
        metrics = new CacheMetricsRegistry();
        exec = Executors.newFixedThreadPool(4);
        loader = new ImageLoader(diskCache, fetcher, new ImageTransformer(), arbitrator, metrics, exec);
    }

    @AfterEach
    void tearDown() {
        loader.close();
        diskCache.close();
    }

    // ----------------------------------------------------------------------
    // Helpers
    // ----------------------------------------------------------------------

    private static byte[] png(int width, int height) throws IOException {
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        try {
            g.setColor(Color.ORANGE);
            g.fillRect(0, 0, width, height);
            g.setColor(Color.BLUE);
            g.fillRect(width / 4, height / 4, width / 2, height / 2);
        } finally {
            g.dispose();
        }
        return ImageLoader.encodePng(img);
    }

    private static FetchResponse ok(byte[] body) {
        return new FetchResponse(200, "image/png", body);
    }

    private LoadResult await(CompletableFuture<LoadResult> f) throws Exception {
        return f.get(10, TimeUnit.SECONDS);
    }

    private List<String> ledgerLines() throws IOException {
        return Files.readAllLines(cacheDir.resolve(MetadataStore.LEDGER_FILE), StandardCharsets.UTF_8);
    }

    private long payloadFileCount() throws IOException {
        try (Stream<Path> s = Files.list(cacheDir)) {
            return s.filter(p -> !p.getFileName().toString().equals(MetadataStore.LEDGER_FILE)).count();
        }
    }

    private static ImageTransformation passThrough(TransformationType type) {
        ImageTransformation t = Mockito.mock(ImageTransformation.class);
        when(t.type()).thenReturn(type);
        when(t.transform(any())).thenAnswer(inv -> inv.getArgument(0));
        return t;
    }

    // ----------------------------------------------------------------------
    // Hit / miss
    // ----------------------------------------------------------------------

    @Test
    void load_missThenHit_fetchesOnce() throws Exception {
        when(fetcher.fetch(URL)).thenReturn(ok(png(40, 30)));

        LoadResult first = await(loader.newRequest().load(URL).getAsync());
        LoadResult second = await(loader.newRequest().load(URL).getAsync());

        assertEquals(LoadResult.Status.LOADED, first.status());
        assertEquals(40, first.image().getWidth());
        assertEquals(LoadResult.Status.HIT, second.status());
        assertEquals(40, second.image().getWidth());
        assertEquals(30, second.image().getHeight());
        verify(fetcher, times(1)).fetch(URL);

        assertEquals(1, metrics.hits());
        assertEquals(1, metrics.misses());
        assertFalse(arbitrator.isActive(URL));
        assertEquals(1, ledgerLines().size());
    }

    @Test
    void load_hitIsFasterThanSlowNetwork() throws Exception {
        byte[] body = png(20, 20);
        when(fetcher.fetch(URL)).thenAnswer(inv -> {
            Thread.sleep(300);
            return ok(body);
        });

        long t0 = System.nanoTime();
        assertEquals(LoadResult.Status.LOADED, await(loader.newRequest().load(URL).getAsync()).status());
        long missNanos = System.nanoTime() - t0;

        long t1 = System.nanoTime();
        assertEquals(LoadResult.Status.HIT, await(loader.newRequest().load(URL).getAsync()).status());
        long hitNanos = System.nanoTime() - t1;

        assertTrue(hitNanos < missNanos, "hit " + hitNanos + "ns should beat miss " + missNanos + "ns");
    }

    @Test
    void load_cachedFileNotAnImage_isDroppedAndRefetched() throws Exception {
        diskCache.store(URL, "definitely not a png".getBytes(StandardCharsets.UTF_8), List.of());
        when(fetcher.fetch(URL)).thenReturn(ok(png(10, 10)));

        LoadResult result = await(loader.newRequest().load(URL).getAsync());

        assertEquals(LoadResult.Status.LOADED, result.status());
        verify(fetcher, times(1)).fetch(URL);
        assertEquals(1, ledgerLines().size());
        assertEquals(1, payloadFileCount());
    }

    @Test
    void load_cachedFileEvictedAfterLookup_refetches() throws Exception {
        DiskCache racing = new DiskCache(10L * 1024 * 1024, cacheDir.resolve("racing")) {
            @Override
            public Optional<CacheValue> get(String key) {
                Optional<CacheValue> value = super.get(key);
                // a store for another key evicts the entry before the loader reads it
                value.ifPresent(v -> {
                    try {
                        Files.deleteIfExists(v.file());
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                });
                return value;
            }
        };
        ExecutorService racingExec = Executors.newSingleThreadExecutor();
        ImageLoader racingLoader = new ImageLoader(racing, fetcher, new ImageTransformer(), arbitrator, metrics, racingExec);
        try {
            racing.store(URL, png(10, 10), List.of());
            when(fetcher.fetch(URL)).thenReturn(ok(png(12, 12)));

            LoadResult result = await(racingLoader.newRequest().load(URL).getAsync());

            assertEquals(LoadResult.Status.LOADED, result.status());
            assertEquals(12, result.image().getWidth());
            verify(fetcher, times(1)).fetch(URL);
            assertEquals(0, metrics.failures());
            assertFalse(arbitrator.isActive(URL));
        } finally {
            racingLoader.close();
            racing.close();
        }
    }

    // ----------------------------------------------------------------------
    // Single flight
    // ----------------------------------------------------------------------

    @Test
    void submit_concurrentSameKey_onlyOneFetches() throws Exception {
        CountDownLatch fetchStarted = new CountDownLatch(1);
        CountDownLatch releaseFetch = new CountDownLatch(1);
        byte[] body = png(16, 16);
        when(fetcher.fetch(URL)).thenAnswer(inv -> {
            fetchStarted.countDown();
            releaseFetch.await(10, TimeUnit.SECONDS);
            return ok(body);
        });

        CompletableFuture<LoadResult> leader = loader.newRequest().load(URL).getAsync();
        assertTrue(fetchStarted.await(5, TimeUnit.SECONDS));

        List<CompletableFuture<LoadResult>> duplicates = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            duplicates.add(loader.newRequest().load(URL).getAsync());
        }
        for (CompletableFuture<LoadResult> d : duplicates) {
            assertTrue(d.isDone(), "duplicates resolve without waiting");
            assertEquals(LoadResult.Status.IN_PROGRESS, d.get().status());
        }

        releaseFetch.countDown();
        assertEquals(LoadResult.Status.LOADED, await(leader).status());
        verify(fetcher, times(1)).fetch(URL);
        assertEquals(5, metrics.rejected());
        assertFalse(arbitrator.isActive(URL));

        // released before the future completed, so the key is admissible again
        assertEquals(LoadResult.Status.HIT, await(loader.newRequest().load(URL).getAsync()).status());
    }

    // ----------------------------------------------------------------------
    // Transformations and save strategy
    // ----------------------------------------------------------------------

    @Test
    void load_cropThenResize_appliesBothInOrder() throws Exception {
        when(fetcher.fetch(URL)).thenReturn(ok(png(400, 300)));

        LoadResult result = await(loader.newRequest()
                .load(URL)
                .transformations(Transformations.none().centerCrop(200, 200).resize(150, 150))
                .getAsync());

        assertEquals(LoadResult.Status.LOADED, result.status());
        assertEquals(150, result.image().getWidth());
        assertEquals(150, result.image().getHeight());
        assertEquals(List.of(TransformationType.CENTER_CROP, TransformationType.RESIZE), result.applied());
    }

    @Test
    void saveOriginal_hitReappliesTransformations() throws Exception {
        when(fetcher.fetch(URL)).thenReturn(ok(png(100, 80)));
        ImageTransformation crop = passThrough(TransformationType.CENTER_CROP);

        await(loader.newRequest().load(URL)
                .transformations(Transformations.none().add(crop))
                .saveStrategy(SaveStrategy.SAVE_ORIGINAL)
                .getAsync());
        LoadResult hit = await(loader.newRequest().load(URL)
                .transformations(Transformations.none().add(crop))
                .getAsync());

        assertEquals(LoadResult.Status.HIT, hit.status());
        assertEquals(List.of(TransformationType.CENTER_CROP), hit.applied());
        assertTrue(hit.alreadyApplied().isEmpty());
        verify(crop, times(2)).transform(any());
        assertTrue(ledgerLines().get(0).endsWith(";()"));
    }

    @Test
    void saveTransformed_hitSkipsTransformationsAlreadyInCachedBytes() throws Exception {
        when(fetcher.fetch(URL)).thenReturn(ok(png(100, 80)));
        ImageTransformation crop = passThrough(TransformationType.CENTER_CROP);

        LoadResult first = await(loader.newRequest().load(URL)
                .transformations(Transformations.none().add(crop))
                .saveStrategy(SaveStrategy.SAVE_TRANSFORMED)
                .getAsync());
        LoadResult second = await(loader.newRequest().load(URL)
                .transformations(Transformations.none().add(crop))
                .getAsync());

        assertEquals(LoadResult.Status.LOADED, first.status());
        assertEquals(LoadResult.Status.HIT, second.status());
        assertTrue(second.applied().isEmpty());
        assertEquals(List.of(TransformationType.CENTER_CROP), second.alreadyApplied());
        verify(crop, times(1)).transform(any());
        assertTrue(ledgerLines().get(0).endsWith(";(0)"));
    }

    @Test
    void saveTransformed_storesTransformedPixels() throws Exception {
        when(fetcher.fetch(URL)).thenReturn(ok(png(400, 300)));

        await(loader.newRequest().load(URL)
                .transformations(Transformations.none().resize(50, 40))
                .saveStrategy(SaveStrategy.SAVE_TRANSFORMED)
                .getAsync());
        LoadResult hit = await(loader.newRequest().load(URL).getAsync());

        assertEquals(50, hit.image().getWidth());
        assertEquals(40, hit.image().getHeight());
    }

    // ----------------------------------------------------------------------
    // Failures
    // ----------------------------------------------------------------------

    private void assertFailedAndNothingCached(LoadResult result) throws IOException {
        assertEquals(LoadResult.Status.FAILED, result.status());
        assertNotNull(result.error());
        assertNull(result.image());
        assertFalse(arbitrator.isActive(URL));
        assertEquals(0, payloadFileCount());
        assertTrue(ledgerLines().isEmpty());
    }

    @Test
    void load_httpError_fails() throws Exception {
        when(fetcher.fetch(URL)).thenReturn(new FetchResponse(404, "text/html", "nope".getBytes(StandardCharsets.UTF_8)));

        LoadResult result = await(loader.newRequest().load(URL).getAsync());

        assertFailedAndNothingCached(result);
        assertTrue(result.error().contains("404"));
        assertEquals(1, metrics.failures());
    }

    @Test
    void load_unsupportedContentType_fails() throws Exception {
        when(fetcher.fetch(URL)).thenReturn(new FetchResponse(200, "image/gif", png(5, 5)));

        assertFailedAndNothingCached(await(loader.newRequest().load(URL).getAsync()));
    }

    @Test
    void load_fetcherThrows_fails() throws Exception {
        when(fetcher.fetch(URL)).thenThrow(new IOException("connection refused"));

        LoadResult result = await(loader.newRequest().load(URL).getAsync());

        assertFailedAndNothingCached(result);
        assertTrue(result.error().contains("connection refused"));
    }

    @Test
    void load_undecodableBody_fails() throws Exception {
        when(fetcher.fetch(URL)).thenReturn(new FetchResponse(200, "image/png", new byte[]{1, 2, 3, 4}));

        assertFailedAndNothingCached(await(loader.newRequest().load(URL).getAsync()));
    }

    @Test
    void load_transformationThrows_failsWithoutCaching() throws Exception {
        when(fetcher.fetch(URL)).thenReturn(ok(png(30, 20)));

        // circle crop refuses non-square input
        LoadResult result = await(loader.newRequest().load(URL)
                .transformations(Transformations.none().circleCrop())
                .getAsync());

        assertFailedAndNothingCached(result);
    }

    @Test
    void load_transformationThrowsError_stillResolvesAsFailed() throws Exception {
        when(fetcher.fetch(URL)).thenReturn(ok(png(30, 30)));
        ImageTransformation exploding = Mockito.mock(ImageTransformation.class);
        when(exploding.type()).thenReturn(TransformationType.RESIZE);
        when(exploding.transform(any())).thenThrow(new OutOfMemoryError("Java heap space"));

        LoadResult result = await(loader.newRequest().load(URL)
                .transformations(Transformations.none().add(exploding))
                .getAsync());

        assertFailedAndNothingCached(result);
        assertTrue(result.error().contains("OutOfMemoryError"));
        assertEquals(1, metrics.failures());
    }

    @Test
    void into_errorThrownDuringLoad_reachesSink() throws Exception {
        when(fetcher.fetch(URL)).thenThrow(new StackOverflowError());
        CountDownLatch delivered = new CountDownLatch(1);
        ImageSink sink = Mockito.mock(ImageSink.class);
        Mockito.doAnswer(inv -> {
            delivered.countDown();
            return null;
        }).when(sink).onError(any());

        loader.newRequest().load(URL).into(sink);

        assertTrue(delivered.await(10, TimeUnit.SECONDS));
        assertFalse(arbitrator.isActive(URL));
    }

    @Test
    void load_failureReleasesKeyForRetry() throws Exception {
        when(fetcher.fetch(URL))
                .thenThrow(new IOException("flaky"))
                .thenReturn(ok(png(8, 8)));

        assertEquals(LoadResult.Status.FAILED, await(loader.newRequest().load(URL).getAsync()).status());
        assertEquals(LoadResult.Status.LOADED, await(loader.newRequest().load(URL).getAsync()).status());
    }

    // ----------------------------------------------------------------------
    // Builder / sink
    // ----------------------------------------------------------------------

    @Test
    void build_withoutUrl_throws() {
        assertThrows(IllegalStateException.class, () -> loader.newRequest().build());
    }

    @Test
    void transformations_duplicateKind_throws() {
        assertThrows(IllegalStateException.class, () -> Transformations.none().resize(1, 1).resize(2, 2));
    }

    @Test
    void into_deliversSuccessToSink() throws Exception {
        when(fetcher.fetch(URL)).thenReturn(ok(png(12, 12)));
        CountDownLatch delivered = new CountDownLatch(1);
        AtomicReference<LoadResult> received = new AtomicReference<>();

        loader.newRequest().load(URL).into(new ImageSink() {
            @Override
            public void onSuccess(LoadResult result) {
                received.set(result);
                delivered.countDown();
            }

            @Override
            public void onError(LoadResult result) {
                fail("unexpected error " + result.error());
            }
        });

        assertTrue(delivered.await(10, TimeUnit.SECONDS));
        assertEquals(LoadResult.Status.LOADED, received.get().status());
    }

    @Test
    void into_deliversErrorToSink() throws Exception {
        when(fetcher.fetch(URL)).thenReturn(new FetchResponse(500, "text/plain", new byte[0]));
        CountDownLatch delivered = new CountDownLatch(1);
        ImageSink sink = Mockito.mock(ImageSink.class);
        Mockito.doAnswer(inv -> {
            delivered.countDown();
            return null;
        }).when(sink).onError(any());

        loader.newRequest().load(URL).into(sink);

        assertTrue(delivered.await(10, TimeUnit.SECONDS));
        verify(sink, never()).onSuccess(any());
    }

    // ----------------------------------------------------------------------
    // Shutdown
    // ----------------------------------------------------------------------

    @Test
    void close_resolvesRunningAndQueuedRequestsAsFailed() throws Exception {
        loader.close();
        ExecutorService single = Executors.newFixedThreadPool(1);
        ImageLoader small = new ImageLoader(diskCache, fetcher, new ImageTransformer(), arbitrator, metrics, single);

        CountDownLatch started = new CountDownLatch(1);
        when(fetcher.fetch("https://slow")).thenAnswer(inv -> {
            started.countDown();
            try {
                new CountDownLatch(1).await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("interrupted", e);
            }
            return ok(png(4, 4));
        });

        CompletableFuture<LoadResult> running = small.newRequest().load("https://slow").getAsync();
        assertTrue(started.await(5, TimeUnit.SECONDS));
        CompletableFuture<LoadResult> queued = small.newRequest().load("https://queued").getAsync();

        small.close();

        assertEquals(LoadResult.Status.FAILED, await(running).status());
        assertEquals(LoadResult.Status.FAILED, await(queued).status());
        assertEquals(0, arbitrator.activeCount());
        verify(fetcher, never()).fetch("https://queued");
    }

    @Test
    void submit_afterClose_failsImmediately() throws Exception {
        loader.close();

        LoadResult result = await(loader.newRequest().load(URL).getAsync());

        assertEquals(LoadResult.Status.FAILED, result.status());
        assertFalse(arbitrator.isActive(URL));
        verify(fetcher, never()).fetch(any());
    }
}
