package org.iceforge.imgcache.cache;

import org.iceforge.imgcache.transform.TransformationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Size-bounded on-disk key/value store.
 *
 * <p>Every operation is a command executed by one worker thread, which is the only thread
 * that touches the {@link MetadataStore} after construction. Callers block on their own
 * reply only. A full command queue blocks the caller instead of dropping the command.
 *
 * <p>Every mutation rewrites the ledger before the call returns.
 */
public class DiskCache implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DiskCache.class);

    public static final int DEFAULT_QUEUE_CAPACITY = 1024;

    private record Command<T>(String name, Callable<T> action, CompletableFuture<T> reply) {}

    @FunctionalInterface
    private interface PayloadWriter {
        void writeTo(Path target) throws IOException;
    }

    private final long maxBytes;
    private final Path cacheDir;
    private final MetadataStore store;
    private final BlockingQueue<Command<?>> queue;
    private final Thread worker;
    private volatile boolean closed;

    // worker-thread only
    private long lastTimestamp;

    public DiskCache(long maxBytes, Path cacheDir) {
        this(maxBytes, cacheDir, DEFAULT_QUEUE_CAPACITY);
    }

    /**
     * Creates the directory and ledger when absent, loads and repairs the ledger, then starts
     * the worker.
     *
     * @throws DiskCacheException when the directory or the ledger cannot be created or read
     */
    public DiskCache(long maxBytes, Path cacheDir, int queueCapacity) {
        if (maxBytes <= 0L) {
            throw new IllegalArgumentException("maxBytes must be positive: " + maxBytes);
        }
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be positive: " + queueCapacity);
        }
        this.maxBytes = maxBytes;
        this.cacheDir = Objects.requireNonNull(cacheDir, "cacheDir").toAbsolutePath().normalize();
        this.store = new MetadataStore(this.cacheDir);
        this.queue = new ArrayBlockingQueue<>(queueCapacity);

        try {
            Files.createDirectories(this.cacheDir);
        } catch (IOException e) {
            throw new DiskCacheException("Failed to create cache directory: " + this.cacheDir, e);
        }
        try {
            store.load();
            trimToBudget();
        } catch (IOException e) {
            throw new DiskCacheException("Failed to load cache ledger in " + this.cacheDir, e);
        }
        this.lastTimestamp = store.maxTimestamp();

        this.worker = new Thread(this::runLoop, "imgcache-disk-cache");
        this.worker.setDaemon(true);
        this.worker.start();

        log.info("Opened disk cache dir={} maxBytes={} entries={} bytesUsed={}",
                this.cacheDir, maxBytes, store.size(), store.totalBytes());
    }

    // ----------------------------------------------------------------------
    // Public operations
    // ----------------------------------------------------------------------

    /**
     * Looks up a key. A record whose file has disappeared is dropped and reported as a miss.
     * A hit refreshes the record's eviction timestamp.
     */
    public Optional<CacheValue> get(String key) {
        requireKey(key);
        return call("get", () -> doGet(key));
    }

    /** Presence check against the in-memory records only. */
    public boolean contains(String key) {
        requireKey(key);
        return call("contains", () -> store.contains(key));
    }

    public MutationResult store(String key, byte[] bytes, List<TransformationType> appliedTransformations) {
        requireStorableKey(key);
        Objects.requireNonNull(bytes, "bytes");
        return call("store", () -> doStore(key, bytes.length,
                target -> Files.write(target, bytes), appliedTransformations));
    }

    /** Copies {@code source} into the cache; the source file is left in place. */
    public MutationResult store(String key, Path source, List<TransformationType> appliedTransformations) {
        requireStorableKey(key);
        Objects.requireNonNull(source, "source");
        return call("store", () -> doStore(key, Files.size(source),
                target -> Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING), appliedTransformations));
    }

    public MutationResult remove(String key) {
        requireKey(key);
        return call("remove", () -> doRemove(key));
    }

    /** Deletes every payload, the ledger and the directory. A later store recreates them. */
    public MutationResult clear() {
        return call("clear", this::doClear);
    }

    /** Evicts the single oldest record, if any. */
    public Optional<CacheRecord> evictOldest() {
        return call("evictOldest", this::doEvictOldest);
    }

    /** Total bytes of all cached payloads. */
    public long size() {
        return call("size", store::totalBytes);
    }

    public int count() {
        return call("count", store::size);
    }

    public List<String> keys() {
        return call("keys", () -> store.records().stream().map(CacheRecord::key).toList());
    }

    public long maxBytes() {
        return maxBytes;
    }

    public Path cacheDir() {
        return cacheDir;
    }

    /**
     * Stops the worker after the command it is running. Anything still queued fails with
     * {@link DiskCacheException}.
     */
    @Override
    public void close() {
        if (closed) return;
        closed = true;
        try {
            worker.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        failPending();
        log.info("Closed disk cache dir={}", cacheDir);
    }

    public boolean isClosed() {
        return closed;
    }

    // ----------------------------------------------------------------------
    // Command plumbing
    // ----------------------------------------------------------------------

    private <T> T call(String name, Callable<T> action) {
        if (closed) {
            throw new DiskCacheException("Disk cache is closed: " + cacheDir);
        }
        Command<T> cmd = new Command<>(name, action, new CompletableFuture<>());
        try {
            queue.put(cmd);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DiskCacheException("Interrupted while submitting " + name, e);
        }
        if (closed) {
            // the worker may have drained the queue before our put landed
            failPending();
        }
        try {
            return cmd.reply().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DiskCacheException("Interrupted while waiting for " + name, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new DiskCacheException(name + " failed in " + cacheDir, cause);
        }
    }

    private void runLoop() {
        while (!closed) {
            Command<?> cmd;
            try {
                cmd = queue.poll(100, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                break;
            }
            if (cmd != null) {
                execute(cmd);
            }
        }
        failPending();
    }

    private <T> void execute(Command<T> cmd) {
        try {
            cmd.reply().complete(cmd.action().call());
        } catch (Throwable t) {
            cmd.reply().completeExceptionally(t);
        }
    }

    private void failPending() {
        Command<?> cmd;
        while ((cmd = queue.poll()) != null) {
            cmd.reply().completeExceptionally(new DiskCacheException("Disk cache is closed: " + cacheDir));
        }
    }

    // ----------------------------------------------------------------------
    // Worker-side implementations
    // ----------------------------------------------------------------------

    private Optional<CacheValue> doGet(String key) {
        Optional<CacheRecord> found = store.get(key);
        if (found.isEmpty()) return Optional.empty();

        CacheRecord r = found.get();
        Path file = store.resolve(r);
        if (!Files.isRegularFile(file)) {
            log.warn("Cached file {} for key {} is missing, dropping record", file, key);
            store.remove(key);
            persistOrRollback(List.of(r), null);
            return Optional.empty();
        }

        CacheRecord touched = r.withTimestamp(nextTimestamp());
        store.put(touched);
        persistOrRollback(List.of(r), touched);
        return Optional.of(new CacheValue(key, file, touched.sizeBytes(), touched.appliedTransformations()));
    }

    /**
     * Writes the new payload, updates the records and rewrites the ledger. Files of replaced and
     * evicted records are deleted only after the ledger no longer references them.
     */
    private MutationResult doStore(String key, long newSize, PayloadWriter writer,
                                   List<TransformationType> appliedTransformations) throws IOException {
        if (newSize > maxBytes) {
            log.warn("Refusing to cache key {}: {} bytes exceeds the whole budget of {} bytes", key, newSize, maxBytes);
            return MutationResult.notStored();
        }

        Files.createDirectories(cacheDir);
        long timestamp = nextTimestamp();
        String fileName = CacheFileNames.payloadName(timestamp, key);
        Path target = cacheDir.resolve(fileName);
        try {
            writer.writeTo(target);
        } catch (IOException e) {
            deletePayload(target, new ArrayList<>());
            throw new DiskCacheException("Failed to write cache file for key " + key, e);
        }

        List<CacheRecord> dropped = new ArrayList<>();
        List<String> evicted = new ArrayList<>();
        store.remove(key).ifPresent(dropped::add);

        long total = store.totalBytes();
        if (total + newSize > maxBytes) {
            long reclaim = EvictionPolicy.reclaimTarget(maxBytes, newSize);
            log.info("Disk cache size exceeded ({} > {}), reclaiming at least {} bytes", total + newSize, maxBytes, reclaim);
            for (CacheRecord victim : EvictionPolicy.selectVictims(store.records(), reclaim)) {
                store.remove(victim.key());
                dropped.add(victim);
                evicted.add(victim.key());
            }
        }

        CacheRecord added = new CacheRecord(key, fileName, newSize, timestamp, appliedTransformations);
        store.put(added);
        try {
            persistOrRollback(dropped, added);
        } catch (DiskCacheException e) {
            deletePayload(target, new ArrayList<>());
            throw e;
        }

        List<Path> undeleted = new ArrayList<>();
        for (CacheRecord d : dropped) {
            deletePayload(store.resolve(d), undeleted);
        }
        if (!evicted.isEmpty()) {
            log.debug("Evicted keys={} to store key={}", evicted, key);
        }
        log.debug("Stored key={} file={} size={} applied={}", key, fileName, newSize, appliedTransformations);
        return MutationResult.of(evicted, undeleted);
    }

    private MutationResult doRemove(String key) {
        Optional<CacheRecord> removed = store.remove(key);
        if (removed.isEmpty()) return MutationResult.of(List.of(), List.of());

        persistOrRollback(List.of(removed.get()), null);
        List<Path> undeleted = new ArrayList<>();
        deletePayload(store.resolve(removed.get()), undeleted);
        return MutationResult.of(List.of(key), undeleted);
    }

    private MutationResult doClear() throws IOException {
        List<String> removed = store.records().stream().map(CacheRecord::key).toList();
        List<Path> undeleted = new ArrayList<>();
        store.clearRecords();

        if (Files.isDirectory(cacheDir)) {
            try (Stream<Path> files = Files.list(cacheDir)) {
                files.filter(Files::isRegularFile).forEach(p -> deletePayload(p, undeleted));
            }
            try {
                Files.deleteIfExists(cacheDir);
            } catch (IOException e) {
                log.warn("Failed to delete cache directory {}", cacheDir, e);
            }
        }
        log.info("Cleared disk cache dir={} entries={}", cacheDir, removed.size());
        return MutationResult.of(removed, undeleted);
    }

    private Optional<CacheRecord> doEvictOldest() {
        Optional<CacheRecord> oldest = EvictionPolicy.oldest(store.records());
        if (oldest.isEmpty()) return oldest;

        CacheRecord victim = oldest.get();
        store.remove(victim.key());
        persistOrRollback(List.of(victim), null);
        deletePayload(store.resolve(victim), new ArrayList<>());
        return oldest;
    }

    private void trimToBudget() throws IOException {
        long excess = store.totalBytes() - maxBytes;
        if (excess <= 0L) return;

        List<Path> undeleted = new ArrayList<>();
        List<CacheRecord> victims = EvictionPolicy.selectVictims(store.records(), excess);
        for (CacheRecord victim : victims) {
            store.remove(victim.key());
            deletePayload(store.resolve(victim), undeleted);
        }
        store.persist();
        log.info("Loaded cache exceeded budget by {} bytes, evicted {} entries", excess, victims.size());
    }

    /**
     * Rewrites the ledger. When that fails, {@code added} is taken out of the records and
     * {@code dropped} put back, so memory keeps matching the ledger still on disk.
     */
    private void persistOrRollback(List<CacheRecord> dropped, CacheRecord added) {
        try {
            store.persist();
        } catch (IOException e) {
            if (added != null) {
                store.remove(added.key());
            }
            dropped.forEach(store::put);
            throw new DiskCacheException("Failed to write cache ledger " + store.ledgerFile(), e);
        }
    }

    /** Absent files are fine; a file that exists but cannot be deleted is reported back. */
    private static void deletePayload(Path file, List<Path> undeleted) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete cache file {}", file, e);
            undeleted.add(file);
        }
    }

    private long nextTimestamp() {
        lastTimestamp = Math.max(System.currentTimeMillis(), lastTimestamp + 1);
        return lastTimestamp;
    }

    private static void requireKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("key must not be empty");
        }
    }

    private static void requireStorableKey(String key) {
        requireKey(key);
        if (key.indexOf('\n') >= 0 || key.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("key must not contain line breaks: " + key);
        }
    }
}
