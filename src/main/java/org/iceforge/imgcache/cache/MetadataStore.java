package org.iceforge.imgcache.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * In-memory view of the cache ledger plus the code that reads, repairs and rewrites it.
 *
 * <p>Not thread-safe. Only the {@link DiskCache} worker thread touches an instance after
 * construction.
 */
public class MetadataStore {
    private static final Logger log = LoggerFactory.getLogger(MetadataStore.class);

    public static final String LEDGER_FILE = "disk-cache.dat";
    static final String LEDGER_TMP_FILE = LEDGER_FILE + ".tmp";

    private final Path cacheDir;
    private final Path ledgerFile;
    private final Path ledgerTmpFile;
    private final Map<String, CacheRecord> records = new LinkedHashMap<>();
    private long totalBytes;

    public MetadataStore(Path cacheDir) {
        this.cacheDir = cacheDir;
        this.ledgerFile = cacheDir.resolve(LEDGER_FILE);
        this.ledgerTmpFile = cacheDir.resolve(LEDGER_TMP_FILE);
    }

    /**
     * Builds the record map from the ledger, creating an empty ledger when none exists.
     * Malformed lines and any disagreement between the ledger and the directory contents
     * trigger {@link #reconcile()}.
     *
     * @return true when the ledger had to be repaired
     * @throws IOException when the ledger cannot be created or read
     */
    public boolean load() throws IOException {
        records.clear();
        totalBytes = 0L;

        if (!Files.exists(ledgerFile)) {
            Files.createFile(ledgerFile);
        }
        Files.deleteIfExists(ledgerTmpFile);

        boolean corrupted = false;
        for (String line : Files.readAllLines(ledgerFile, StandardCharsets.UTF_8)) {
            Optional<CacheRecord> decoded = CacheLedgerCodec.decode(line);
            if (decoded.isEmpty()) {
                log.warn("Dropping malformed ledger line: {}", line);
                corrupted = true;
                continue;
            }
            CacheRecord r = decoded.get();
            if (records.containsKey(r.key())) {
                log.warn("Dropping duplicate ledger entry for key {}", r.key());
                corrupted = true;
                continue;
            }
            records.put(r.key(), r);
        }

        Set<String> referenced = new HashSet<>();
        for (CacheRecord r : records.values()) {
            if (!referenced.add(r.fileName())) {
                corrupted = true;
            }
        }
        Set<String> onDisk = new HashSet<>();
        for (Path p : listPayloadFiles()) {
            onDisk.add(p.getFileName().toString());
        }
        if (!onDisk.equals(referenced)) {
            corrupted = true;
        }

        if (corrupted) {
            reconcile();
        }

        for (Map.Entry<String, CacheRecord> e : records.entrySet()) {
            long size = Files.size(resolve(e.getValue()));
            e.setValue(e.getValue().withSize(size));
            totalBytes += size;
        }
        return corrupted;
    }

    /**
     * Drops records whose file is missing (or that share a file with an earlier record),
     * deletes files no record references, then rewrites the ledger.
     */
    void reconcile() throws IOException {
        Map<String, String> fileOwners = new HashMap<>();
        List<String> dropped = new ArrayList<>();
        for (CacheRecord r : records.values()) {
            Path file = resolve(r);
            if (!Files.isRegularFile(file) || fileOwners.putIfAbsent(r.fileName(), r.key()) != null) {
                dropped.add(r.key());
            }
        }
        for (String key : dropped) {
            records.remove(key);
        }

        int deletedFiles = 0;
        for (Path p : listPayloadFiles()) {
            if (!fileOwners.containsKey(p.getFileName().toString())) {
                try {
                    Files.deleteIfExists(p);
                    deletedFiles++;
                } catch (IOException e) {
                    log.warn("Failed to delete unreferenced cache file {}", p, e);
                }
            }
        }

        log.info("Reconciled cache ledger in {}: dropped {} record(s), deleted {} unreferenced file(s)",
                cacheDir, dropped.size(), deletedFiles);
        persist();
    }

    /**
     * Rewrites the whole ledger through a temp file and an atomic rename, so a crash
     * mid-write leaves the previous ledger intact.
     */
    public void persist() throws IOException {
        Files.createDirectories(cacheDir);
        try (Writer w = Files.newBufferedWriter(ledgerTmpFile, StandardCharsets.UTF_8)) {
            for (CacheRecord r : records.values()) {
                w.write(CacheLedgerCodec.encode(r));
                w.write('\n');
            }
        }
        try {
            Files.move(ledgerTmpFile, ledgerFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(ledgerTmpFile, ledgerFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /** Regular files in the cache directory other than the ledger and its temp file. */
    public List<Path> listPayloadFiles() throws IOException {
        if (!Files.isDirectory(cacheDir)) return List.of();
        try (Stream<Path> stream = Files.list(cacheDir)) {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return !name.equals(LEDGER_FILE) && !name.equals(LEDGER_TMP_FILE);
                    })
                    .toList();
        }
    }

    public Path resolve(CacheRecord r) {
        return cacheDir.resolve(r.fileName());
    }

    public Optional<CacheRecord> get(String key) {
        return Optional.ofNullable(records.get(key));
    }

    public boolean contains(String key) {
        return records.containsKey(key);
    }

    public void put(CacheRecord r) {
        CacheRecord previous = records.put(r.key(), r);
        if (previous != null) totalBytes -= previous.sizeBytes();
        totalBytes += r.sizeBytes();
    }

    public Optional<CacheRecord> remove(String key) {
        CacheRecord removed = records.remove(key);
        if (removed != null) totalBytes -= removed.sizeBytes();
        return Optional.ofNullable(removed);
    }

    public void clearRecords() {
        records.clear();
        totalBytes = 0L;
    }

    public List<CacheRecord> records() {
        return new ArrayList<>(records.values());
    }

    public long totalBytes() {
        return totalBytes;
    }

    public int size() {
        return records.size();
    }

    public long maxTimestamp() {
        long max = 0L;
        for (CacheRecord r : records.values()) {
            max = Math.max(max, r.timestamp());
        }
        return max;
    }

    public Path cacheDir() {
        return cacheDir;
    }

    public Path ledgerFile() {
        return ledgerFile;
    }
}
