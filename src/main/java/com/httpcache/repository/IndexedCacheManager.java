package com.httpcache.repository;

import com.httpcache.model.FreshnessPolicy;
import com.httpcache.model.HttpResponseRecord;
import com.httpcache.model.RangeField;
import com.httpcache.model.StoredEntry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Cache manager that keeps secondary indices over its entries:
 * <ul>
 *   <li>a tag index from response URL to keys,</li>
 *   <li>numeric indices for age and time-to-live,</li>
 *   <li>a stale view computed when asked.</li>
 * </ul>
 *
 * Age and time-to-live change with the clock, so the numeric indices are keyed
 * on instants that do not: the response's birth (for age) and its expiry (for
 * time-to-live). A query turns its bounds into an instant window, then checks
 * each candidate against the clock.
 *
 * The primary map and every index change together under one write lock, so a
 * reader never sees an index entry without its record or the reverse. Index
 * anchors are computed before the lock is taken, so nothing that can fail runs
 * between the first and the last structural change. With
 * {@link IndexedStoreOptions.StorageType#DISK_COPIES} each entry is also
 * written to its own file, before the in-memory state changes.
 */
@Slf4j
public class IndexedCacheManager implements CacheManager {

    private static final String FILE_SUFFIX = ".json.gz";

    // Keeps second-to-millisecond conversions clear of overflow
    private static final long MAX_WINDOW_SECONDS = 100_000_000_000_000L;

    private final IndexedStoreOptions options;
    private final EntryCodec codec;
    private final Clock clock;
    private final Path directory;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, IndexedEntry> entries = new HashMap<>();
    private final Map<String, Set<String>> tagIndex = new HashMap<>();
    private final NavigableMap<Long, Set<String>> birthIndex = new TreeMap<>();
    private final NavigableMap<Long, Set<String>> expiryIndex = new TreeMap<>();

    public IndexedCacheManager(IndexedStoreOptions options, EntryCodec codec, Clock clock) {
        this.options = options;
        this.codec = codec;
        this.clock = clock;
        this.directory = options.directory();

        if (isDiskBacked()) {
            try {
                Files.createDirectories(directory);
            } catch (IOException e) {
                throw new CacheStorageException("Cannot create store directory " + directory, e);
            }
            load();
        }
        log.info("Opened indexed cache store: namespace={}, storage={}, entries={}",
                options.getNamespace(), options.getStorageType(), entries.size());
    }

    // ========== CacheManager ==========

    @Override
    public Optional<StoredEntry> get(String key) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entries.get(key)).map(IndexedEntry::entry);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void put(String key, HttpResponseRecord response, FreshnessPolicy policy) {
        IndexedEntry indexed = IndexedEntry.of(StoredEntry.builder()
                .key(key)
                .response(response)
                .policy(policy)
                .build());
        byte[] encoded = isDiskBacked() ? codec.encode(indexed.entry()) : null;

        lock.writeLock().lock();
        try {
            if (encoded != null) {
                writeFile(key, encoded);
            }
            replace(indexed);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Stored in indexed cache: key={}, url={}", key, response.getUrl());
    }

    @Override
    public void delete(String key) {
        lock.writeLock().lock();
        try {
            if (isDiskBacked()) {
                deleteFile(key);
            }
            IndexedEntry previous = entries.remove(key);
            if (previous != null) {
                unindex(previous);
                log.debug("Deleted from indexed cache: {}", key);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            if (isDiskBacked()) {
                for (String key : entries.keySet()) {
                    deleteFile(key);
                }
            }
            int size = entries.size();
            entries.clear();
            tagIndex.clear();
            birthIndex.clear();
            expiryIndex.clear();
            log.info("Cleared {} entries from indexed cache", size);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public long size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String getName() {
        return "indexed";
    }

    // ========== Queries ==========

    /**
     * All entries whose stored response URL equals {@code url}.
     */
    public List<StoredEntry> lookupByTag(String url) {
        lock.readLock().lock();
        try {
            Set<String> keys = tagIndex.get(url);
            if (keys == null) {
                return List.of();
            }
            return resolve(keys);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Entries whose field value, computed now, lies in {@code [low, high]}.
     *
     * @param field AGE or TIME_TO_LIVE, both in seconds
     */
    public List<StoredEntry> range(RangeField field, long low, long high) {
        if (low > high) {
            return List.of();
        }
        Instant now = clock.instant();
        long nowMillis = now.toEpochMilli();

        lock.readLock().lock();
        try {
            NavigableMap<Long, Set<String>> window = switch (field) {
                // age in [low, high] <=> birth in (now - (high + 1)s, now - low s]
                case AGE -> birthIndex.subMap(
                        nowMillis - millis(high) - 1000L, true,
                        nowMillis - millis(low), true);
                // ttl in [low, high] <=> expiry in (now + (low - 1)s, now + high s]
                case TIME_TO_LIVE -> expiryIndex.subMap(
                        nowMillis + millis(low) - 1000L, true,
                        nowMillis + millis(high), true);
            };

            List<StoredEntry> result = new ArrayList<>();
            for (String key : keys(window.values())) {
                StoredEntry entry = entries.get(key).entry();
                long value = field.valueAt(entry.getPolicy(), now);
                if (value >= low && value <= high) {
                    result.add(entry);
                }
            }
            result.sort(Comparator.comparing(StoredEntry::getKey));
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Entries that are stale right now.
     */
    public List<StoredEntry> staleView() {
        Instant now = clock.instant();
        lock.readLock().lock();
        try {
            List<StoredEntry> result = new ArrayList<>();
            for (String key : keys(expiryIndex.headMap(now.toEpochMilli(), true).values())) {
                StoredEntry entry = entries.get(key).entry();
                if (!entry.getPolicy().isFreshAt(now)) {
                    result.add(entry);
                }
            }
            result.sort(Comparator.comparing(StoredEntry::getKey));
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Entries whose body, read as UTF-8, contains {@code text}.
     */
    public List<StoredEntry> search(String text) {
        lock.readLock().lock();
        try {
            List<StoredEntry> result = new ArrayList<>();
            for (IndexedEntry indexed : entries.values()) {
                StoredEntry entry = indexed.entry();
                String body = new String(entry.getResponse().getBody(), StandardCharsets.UTF_8);
                if (body.contains(text)) {
                    result.add(entry);
                }
            }
            result.sort(Comparator.comparing(StoredEntry::getKey));
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Snapshot of every entry, ordered by key.
     */
    public List<StoredEntry> entries() {
        lock.readLock().lock();
        try {
            List<StoredEntry> result = new ArrayList<>(entries.size());
            entries.values().forEach(indexed -> result.add(indexed.entry()));
            result.sort(Comparator.comparing(StoredEntry::getKey));
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public IndexedStoreOptions getOptions() {
        return options;
    }

    // ========== Index maintenance (write lock held) ==========

    private void replace(IndexedEntry indexed) {
        IndexedEntry previous = entries.put(indexed.key(), indexed);
        if (previous != null) {
            unindex(previous);
        }
        index(indexed);
    }

    private void index(IndexedEntry indexed) {
        String key = indexed.key();
        tagIndex.computeIfAbsent(indexed.tag(), t -> new LinkedHashSet<>()).add(key);
        birthIndex.computeIfAbsent(indexed.birthMillis(), t -> new LinkedHashSet<>()).add(key);
        expiryIndex.computeIfAbsent(indexed.expiryMillis(), t -> new LinkedHashSet<>()).add(key);
    }

    private void unindex(IndexedEntry indexed) {
        String key = indexed.key();
        removeFrom(tagIndex, indexed.tag(), key);
        removeFrom(birthIndex, indexed.birthMillis(), key);
        removeFrom(expiryIndex, indexed.expiryMillis(), key);
    }

    private static <K> void removeFrom(Map<K, Set<String>> index, K indexKey, String key) {
        Set<String> keys = index.get(indexKey);
        if (keys != null) {
            keys.remove(key);
            if (keys.isEmpty()) {
                index.remove(indexKey);
            }
        }
    }

    private List<StoredEntry> resolve(Collection<String> keys) {
        List<StoredEntry> result = new ArrayList<>(keys.size());
        for (String key : keys) {
            result.add(entries.get(key).entry());
        }
        result.sort(Comparator.comparing(StoredEntry::getKey));
        return result;
    }

    private static Set<String> keys(Collection<Set<String>> buckets) {
        Set<String> keys = new LinkedHashSet<>();
        buckets.forEach(keys::addAll);
        return keys;
    }

    private static long millis(long seconds) {
        return Math.max(-MAX_WINDOW_SECONDS, Math.min(MAX_WINDOW_SECONDS, seconds)) * 1000L;
    }

    // ========== Disk copies ==========

    private boolean isDiskBacked() {
        return options.getStorageType() == IndexedStoreOptions.StorageType.DISK_COPIES;
    }

    private Path fileFor(String key) {
        return directory.resolve(DigestUtils.sha256Hex(key) + FILE_SUFFIX);
    }

    private void writeFile(String key, byte[] encoded) {
        Path target = fileFor(key);
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, "entry-", ".tmp");
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(encoded);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                if (options.isDurable()) {
                    channel.force(true);
                }
            }
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException suppressed) {
                    e.addSuppressed(suppressed);
                }
            }
            throw new CacheStorageException("Failed to write entry " + key + " to " + target, e);
        }
    }

    private void deleteFile(String key) {
        Path target = fileFor(key);
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            throw new CacheStorageException("Failed to delete entry " + key + " at " + target, e);
        }
    }

    private void load() {
        int corrupt = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + FILE_SUFFIX)) {
            for (Path file : files) {
                IndexedEntry indexed;
                try {
                    indexed = IndexedEntry.of(codec.decode(Files.readAllBytes(file)));
                } catch (RuntimeException e) {
                    corrupt++;
                    log.warn("Discarding unreadable cache file {}: {}", file, e.toString());
                    Files.deleteIfExists(file);
                    continue;
                }
                replace(indexed);
            }
        } catch (IOException e) {
            throw new CacheStorageException("Failed to load store directory " + directory, e);
        }
        if (corrupt > 0) {
            log.warn("Discarded {} unreadable entries from {}", corrupt, directory);
        }
    }

    /**
     * A stored entry with the index anchors derived from it.
     */
    private record IndexedEntry(StoredEntry entry, String tag, long birthMillis, long expiryMillis) {

        static IndexedEntry of(StoredEntry entry) {
            FreshnessPolicy policy = entry.getPolicy();
            return new IndexedEntry(entry,
                    String.valueOf(entry.getResponse().getUrl()),
                    policy.birthMillis(),
                    policy.expiryMillis());
        }

        String key() {
            return entry.getKey();
        }
    }
}
