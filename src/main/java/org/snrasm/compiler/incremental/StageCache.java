package org.snrasm.compiler.incremental;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Bounded in-memory memo of one compilation stage.
 * <p>
 * Entries are evicted in least-recently-used order once {@code maxEntries} is reached.
 * All operations are synchronized; {@link #computeIfAbsent} runs the computation outside
 * the lock, so two threads asking for the same missing key may both compute it and the
 * last one wins.
 *
 * @param <V> The type of the cached stage result.
 */
public final class StageCache<V> {

    private static final Logger LOG = LoggerFactory.getLogger(StageCache.class);

    private final String name;
    private final int maxEntries;
    private final LinkedHashMap<String, V> entries;

    private final AtomicLong hits = new AtomicLong(0);
    private final AtomicLong misses = new AtomicLong(0);

    /**
     * @param name       The stage name used in log output.
     * @param maxEntries The number of entries kept before the least recently used is dropped.
     */
    public StageCache(String name, int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive, got " + maxEntries);
        }
        this.name = name;
        this.maxEntries = maxEntries;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, V> eldest) {
                return size() > StageCache.this.maxEntries;
            }
        };
    }

    public synchronized Optional<V> get(String key) {
        V value = entries.get(key);
        if (value == null) {
            misses.incrementAndGet();
            LOG.trace("{} cache miss {}", name, key);
            return Optional.empty();
        }
        hits.incrementAndGet();
        LOG.trace("{} cache hit {}", name, key);
        return Optional.of(value);
    }

    public synchronized void put(String key, V value) {
        entries.put(key, value);
    }

    /**
     * Returns the cached value or computes and stores it.
     *
     * @param key     The content hash.
     * @param compute The stage computation, run on a miss.
     * @return The cached or computed value.
     */
    public V computeIfAbsent(String key, Supplier<V> compute) {
        Optional<V> cached = get(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        V value = compute.get();
        put(key, value);
        return value;
    }

    /**
     * Drops one entry.
     * @param key The content hash.
     * @return {@code true} if an entry was removed.
     */
    public synchronized boolean invalidate(String key) {
        return entries.remove(key) != null;
    }

    public synchronized void invalidateAll() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }

    public String name() {
        return name;
    }
}
