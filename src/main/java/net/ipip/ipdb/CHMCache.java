package net.ipip.ipdb;

import java.io.IOException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A lookup cache backed by a {@link ConcurrentHashMap}. Nothing is ever
 * evicted: results are cached until about {@code capacity} entries are held
 * (the size check races with concurrent inserts), after which new keys are
 * loaded on every call.
 */
public class CHMCache implements LookupCache {

    private static final int DEFAULT_CAPACITY = 4096;

    private final int capacity;
    private final ConcurrentHashMap<CacheKey, Object> cache;
    private volatile boolean cacheFull = false;

    public CHMCache() {
        this(DEFAULT_CAPACITY);
    }

    public CHMCache(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Capacity must not be negative: " + capacity);
        }
        this.capacity = capacity;
        this.cache = new ConcurrentHashMap<>(Math.min(capacity, DEFAULT_CAPACITY));
    }

    @Override
    public Object get(CacheKey key, Loader loader) throws IOException, LookupException {
        Object value = cache.get(key);
        if (value == null) {
            value = loader.load(key);
            if (!cacheFull) {
                if (cache.size() < capacity) {
                    cache.put(key, value);
                } else {
                    cacheFull = true;
                }
            }
        }
        return value;
    }

    int size() {
        return cache.size();
    }
}
