package net.ipip.ipdb;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.io.IOException;

/**
 * A bounded cache backed by Caffeine. Once the capacity is reached, entries
 * are evicted by recency and frequency of use (Window TinyLFU), so hot
 * addresses stay cached. This is the default cache of a {@link Reader}.
 */
public class LRUCache implements LookupCache {

    static final int DEFAULT_CAPACITY = 4096;

    private final Cache<CacheKey, Object> cache;

    public LRUCache() {
        this(DEFAULT_CAPACITY);
    }

    public LRUCache(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Capacity must not be negative: " + capacity);
        }
        this.cache = Caffeine.newBuilder()
            .maximumSize(capacity)
            // evict on the calling thread instead of the common pool
            .executor(Runnable::run)
            .build();
    }

    @Override
    public Object get(CacheKey key, Loader loader) throws IOException, LookupException {
        Object value = cache.getIfPresent(key);
        if (value == null) {
            value = loader.load(key);
            cache.put(key, value);
        }
        return value;
    }

    long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
