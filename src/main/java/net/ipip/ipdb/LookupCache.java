package net.ipip.ipdb;

import java.io.IOException;

/**
 * LookupCache is an interface for a cache that stores the decoded results of
 * lookups. Each loaded database gets its own instance; reloading a database
 * discards the cache of the previous one.
 *
 * <p>Implementations must be safe for use by concurrent lookups.
 */
public interface LookupCache {
    /**
     * A loader is used to load a value for a key that is not in the cache.
     */
    interface Loader {
        /**
         * @param key
         *            the key to load
         * @return the value for the key
         * @throws IOException
         *             if the database is corrupt
         * @throws LookupException
         *             if the lookup fails
         */
        Object load(CacheKey key) throws IOException, LookupException;
    }

    /**
     * This method returns the value for the key. If the key is not in the cache
     * then the loader is called to load the value. Failed loads are not cached.
     *
     * @param key
     *            the key to look up
     * @param loader
     *            the loader to use if the key is not in the cache
     * @return the value for the key
     * @throws IOException
     *             if the database is corrupt
     * @throws LookupException
     *             if the lookup fails
     */
    Object get(CacheKey key, Loader loader) throws IOException, LookupException;
}
