package net.ipip.ipdb;

import java.io.IOException;

/**
 * A no-op cache singleton. Every lookup walks the database again.
 */
public final class NoCache implements LookupCache {

    private static final NoCache INSTANCE = new NoCache();

    private NoCache() {
    }

    @Override
    public Object get(CacheKey key, Loader loader) throws IOException, LookupException {
        return loader.load(key);
    }

    /**
     * @return the singleton instance of the NoCache class
     */
    public static NoCache getInstance() {
        return INSTANCE;
    }

}
