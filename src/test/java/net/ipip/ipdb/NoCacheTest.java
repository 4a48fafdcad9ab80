package net.ipip.ipdb;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

public class NoCacheTest {

    @Test
    public void testEveryLookupIsLoaded() throws Exception {
        CacheKey key = new CacheKey("8.8.8.8", "CN", List.class);
        AtomicInteger loads = new AtomicInteger();
        LookupCache.Loader loader = k -> loads.incrementAndGet();

        assertEquals(1, NoCache.getInstance().get(key, loader));
        assertEquals(2, NoCache.getInstance().get(key, loader));
        assertSame(NoCache.getInstance(), NoCache.getInstance());
    }
}
