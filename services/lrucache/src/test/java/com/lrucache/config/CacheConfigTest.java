package com.lrucache.config;

import com.lrucache.core.LruCache;
import com.lrucache.demo.CacheDemoRunner;
import com.lrucache.json.CacheSnapshotWriter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "lru.cache.capacity=2",
        "lru.cache.demo.enabled=false"
})
public class CacheConfigTest {

    @Autowired
    private LruCache<String, String> cache;

    @Autowired
    private CacheSnapshotWriter snapshotWriter;

    @Autowired
    private ApplicationContext context;

    @Test
    void testCapacityComesFromProperties() {
        assertEquals(2, cache.limit());
    }

    @Test
    void testSharedCacheEvictsAtConfiguredCapacity() {
        cache.clear();
        cache.put("a", "1");
        cache.put("b", "2");

        assertEquals("a", cache.put("c", "3").orElseThrow().key());
        assertEquals("[{\"key\":\"b\",\"value\":\"2\"},{\"key\":\"c\",\"value\":\"3\"}]",
                snapshotWriter.write(cache));
    }

    @Test
    void testDemoRunnerDisabled() {
        assertTrue(context.getBeansOfType(CacheDemoRunner.class).isEmpty());
    }
}
