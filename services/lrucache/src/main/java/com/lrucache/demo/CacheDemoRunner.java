package com.lrucache.demo;

import com.lrucache.core.LruCache;
import com.lrucache.json.CacheSnapshotWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Walks a small capacity-4 cache through inserts, reads, an eviction and an
 * update on start-up, logging the chain after each step.
 */
@Component
@ConditionalOnProperty(name = "lru.cache.demo.enabled", havingValue = "true", matchIfMissing = true)
public class CacheDemoRunner implements CommandLineRunner {
    private static final Logger logger = LoggerFactory.getLogger(CacheDemoRunner.class);
    private static final int DEMO_CAPACITY = 4;

    private final CacheSnapshotWriter snapshotWriter;

    public CacheDemoRunner(CacheSnapshotWriter snapshotWriter) {
        this.snapshotWriter = snapshotWriter;
    }

    @Override
    public void run(String... args) {
        LruCache<String, Integer> cache = new LruCache<>(DEMO_CAPACITY,
                (key, value) -> logger.info("Evicted {}:{}", key, value));

        cache.put("adam", 29);
        cache.put("john", 26);
        cache.put("angela", 24);
        cache.put("bob", 48);
        logger.info("After inserts: {}", cache);

        for (String name : new String[] {"adam", "john", "angela", "bob"}) {
            cache.get(name);
        }
        logger.info("After reading in insertion order: {}", cache);

        cache.get("angela");
        logger.info("After reading angela: {}", cache);

        cache.put("ygwie", 81);
        logger.info("After inserting ygwie: {}", cache);
        logger.info("adam still cached: {}", cache.get("adam").isFound());

        cache.put("john", 11);
        logger.info("After updating john: {}", cache);
        logger.info("Snapshot: {}", snapshotWriter.write(cache));
    }
}
