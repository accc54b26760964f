package com.lrucache.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lrucache.core.LruCache;
import com.lrucache.json.CacheSnapshotWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CacheConfig {
    private static final Logger logger = LoggerFactory.getLogger(CacheConfig.class);

    @Value("${lru.cache.capacity:1000}")
    private int capacity;

    @Bean
    public LruCache<String, String> lruCache() {
        logger.info("Creating LRU cache with capacity {}", capacity);
        return new LruCache<>(capacity,
                (key, value) -> logger.debug("Evicted {} from shared cache", key));
    }

    @Bean
    public CacheSnapshotWriter cacheSnapshotWriter(ObjectMapper objectMapper) {
        return new CacheSnapshotWriter(objectMapper);
    }
}
