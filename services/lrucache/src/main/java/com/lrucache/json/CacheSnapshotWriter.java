package com.lrucache.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.lrucache.core.CacheEntry;
import com.lrucache.core.LruCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a cache as a JSON array of {@code {"key": ..., "value": ...}}
 * objects, least recently used first. Reading the cache this way does not
 * change recency.
 */
public class CacheSnapshotWriter {
    private static final Logger logger = LoggerFactory.getLogger(CacheSnapshotWriter.class);

    private final ObjectMapper mapper;

    public CacheSnapshotWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ArrayNode toTree(LruCache<?, ?> cache) {
        ArrayNode array = mapper.createArrayNode();
        for (CacheEntry<?, ?> entry : cache.toOrderedSequence()) {
            array.addObject()
                    .putPOJO("key", entry.key())
                    .putPOJO("value", entry.value());
        }
        return array;
    }

    public String write(LruCache<?, ?> cache) {
        try {
            String json = mapper.writeValueAsString(toTree(cache));
            logger.debug("Wrote snapshot of {} entries", cache.size());
            return json;
        } catch (JsonProcessingException e) {
            throw new CacheSnapshotException("Failed to serialise cache snapshot", e);
        }
    }
}
