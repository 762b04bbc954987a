package com.relaygate.service.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relaygate.exception.CacheStoreException;
import com.relaygate.model.CacheEntry;
import com.relaygate.model.CacheKey;
import com.relaygate.model.CachedLookup;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Redis-backed store with gzip compression, shared between gateway instances.
 * Key pattern: relaygate:cache:entry:{sha256}, hits under relaygate:cache:hits:{sha256}.
 */
@Slf4j
public class RedisResponseCacheStore implements ResponseCacheStore {

    private static final String ENTRY_PREFIX = "relaygate:cache:entry:";
    private static final String HITS_PREFIX = "relaygate:cache:hits:";

    private final RedisTemplate<String, byte[]> redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public RedisResponseCacheStore(RedisTemplate<String, byte[]> redisTemplate,
                                   ObjectMapper objectMapper,
                                   Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.ttl = ttl;
    }

    @Override
    public String getName() {
        return "redis";
    }

    @Override
    public Optional<CachedLookup> get(CacheKey key) {
        try {
            byte[] compressed = redisTemplate.opsForValue().get(ENTRY_PREFIX + key.getDigest());
            if (compressed == null) {
                log.debug("Redis cache miss: {}", key);
                return Optional.empty();
            }

            CacheEntry entry = decompress(compressed);

            // Hit counter lives beside the entry so the entry bytes are never rewritten
            String hitsKey = HITS_PREFIX + key.getDigest();
            Long hits = redisTemplate.opsForValue().increment(hitsKey);
            redisTemplate.expire(hitsKey, ttl);

            return Optional.of(new CachedLookup(key, entry, hits != null ? hits : 1));

        } catch (Exception e) {
            throw new CacheStoreException("Redis read failed for key " + key, e);
        }
    }

    @Override
    public void put(CacheKey key, CacheEntry entry) {
        try {
            byte[] compressed = compress(entry);
            redisTemplate.opsForValue().set(ENTRY_PREFIX + key.getDigest(), compressed, ttl);
            redisTemplate.delete(HITS_PREFIX + key.getDigest());

            log.debug("Stored in Redis cache: key={}, ttl={}, size={}B", key, ttl, compressed.length);

        } catch (Exception e) {
            throw new CacheStoreException("Redis write failed for key " + key, e);
        }
    }

    @Override
    public long size() {
        try {
            Set<String> keys = redisTemplate.keys(ENTRY_PREFIX + "*");
            return keys != null ? keys.size() : 0;
        } catch (Exception e) {
            throw new CacheStoreException("Redis size query failed", e);
        }
    }

    @Override
    public void clear() {
        try {
            Set<String> entries = redisTemplate.keys(ENTRY_PREFIX + "*");
            Set<String> hits = redisTemplate.keys(HITS_PREFIX + "*");
            if (entries != null && !entries.isEmpty()) {
                redisTemplate.delete(entries);
            }
            if (hits != null && !hits.isEmpty()) {
                redisTemplate.delete(hits);
            }
            log.info("Cleared {} entries from Redis cache", entries != null ? entries.size() : 0);
        } catch (Exception e) {
            throw new CacheStoreException("Redis clear failed", e);
        }
    }

    /**
     * Compress cache entry using GZIP.
     */
    private byte[] compress(CacheEntry entry) throws IOException {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            try (GZIPOutputStream gzipOut = new GZIPOutputStream(baos)) {
                gzipOut.write(objectMapper.writeValueAsBytes(entry));
            }
            return baos.toByteArray();
        }
    }

    /**
     * Decompress and deserialize cache entry.
     */
    private CacheEntry decompress(byte[] compressed) throws IOException {
        try (GZIPInputStream gzipIn = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return objectMapper.readValue(gzipIn.readAllBytes(), CacheEntry.class);
        }
    }
}
