package com.scout.service.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.scout.model.dto.CacheHealth;
import com.scout.model.dto.CacheRecord;
import com.scout.model.dto.CacheStats;
import com.scout.repository.CacheFileRepository;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Two-tier response cache: strict-LRU memory tier in front of a file tier.
 *
 * Flow:
 * 1. Memory tier lookup (marks the entry most recently used)
 * 2. On miss, file tier lookup; a live record is promoted into memory
 * 3. Expired records are purged from whichever tier held them
 *
 * Memory hits only bump the in-memory hit count; it is written back to the
 * file record when the entry is evicted from memory.
 *
 * The cache is a best-effort optimization: file-tier failures are logged and
 * behave as misses or no-ops, never as errors. All tier mutations run under a
 * single lock per store.
 */
@Slf4j
public class CacheStore {

    private final MemoryCacheTier memoryTier;
    private final CacheFileRepository fileTier;
    private final Duration defaultTtl;
    private final Clock clock;
    private final Object lock = new Object();

    private boolean initialized;
    private long hits;
    private long misses;
    private Instant lastCleanup;

    public CacheStore(CacheFileRepository fileTier, int memoryMaxEntries, Duration defaultTtl, Clock clock) {
        this.memoryTier = new MemoryCacheTier(memoryMaxEntries);
        this.fileTier = fileTier;
        this.defaultTtl = defaultTtl;
        this.clock = clock;
    }

    public void initialize() {
        synchronized (lock) {
            if (initialized) {
                log.warn("Cache store already initialized");
                return;
            }
            try {
                fileTier.createDirectory();
            } catch (IOException e) {
                // the memory tier still works without a file tier
                log.error("Failed to create cache directory {}", fileTier.getDirectory(), e);
            }
            initialized = true;
            log.info("Cache store initialized: memory=0/{}, file={}", memoryTier.capacity(), safeFileCount());
        }
    }

    public void shutdown() {
        synchronized (lock) {
            if (!initialized) {
                return;
            }
            memoryTier.clear();
            initialized = false;
            log.info("Cache store shutdown complete");
        }
    }

    /**
     * Get a cached value.
     *
     * @param key cache key
     * @return value if present and unexpired in either tier
     */
    public Optional<JsonNode> get(String key) {
        synchronized (lock) {
            ensureInitialized();
            Instant now = clock.instant();

            CacheRecord record = memoryTier.get(key, now);
            if (record != null) {
                hits++;
                log.debug("Cache HIT (memory): {}", MemoryCacheTier.abbreviate(key));
                return Optional.of(record.getValue());
            }

            record = readFileTier(key, now);
            if (record != null) {
                record.recordHit();
                writeBack(memoryTier.put(record), now);
                hits++;
                log.debug("Cache HIT (file): {}", MemoryCacheTier.abbreviate(key));
                return Optional.of(record.getValue());
            }

            misses++;
            log.debug("Cache MISS: {}", MemoryCacheTier.abbreviate(key));
            return Optional.empty();
        }
    }

    /**
     * Store a value in both tiers.
     *
     * @param key   cache key
     * @param value JSON value
     * @param ttl   time to live, default TTL when null
     */
    public void put(String key, JsonNode value, Duration ttl) {
        synchronized (lock) {
            ensureInitialized();
            Duration effectiveTtl = ttl != null ? ttl : defaultTtl;
            Instant now = clock.instant();

            CacheRecord record = CacheRecord.builder()
                    .key(key)
                    .value(value)
                    .createdAt(now)
                    .expiresAt(now.plus(effectiveTtl))
                    .hitCount(0)
                    .build();

            writeBack(memoryTier.put(record), now);
            try {
                fileTier.write(copyOf(record));
            } catch (RuntimeException e) {
                log.error("Cache file write failed for {}, memory tier kept", MemoryCacheTier.abbreviate(key), e);
            }

            log.debug("Cache SET: {} (TTL: {}s)", MemoryCacheTier.abbreviate(key), effectiveTtl.toSeconds());
        }
    }

    public void put(String key, JsonNode value) {
        put(key, value, null);
    }

    /**
     * Remove a key from both tiers.
     *
     * @return true if either tier held the key
     */
    public boolean delete(String key) {
        synchronized (lock) {
            ensureInitialized();
            boolean memoryDeleted = memoryTier.remove(key);
            boolean fileDeleted = false;
            try {
                fileDeleted = fileTier.delete(key);
            } catch (RuntimeException e) {
                log.warn("Cache file delete failed for {}", MemoryCacheTier.abbreviate(key), e);
            }
            if (memoryDeleted || fileDeleted) {
                log.debug("Cache DELETE: {}", MemoryCacheTier.abbreviate(key));
            }
            return memoryDeleted || fileDeleted;
        }
    }

    /**
     * Clear both tiers and reset counters.
     *
     * @return number of entries removed across both tiers
     */
    public int clear() {
        synchronized (lock) {
            ensureInitialized();
            int removed = memoryTier.clear();
            try {
                removed += fileTier.deleteAll();
            } catch (RuntimeException e) {
                log.warn("Cache file clear failed", e);
            }
            hits = 0;
            misses = 0;
            log.info("Cache CLEARED: {} entries removed", removed);
            return removed;
        }
    }

    /**
     * Remove expired and unparsable records from the file tier.
     * The memory tier purges lazily on access.
     *
     * @return number of files removed
     */
    public int cleanupExpired() {
        synchronized (lock) {
            ensureInitialized();
            int removed = 0;
            try {
                removed = fileTier.deleteExpired(clock.instant());
            } catch (RuntimeException e) {
                log.warn("Cache cleanup failed", e);
            }
            lastCleanup = clock.instant();
            if (removed > 0) {
                log.info("Cache cleanup: {} expired entries removed", removed);
            }
            return removed;
        }
    }

    /**
     * Check for a live entry without counting a hit or miss.
     */
    public boolean exists(String key) {
        synchronized (lock) {
            ensureInitialized();
            Instant now = clock.instant();
            if (memoryTier.containsLive(key, now)) {
                return true;
            }
            return readFileTier(key, now) != null;
        }
    }

    public CacheStats getStats() {
        synchronized (lock) {
            return CacheStats.builder()
                    .hits(hits)
                    .misses(misses)
                    .memoryEntries(memoryTier.size())
                    .memoryMaxEntries(memoryTier.capacity())
                    .fileEntries(safeFileCount())
                    .build();
        }
    }

    public CacheHealth healthCheck() {
        boolean fileOk = fileTier.isWritable();
        synchronized (lock) {
            return CacheHealth.builder()
                    .status(fileOk ? "healthy" : "degraded")
                    .fileCacheAccessible(fileOk)
                    .stats(getStats())
                    .lastCleanup(lastCleanup)
                    .build();
        }
    }

    /**
     * Memory-tier keys from least to most recently used.
     */
    public List<String> memoryKeys() {
        synchronized (lock) {
            return memoryTier.keys();
        }
    }

    private CacheRecord readFileTier(String key, Instant now) {
        Optional<CacheRecord> stored;
        try {
            stored = fileTier.read(key);
        } catch (RuntimeException e) {
            log.warn("Cache file unreadable for {}, treating as miss: {}", MemoryCacheTier.abbreviate(key), e.getMessage());
            deleteQuietly(key);
            return null;
        }

        if (stored.isEmpty()) {
            return null;
        }

        CacheRecord record = stored.get();
        if (record.getExpiresAt() == null || record.isExpired(now)) {
            deleteQuietly(key);
            return null;
        }
        return record;
    }

    /**
     * Persist the hit counts of records leaving the memory tier. Expired and unhit records are skipped.
     */
    private void writeBack(List<CacheRecord> evicted, Instant now) {
        for (CacheRecord record : evicted) {
            if (record.getHitCount() == 0 || record.isExpired(now)) {
                continue;
            }
            try {
                fileTier.write(copyOf(record));
            } catch (RuntimeException e) {
                log.warn("Hit count write-back failed for {}: {}", MemoryCacheTier.abbreviate(record.getKey()), e.getMessage());
            }
        }
    }

    private void deleteQuietly(String key) {
        try {
            fileTier.delete(key);
        } catch (RuntimeException e) {
            log.debug("Could not remove cache file for {}: {}", MemoryCacheTier.abbreviate(key), e.getMessage());
        }
    }

    private int safeFileCount() {
        try {
            return fileTier.count();
        } catch (RuntimeException e) {
            log.warn("Cache file count unavailable: {}", e.getMessage());
            return 0;
        }
    }

    private static CacheRecord copyOf(CacheRecord record) {
        return CacheRecord.builder()
                .key(record.getKey())
                .value(record.getValue())
                .createdAt(record.getCreatedAt())
                .expiresAt(record.getExpiresAt())
                .hitCount(record.getHitCount())
                .build();
    }

    private void ensureInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Cache store not initialized. Call initialize() first.");
        }
    }
}
