package com.scout.service.cache;

import com.scout.model.dto.CacheRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Strict LRU memory tier bounded by entry count.
 *
 * <p>Not thread-safe; {@link CacheStore} serializes access.
 */
@Slf4j
class MemoryCacheTier {

    private final int capacity;
    private final LinkedHashMap<String, CacheRecord> entries;

    MemoryCacheTier(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Memory cache capacity must be at least 1, got " + capacity);
        }
        this.capacity = capacity;
        // access order: iteration runs least- to most-recently used
        this.entries = new LinkedHashMap<>(16, 0.75f, true);
    }

    /**
     * Look up a live record and mark it most recently used. Expired records are purged.
     */
    CacheRecord get(String key, Instant now) {
        CacheRecord record = entries.get(key);
        if (record == null) {
            return null;
        }
        if (record.isExpired(now)) {
            entries.remove(key);
            return null;
        }
        record.recordHit();
        return record;
    }

    /**
     * Whether a live record exists, without touching recency or hit counters.
     * Map lookups would reorder an access-ordered map, so this scans.
     */
    boolean containsLive(String key, Instant now) {
        if (!entries.containsKey(key)) {
            return false;
        }
        for (CacheRecord record : entries.values()) {
            if (record.getKey().equals(key)) {
                return !record.isExpired(now);
            }
        }
        return false;
    }

    /**
     * Insert or replace a record, evicting least recently used entries at capacity.
     *
     * @return the evicted records, oldest first
     */
    List<CacheRecord> put(CacheRecord record) {
        entries.remove(record.getKey());
        List<CacheRecord> evicted = new ArrayList<>();
        Iterator<Map.Entry<String, CacheRecord>> eldest = entries.entrySet().iterator();
        while (entries.size() >= capacity && eldest.hasNext()) {
            CacheRecord victim = eldest.next().getValue();
            eldest.remove();
            evicted.add(victim);
            log.debug("Evicted from memory cache: {}", abbreviate(victim.getKey()));
        }
        entries.put(record.getKey(), record);
        return evicted;
    }

    boolean remove(String key) {
        return entries.remove(key) != null;
    }

    int clear() {
        int size = entries.size();
        entries.clear();
        return size;
    }

    int size() {
        return entries.size();
    }

    int capacity() {
        return capacity;
    }

    /**
     * Keys from least to most recently used.
     */
    List<String> keys() {
        return new ArrayList<>(entries.keySet());
    }

    static String abbreviate(String key) {
        return key.length() > 16 ? key.substring(0, 16) + "..." : key;
    }
}
