package com.scout.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One cached value, stored identically in the memory and file tiers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheRecord {

    @JsonProperty("key")
    private String key;

    @JsonProperty("value")
    private JsonNode value;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("expires_at")
    private Instant expiresAt;

    @JsonProperty("hit_count")
    private int hitCount;

    /**
     * A record read strictly after its expiry instant is absent.
     */
    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }

    public void recordHit() {
        hitCount++;
    }
}
