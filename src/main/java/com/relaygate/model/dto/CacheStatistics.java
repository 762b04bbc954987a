package com.relaygate.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response cache statistics since startup.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatistics {

    private String store;

    private boolean enabled;

    /**
     * Live entries, or -1 when the store could not be asked.
     */
    private long entries;

    private long hits;

    private long misses;

    @JsonProperty("hit_rate")
    private double hitRate;

    private long writes;

    private long errors;
}
