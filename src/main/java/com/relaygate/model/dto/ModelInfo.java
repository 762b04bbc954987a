package com.relaygate.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * A model the gateway knows how to price, as listed by {@code GET /v1/models}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelInfo {

    private String id;

    @JsonProperty("object")
    @Builder.Default
    private String object = "model";

    @JsonProperty("owned_by")
    private String provider;

    private String tier;

    @JsonProperty("input_per_million")
    private BigDecimal inputPerMillion;

    @JsonProperty("output_per_million")
    private BigDecimal outputPerMillion;
}
