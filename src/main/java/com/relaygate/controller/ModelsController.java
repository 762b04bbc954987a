package com.relaygate.controller;

import com.relaygate.model.dto.ModelInfo;
import com.relaygate.service.pricing.ModelTierResolver;
import com.relaygate.service.pricing.PricingTable;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Lists the models known to the pricing table.
 */
@RestController
@RequestMapping("/v1")
public class ModelsController {

    private final PricingTable pricingTable;
    private final ModelTierResolver tierResolver;

    public ModelsController(PricingTable pricingTable, ModelTierResolver tierResolver) {
        this.pricingTable = pricingTable;
        this.tierResolver = tierResolver;
    }

    @GetMapping("/models")
    public ResponseEntity<Map<String, Object>> listModels() {
        List<ModelInfo> models = pricingTable.all().stream()
                .map(entry -> ModelInfo.builder()
                        .id(entry.getModel())
                        .provider(entry.getProvider())
                        .tier(tierResolver.resolve(entry.getModel()))
                        .inputPerMillion(entry.getInputPerMillion())
                        .outputPerMillion(entry.getOutputPerMillion())
                        .build())
                .collect(Collectors.toList());

        return ResponseEntity.ok(Map.of(
                "object", "list",
                "data", models
        ));
    }
}
