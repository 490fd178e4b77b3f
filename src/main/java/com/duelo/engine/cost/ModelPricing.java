package com.duelo.engine.cost;

import com.duelo.engine.provider.ProviderType;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Objects;

public record ModelPricing(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("provider") ProviderType provider,
        @JsonProperty("context_window_k") int contextWindowK,
        @JsonProperty("input_cost_usd_per_1k_tokens") BigDecimal inputCostPer1k,
        @JsonProperty("output_cost_usd_per_1k_tokens") BigDecimal outputCostPer1k,
        @JsonProperty("available") boolean available
) {

    public ModelPricing {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(provider, "provider is required for model " + id);
        inputCostPer1k = inputCostPer1k != null ? inputCostPer1k : BigDecimal.ZERO;
        outputCostPer1k = outputCostPer1k != null ? outputCostPer1k : BigDecimal.ZERO;
        name = name != null ? name : id;
    }
}
