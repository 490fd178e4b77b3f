package com.duelo.engine.cost;

import com.duelo.engine.exception.UnknownModelException;

import java.util.List;
import java.util.Optional;

/**
 * Read-only lookup of the models agents may run on.
 */
public interface ModelPricingCatalog {

    Optional<ModelPricing> find(String modelId);

    List<ModelPricing> availableModels();

    /**
     * Returns the pricing of an available model.
     *
     * @throws UnknownModelException if the model is absent or marked unavailable
     */
    default ModelPricing require(String modelId) {
        return find(modelId)
                .filter(ModelPricing::available)
                .orElseThrow(() -> new UnknownModelException(modelId));
    }
}
