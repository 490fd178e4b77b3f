package com.duelo.engine.cost;

import com.duelo.config.AgentEngineProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
@Slf4j
public class JsonModelPricingCatalog implements ModelPricingCatalog {

    private final Map<String, ModelPricing> models;

    public JsonModelPricingCatalog(AgentEngineProperties properties, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        this.models = load(resourceLoader.getResource(properties.getPricing().getLocation()), objectMapper);
    }

    @Override
    public Optional<ModelPricing> find(String modelId) {
        if (!StringUtils.hasText(modelId)) {
            return Optional.empty();
        }
        return Optional.ofNullable(models.get(modelId.trim()));
    }

    @Override
    public List<ModelPricing> availableModels() {
        return models.values().stream().filter(ModelPricing::available).toList();
    }

    private static Map<String, ModelPricing> load(Resource resource, ObjectMapper objectMapper) {
        try (InputStream in = resource.getInputStream()) {
            List<ModelPricing> entries = objectMapper.readValue(in, new TypeReference<List<ModelPricing>>() {});
            Map<String, ModelPricing> byId = new LinkedHashMap<>();
            for (ModelPricing entry : entries) {
                if (byId.put(entry.id(), entry) != null) {
                    log.warn("Duplicate pricing entry for model {}; the last one wins.", entry.id());
                }
            }
            log.info("Loaded pricing for {} models from {}.", byId.size(), resource.getDescription());
            return Collections.unmodifiableMap(byId);
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to load model pricing from " + resource.getDescription(), ex);
        }
    }
}
