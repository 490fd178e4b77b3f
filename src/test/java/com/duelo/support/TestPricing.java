package com.duelo.support;

import com.duelo.config.AgentEngineProperties;
import com.duelo.engine.cost.JsonModelPricingCatalog;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.DefaultResourceLoader;

/**
 * Pricing fixtures from {@code pricing-test.json}: {@code test-model} costs 0.01 USD per 1k input
 * and 0.03 USD per 1k output tokens.
 */
public final class TestPricing {

    public static final String TEST_MODEL = "test-model";
    public static final String GOOGLE_MODEL = "test-gemini";
    public static final String MOCK_MODEL = "test-mock";
    public static final String RETIRED_MODEL = "retired-model";

    private TestPricing() {
    }

    public static AgentEngineProperties properties() {
        AgentEngineProperties properties = new AgentEngineProperties();
        properties.getPricing().setLocation("classpath:pricing-test.json");
        return properties;
    }

    public static JsonModelPricingCatalog catalog(AgentEngineProperties properties) {
        return new JsonModelPricingCatalog(properties, new DefaultResourceLoader(), new ObjectMapper());
    }
}
