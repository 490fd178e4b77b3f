package com.duelo.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "engine")
public class AgentEngineProperties {

    private ProviderConfig provider = new ProviderConfig();
    private OpenAIConfig openai = new OpenAIConfig();
    private GoogleConfig google = new GoogleConfig();
    private CreditsConfig credits = new CreditsConfig();
    private EstimationConfig estimation = new EstimationConfig();
    private DebugLogConfig debugLog = new DebugLogConfig();
    private PricingConfig pricing = new PricingConfig();

    public enum OverrunPolicy {
        CHARGE_AVAILABLE, FAIL_UNCHARGED
    }

    public static class ProviderConfig {
        private Duration timeout = Duration.ofSeconds(120);
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(120);
        private int concurrency = 8;
        private boolean mockEnabled = false;
        private boolean httpLogging = false;

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
        public Duration getReadTimeout() { return readTimeout; }
        public void setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; }
        public int getConcurrency() { return concurrency; }
        public void setConcurrency(int concurrency) { this.concurrency = concurrency; }
        public boolean isMockEnabled() { return mockEnabled; }
        public void setMockEnabled(boolean mockEnabled) { this.mockEnabled = mockEnabled; }
        public boolean isHttpLogging() { return httpLogging; }
        public void setHttpLogging(boolean httpLogging) { this.httpLogging = httpLogging; }
    }

    public static class OpenAIConfig {
        private boolean enabled = true;
        private String defaultModel = "gpt-4o-mini";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getDefaultModel() { return defaultModel; }
        public void setDefaultModel(String defaultModel) { this.defaultModel = defaultModel; }
    }

    public static class GoogleConfig {
        private boolean enabled = true;
        private String defaultModel = "gemini-2.5-flash";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getDefaultModel() { return defaultModel; }
        public void setDefaultModel(String defaultModel) { this.defaultModel = defaultModel; }
    }

    public static class CreditsConfig {
        private int creditsPerDollar = 100;
        private int minimumCreditCost = 1;
        private OverrunPolicy overrunPolicy = OverrunPolicy.CHARGE_AVAILABLE;

        public int getCreditsPerDollar() { return creditsPerDollar; }
        public void setCreditsPerDollar(int creditsPerDollar) { this.creditsPerDollar = creditsPerDollar; }
        public int getMinimumCreditCost() { return minimumCreditCost; }
        public void setMinimumCreditCost(int minimumCreditCost) { this.minimumCreditCost = minimumCreditCost; }
        public OverrunPolicy getOverrunPolicy() { return overrunPolicy; }

        public void setOverrunPolicy(OverrunPolicy overrunPolicy) {
            if (overrunPolicy == null) {
                return;
            }
            this.overrunPolicy = overrunPolicy;
        }
    }

    public static class EstimationConfig {
        private int writerCompletionTokens = 1500;
        private int judgeCompletionTokens = 800;
        private double writerTemperature = 0.8;
        private double judgeTemperature = 0.3;
        private int writerMaxTokens = 4000;
        private int judgeMaxTokens = 2000;

        public int getWriterCompletionTokens() { return writerCompletionTokens; }
        public void setWriterCompletionTokens(int writerCompletionTokens) { this.writerCompletionTokens = writerCompletionTokens; }
        public int getJudgeCompletionTokens() { return judgeCompletionTokens; }
        public void setJudgeCompletionTokens(int judgeCompletionTokens) { this.judgeCompletionTokens = judgeCompletionTokens; }
        public double getWriterTemperature() { return writerTemperature; }
        public void setWriterTemperature(double writerTemperature) { this.writerTemperature = writerTemperature; }
        public double getJudgeTemperature() { return judgeTemperature; }
        public void setJudgeTemperature(double judgeTemperature) { this.judgeTemperature = judgeTemperature; }
        public int getWriterMaxTokens() { return writerMaxTokens; }
        public void setWriterMaxTokens(int writerMaxTokens) { this.writerMaxTokens = writerMaxTokens; }
        public int getJudgeMaxTokens() { return judgeMaxTokens; }
        public void setJudgeMaxTokens(int judgeMaxTokens) { this.judgeMaxTokens = judgeMaxTokens; }
    }

    public static class DebugLogConfig {
        private boolean enabled = false;
        private int capacity = 1000;
        private String store = "memory";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public int getCapacity() { return capacity; }
        public void setCapacity(int capacity) { this.capacity = capacity; }
        public String getStore() { return store; }
        public void setStore(String store) { this.store = store; }
    }

    public static class PricingConfig {
        private String location = "classpath:model-pricing.json";

        public String getLocation() { return location; }
        public void setLocation(String location) { this.location = location; }
    }

    public ProviderConfig getProvider() {
        return provider;
    }

    public void setProvider(ProviderConfig provider) {
        this.provider = provider != null ? provider : new ProviderConfig();
    }

    public OpenAIConfig getOpenai() {
        return openai;
    }

    public void setOpenai(OpenAIConfig openai) {
        this.openai = openai;
    }

    public GoogleConfig getGoogle() {
        return google;
    }

    public void setGoogle(GoogleConfig google) {
        this.google = google;
    }

    public CreditsConfig getCredits() {
        return credits;
    }

    public void setCredits(CreditsConfig credits) {
        this.credits = credits != null ? credits : new CreditsConfig();
    }

    public EstimationConfig getEstimation() {
        return estimation;
    }

    public void setEstimation(EstimationConfig estimation) {
        this.estimation = estimation != null ? estimation : new EstimationConfig();
    }

    public DebugLogConfig getDebugLog() {
        return debugLog;
    }

    public void setDebugLog(DebugLogConfig debugLog) {
        this.debugLog = debugLog != null ? debugLog : new DebugLogConfig();
    }

    public PricingConfig getPricing() {
        return pricing;
    }

    public void setPricing(PricingConfig pricing) {
        this.pricing = pricing;
    }
}
