package com.duelo.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class AgentEngineConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService llmExecutor(AgentEngineProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getProvider().getConcurrency()));
    }
}
