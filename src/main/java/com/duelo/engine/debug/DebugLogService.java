package com.duelo.engine.debug;

import com.duelo.config.AgentEngineProperties;
import com.duelo.entity.AgentType;
import com.duelo.entity.DebugLogEntry;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Development-only capture of prompts, raw answers and parse results. Disabled unless
 * {@code engine.debug-log.enabled=true}. Recording never throws: a failure here must not affect
 * the execution being logged.
 */
@Service
@Slf4j
public class DebugLogService {

    static final int MAX_VALUE_LENGTH = 200;

    private final DebugLogStore store;
    private final ObjectMapper objectMapper;
    private final AgentEngineProperties.DebugLogConfig config;

    public DebugLogService(DebugLogStore store, ObjectMapper objectMapper, AgentEngineProperties properties) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.config = properties.getDebugLog();
    }

    public boolean isEnabled() {
        return config.isEnabled();
    }

    public void record(DebugLogRecord record) {
        if (!config.isEnabled()) {
            return;
        }
        try {
            DebugLogEntry entry = DebugLogEntry.builder()
                    .operationType(record.operationType())
                    .userId(record.userId())
                    .agentId(record.agentId())
                    .contestId(record.contestId())
                    .model(record.model())
                    .strategyInput(formatStrategyInput(record.strategyInput()))
                    .llmPrompt(record.prompt())
                    .llmResponse(record.response())
                    .parsedOutput(toJson(record.parsedOutput()))
                    .executionTimeMs(record.executionTimeMs())
                    .promptTokens(record.promptTokens())
                    .completionTokens(record.completionTokens())
                    .costUsd(record.costUsd())
                    .build();
            store.append(entry, Math.max(1, config.getCapacity()));
        } catch (Exception ex) {
            log.debug("Failed to record {} debug log: {}", record.operationType(), ex.getMessage());
        }
    }

    public List<DebugLogEntry> recent(AgentType type, int limit) {
        return store.recent(type, Math.max(0, limit));
    }

    public long count(AgentType type) {
        return store.count(type);
    }

    static String formatStrategyInput(@Nullable Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return "";
        }
        StringBuilder formatted = new StringBuilder();
        for (Map.Entry<String, Object> entry : input.entrySet()) {
            if (formatted.length() > 0) {
                formatted.append('\n');
            }
            formatted.append("- ").append(entry.getKey()).append(": ").append(formatValue(entry.getValue()));
        }
        return formatted.toString();
    }

    private static String formatValue(@Nullable Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof CharSequence text) {
            String string = text.toString();
            String shown = string.length() > MAX_VALUE_LENGTH ? string.substring(0, MAX_VALUE_LENGTH) + "..." : string;
            return "\"" + shown + "\"";
        }
        if (value instanceof Collection<?> collection) {
            return "[" + collection.size() + " items]";
        }
        return String.valueOf(value);
    }

    private String toJson(@Nullable Object value) throws Exception {
        return value != null ? objectMapper.writeValueAsString(value) : null;
    }
}
