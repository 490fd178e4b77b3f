package com.duelo.engine.debug;

import com.duelo.config.AgentEngineProperties;
import com.duelo.entity.AgentType;
import com.duelo.entity.DebugLogEntry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

class DebugLogServiceTest {

    private AgentEngineProperties properties;
    private InMemoryDebugLogStore store;
    private DebugLogService service;

    @BeforeEach
    void setUp() {
        properties = new AgentEngineProperties();
        properties.getDebugLog().setEnabled(true);
        store = new InMemoryDebugLogStore();
        service = new DebugLogService(store, new ObjectMapper(), properties);
    }

    @Test
    void testDisabledServiceStoresNothing() {
        properties.getDebugLog().setEnabled(false);

        service.record(record(AgentType.WRITER, "prompt"));

        assertFalse(service.isEnabled());
        assertEquals(0, service.count(AgentType.WRITER));
    }

    @Test
    void testRecordCapturesRoundTrip() {
        UUID agentId = UUID.randomUUID();
        service.record(DebugLogRecord.builder()
                .operationType(AgentType.JUDGE)
                .agentId(agentId)
                .model("test-model")
                .strategyInput(Map.of("texts", List.of("a", "b")))
                .prompt("judge prompt")
                .response("1. A")
                .parsedOutput(Map.of("parsing_success", false))
                .executionTimeMs(42)
                .promptTokens(100)
                .completionTokens(20)
                .costUsd(new BigDecimal("0.0016"))
                .build());

        DebugLogEntry entry = service.recent(AgentType.JUDGE, 10).get(0);
        assertNotNull(entry.getId());
        assertNotNull(entry.getCreatedAt());
        assertEquals(agentId, entry.getAgentId());
        assertEquals("judge prompt", entry.getLlmPrompt());
        assertEquals("1. A", entry.getLlmResponse());
        assertEquals("{\"parsing_success\":false}", entry.getParsedOutput());
        assertEquals("- texts: [2 items]", entry.getStrategyInput());
        assertEquals(42L, entry.getExecutionTimeMs());
        assertEquals(0, service.count(AgentType.WRITER));
    }

    @Test
    void testOldestEntriesAreEvictedPerType() {
        properties.getDebugLog().setCapacity(1000);
        for (int i = 0; i < 1001; i++) {
            service.record(record(AgentType.WRITER, "prompt " + i));
        }
        service.record(record(AgentType.JUDGE, "judge"));

        assertEquals(1000, service.count(AgentType.WRITER));
        assertEquals(1, service.count(AgentType.JUDGE));
        List<DebugLogEntry> recent = service.recent(AgentType.WRITER, 1000);
        assertEquals("prompt 1000", recent.get(0).getLlmPrompt());
        assertEquals("prompt 1", recent.get(recent.size() - 1).getLlmPrompt());
    }

    @Test
    void testRecentHonoursLimit() {
        for (int i = 0; i < 5; i++) {
            service.record(record(AgentType.WRITER, "prompt " + i));
        }

        assertEquals(List.of("prompt 4", "prompt 3"),
                service.recent(AgentType.WRITER, 2).stream().map(DebugLogEntry::getLlmPrompt).toList());
        assertTrue(service.recent(AgentType.WRITER, -1).isEmpty());
    }

    @Test
    void testStoreFailureIsNotPropagated() {
        DebugLogStore failing = mock(DebugLogStore.class);
        doThrow(new IllegalStateException("disk full")).when(failing).append(any(DebugLogEntry.class), anyInt());
        DebugLogService failingService = new DebugLogService(failing, new ObjectMapper(), properties);

        assertDoesNotThrow(() -> failingService.record(record(AgentType.WRITER, "prompt")));
    }

    @Test
    void testStrategyInputFormatting() {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("description", "x".repeat(250));
        input.put("texts", List.of(1, 2, 3));
        input.put("temperature", 0.8);
        input.put("title", null);

        String formatted = DebugLogService.formatStrategyInput(input);

        assertEquals("- description: \"" + "x".repeat(200) + "...\"\n"
                + "- texts: [3 items]\n"
                + "- temperature: 0.8\n"
                + "- title: null", formatted);
        assertEquals("", DebugLogService.formatStrategyInput(Map.of()));
        assertEquals("", DebugLogService.formatStrategyInput(null));
    }

    private static DebugLogRecord record(AgentType type, String prompt) {
        return DebugLogRecord.builder()
                .operationType(type)
                .model("test-model")
                .strategyInput(Map.of())
                .prompt(prompt)
                .response("response")
                .build();
    }
}
