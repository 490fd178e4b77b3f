package com.duelo.engine.debug;

import com.duelo.entity.AgentType;
import com.duelo.entity.DebugLogEntry;
import com.duelo.repository.BaseRepositoryTest;
import com.duelo.repository.DebugLogEntryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.TestPropertySource;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Import(JpaDebugLogStore.class)
@TestPropertySource(properties = "engine.debug-log.store=jpa")
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class JpaDebugLogStoreTest extends BaseRepositoryTest {

    @Autowired
    private DebugLogStore store;

    @Autowired
    private DebugLogEntryRepository repository;

    @BeforeEach
    void setUp() {
        repository.deleteAllInBatch();
    }

    @Test
    void testAppendPrunesOldestBeyondCapacity() {
        for (int i = 0; i < 5; i++) {
            store.append(entry(AgentType.JUDGE, "prompt " + i), 3);
        }
        store.append(entry(AgentType.WRITER, "writer"), 3);

        assertEquals(3, store.count(AgentType.JUDGE));
        assertEquals(1, store.count(AgentType.WRITER));
        List<String> prompts = store.recent(AgentType.JUDGE, 10).stream().map(DebugLogEntry::getLlmPrompt).toList();
        assertEquals(List.of("prompt 4", "prompt 3", "prompt 2"), prompts);
    }

    @Test
    void testShrunkCapacityPrunesOnNextAppend() {
        for (int i = 0; i < 4; i++) {
            store.append(entry(AgentType.WRITER, "prompt " + i), 10);
        }

        store.append(entry(AgentType.WRITER, "latest"), 2);

        assertEquals(2, store.count(AgentType.WRITER));
        assertEquals("latest", store.recent(AgentType.WRITER, 1).get(0).getLlmPrompt());
        assertTrue(store.recent(AgentType.WRITER, 0).isEmpty());
    }

    private static DebugLogEntry entry(AgentType type, String prompt) {
        return DebugLogEntry.builder()
                .operationType(type)
                .model("gpt-4o-mini")
                .llmPrompt(prompt)
                .llmResponse("response")
                .executionTimeMs(10L)
                .build();
    }
}
