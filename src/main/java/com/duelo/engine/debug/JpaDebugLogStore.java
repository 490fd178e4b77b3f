package com.duelo.engine.debug;

import com.duelo.entity.AgentType;
import com.duelo.entity.DebugLogEntry;
import com.duelo.repository.DebugLogEntryRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Keeps debug entries in {@code debug_log_entry}, pruned to capacity after every insert.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "engine.debug-log", name = "store", havingValue = "jpa")
public class JpaDebugLogStore implements DebugLogStore {

    private final DebugLogEntryRepository repository;

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void append(DebugLogEntry entry, int capacity) {
        repository.save(entry);
        List<Long> overflow = repository.findIdsNewestFirst(entry.getOperationType(), PageRequest.of(1, capacity));
        while (!overflow.isEmpty()) {
            repository.deleteAllByIdInBatch(overflow);
            overflow = repository.findIdsNewestFirst(entry.getOperationType(), PageRequest.of(1, capacity));
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<DebugLogEntry> recent(AgentType type, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return repository.findByOperationTypeOrderByIdDesc(type, PageRequest.of(0, limit));
    }

    @Override
    @Transactional(readOnly = true)
    public long count(AgentType type) {
        return repository.countByOperationType(type);
    }
}
