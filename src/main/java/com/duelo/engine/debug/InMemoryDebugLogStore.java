package com.duelo.engine.debug;

import com.duelo.entity.AgentType;
import com.duelo.entity.DebugLogEntry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

@Component
@ConditionalOnProperty(prefix = "engine.debug-log", name = "store", havingValue = "memory", matchIfMissing = true)
public class InMemoryDebugLogStore implements DebugLogStore {

    private final Map<AgentType, Deque<DebugLogEntry>> buffers = new EnumMap<>(AgentType.class);
    private final AtomicLong sequence = new AtomicLong();

    public InMemoryDebugLogStore() {
        for (AgentType type : AgentType.values()) {
            buffers.put(type, new ArrayDeque<>());
        }
    }

    @Override
    public void append(DebugLogEntry entry, int capacity) {
        entry.setId(sequence.incrementAndGet());
        if (entry.getCreatedAt() == null) {
            entry.setCreatedAt(OffsetDateTime.now());
        }
        Deque<DebugLogEntry> buffer = buffers.get(entry.getOperationType());
        synchronized (buffer) {
            buffer.addLast(entry);
            while (buffer.size() > capacity) {
                buffer.removeFirst();
            }
        }
    }

    @Override
    public List<DebugLogEntry> recent(AgentType type, int limit) {
        Deque<DebugLogEntry> buffer = buffers.get(type);
        List<DebugLogEntry> result = new ArrayList<>();
        synchronized (buffer) {
            Iterator<DebugLogEntry> newestFirst = buffer.descendingIterator();
            while (newestFirst.hasNext() && result.size() < limit) {
                result.add(newestFirst.next());
            }
        }
        return result;
    }

    @Override
    public long count(AgentType type) {
        Deque<DebugLogEntry> buffer = buffers.get(type);
        synchronized (buffer) {
            return buffer.size();
        }
    }
}
