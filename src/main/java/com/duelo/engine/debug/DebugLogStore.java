package com.duelo.engine.debug;

import com.duelo.entity.AgentType;
import com.duelo.entity.DebugLogEntry;

import java.util.List;

/**
 * Bounded FIFO storage of debug entries, one queue per operation type.
 */
public interface DebugLogStore {

    /**
     * Stores the entry and evicts the oldest ones of its type beyond {@code capacity}.
     */
    void append(DebugLogEntry entry, int capacity);

    /**
     * Newest first.
     */
    List<DebugLogEntry> recent(AgentType type, int limit);

    long count(AgentType type);
}
