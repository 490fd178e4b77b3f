package com.duelo.repository;

import com.duelo.entity.AgentExecution;
import com.duelo.entity.ExecutionStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Repository interface for managing {@link AgentExecution} audit rows.
 */
public interface AgentExecutionRepository extends JpaRepository<AgentExecution, UUID> {

    List<AgentExecution> findByRequesterIdOrderByCreatedAtDesc(UUID requesterId);

    boolean existsByAgentIdAndStatusIn(UUID agentId, Collection<ExecutionStatus> statuses);
}
