package com.duelo.repository;

import com.duelo.entity.Agent;
import com.duelo.entity.AgentType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * Repository interface for managing {@link Agent} entities.
 */
public interface AgentRepository extends JpaRepository<Agent, UUID> {

    List<Agent> findByOwnerIdOrderByCreatedAtDesc(UUID ownerId);

    List<Agent> findByPublicAgentTrueAndTypeOrderByNameAsc(AgentType type);
}
