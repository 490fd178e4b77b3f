package com.duelo.engine;

import com.duelo.engine.cost.ModelPricingCatalog;
import com.duelo.engine.exception.AgentAccessDeniedException;
import com.duelo.engine.exception.AgentInUseException;
import com.duelo.engine.exception.AgentNotFoundException;
import com.duelo.engine.model.AgentDraft;
import com.duelo.entity.Agent;
import com.duelo.entity.ExecutionStatus;
import com.duelo.repository.AgentExecutionRepository;
import com.duelo.repository.AgentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

/**
 * Agent lookup and maintenance. Private agents are visible to their owner only; public agents
 * can be used and cloned by anyone.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AgentCatalogService {

    private static final String CLONE_PREFIX = "Copy of ";
    private static final int MAX_NAME_LENGTH = 100;

    private final AgentRepository agentRepository;
    private final AgentExecutionRepository executionRepository;
    private final ModelPricingCatalog pricingCatalog;

    @Transactional(readOnly = true)
    public Agent requireUsable(UUID agentId, UUID requesterId) {
        Agent agent = agentRepository.findById(agentId).orElseThrow(() -> new AgentNotFoundException(agentId));
        checkUsable(agent, requesterId);
        return agent;
    }

    public void checkUsable(Agent agent, UUID requesterId) {
        if (!agent.isPublicAgent() && !agent.isOwnedBy(requesterId)) {
            throw new AgentAccessDeniedException("Agent " + agent.getId() + " is private to its owner");
        }
    }

    @Transactional(readOnly = true)
    public List<Agent> agentsOwnedBy(UUID ownerId) {
        return agentRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId);
    }

    @Transactional
    public Agent create(UUID ownerId, AgentDraft draft) {
        pricingCatalog.require(draft.defaultModel().trim());
        Agent agent = Agent.builder().ownerId(ownerId).build();
        apply(agent, draft);
        Agent saved = agentRepository.save(agent);
        log.info("Created {} agent {} for owner {}.", saved.getType(), saved.getId(), ownerId);
        return saved;
    }

    @Transactional
    public Agent update(UUID agentId, UUID editorId, AgentDraft draft) {
        Agent agent = requireOwned(agentId, editorId);
        if (agent.getType() != draft.type()) {
            throw new IllegalArgumentException("Agent type cannot change from " + agent.getType() + " to " + draft.type());
        }
        pricingCatalog.require(draft.defaultModel().trim());
        apply(agent, draft);
        return agentRepository.save(agent);
    }

    @Transactional
    public void delete(UUID agentId, UUID requesterId) {
        Agent agent = requireOwned(agentId, requesterId);
        if (executionRepository.existsByAgentIdAndStatusIn(agentId,
                EnumSet.of(ExecutionStatus.PENDING, ExecutionStatus.RUNNING))) {
            throw new AgentInUseException(agentId);
        }
        agentRepository.delete(agent);
        log.info("Deleted agent {}.", agentId);
    }

    /**
     * Copies a public agent into a private agent owned by {@code requesterId}.
     */
    @Transactional
    public Agent clonePublic(UUID agentId, UUID requesterId) {
        Agent source = agentRepository.findById(agentId).orElseThrow(() -> new AgentNotFoundException(agentId));
        if (!source.isPublicAgent()) {
            throw new AgentAccessDeniedException("Only public agents can be cloned");
        }
        String name = CLONE_PREFIX + source.getName();
        Agent copy = Agent.builder()
                .name(name.length() > MAX_NAME_LENGTH ? name.substring(0, MAX_NAME_LENGTH) : name)
                .description(source.getDescription())
                .type(source.getType())
                .ownerId(requesterId)
                .personalityPrompt(source.getPersonalityPrompt())
                .defaultModel(source.getDefaultModel())
                .publicAgent(false)
                .build();
        return agentRepository.save(copy);
    }

    private Agent requireOwned(UUID agentId, UUID userId) {
        Agent agent = agentRepository.findById(agentId).orElseThrow(() -> new AgentNotFoundException(agentId));
        if (!agent.isOwnedBy(userId)) {
            throw new AgentAccessDeniedException("Only the owner can modify agent " + agentId);
        }
        return agent;
    }

    private static void apply(Agent agent, AgentDraft draft) {
        agent.setName(draft.name().trim());
        agent.setDescription(draft.description());
        agent.setType(draft.type());
        agent.setPersonalityPrompt(draft.personalityPrompt());
        agent.setDefaultModel(draft.defaultModel().trim());
        agent.setPublicAgent(draft.publicAgent());
    }
}
