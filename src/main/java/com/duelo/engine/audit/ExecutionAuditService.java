package com.duelo.engine.audit;

import com.duelo.entity.Agent;
import com.duelo.entity.AgentExecution;
import com.duelo.entity.AgentType;
import com.duelo.entity.ExecutionStatus;
import com.duelo.repository.AgentExecutionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Lifecycle writes of {@link AgentExecution} rows. Each write commits in its own transaction so
 * the audit trail survives a rolled back settlement.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ExecutionAuditService {

    private static final int MAX_ERROR_LENGTH = 2000;

    private final AgentExecutionRepository executionRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public AgentExecution open(Agent agent, UUID requesterId, AgentType type, String model, @Nullable UUID targetId) {
        AgentExecution execution = AgentExecution.builder()
                .agentId(agent.getId())
                .requesterId(requesterId)
                .executionType(type)
                .model(model)
                .targetId(targetId)
                .status(ExecutionStatus.PENDING)
                .creditsCharged(0L)
                .build();
        AgentExecution saved = executionRepository.save(execution);
        log.info("Opened {} execution {} for agent {} (requester={}, model={}).",
                type, saved.getId(), agent.getId(), requesterId, model);
        return saved;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markRunning(UUID executionId, long estimatedCredits) {
        executionRepository.findById(executionId).ifPresent(execution -> {
            if (execution.getStatus() != ExecutionStatus.PENDING) {
                return;
            }
            execution.setStatus(ExecutionStatus.RUNNING);
            execution.setEstimatedCredits(estimatedCredits);
            executionRepository.save(execution);
        });
    }

    /**
     * Moves a non-terminal execution to {@code FAILED}. Terminal executions are left untouched.
     *
     * @return whether the row changed
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean markFailed(UUID executionId, String errorMessage) {
        Optional<AgentExecution> found = executionRepository.findById(executionId);
        if (found.isEmpty() || found.get().getStatus().isTerminal()) {
            return false;
        }
        AgentExecution execution = found.get();
        execution.setStatus(ExecutionStatus.FAILED);
        execution.setCreditsCharged(0L);
        execution.setErrorMessage(truncate(errorMessage));
        execution.setFinishedAt(OffsetDateTime.now());
        executionRepository.save(execution);
        log.info("Execution {} failed: {}", executionId, execution.getErrorMessage());
        return true;
    }

    /**
     * Links an execution to the record its output was stored as. Reached through
     * {@link com.duelo.engine.AgentExecutionService#recordResult}, which checks the status first.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void attachResult(UUID executionId, UUID resultId) {
        executionRepository.findById(executionId).ifPresent(execution -> {
            execution.setResultId(resultId);
            executionRepository.save(execution);
        });
    }

    @Transactional(readOnly = true)
    public Optional<AgentExecution> find(UUID executionId) {
        return executionRepository.findById(executionId);
    }

    @Transactional(readOnly = true)
    public List<AgentExecution> executionsFor(UUID requesterId) {
        return executionRepository.findByRequesterIdOrderByCreatedAtDesc(requesterId);
    }

    private static String truncate(@Nullable String message) {
        String value = message != null ? message : "unknown error";
        return value.length() <= MAX_ERROR_LENGTH ? value : value.substring(0, MAX_ERROR_LENGTH);
    }
}
