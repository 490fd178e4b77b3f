package com.duelo.engine.ledger;

import com.duelo.config.AgentEngineProperties;
import com.duelo.config.AgentEngineProperties.OverrunPolicy;
import com.duelo.engine.exception.InvalidExecutionRequestException;
import com.duelo.entity.AgentExecution;
import com.duelo.entity.CreditLedgerEntry;
import com.duelo.entity.ExecutionStatus;
import com.duelo.repository.AgentExecutionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Commits the financial outcome of an execution: the ledger debit, the balance update and the
 * execution row marked {@code COMPLETED} succeed or fail together.
 */
@Service
@Slf4j
public class ExecutionSettlementService {

    private final CreditLedgerService ledgerService;
    private final AgentExecutionRepository executionRepository;
    private final UserLockRegistry userLocks;
    private final TransactionTemplate transactionTemplate;
    private final AgentEngineProperties properties;

    public ExecutionSettlementService(CreditLedgerService ledgerService,
                                      AgentExecutionRepository executionRepository,
                                      UserLockRegistry userLocks,
                                      TransactionTemplate transactionTemplate,
                                      AgentEngineProperties properties) {
        this.ledgerService = ledgerService;
        this.executionRepository = executionRepository;
        this.userLocks = userLocks;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
    }

    /**
     * @return the credits actually charged
     * @throws com.duelo.engine.exception.InsufficientCreditsException under {@code FAIL_UNCHARGED}
     *         when the balance no longer covers the actual cost; nothing is committed then
     */
    public long settle(SettlementRequest request) {
        return userLocks.withLock(request.userId(), () -> transactionTemplate.execute(status -> {
            AgentExecution execution = executionRepository.findById(request.executionId())
                    .orElseThrow(() -> new InvalidExecutionRequestException("Unknown execution " + request.executionId()));
            if (execution.getStatus().isTerminal()) {
                throw new InvalidExecutionRequestException(
                        "Execution " + execution.getId() + " is already " + execution.getStatus());
            }
            long charged = charge(request);
            execution.setStatus(ExecutionStatus.COMPLETED);
            execution.setCreditsCharged(charged);
            execution.setPromptTokens(request.cost().promptTokens());
            execution.setCompletionTokens(request.cost().completionTokens());
            execution.setParsingSuccess(request.parsingSuccess());
            execution.setFinishedAt(OffsetDateTime.now());
            executionRepository.save(execution);
            return charged;
        }));
    }

    private long charge(SettlementRequest request) {
        LedgerReference reference = LedgerReference.forExecution(request.executionId(), request.description(),
                request.cost().model(), request.cost().totalTokens(), request.cost().costUsd());
        long credits = request.cost().credits();
        if (properties.getCredits().getOverrunPolicy() == OverrunPolicy.FAIL_UNCHARGED) {
            return -ledgerService.debit(request.userId(), credits, reference).getAmount();
        }
        Optional<CreditLedgerEntry> entry = ledgerService.debitAvailable(request.userId(), credits, reference);
        return entry.map(e -> -e.getAmount()).orElse(0L);
    }
}
