package com.duelo.repository;

import com.duelo.entity.CreditLedgerEntry;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only access to {@link CreditLedgerEntry} rows. Deliberately exposes no update or delete.
 */
public interface CreditLedgerEntryRepository extends Repository<CreditLedgerEntry, Long> {

    CreditLedgerEntry save(CreditLedgerEntry entry);

    Optional<CreditLedgerEntry> findById(Long id);

    List<CreditLedgerEntry> findByUserIdOrderByIdAsc(UUID userId);

    Optional<CreditLedgerEntry> findFirstByUserIdOrderByIdDesc(UUID userId);

    @Query("""
            select e.model as model,
                   count(e) as operations,
                   sum(-e.amount) as credits,
                   sum(e.tokensUsed) as tokens,
                   sum(e.realCostUsd) as costUsd
            from CreditLedgerEntry e
            where e.transactionType = com.duelo.entity.TransactionType.CONSUMPTION
              and e.model is not null
            group by e.model
            order by e.model
            """)
    List<ModelUsageRow> summarizeConsumptionByModel();

    interface ModelUsageRow {
        String getModel();

        Long getOperations();

        Long getCredits();

        Long getTokens();

        BigDecimal getCostUsd();
    }
}
