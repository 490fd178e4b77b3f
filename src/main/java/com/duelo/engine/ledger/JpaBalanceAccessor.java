package com.duelo.engine.ledger;

import com.duelo.engine.exception.InsufficientCreditsException;
import com.duelo.entity.UserCreditBalance;
import com.duelo.repository.UserCreditBalanceRepository;
import jakarta.persistence.EntityManager;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Balance rows in {@code user_credit_balance}, updated under a {@code PESSIMISTIC_WRITE} lock.
 * A user without a row has a balance of zero.
 */
@Component
@RequiredArgsConstructor
public class JpaBalanceAccessor implements BalanceAccessor {

    private final UserCreditBalanceRepository repository;
    private final EntityManager entityManager;

    @Override
    @Transactional(readOnly = true)
    public long getBalance(UUID userId) {
        return repository.findById(userId).map(UserCreditBalance::getBalance).orElse(0L);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public long lockBalance(UUID userId) {
        return lockedRow(userId).map(UserCreditBalance::getBalance).orElse(0L);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public long lockAndUpdateBalance(UUID userId, long delta) {
        UserCreditBalance row = lockedRow(userId)
                .orElseGet(() -> UserCreditBalance.builder().userId(userId).balance(0L).build());
        long updated = row.getBalance() + delta;
        if (updated < 0) {
            throw new InsufficientCreditsException(-delta, row.getBalance());
        }
        row.setBalance(updated);
        repository.save(row);
        return updated;
    }

    // The query hands back an instance already in the persistence context as is, so re-read it once locked.
    private Optional<UserCreditBalance> lockedRow(UUID userId) {
        Optional<UserCreditBalance> row = repository.findByUserIdForUpdate(userId);
        row.ifPresent(entityManager::refresh);
        return row;
    }
}
