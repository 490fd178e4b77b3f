package com.duelo.engine.ledger;

import com.duelo.engine.exception.InsufficientCreditsException;
import com.duelo.entity.CreditLedgerEntry;
import com.duelo.entity.TransactionType;
import com.duelo.repository.CreditLedgerEntryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Service
@Slf4j
public class CreditLedgerServiceImpl implements CreditLedgerService {

    private static final Set<TransactionType> CREDIT_TYPES = EnumSet.of(TransactionType.PURCHASE, TransactionType.REFUND);

    private final BalanceAccessor balanceAccessor;
    private final CreditLedgerEntryRepository entryRepository;
    private final UserLockRegistry userLocks;
    private final TransactionTemplate transactionTemplate;

    public CreditLedgerServiceImpl(BalanceAccessor balanceAccessor,
                                   CreditLedgerEntryRepository entryRepository,
                                   UserLockRegistry userLocks,
                                   TransactionTemplate transactionTemplate) {
        this.balanceAccessor = balanceAccessor;
        this.entryRepository = entryRepository;
        this.userLocks = userLocks;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public long balanceOf(UUID userId) {
        return balanceAccessor.getBalance(userId);
    }

    @Override
    public boolean hasSufficientCredits(UUID userId, long required) {
        return userLocks.withLock(userId, () -> balanceAccessor.getBalance(userId) >= required);
    }

    @Override
    public CreditLedgerEntry debit(UUID userId, long amount, LedgerReference reference) {
        requirePositive(amount);
        return userLocks.withLock(userId, () -> transactionTemplate.execute(status -> {
            long balance = balanceAccessor.lockBalance(userId);
            if (balance < amount) {
                throw new InsufficientCreditsException(amount, balance);
            }
            return append(userId, -amount, TransactionType.CONSUMPTION, reference);
        }));
    }

    @Override
    public Optional<CreditLedgerEntry> debitAvailable(UUID userId, long amount, LedgerReference reference) {
        requirePositive(amount);
        return userLocks.withLock(userId, () -> transactionTemplate.execute(status -> {
            long balance = balanceAccessor.lockBalance(userId);
            long charge = Math.min(amount, balance);
            if (charge <= 0) {
                log.warn("User {} has no credits left; {} credits not collected ({}).", userId, amount, reference.description());
                return Optional.<CreditLedgerEntry>empty();
            }
            if (charge < amount) {
                log.warn("User {} short by {} credits; charged remaining {} ({}).",
                        userId, amount - charge, charge, reference.description());
            }
            return Optional.of(append(userId, -charge, TransactionType.CONSUMPTION, reference));
        }));
    }

    @Override
    public CreditLedgerEntry credit(UUID userId, long amount, TransactionType type, LedgerReference reference) {
        requirePositive(amount);
        if (!CREDIT_TYPES.contains(type)) {
            throw new IllegalArgumentException("Credits can only be added by PURCHASE or REFUND, not " + type);
        }
        return userLocks.withLock(userId, () -> transactionTemplate.execute(status ->
                append(userId, amount, type, reference)));
    }

    @Override
    public CreditLedgerEntry adjust(UUID userId, long signedAmount, LedgerReference reference) {
        if (signedAmount == 0) {
            throw new IllegalArgumentException("Adjustment amount must not be zero");
        }
        return userLocks.withLock(userId, () -> transactionTemplate.execute(status -> {
            if (signedAmount < 0) {
                long balance = balanceAccessor.lockBalance(userId);
                if (balance + signedAmount < 0) {
                    throw new InsufficientCreditsException(-signedAmount, balance);
                }
            }
            return append(userId, signedAmount, TransactionType.ADMIN_ADJUSTMENT, reference);
        }));
    }

    @Override
    public List<CreditLedgerEntry> entriesFor(UUID userId) {
        return entryRepository.findByUserIdOrderByIdAsc(userId);
    }

    @Override
    public List<ModelUsage> usageByModel() {
        return entryRepository.summarizeConsumptionByModel().stream()
                .map(row -> new ModelUsage(
                        row.getModel(),
                        valueOrZero(row.getOperations()),
                        valueOrZero(row.getCredits()),
                        valueOrZero(row.getTokens()),
                        row.getCostUsd() != null ? row.getCostUsd() : BigDecimal.ZERO))
                .toList();
    }

    private CreditLedgerEntry append(UUID userId, long signedAmount, TransactionType type, LedgerReference reference) {
        long balanceAfter = balanceAccessor.lockAndUpdateBalance(userId, signedAmount);
        CreditLedgerEntry entry = entryRepository.save(CreditLedgerEntry.builder()
                .userId(userId)
                .amount(signedAmount)
                .transactionType(type)
                .balanceAfter(balanceAfter)
                .relatedEntityType(reference.relatedEntityType())
                .relatedEntityId(reference.relatedEntityId())
                .description(reference.description())
                .model(reference.model())
                .tokensUsed(reference.tokensUsed())
                .realCostUsd(reference.realCostUsd())
                .build());
        log.info("Ledger {} of {} credits for user {}; balance now {}.", type, signedAmount, userId, balanceAfter);
        return entry;
    }

    private static void requirePositive(long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Amount must be positive, got " + amount);
        }
    }

    private static long valueOrZero(Long value) {
        return value != null ? value : 0L;
    }
}
