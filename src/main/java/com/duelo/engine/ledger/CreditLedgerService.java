package com.duelo.engine.ledger;

import com.duelo.entity.CreditLedgerEntry;
import com.duelo.entity.TransactionType;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * The only writer of credit balances. Every change appends exactly one ledger entry whose
 * {@code balanceAfter} equals the new balance.
 */
public interface CreditLedgerService {

    long balanceOf(UUID userId);

    boolean hasSufficientCredits(UUID userId, long required);

    /**
     * Consumes {@code amount} credits.
     *
     * @throws com.duelo.engine.exception.InsufficientCreditsException if the balance is lower than {@code amount}
     */
    CreditLedgerEntry debit(UUID userId, long amount, LedgerReference reference);

    /**
     * Consumes {@code min(amount, balance)} credits; no entry is written when nothing can be taken.
     */
    Optional<CreditLedgerEntry> debitAvailable(UUID userId, long amount, LedgerReference reference);

    /**
     * Adds credits from a purchase or a refund.
     */
    CreditLedgerEntry credit(UUID userId, long amount, TransactionType type, LedgerReference reference);

    /**
     * Administrative correction in either direction; the balance never drops below zero.
     */
    CreditLedgerEntry adjust(UUID userId, long signedAmount, LedgerReference reference);

    List<CreditLedgerEntry> entriesFor(UUID userId);

    List<ModelUsage> usageByModel();
}
