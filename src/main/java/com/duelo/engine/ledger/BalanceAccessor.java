package com.duelo.engine.ledger;

import java.util.UUID;

/**
 * Where a user's current credit balance lives. Callers serialise access per user; implementations
 * take the storage-level lock needed to make {@link #lockAndUpdateBalance} safe across processes.
 */
public interface BalanceAccessor {

    long getBalance(UUID userId);

    /**
     * Reads the balance under the storage lock of the surrounding transaction. Balance checks that
     * decide a write go through this method, never through {@link #getBalance}.
     */
    long lockBalance(UUID userId);

    /**
     * Applies {@code delta} to the balance and returns the new balance.
     *
     * @throws com.duelo.engine.exception.InsufficientCreditsException if the result would be negative
     */
    long lockAndUpdateBalance(UUID userId, long delta);
}
