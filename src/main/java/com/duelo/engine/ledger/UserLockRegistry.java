package com.duelo.engine.ledger;

import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process, reentrant lock per user. Held around whole balance transactions, commit included,
 * so two operations on the same user never interleave inside this JVM.
 * <p>
 * Users are hashed onto a fixed set of lock stripes, so memory stays bounded however many users
 * are seen; two users on the same stripe simply wait for each other.
 */
@Component
public class UserLockRegistry {

    static final int DEFAULT_STRIPES = 256;

    private final ReentrantLock[] stripes;

    public UserLockRegistry() {
        this(DEFAULT_STRIPES);
    }

    UserLockRegistry(int stripeCount) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("stripeCount must be positive, got " + stripeCount);
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public <T> T withLock(UUID userId, Supplier<T> action) {
        ReentrantLock lock = lockFor(userId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock lockFor(UUID userId) {
        return stripes[Math.floorMod(userId.hashCode(), stripes.length)];
    }
}
