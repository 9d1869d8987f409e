package com.simfolio.backend.service.ledger;

import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fair locks held across the read-validate-write of a trade so two trades for the same user
 * never interleave inside this process.
 *
 * <p>Accounts are hashed onto a fixed set of stripes, so memory stays constant however many
 * users trade. Two users sharing a stripe only wait on each other; a trade never needs more
 * than one account lock, so striping cannot deadlock.
 */
@Component
public class AccountLockRegistry {

    static final int DEFAULT_STRIPES = 256;

    private final ReentrantLock[] stripes;

    public AccountLockRegistry() {
        this(DEFAULT_STRIPES);
    }

    AccountLockRegistry(int stripeCount) {
        if (stripeCount < 1) {
            throw new IllegalArgumentException("stripeCount must be positive");
        }
        stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock(true);
        }
    }

    ReentrantLock lockFor(Long userId) {
        return stripes[Math.floorMod(userId.hashCode(), stripes.length)];
    }

    /**
     * @return true when the lock was acquired; the caller must then unlock it
     */
    public boolean tryLock(Long userId, long timeout, TimeUnit unit) throws InterruptedException {
        return lockFor(userId).tryLock(timeout, unit);
    }

    public void unlock(Long userId) {
        ReentrantLock lock = lockFor(userId);
        if (lock.isHeldByCurrentThread()) {
            lock.unlock();
        }
    }
}
