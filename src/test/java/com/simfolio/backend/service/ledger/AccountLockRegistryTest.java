package com.simfolio.backend.service.ledger;

import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AccountLockRegistryTest {

    @Test
    void lockCountStaysFixedHoweverManyAccountsTrade() {
        AccountLockRegistry registry = new AccountLockRegistry(8);
        Set<Object> distinct = Collections.newSetFromMap(new IdentityHashMap<>());

        for (long userId = 1; userId <= 10_000; userId++) {
            distinct.add(registry.lockFor(userId));
        }

        assertThat(distinct).hasSize(8);
        assertThat(registry.lockFor(3L)).isSameAs(registry.lockFor(3L));
    }

    @Test
    void heldAccountBlocksOtherThreadsUntilReleased() throws Exception {
        AccountLockRegistry registry = new AccountLockRegistry();
        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        CompletableFuture<Void> holder = CompletableFuture.runAsync(() -> {
            try {
                assertThat(registry.tryLock(42L, 1, TimeUnit.SECONDS)).isTrue();
                locked.countDown();
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                registry.unlock(42L);
            }
        });

        assertThat(locked.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(registry.tryLock(42L, 50, TimeUnit.MILLISECONDS)).isFalse();

        release.countDown();
        holder.get(5, TimeUnit.SECONDS);
        assertThat(registry.tryLock(42L, 1, TimeUnit.SECONDS)).isTrue();
        registry.unlock(42L);
    }

    @Test
    void unlockWithoutHoldingIsIgnored() throws Exception {
        AccountLockRegistry registry = new AccountLockRegistry(4);

        registry.unlock(7L);

        assertThat(registry.tryLock(7L, 1, TimeUnit.SECONDS)).isTrue();
        registry.unlock(7L);
        assertThat(registry.lockFor(7L).isLocked()).isFalse();
    }

    @Test
    void rejectsNonPositiveStripeCount() {
        assertThatThrownBy(() -> new AccountLockRegistry(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
