package com.z254.sentinel.responder.lifecycle;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class IncidentLocksTest {

    private final IncidentLocks locks = new IncidentLocks();

    @Test
    @DisplayName("one lock is kept per open incident")
    void lockPerIncident() {
        assertThat(locks.withLock("inc-1", () -> "done")).isEqualTo("done");
        locks.withLock("inc-1", () -> { });
        locks.withLock("inc-2", () -> { });

        assertThat(locks.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("retire outside the lock is ignored")
    void retireRequiresHolder() {
        locks.withLock("inc-1", () -> { });

        locks.retire("inc-1");

        assertThat(locks.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("thread waiting on a retired lock still runs, once, under a fresh lock")
    void waiterSurvivesRetirement() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger waiterRuns = new AtomicInteger();
        try {
            Future<?> holder = pool.submit(() -> locks.withLock("inc-1", () -> {
                holding.countDown();
                await(release);
                locks.retire("inc-1");
            }));
            assertThat(holding.await(5, TimeUnit.SECONDS)).isTrue();
            Future<?> waiter = pool.submit(() -> locks.withLock("inc-1", waiterRuns::incrementAndGet));
            release.countDown();

            holder.get(5, TimeUnit.SECONDS);
            waiter.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(waiterRuns).hasValue(1);
        assertThat(locks.size()).isEqualTo(1);
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
