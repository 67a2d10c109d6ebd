package ai.svcs.llm;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class CallBudgetTest {

    @Test
    void spendsOneCallPerAcquire() throws InterruptedException {
        var budget = new CallBudget(2, 1);

        try (var permit = budget.acquire().orElseThrow()) {
            assertEquals(1, budget.remaining());
        }
        try (var permit = budget.acquire().orElseThrow()) {
            assertTrue(budget.isExhausted());
        }
        assertTrue(budget.acquire().isEmpty());
        assertEquals(2, budget.used());
    }

    @Test
    void concurrentAcquiresNeverOverspend() throws InterruptedException {
        var budget = new CallBudget(25, 4);
        var granted = new AtomicInteger();
        var done = new CountDownLatch(8);
        var pool = Executors.newFixedThreadPool(8);
        try {
            for (int t = 0; t < 8; t++) {
                pool.execute(() -> {
                    try {
                        for (int i = 0; i < 10; i++) {
                            var permit = budget.acquire();
                            if (permit.isPresent()) {
                                granted.incrementAndGet();
                                permit.get().close();
                            }
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }
            assertTrue(done.await(10, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        assertEquals(25, granted.get());
        assertEquals(0, budget.remaining());
    }

    @Test
    void closingAPermitTwiceReleasesOnce() throws InterruptedException {
        var budget = new CallBudget(3, 1);
        var permit = budget.acquire().orElseThrow();
        permit.close();
        permit.close();

        var second = budget.acquire().orElseThrow();
        assertFalse(budget.isExhausted());
        second.close();
    }

    @Test
    void rejectsNonPositiveSizes() {
        assertThrows(IllegalArgumentException.class, () -> new CallBudget(0, 1));
        assertThrows(IllegalArgumentException.class, () -> new CallBudget(1, 0));
    }

    @Test
    void abandonedWaitForASlotIsRefunded() throws InterruptedException {
        var budget = new CallBudget(3, 1);

        try (var held = budget.acquire().orElseThrow()) {
            assertTrue(budget.acquire(() -> true).isEmpty());
            assertEquals(2, budget.remaining());
            assertEquals(1, budget.inFlight());
        }
        assertEquals(0, budget.inFlight());
    }
}
