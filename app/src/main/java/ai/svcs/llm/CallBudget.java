package ai.svcs.llm;

import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Provider calls allowed per run, shared by every file analyzed concurrently. Each attempt, retries included,
 * spends one call; at most {@code maxConcurrent} calls are in flight at once.
 */
public final class CallBudget {
    private static final long SLOT_POLL_MILLIS = 50;

    private final int total;
    private final AtomicInteger remaining;
    private final int maxConcurrent;
    private final Semaphore inFlight;

    public CallBudget(int total, int maxConcurrent) {
        if (total <= 0 || maxConcurrent <= 0) {
            throw new IllegalArgumentException("Budget and concurrency must be positive");
        }
        this.total = total;
        this.remaining = new AtomicInteger(total);
        this.maxConcurrent = maxConcurrent;
        this.inFlight = new Semaphore(maxConcurrent, true);
    }

    /**
     * Reserves one call and waits for a concurrency slot. Empty when the budget is spent; the reservation is never
     * refunded.
     */
    public Optional<Permit> acquire() throws InterruptedException {
        return acquire(() -> false);
    }

    /**
     * Like {@link #acquire()}, but gives up waiting for a slot once {@code stop} reports true. A reservation abandoned
     * that way is refunded, since no call was made.
     */
    public Optional<Permit> acquire(BooleanSupplier stop) throws InterruptedException {
        while (true) {
            int left = remaining.get();
            if (left <= 0) {
                return Optional.empty();
            }
            if (remaining.compareAndSet(left, left - 1)) {
                break;
            }
        }
        while (!inFlight.tryAcquire(SLOT_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
            if (stop.getAsBoolean()) {
                remaining.incrementAndGet();
                return Optional.empty();
            }
        }
        return Optional.of(new Permit());
    }

    public boolean isExhausted() {
        return remaining.get() <= 0;
    }

    public int remaining() {
        return Math.max(0, remaining.get());
    }

    public int used() {
        return total - remaining();
    }

    public int total() {
        return total;
    }

    /** Calls holding a concurrency slot right now, including abandoned calls that have not returned yet. */
    public int inFlight() {
        return maxConcurrent - inFlight.availablePermits();
    }

    /** Holds one concurrency slot until closed. */
    public final class Permit implements AutoCloseable {
        private final AtomicBoolean released = new AtomicBoolean();

        private Permit() {}

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                inFlight.release();
            }
        }
    }
}
