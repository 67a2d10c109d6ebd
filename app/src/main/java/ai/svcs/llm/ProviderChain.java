package ai.svcs.llm;

import ai.svcs.semantic.CancellationSignal;
import ai.svcs.semantic.RunCounters;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Ordered list of providers sharing one {@link CallBudget}. Each provider gets a per-call timeout and bounded
 * retries with exponential backoff; on exhaustion the next provider is tried. Failures never escape as exceptions.
 */
public final class ProviderChain implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(ProviderChain.class);
    private static final Logger interactions = LogManager.getLogger("ai.svcs.llm.interactions");
    private static final Duration POLL_INTERVAL = Duration.ofMillis(50);

    private final List<AiProvider> providers;
    private final CallBudget budget;
    private final Duration timeout;
    private final int maxRetries;
    private final Duration backoff;
    private final ExecutorService callExecutor;

    public ProviderChain(
            List<AiProvider> providers, CallBudget budget, Duration timeout, int maxRetries, Duration backoff) {
        if (providers.isEmpty()) {
            throw new IllegalArgumentException("At least one provider is required");
        }
        this.providers = List.copyOf(providers);
        this.budget = budget;
        this.timeout = timeout;
        this.maxRetries = maxRetries;
        this.backoff = backoff;
        this.callExecutor = Executors.newCachedThreadPool(new ProviderThreadFactory());
    }

    public List<AiProvider> providers() {
        return providers;
    }

    public CallBudget budget() {
        return budget;
    }

    public CallOutcome complete(String prompt, RunCounters counters) {
        return complete(prompt, counters, CancellationSignal.create());
    }

    /**
     * Sends {@code prompt} to the providers in order. Cancellation is honored before every attempt, during backoff
     * and while a call is in flight; it yields {@link CallOutcome.Cancelled}.
     */
    public CallOutcome complete(String prompt, RunCounters counters, CancellationSignal cancellation) {
        boolean attempted = false;
        boolean onlyTimeouts = true;
        String lastError = "no attempt made";

        for (var provider : providers) {
            for (int attempt = 0; attempt <= maxRetries; attempt++) {
                if (cancellation.isCancelled()) {
                    return new CallOutcome.Cancelled();
                }
                if (attempt > 0 && !sleepBeforeRetry(attempt, cancellation)) {
                    return cancellation.isCancelled()
                            ? new CallOutcome.Cancelled()
                            : new CallOutcome.Failure("Interrupted while backing off");
                }
                CallBudget.Permit permit;
                try {
                    var acquired = budget.acquire(cancellation::isCancelled);
                    if (acquired.isEmpty()) {
                        if (cancellation.isCancelled()) {
                            return new CallOutcome.Cancelled();
                        }
                        logger.info("Provider call budget of {} spent", budget.total());
                        return attempted
                                ? failure(onlyTimeouts, lastError)
                                : new CallOutcome.BudgetExhausted();
                    }
                    permit = acquired.get();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return new CallOutcome.Failure("Interrupted while waiting for a provider slot");
                }

                attempted = true;
                counters.providerCall();
                try {
                    interactions.debug("Prompt to {} (attempt {}):\n{}", provider.name(), attempt + 1, prompt);
                    var reply = callWithTimeout(provider, prompt, permit, cancellation);
                    interactions.debug("Reply from {}:\n{}", provider.name(), reply);
                    return new CallOutcome.Success(provider.name(), reply);
                } catch (ProviderException e) {
                    counters.providerFailure();
                    boolean timedOut = LlmTimeouts.isTimeout(e);
                    onlyTimeouts &= timedOut;
                    lastError = provider.name() + ": " + e.getMessage();
                    logger.warn(
                            "Provider {} failed on attempt {} of {}: {}",
                            provider.name(),
                            attempt + 1,
                            maxRetries + 1,
                            e.getMessage());
                    if (!timedOut && !e.isRetryable()) {
                        break;
                    }
                } catch (CancellationException e) {
                    logger.debug("Call to {} abandoned: {}", provider.name(), e.getMessage());
                    return new CallOutcome.Cancelled();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return new CallOutcome.Failure("Interrupted while calling " + provider.name());
                }
            }
        }
        return failure(onlyTimeouts, lastError);
    }

    private static CallOutcome failure(boolean onlyTimeouts, String lastError) {
        return onlyTimeouts ? new CallOutcome.Timeout(lastError) : new CallOutcome.Failure(lastError);
    }

    /**
     * Runs one call on the provider pool. The task owns {@code permit} and releases it when the provider returns, so
     * a call that ignores interruption keeps its slot until it really ends.
     */
    private String callWithTimeout(
            AiProvider provider, String prompt, CallBudget.Permit permit, CancellationSignal cancellation)
            throws ProviderException, InterruptedException {
        var claimed = new AtomicBoolean();
        Future<String> future;
        try {
            future = callExecutor.submit(() -> {
                if (!claimed.compareAndSet(false, true)) {
                    throw new CancellationException("abandoned before start");
                }
                try (permit) {
                    return provider.complete(prompt);
                }
            });
        } catch (RejectedExecutionException e) {
            permit.close();
            throw new ProviderException("Provider pool is shut down", e, false);
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            while (true) {
                if (cancellation.isCancelled()) {
                    abandon(future, claimed, permit);
                    throw new CancellationException("cancelled while waiting for " + provider.name());
                }
                long left = deadline - System.nanoTime();
                if (left <= 0) {
                    abandon(future, claimed, permit);
                    throw new ProviderException(
                            "No reply from " + provider.name() + " within " + describe(timeout),
                            new TimeoutException(describe(timeout)),
                            true);
                }
                try {
                    return future.get(Math.min(left, POLL_INTERVAL.toNanos()), TimeUnit.NANOSECONDS);
                } catch (TimeoutException e) {
                    logger.trace("Still waiting for {}", provider.name());
                }
            }
        } catch (ExecutionException e) {
            var cause = e.getCause();
            if (cause instanceof ProviderException pe) {
                throw pe;
            }
            throw new ProviderException(
                    provider.name() + " failed: " + (cause == null ? e.getMessage() : cause.getMessage()),
                    cause,
                    LlmTimeouts.isRetryable(cause));
        } catch (InterruptedException e) {
            abandon(future, claimed, permit);
            throw e;
        }
    }

    private static void abandon(Future<?> future, AtomicBoolean claimed, CallBudget.Permit permit) {
        future.cancel(true);
        if (claimed.compareAndSet(false, true)) {
            // the task never started and will not release the slot itself
            permit.close();
        }
    }

    static String describe(Duration duration) {
        return duration.toMillis() % 1000 == 0 ? duration.toSeconds() + "s" : duration.toMillis() + "ms";
    }

    private boolean sleepBeforeRetry(int attempt, CancellationSignal cancellation) {
        long delay = backoff.toMillis() * (1L << Math.min(attempt - 1, 16));
        long until = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(delay);
        try {
            while (!cancellation.isCancelled()) {
                long left = TimeUnit.NANOSECONDS.toMillis(until - System.nanoTime());
                if (left <= 0) {
                    return true;
                }
                Thread.sleep(Math.min(left, POLL_INTERVAL.toMillis()));
            }
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void close() {
        callExecutor.shutdownNow();
    }

    private static final class ProviderThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            var thread = new Thread(r, "svcs-provider-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
