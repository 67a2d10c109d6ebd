package ai.svcs.semantic;

import java.util.concurrent.atomic.AtomicInteger;

/** Per-run tallies shared by every file of one {@link AnalysisContext}. Thread-safe. */
public final class RunCounters {
    private final AtomicInteger filesAnalyzed = new AtomicInteger();
    private final AtomicInteger filesFailed = new AtomicInteger();
    private final AtomicInteger filesCancelled = new AtomicInteger();
    private final AtomicInteger parseFallbacks = new AtomicInteger();
    private final AtomicInteger opaqueParses = new AtomicInteger();
    private final AtomicInteger ruleFailures = new AtomicInteger();
    private final AtomicInteger gateSkips = new AtomicInteger();
    private final AtomicInteger providerCalls = new AtomicInteger();
    private final AtomicInteger providerFailures = new AtomicInteger();
    private final AtomicInteger discardedReplies = new AtomicInteger();

    public void fileAnalyzed() {
        filesAnalyzed.incrementAndGet();
    }

    public void fileFailed() {
        filesFailed.incrementAndGet();
    }

    public void fileCancelled() {
        filesCancelled.incrementAndGet();
    }

    public void parseFallback() {
        parseFallbacks.incrementAndGet();
    }

    public void opaqueParse() {
        opaqueParses.incrementAndGet();
    }

    public void ruleFailure() {
        ruleFailures.incrementAndGet();
    }

    public void gateSkip() {
        gateSkips.incrementAndGet();
    }

    public void providerCall() {
        providerCalls.incrementAndGet();
    }

    public void providerFailure() {
        providerFailures.incrementAndGet();
    }

    public void discardedReply() {
        discardedReplies.incrementAndGet();
    }

    public int filesAnalyzed() {
        return filesAnalyzed.get();
    }

    public int filesFailed() {
        return filesFailed.get();
    }

    public int filesCancelled() {
        return filesCancelled.get();
    }

    public int parseFallbacks() {
        return parseFallbacks.get();
    }

    public int opaqueParses() {
        return opaqueParses.get();
    }

    public int ruleFailures() {
        return ruleFailures.get();
    }

    public int gateSkips() {
        return gateSkips.get();
    }

    public int providerCalls() {
        return providerCalls.get();
    }

    public int providerFailures() {
        return providerFailures.get();
    }

    public int discardedReplies() {
        return discardedReplies.get();
    }

    @Override
    public String toString() {
        return "RunCounters{files=%d, failed=%d, cancelled=%d, fallbacks=%d, opaque=%d, ruleFailures=%d, gateSkips=%d, providerCalls=%d, providerFailures=%d, discarded=%d}"
                .formatted(
                        filesAnalyzed(),
                        filesFailed(),
                        filesCancelled(),
                        parseFallbacks(),
                        opaqueParses(),
                        ruleFailures(),
                        gateSkips(),
                        providerCalls(),
                        providerFailures(),
                        discardedReplies());
    }
}
