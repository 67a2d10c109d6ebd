package ai.svcs.semantic;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jetbrains.annotations.Nullable;

/**
 * Caller-initiated or deadline-based stop request, checked by the engine between layers and by the provider chain
 * while a call is pending. A cancelled file returns the events its completed layers produced and is flagged partial.
 */
public final class CancellationSignal {
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final @Nullable Instant deadline;
    private final Clock clock;

    private CancellationSignal(@Nullable Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    public static CancellationSignal create() {
        return new CancellationSignal(null, Clock.systemUTC());
    }

    public static CancellationSignal withTimeout(Duration timeout) {
        return withDeadline(Instant.now().plus(timeout), Clock.systemUTC());
    }

    public static CancellationSignal withDeadline(Instant deadline, Clock clock) {
        return new CancellationSignal(deadline, clock);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        if (cancelled.get()) {
            return true;
        }
        return deadline != null && !clock.instant().isBefore(deadline);
    }
}
