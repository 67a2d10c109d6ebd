package ai.svcs.llm;

import ai.svcs.semantic.SemanticEvent;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Outcome of one interpretive-layer run with the states it passed through.
 *
 * @param skipReason why the gate skipped, {@code null} when a provider was invoked
 */
public record GateRun(List<GateState> trail, List<SemanticEvent> events, @Nullable String skipReason, double score) {

    public GateRun {
        trail = List.copyOf(trail);
        events = List.copyOf(events);
    }

    public boolean invoked() {
        return trail.contains(GateState.INVOKE);
    }

    public boolean skipped() {
        return trail.contains(GateState.SKIP);
    }

    public boolean cancelled() {
        return trail.contains(GateState.CANCELLED);
    }
}
