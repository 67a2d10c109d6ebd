package ai.svcs.semantic.patterns;

import ai.svcs.semantic.EventType;
import ai.svcs.semantic.Layer;
import ai.svcs.semantic.SemanticEvent;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A candidate pattern with the signals weighed for it. Confidence is the weight of the present signals over the
 * weight of all signals listed.
 */
public record PatternMatch(
        EventType type, String nodeId, String location, String details, String impact, List<Signal> signals) {

    public PatternMatch {
        if (type.homeLayer() != Layer.PATTERN) {
            throw new IllegalArgumentException(type + " is not a pattern event");
        }
        if (signals.isEmpty()) {
            throw new IllegalArgumentException("A pattern match needs at least one signal");
        }
        signals = List.copyOf(signals);
    }

    public double confidence() {
        double total = signals.stream().mapToDouble(Signal::weight).sum();
        double present = signals.stream().filter(Signal::present).mapToDouble(Signal::weight).sum();
        return SemanticEvent.clamp(present / total);
    }

    public String reasoning() {
        var present = signals.stream().filter(Signal::present).map(Signal::description).toList();
        return String.join("; ", present) + " (" + present.size() + " of " + signals.size() + " signals)";
    }

    public SemanticEvent toEvent() {
        return new SemanticEvent(type, nodeId, location, Layer.PATTERN, confidence(), details, reasoning(), impact);
    }

    /** Descriptions of the absent signals, for debug logging. */
    String missing() {
        return signals.stream().filter(s -> !s.present()).map(Signal::description).collect(Collectors.joining("; "));
    }
}
