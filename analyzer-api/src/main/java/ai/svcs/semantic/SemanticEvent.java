package ai.svcs.semantic;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jetbrains.annotations.Nullable;

/**
 * One classified change. Deterministic layers always report confidence 1.0 and carry no reasoning or impact; the
 * pattern and interpretive layers clamp their confidence to [0, 1].
 */
@JsonPropertyOrder({"event_type", "node_id", "location", "layer", "confidence", "details", "reasoning", "impact"})
@JsonInclude(JsonInclude.Include.ALWAYS)
public record SemanticEvent(
        @JsonProperty("event_type") EventType eventType,
        @JsonProperty("node_id") String nodeId,
        @JsonProperty("location") String location,
        @JsonProperty("layer") Layer layer,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("details") String details,
        @JsonProperty("reasoning") @Nullable String reasoning,
        @JsonProperty("impact") @Nullable String impact) {

    public SemanticEvent {
        if (layer.isDeterministic()) {
            if (eventType.homeLayer() != layer) {
                throw new IllegalArgumentException(eventType + " is not a layer " + layer.label() + " event");
            }
            confidence = 1.0;
            reasoning = null;
            impact = null;
        } else {
            if (layer == Layer.PATTERN && eventType.homeLayer() != Layer.PATTERN) {
                throw new IllegalArgumentException(eventType + " is not a pattern event");
            }
            if (layer == Layer.INTERPRETIVE && !eventType.isInterpretable()) {
                throw new IllegalArgumentException(eventType + " may not be emitted by the interpretive layer");
            }
            confidence = clamp(confidence);
        }
    }

    /** A layer 1-4 event; the layer is the type's home layer. */
    public static SemanticEvent rule(EventType type, String nodeId, String location, String details) {
        return new SemanticEvent(type, nodeId, location, type.homeLayer(), 1.0, details, null, null);
    }

    public static double clamp(double confidence) {
        if (Double.isNaN(confidence)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }
}
