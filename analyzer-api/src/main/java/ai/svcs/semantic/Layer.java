package ai.svcs.semantic;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Optional;

/** Classification layers. The label is the wire form ("1" .. "4", "5a", "5b"). */
public enum Layer {
    STRUCTURAL("1"),
    SYNTACTIC("2"),
    SEMANTIC("3"),
    BEHAVIORAL("4"),
    PATTERN("5a"),
    INTERPRETIVE("5b");

    private final String label;

    Layer(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** Layers 1-4 are deterministic rules and always carry confidence 1.0. */
    public boolean isDeterministic() {
        return ordinal() <= BEHAVIORAL.ordinal();
    }

    public static Optional<Layer> fromLabel(String label) {
        var trimmed = label.trim();
        for (var layer : values()) {
            if (layer.label.equalsIgnoreCase(trimmed)) {
                return Optional.of(layer);
            }
        }
        return Optional.empty();
    }
}
