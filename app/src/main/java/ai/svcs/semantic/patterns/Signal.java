package ai.svcs.semantic.patterns;

/** One piece of evidence for a pattern hypothesis. */
public record Signal(String description, double weight, boolean present) {

    public Signal {
        if (!(weight > 0)) {
            throw new IllegalArgumentException("Signal weight must be positive: " + description);
        }
    }

    public static Signal of(String description, double weight, boolean present) {
        return new Signal(description, weight, present);
    }
}
