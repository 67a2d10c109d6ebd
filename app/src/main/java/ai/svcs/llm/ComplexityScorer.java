package ai.svcs.llm;

/** Decides how interesting a change is; the interpretive layer only calls a provider above its threshold. */
@FunctionalInterface
public interface ComplexityScorer {

    double score(GateInput input);

    /**
     * {@code lines / 10 + bytes / 1000 + 2 * lowerLayerEvents + imports + 2 * decorators}, over the larger of the
     * two versions.
     */
    static ComplexityScorer standard() {
        return input -> input.lineCount() / 10.0
                + input.byteSize() / 1000.0
                + 2.0 * input.lowerLayerEventCount()
                + input.importCount()
                + 2.0 * input.decoratorCount();
    }
}
