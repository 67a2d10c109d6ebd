package ai.svcs.llm;

/**
 * Size and activity measures of one file change, fed to a {@link ComplexityScorer}. Sizes are the larger of the
 * two versions.
 */
public record GateInput(int lineCount, int byteSize, int lowerLayerEventCount, int importCount, int decoratorCount) {}
