package ai.svcs.semantic;

import java.util.List;

/**
 * One stage of the classification pipeline. Each layer sees the file diff plus every event produced by the layers
 * before it, and returns only its own events.
 */
public interface ClassificationLayer {

    Layer layer();

    List<SemanticEvent> classify(FileDiff diff, List<SemanticEvent> prior, AnalysisContext context);
}
