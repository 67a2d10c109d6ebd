package ai.svcs.semantic;

import ai.svcs.analyzer.NodeFeatures;
import ai.svcs.analyzer.SemanticNode;

/** The two versions of a node present on both sides of a change. */
public record NodePair(SemanticNode before, SemanticNode after) {

    public NodePair {
        if (!before.id().equals(after.id())) {
            throw new IllegalArgumentException("Pair ids differ: " + before.id() + " vs " + after.id());
        }
    }

    public String id() {
        return after.id();
    }

    public String textBefore() {
        return before.canonicalText();
    }

    public String textAfter() {
        return after.canonicalText();
    }

    /** Byte-identical canonical text: a no-op for every later layer. */
    public boolean isUnchanged() {
        return textBefore().equals(textAfter());
    }

    public NodeFeatures featuresBefore() {
        return before.features();
    }

    public NodeFeatures featuresAfter() {
        return after.features();
    }
}
