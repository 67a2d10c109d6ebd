package ai.svcs.semantic.layers;

import ai.svcs.semantic.NodePair;

/** One comparison applied to a changed node pair. */
@FunctionalInterface
public interface PairRule {

    void apply(NodePair pair, EventCollector out);

    record Named(String name, PairRule rule) {}

    static Named named(String name, PairRule rule) {
        return new Named(name, rule);
    }
}
