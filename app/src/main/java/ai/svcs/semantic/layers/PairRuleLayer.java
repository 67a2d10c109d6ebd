package ai.svcs.semantic.layers;

import ai.svcs.semantic.AnalysisContext;
import ai.svcs.semantic.ClassificationLayer;
import ai.svcs.semantic.FileDiff;
import ai.svcs.semantic.SemanticEvent;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs a fixed list of rules over every changed node pair, in id order. A rule that throws loses only its own
 * events for that node; the failure is logged and counted.
 */
abstract class PairRuleLayer implements ClassificationLayer {
    private static final Logger logger = LogManager.getLogger(PairRuleLayer.class);

    protected abstract List<PairRule.Named> rules(AnalysisContext context);

    /** Whole-file comparisons run after the node rules; none by default. */
    protected List<SemanticEvent> fileEvents(FileDiff diff, AnalysisContext context) {
        return List.of();
    }

    @Override
    public List<SemanticEvent> classify(FileDiff diff, List<SemanticEvent> prior, AnalysisContext context) {
        var rules = rules(context);
        var events = new ArrayList<SemanticEvent>();
        for (var pair : diff.candidates()) {
            var location = diff.location(pair.after());
            for (var rule : rules) {
                var out = new EventCollector(pair.id(), location);
                try {
                    rule.rule().apply(pair, out);
                    events.addAll(out.events());
                } catch (RuntimeException e) {
                    context.counters().ruleFailure();
                    logger.warn(
                            "Layer {} rule {} failed on {} in {}",
                            layer().label(),
                            rule.name(),
                            pair.id(),
                            diff.path(),
                            e);
                }
            }
        }
        if (!diff.isOpaque()) {
            try {
                events.addAll(fileEvents(diff, context));
            } catch (RuntimeException e) {
                context.counters().ruleFailure();
                logger.warn("Layer {} file rules failed in {}", layer().label(), diff.path(), e);
            }
        }
        return events;
    }

    static String join(Iterable<String> values) {
        return String.join(", ", values);
    }
}
