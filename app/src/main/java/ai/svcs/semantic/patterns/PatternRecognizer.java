package ai.svcs.semantic.patterns;

import ai.svcs.semantic.AnalysisContext;
import ai.svcs.semantic.ClassificationLayer;
import ai.svcs.semantic.FileDiff;
import ai.svcs.semantic.Layer;
import ai.svcs.semantic.SemanticEvent;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Layer 5a: heuristic pattern recognition over the layer 1-4 events, the node trees and the raw text. Matches
 * below the configured confidence are dropped; a rule that throws is logged, counted and skipped.
 */
public final class PatternRecognizer implements ClassificationLayer {
    private static final Logger logger = LogManager.getLogger(PatternRecognizer.class);

    private final List<PatternRule> rules;

    public PatternRecognizer() {
        this(defaultRules());
    }

    public PatternRecognizer(List<PatternRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static List<PatternRule> defaultRules() {
        return List.of(
                new RefactoringRule(),
                new OptimizationRule(),
                new DesignPatternRule(),
                new SecurityRule(),
                new PerformanceRule(),
                new ApiChangeRule(),
                new ComplexityRule(),
                new ConcurrencyRule(),
                new ErrorHandlingRule(),
                new MemoryRule(),
                new ArchitectureRule());
    }

    @Override
    public Layer layer() {
        return Layer.PATTERN;
    }

    @Override
    public List<SemanticEvent> classify(FileDiff diff, List<SemanticEvent> prior, AnalysisContext context) {
        double minConfidence = context.config().patternMinConfidence();
        var input = new PatternInput(diff, prior);
        var events = new ArrayList<SemanticEvent>();
        var seen = new HashSet<String>();
        for (var rule : rules) {
            List<PatternMatch> matches;
            try {
                matches = rule.detect(input);
            } catch (RuntimeException e) {
                context.counters().ruleFailure();
                logger.warn("Pattern rule {} failed in {}", rule.name(), diff.path(), e);
                continue;
            }
            for (var match : matches) {
                if (match.confidence() < minConfidence) {
                    logger.trace(
                            "Dropped {} on {} at {} (missing: {})",
                            match.type(),
                            match.nodeId(),
                            match.confidence(),
                            match.missing());
                    continue;
                }
                if (seen.add(match.type().wireName() + "|" + match.nodeId() + "|" + match.details())) {
                    events.add(match.toEvent());
                }
            }
        }
        return events;
    }
}
