package ai.svcs.llm;

import ai.svcs.semantic.AnalysisCancelledException;
import ai.svcs.semantic.AnalysisContext;
import ai.svcs.semantic.ClassificationLayer;
import ai.svcs.semantic.FileDiff;
import ai.svcs.semantic.Layer;
import ai.svcs.semantic.SemanticEvent;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Layer 5b: a gated call to an AI provider for the changes rules cannot see. The gate guarantees that skipped files
 * cost no provider call; provider failures degrade to the lower layers' result.
 */
public final class InterpretiveLayer implements ClassificationLayer {
    private static final Logger logger = LogManager.getLogger(InterpretiveLayer.class);

    private final ComplexityScorer scorer;

    public InterpretiveLayer() {
        this(ComplexityScorer.standard());
    }

    public InterpretiveLayer(ComplexityScorer scorer) {
        this.scorer = scorer;
    }

    @Override
    public Layer layer() {
        return Layer.INTERPRETIVE;
    }

    @Override
    public List<SemanticEvent> classify(FileDiff diff, List<SemanticEvent> prior, AnalysisContext context) {
        var run = interpret(diff, prior, context);
        logger.debug("Interpretive run for {}: {}", diff.path(), run.trail());
        if (run.cancelled()) {
            throw new AnalysisCancelledException("Cancelled while interpreting " + diff.path());
        }
        return run.events();
    }

    public GateRun interpret(FileDiff diff, List<SemanticEvent> prior, AnalysisContext context) {
        var run = new Run();
        run.move(GateState.GATE_CHECK);

        var config = context.config();
        var input = gateInput(diff, prior);
        double score = scorer.score(input);
        var skipReason = skipReason(diff, context, input, score);
        if (skipReason != null) {
            context.counters().gateSkip();
            logger.debug("Gate skipped {}: {}", diff.path(), skipReason);
            run.move(GateState.SKIP);
            return run.finish(List.of(), skipReason, score);
        }

        run.move(GateState.INVOKE);
        var chain = context.providerChain().orElseThrow();
        var prompt = new PromptBuilder(config.aiMaxPromptChars()).build(diff, prior);
        run.move(GateState.CALLING);
        var outcome = chain.complete(prompt, context.counters(), context.cancellation());

        if (outcome instanceof CallOutcome.Success success) {
            run.move(GateState.SUCCESS);
            run.move(GateState.PARSE_RESPONSE);
            var parsed = new ResponseParser(config.aiMinConfidence()).parse(success.reply(), diff.path());
            if (parsed.isEmpty()) {
                context.counters().discardedReply();
                logger.warn("Discarded unparseable reply from {} for {}", success.provider(), diff.path());
                run.move(GateState.DISCARD);
                return run.finish(List.of(), null, score);
            }
            run.move(GateState.EMIT);
            return run.finish(parsed.get(), null, score);
        }
        if (outcome instanceof CallOutcome.Timeout timeout) {
            logger.warn("Provider timed out for {}: {}", diff.path(), timeout.detail());
            run.move(GateState.TIMEOUT);
        } else if (outcome instanceof CallOutcome.Failure failure) {
            logger.warn("Provider failed for {}: {}", diff.path(), failure.detail());
            run.move(GateState.ERROR);
        } else if (outcome instanceof CallOutcome.Cancelled) {
            logger.debug("Provider call for {} cancelled", diff.path());
            run.move(GateState.CANCELLED);
        } else {
            logger.info("Call budget spent before {} could be interpreted", diff.path());
            run.move(GateState.ERROR);
        }
        return run.finish(List.of(), null, score);
    }

    static GateInput gateInput(FileDiff diff, List<SemanticEvent> prior) {
        var before = diff.before();
        var after = diff.after();
        return new GateInput(
                Math.max(before.lineCount(), after.lineCount()),
                Math.max(before.byteSize(), after.byteSize()),
                prior.size(),
                Math.max(before.importCount(), after.importCount()),
                Math.max(before.decoratorCount(), after.decoratorCount()));
    }

    private static @Nullable String skipReason(FileDiff diff, AnalysisContext context, GateInput input, double score) {
        var config = context.config();
        var chain = context.providerChain();
        if (chain.isEmpty()) {
            return "no provider configured";
        }
        if (diff.before().shapeText().equals(diff.after().shapeText())) {
            return "whitespace, comment or literal-only change";
        }
        if (diff.before().lineCount() < config.gateMinLines() && diff.after().lineCount() < config.gateMinLines()) {
            return "both versions shorter than " + config.gateMinLines() + " lines";
        }
        if (score < config.gateThreshold()) {
            return "complexity score %.2f below threshold %.2f".formatted(score, config.gateThreshold());
        }
        if (chain.get().budget().isExhausted()) {
            return "call budget spent";
        }
        return null;
    }

    /** Records the state trail and rejects illegal transitions. */
    private static final class Run {
        private final List<GateState> trail = new ArrayList<>(List.of(GateState.IDLE));

        void move(GateState next) {
            var current = trail.get(trail.size() - 1);
            if (!current.canMoveTo(next)) {
                throw new IllegalStateException("Illegal gate transition " + current + " -> " + next);
            }
            trail.add(next);
        }

        GateRun finish(List<SemanticEvent> events, @Nullable String skipReason, double score) {
            move(GateState.IDLE);
            return new GateRun(trail, events, skipReason, score);
        }
    }
}
