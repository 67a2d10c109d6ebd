package ai.svcs.analyzer;

import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs parse strategies in order and returns the first accepted tree. The opaque stage is always appended, so
 * {@link #parse} never fails.
 */
public final class FallbackChain {
    private static final Logger logger = LogManager.getLogger(FallbackChain.class);

    private final SourceLanguage language;
    private final List<ParseStrategy> strategies;
    private final OpaqueStrategy opaque;

    public FallbackChain(SourceLanguage language, List<ParseStrategy> strategies) {
        this.language = language;
        this.opaque = new OpaqueStrategy(language);
        var ordered = new ArrayList<ParseStrategy>();
        for (var strategy : strategies) {
            if (strategy.stage() != ParseStage.OPAQUE) {
                ordered.add(strategy);
            }
        }
        ordered.add(opaque);
        this.strategies = List.copyOf(ordered);
    }

    public List<ParseStrategy> strategies() {
        return strategies;
    }

    public NodeTree parse(String path, String source) {
        var content = SourceContent.of(source);
        var failures = new ArrayList<ParseError>();
        for (var strategy : strategies) {
            ParseOutcome outcome;
            try {
                outcome = strategy.attempt(path, content);
            } catch (RuntimeException e) {
                outcome = new ParseOutcome.Rejected(new ParseError(
                        strategy.stage(), ParseError.Reason.INTERNAL_FAILURE, String.valueOf(e.getMessage()), e));
            }
            if (outcome instanceof ParseOutcome.Parsed parsed) {
                if (!failures.isEmpty()) {
                    logger.debug("{} parsed {} at stage {} after {}", language, path, strategy.stage(), failures);
                }
                return parsed.tree().withFailedAttempts(failures);
            }
            var error = ((ParseOutcome.Rejected) outcome).error();
            if (error.cause() != null) {
                logger.debug("{} stage {} failed on {}", language, strategy.stage(), path, error.cause());
            } else {
                logger.debug("{} stage {} rejected {}: {}", language, strategy.stage(), path, error.message());
            }
            failures.add(error);
        }
        // only reachable if the opaque stage itself threw
        return opaque.build(path, content).withFailedAttempts(failures);
    }
}
