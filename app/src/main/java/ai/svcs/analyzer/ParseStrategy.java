package ai.svcs.analyzer;

/** One stage of an adapter's fallback chain. */
public interface ParseStrategy {

    ParseStage stage();

    /**
     * Attempts to build a tree. Implementations report malformed input as {@link ParseOutcome.Rejected}; an
     * unexpected runtime failure is converted to a rejection by the chain.
     */
    ParseOutcome attempt(String path, SourceContent source);
}
