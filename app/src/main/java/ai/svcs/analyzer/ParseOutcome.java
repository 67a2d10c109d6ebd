package ai.svcs.analyzer;

/** Result of one fallback stage: a tree, or the reason the stage declined the source. */
public sealed interface ParseOutcome {

    record Parsed(NodeTree tree) implements ParseOutcome {}

    record Rejected(ParseError error) implements ParseOutcome {}

    static ParseOutcome parsed(NodeTree tree) {
        return new Parsed(tree);
    }

    static ParseOutcome rejected(ParseStage stage, ParseError.Reason reason, String message) {
        return new Rejected(ParseError.of(stage, reason, message));
    }
}
