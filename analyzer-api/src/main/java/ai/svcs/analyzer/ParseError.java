package ai.svcs.analyzer;

import org.jetbrains.annotations.Nullable;

/**
 * Why a fallback stage rejected a source. Parse errors are values recorded on the resulting {@link NodeTree}; they
 * never escape an adapter.
 */
public record ParseError(ParseStage stage, Reason reason, String message, @Nullable Throwable cause) {

    public enum Reason {
        SYNTAX_ERRORS,
        TOO_MANY_ERRORS,
        NOT_APPLICABLE,
        NOTHING_RECOGNIZED,
        INTERNAL_FAILURE
    }

    public static ParseError of(ParseStage stage, Reason reason, String message) {
        return new ParseError(stage, reason, message, null);
    }

    @Override
    public String toString() {
        return stage + "/" + reason + ": " + message;
    }
}
