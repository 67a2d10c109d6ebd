package ai.svcs.analyzer;

/** Grammar-independent meaning of a syntax node type, as far as body feature extraction is concerned. */
public enum BodyConstruct {
    COMMENT,
    LOOP,
    CONDITIONAL,
    BRANCH,
    SWITCH,
    CASE,
    TERNARY,
    TRY,
    CATCH,
    CONTEXT_MANAGER,
    CALL,
    LAMBDA,
    COMPREHENSION,
    RETURN,
    YIELD,
    AWAIT,
    RAISE,
    GLOBAL,
    NONLOCAL,
    ASSERT,
    STARRED,
    SLICE,
    BINARY,
    BOOLEAN_OPERATOR,
    COMPARISON,
    UNARY,
    STRING,
    NUMBER,
    BOOLEAN,
    NONE,
    ATTRIBUTE,
    SUBSCRIPT,
    ASSIGNMENT,
    AUGMENTED_ASSIGNMENT;

    /** Literal constructs are replaced by a placeholder in shape text. */
    public boolean isShapeLiteral() {
        return this == STRING || this == NUMBER;
    }
}
