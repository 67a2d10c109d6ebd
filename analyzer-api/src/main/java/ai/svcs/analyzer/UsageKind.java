package ai.svcs.analyzer;

/** The usage histograms collected from a node body. */
public enum UsageKind {
    BINARY_OPERATOR,
    UNARY_OPERATOR,
    COMPARISON_OPERATOR,
    LOGICAL_OPERATOR,
    STRING_LITERAL,
    NUMERIC_LITERAL,
    BOOLEAN_LITERAL,
    NONE_LITERAL,
    ATTRIBUTE_ACCESS,
    SUBSCRIPT_ACCESS,
    ASSIGNMENT,
    AUGMENTED_ASSIGNMENT
}
