package ai.svcs.semantic;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The closed event taxonomy. Each type has a home layer; the interpretive layer may only emit the types for which
 * {@link #isInterpretable()} holds.
 */
public enum EventType {
    // Layer 1
    FILE_ADDED(Layer.STRUCTURAL),
    FILE_REMOVED(Layer.STRUCTURAL),
    FILE_CONTENT_CHANGED(Layer.STRUCTURAL),
    NODE_ADDED(Layer.STRUCTURAL),
    NODE_REMOVED(Layer.STRUCTURAL),
    DEPENDENCY_ADDED(Layer.STRUCTURAL),
    DEPENDENCY_REMOVED(Layer.STRUCTURAL),

    // Layer 2
    SIGNATURE_CHANGED(Layer.SYNTACTIC),
    DECORATOR_ADDED(Layer.SYNTACTIC),
    DECORATOR_REMOVED(Layer.SYNTACTIC),
    FUNCTION_MADE_ASYNC(Layer.SYNTACTIC),
    FUNCTION_MADE_SYNC(Layer.SYNTACTIC),
    INHERITANCE_CHANGED(Layer.SYNTACTIC),
    DEFAULT_PARAMETERS_ADDED(Layer.SYNTACTIC),
    DEFAULT_PARAMETERS_REMOVED(Layer.SYNTACTIC),
    RETURN_TYPE_CHANGED(Layer.SYNTACTIC),
    TYPE_ANNOTATIONS_INTRODUCED(Layer.SYNTACTIC),
    TYPE_ANNOTATIONS_REMOVED(Layer.SYNTACTIC),
    VISIBILITY_CHANGED(Layer.SYNTACTIC),
    STATIC_MODIFIER_CHANGED(Layer.SYNTACTIC),

    // Layer 3
    CONTROL_FLOW_CHANGED(Layer.SEMANTIC),
    FUNCTION_MADE_GENERATOR(Layer.SEMANTIC),
    GENERATOR_MADE_FUNCTION(Layer.SEMANTIC),
    YIELD_PATTERN_CHANGED(Layer.SEMANTIC),
    RETURN_PATTERN_CHANGED(Layer.SEMANTIC),
    EXCEPTION_HANDLING_ADDED(Layer.SEMANTIC),
    EXCEPTION_HANDLING_REMOVED(Layer.SEMANTIC),
    EXCEPTION_HANDLING_CHANGED(Layer.SEMANTIC),
    ERROR_HANDLING_INTRODUCED(Layer.SEMANTIC),
    ERROR_HANDLING_REMOVED(Layer.SEMANTIC),
    INTERNAL_CALL_ADDED(Layer.SEMANTIC),
    INTERNAL_CALL_REMOVED(Layer.SEMANTIC),
    COMPREHENSION_USAGE_CHANGED(Layer.SEMANTIC),
    LAMBDA_USAGE_CHANGED(Layer.SEMANTIC),
    GLOBAL_SCOPE_CHANGED(Layer.SEMANTIC),
    NONLOCAL_SCOPE_CHANGED(Layer.SEMANTIC),
    AWAIT_USAGE_CHANGED(Layer.SEMANTIC),

    // Layer 4
    FUNCTION_COMPLEXITY_CHANGED(Layer.BEHAVIORAL),
    FUNCTIONAL_PROGRAMMING_ADOPTED(Layer.BEHAVIORAL),
    FUNCTIONAL_PROGRAMMING_REMOVED(Layer.BEHAVIORAL),
    FUNCTIONAL_PROGRAMMING_CHANGED(Layer.BEHAVIORAL),
    ATTRIBUTE_ACCESS_CHANGED(Layer.BEHAVIORAL),
    SUBSCRIPT_ACCESS_CHANGED(Layer.BEHAVIORAL),
    ASSIGNMENT_PATTERN_CHANGED(Layer.BEHAVIORAL),
    AUGMENTED_ASSIGNMENT_CHANGED(Layer.BEHAVIORAL),
    BINARY_OPERATOR_USAGE_CHANGED(Layer.BEHAVIORAL),
    UNARY_OPERATOR_USAGE_CHANGED(Layer.BEHAVIORAL),
    COMPARISON_OPERATOR_USAGE_CHANGED(Layer.BEHAVIORAL),
    LOGICAL_OPERATOR_USAGE_CHANGED(Layer.BEHAVIORAL),
    STRING_LITERAL_USAGE_CHANGED(Layer.BEHAVIORAL),
    NUMERIC_LITERAL_USAGE_CHANGED(Layer.BEHAVIORAL),
    BOOLEAN_LITERAL_USAGE_CHANGED(Layer.BEHAVIORAL),
    NONE_LITERAL_USAGE_CHANGED(Layer.BEHAVIORAL),
    ASSERTION_USAGE_CHANGED(Layer.BEHAVIORAL),
    STARRED_EXPRESSION_USAGE_CHANGED(Layer.BEHAVIORAL),
    SLICE_USAGE_CHANGED(Layer.BEHAVIORAL),
    CLASS_METHODS_CHANGED(Layer.BEHAVIORAL),
    CLASS_ATTRIBUTES_CHANGED(Layer.BEHAVIORAL),

    // Layer 5a
    REFACTORING_EXTRACT_METHOD(Layer.PATTERN),
    REFACTORING_INLINE_METHOD(Layer.PATTERN),
    OPTIMIZATION_ALGORITHM(Layer.PATTERN),
    OPTIMIZATION_DATA_STRUCTURE(Layer.PATTERN),
    DESIGN_PATTERN_IMPLEMENTATION(Layer.PATTERN),
    DESIGN_PATTERN_REMOVAL(Layer.PATTERN),
    SECURITY_IMPROVEMENT(Layer.PATTERN),
    SECURITY_VULNERABILITY(Layer.PATTERN),
    PERFORMANCE_IMPROVEMENT(Layer.PATTERN, true),
    PERFORMANCE_REGRESSION(Layer.PATTERN),
    API_BREAKING_CHANGE(Layer.PATTERN),
    API_ENHANCEMENT(Layer.PATTERN),
    CODE_SIMPLIFICATION(Layer.PATTERN, true),
    CODE_COMPLICATION(Layer.PATTERN),
    ERROR_HANDLING_IMPROVEMENT(Layer.PATTERN),
    CONCURRENCY_INTRODUCTION(Layer.PATTERN, true),
    MEMORY_OPTIMIZATION(Layer.PATTERN, true),
    ARCHITECTURE_CHANGE(Layer.PATTERN, true),

    // Layer 5b
    ALGORITHM_OPTIMIZATION(Layer.INTERPRETIVE, true),
    BUSINESS_LOGIC_CHANGE(Layer.INTERPRETIVE, true),
    DESIGN_PATTERN_CHANGE(Layer.INTERPRETIVE, true),
    ERROR_HANDLING_CHANGE(Layer.INTERPRETIVE, true),
    API_MODIFICATION(Layer.INTERPRETIVE, true),
    REFACTORING(Layer.INTERPRETIVE, true),
    SECURITY_ENHANCEMENT(Layer.INTERPRETIVE, true);

    private static final Map<String, EventType> BY_WIRE_NAME =
            Arrays.stream(values()).collect(Collectors.toUnmodifiableMap(EventType::wireName, Function.identity()));

    private final Layer homeLayer;
    private final boolean interpretable;
    private final String wireName;

    EventType(Layer homeLayer) {
        this(homeLayer, false);
    }

    EventType(Layer homeLayer, boolean interpretable) {
        this.homeLayer = homeLayer;
        this.interpretable = interpretable;
        this.wireName = name().toLowerCase(Locale.ROOT);
    }

    public Layer homeLayer() {
        return homeLayer;
    }

    /** Whether the interpretive layer is allowed to emit this type. */
    public boolean isInterpretable() {
        return interpretable;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<EventType> fromWireName(String wireName) {
        return Optional.ofNullable(BY_WIRE_NAME.get(wireName.trim().toLowerCase(Locale.ROOT)));
    }

    @Override
    public String toString() {
        return wireName;
    }
}
