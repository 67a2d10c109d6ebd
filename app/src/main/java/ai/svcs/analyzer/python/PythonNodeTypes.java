package ai.svcs.analyzer.python;

public class PythonNodeTypes {

    // Declarations
    public static final String FUNCTION_DEFINITION = "function_definition";
    public static final String CLASS_DEFINITION = "class_definition";
    public static final String DECORATED_DEFINITION = "decorated_definition";
    public static final String DECORATOR = "decorator";
    public static final String EXPRESSION_STATEMENT = "expression_statement";

    // Parameters
    public static final String IDENTIFIER = "identifier";
    public static final String TYPED_PARAMETER = "typed_parameter";
    public static final String DEFAULT_PARAMETER = "default_parameter";
    public static final String TYPED_DEFAULT_PARAMETER = "typed_default_parameter";
    public static final String LIST_SPLAT_PATTERN = "list_splat_pattern";
    public static final String DICTIONARY_SPLAT_PATTERN = "dictionary_splat_pattern";
    public static final String KEYWORD_SEPARATOR = "keyword_separator";
    public static final String POSITIONAL_SEPARATOR = "positional_separator";

    // Imports
    public static final String IMPORT_STATEMENT = "import_statement";
    public static final String IMPORT_FROM_STATEMENT = "import_from_statement";
    public static final String FUTURE_IMPORT_STATEMENT = "future_import_statement";
    public static final String DOTTED_NAME = "dotted_name";
    public static final String ALIASED_IMPORT = "aliased_import";

    // Statements and expressions
    public static final String FOR_STATEMENT = "for_statement";
    public static final String WHILE_STATEMENT = "while_statement";
    public static final String IF_STATEMENT = "if_statement";
    public static final String ELIF_CLAUSE = "elif_clause";
    public static final String IF_CLAUSE = "if_clause";
    public static final String MATCH_STATEMENT = "match_statement";
    public static final String CASE_CLAUSE = "case_clause";
    public static final String CONDITIONAL_EXPRESSION = "conditional_expression";
    public static final String TRY_STATEMENT = "try_statement";
    public static final String EXCEPT_CLAUSE = "except_clause";
    public static final String EXCEPT_GROUP_CLAUSE = "except_group_clause";
    public static final String WITH_STATEMENT = "with_statement";
    public static final String CALL = "call";
    public static final String LAMBDA = "lambda";
    public static final String LIST_COMPREHENSION = "list_comprehension";
    public static final String DICTIONARY_COMPREHENSION = "dictionary_comprehension";
    public static final String SET_COMPREHENSION = "set_comprehension";
    public static final String GENERATOR_EXPRESSION = "generator_expression";
    public static final String RETURN_STATEMENT = "return_statement";
    public static final String YIELD = "yield";
    public static final String AWAIT = "await";
    public static final String RAISE_STATEMENT = "raise_statement";
    public static final String GLOBAL_STATEMENT = "global_statement";
    public static final String NONLOCAL_STATEMENT = "nonlocal_statement";
    public static final String ASSERT_STATEMENT = "assert_statement";
    public static final String LIST_SPLAT = "list_splat";
    public static final String DICTIONARY_SPLAT = "dictionary_splat";
    public static final String SLICE = "slice";
    public static final String BINARY_OPERATOR = "binary_operator";
    public static final String BOOLEAN_OPERATOR = "boolean_operator";
    public static final String COMPARISON_OPERATOR = "comparison_operator";
    public static final String UNARY_OPERATOR = "unary_operator";
    public static final String NOT_OPERATOR = "not_operator";
    public static final String STRING = "string";
    public static final String INTEGER = "integer";
    public static final String FLOAT = "float";
    public static final String TRUE = "true";
    public static final String FALSE = "false";
    public static final String NONE = "none";
    public static final String ATTRIBUTE = "attribute";
    public static final String SUBSCRIPT = "subscript";
    public static final String ASSIGNMENT = "assignment";
    public static final String AUGMENTED_ASSIGNMENT = "augmented_assignment";
    public static final String AS_PATTERN = "as_pattern";
    public static final String TUPLE = "tuple";
    public static final String PARENTHESIZED_EXPRESSION = "parenthesized_expression";
    public static final String BLOCK = "block";
    public static final String COMMENT = "comment";

    public static final String EXPRESSION_LIST = "expression_list";

    // Capture names in treesitter/python-legacy.scm
    public static final String LEGACY_PRINT = "legacy.print";
    public static final String LEGACY_EXEC = "legacy.exec";
    public static final String LEGACY_COMPARISON = "legacy.comparison";
    public static final String LEGACY_EXCEPT = "legacy.except";
    public static final String LEGACY_RAISE = "legacy.raise";
    public static final String LEGACY_STRING = "legacy.string";
    public static final String LEGACY_INTEGER = "legacy.integer";

    private PythonNodeTypes() {}
}
