package ai.svcs.analyzer;

import static ai.svcs.analyzer.ASTTraversalUtils.children;
import static ai.svcs.analyzer.ASTTraversalUtils.compactText;
import static ai.svcs.analyzer.ASTTraversalUtils.extractNodeText;
import static ai.svcs.analyzer.ASTTraversalUtils.field;
import static ai.svcs.analyzer.ASTTraversalUtils.namedChildren;
import static ai.svcs.analyzer.python.PythonNodeTypes.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSQuery;
import org.treesitter.TSQueryCursor;
import org.treesitter.TSQueryMatch;
import org.treesitter.TreeSitterPython;

public final class PythonAdapter extends TreeSitterAdapter {

    private static final LanguageSyntaxProfile PY_SYNTAX_PROFILE = new LanguageSyntaxProfile(
            Map.ofEntries(
                    Map.entry(COMMENT, BodyConstruct.COMMENT),
                    Map.entry(FOR_STATEMENT, BodyConstruct.LOOP),
                    Map.entry(WHILE_STATEMENT, BodyConstruct.LOOP),
                    Map.entry(IF_STATEMENT, BodyConstruct.CONDITIONAL),
                    Map.entry(ELIF_CLAUSE, BodyConstruct.BRANCH),
                    Map.entry(IF_CLAUSE, BodyConstruct.BRANCH),
                    Map.entry(MATCH_STATEMENT, BodyConstruct.SWITCH),
                    Map.entry(CASE_CLAUSE, BodyConstruct.CASE),
                    Map.entry(CONDITIONAL_EXPRESSION, BodyConstruct.TERNARY),
                    Map.entry(TRY_STATEMENT, BodyConstruct.TRY),
                    Map.entry(EXCEPT_CLAUSE, BodyConstruct.CATCH),
                    Map.entry(EXCEPT_GROUP_CLAUSE, BodyConstruct.CATCH),
                    Map.entry(WITH_STATEMENT, BodyConstruct.CONTEXT_MANAGER),
                    Map.entry(CALL, BodyConstruct.CALL),
                    Map.entry(LAMBDA, BodyConstruct.LAMBDA),
                    Map.entry(LIST_COMPREHENSION, BodyConstruct.COMPREHENSION),
                    Map.entry(DICTIONARY_COMPREHENSION, BodyConstruct.COMPREHENSION),
                    Map.entry(SET_COMPREHENSION, BodyConstruct.COMPREHENSION),
                    Map.entry(GENERATOR_EXPRESSION, BodyConstruct.COMPREHENSION),
                    Map.entry(RETURN_STATEMENT, BodyConstruct.RETURN),
                    Map.entry(YIELD, BodyConstruct.YIELD),
                    Map.entry(AWAIT, BodyConstruct.AWAIT),
                    Map.entry(RAISE_STATEMENT, BodyConstruct.RAISE),
                    Map.entry(GLOBAL_STATEMENT, BodyConstruct.GLOBAL),
                    Map.entry(NONLOCAL_STATEMENT, BodyConstruct.NONLOCAL),
                    Map.entry(ASSERT_STATEMENT, BodyConstruct.ASSERT),
                    Map.entry(LIST_SPLAT, BodyConstruct.STARRED),
                    Map.entry(DICTIONARY_SPLAT, BodyConstruct.STARRED),
                    Map.entry(SLICE, BodyConstruct.SLICE),
                    Map.entry(BINARY_OPERATOR, BodyConstruct.BINARY),
                    Map.entry(BOOLEAN_OPERATOR, BodyConstruct.BOOLEAN_OPERATOR),
                    Map.entry(COMPARISON_OPERATOR, BodyConstruct.COMPARISON),
                    Map.entry(UNARY_OPERATOR, BodyConstruct.UNARY),
                    Map.entry(NOT_OPERATOR, BodyConstruct.UNARY),
                    Map.entry(STRING, BodyConstruct.STRING),
                    Map.entry(INTEGER, BodyConstruct.NUMBER),
                    Map.entry(FLOAT, BodyConstruct.NUMBER),
                    Map.entry(TRUE, BodyConstruct.BOOLEAN),
                    Map.entry(FALSE, BodyConstruct.BOOLEAN),
                    Map.entry(NONE, BodyConstruct.NONE),
                    Map.entry(ATTRIBUTE, BodyConstruct.ATTRIBUTE),
                    Map.entry(SUBSCRIPT, BodyConstruct.SUBSCRIPT),
                    Map.entry(ASSIGNMENT, BodyConstruct.ASSIGNMENT),
                    Map.entry(AUGMENTED_ASSIGNMENT, BodyConstruct.AUGMENTED_ASSIGNMENT)),
            Map.of(
                    LIST_COMPREHENSION, "list",
                    DICTIONARY_COMPREHENSION, "dict",
                    SET_COMPREHENSION, "set",
                    GENERATOR_EXPRESSION, "generator"),
            Set.of("map", "filter", "reduce", "partial", "starmap", "accumulate", "zip"),
            "name", // identifierFieldName
            "body", // bodyFieldName
            "parameters", // parametersFieldName
            "return_type" // returnTypeFieldName
            );

    private static final RegexGrammar PY_REGEX_GRAMMAR = new RegexGrammar(
            RegexGrammar.BlockStyle.INDENT,
            RegexGrammar.ParameterStyle.PYTHON,
            List.of(Pattern.compile(
                    "(?m)^[ \\t]*(?<async>async[ \\t]+)?def[ \\t]+(?<name>\\w+)[ \\t]*\\((?<params>[^)]*)\\)")),
            List.of(),
            Pattern.compile("(?m)^[ \\t]*class[ \\t]+(?<name>\\w+)[ \\t]*(?:\\((?<bases>[^)]*)\\))?[ \\t]*:"),
            List.of(
                    Pattern.compile("(?m)^[ \\t]*import[ \\t]+(?<module>[\\w.]+(?:[ \\t]+as[ \\t]+\\w+)?"
                            + "(?:[ \\t]*,[ \\t]*[\\w.]+(?:[ \\t]+as[ \\t]+\\w+)?)*)"),
                    Pattern.compile("(?m)^[ \\t]*from[ \\t]+(?<module>\\.*[\\w.]*)[ \\t]+import\\b")),
            Pattern.compile("(?m)^[ \\t]*@([\\w.]+(?:\\([^)]*\\))?)[ \\t]*$"),
            Pattern.compile("#[^\\n]*"));

    // Rewrites applied by the legacy stage
    private static final Pattern BACKTICK_REPR = Pattern.compile("`([^`\\n]+)`");
    private static final Pattern EXCEPT_COMMA =
            Pattern.compile("(?m)^([ \\t]*except[ \\t]+(?:\\([^)]*\\)|[\\w.]+))[ \\t]*,[ \\t]*(\\w+)[ \\t]*:");
    private static final Pattern RAISE_COMMA =
            Pattern.compile("(?m)^([ \\t]*raise[ \\t]+[\\w.]+)[ \\t]*,[ \\t]*([^\\n]+?)[ \\t]*$");
    private static final Pattern EXEC_STATEMENT = Pattern.compile("(?m)^([ \\t]*)exec[ \\t]+(?![(=])([^\\n]+?)[ \\t]*$");
    private static final Pattern UNICODE_RAW_STRING = Pattern.compile("\\b[uU][rR](['\"])");
    private static final Pattern OLD_OCTAL = Pattern.compile("(?<![\\w.])0([0-7]+)(?![\\w.])");
    private static final Pattern LONG_SUFFIX = Pattern.compile("(?<![\\w.])(\\d+)[lL]\\b");
    private static final Pattern OBSOLETE_INTEGER = Pattern.compile("0[0-7]*[1-7][0-7]*|\\d+[lL]");
    private static final Pattern OBSOLETE_STRING_PREFIX = Pattern.compile("^(?:`|[uU][rR])");

    private final ThreadLocal<TSQuery> legacyQuery =
            ThreadLocal.withInitial(() -> new TSQuery(new TreeSitterPython(), TSQueryLoader.loadQuery("python-legacy")));

    public PythonAdapter(double maxErrorRatio) {
        super(SourceLanguage.PYTHON, maxErrorRatio, PY_REGEX_GRAMMAR);
    }

    @Override
    protected TSLanguage createTSLanguage() {
        return new TreeSitterPython();
    }

    @Override
    protected LanguageSyntaxProfile profile() {
        return PY_SYNTAX_PROFILE;
    }

    // tree-sitter-python still parses these Python 2 forms cleanly
    @Override
    protected Optional<String> obsoleteSyntax(TSNode root, SourceContent content) {
        var query = legacyQuery.get();
        var cursor = new TSQueryCursor();
        cursor.exec(query, root);

        var match = new TSQueryMatch();
        while (cursor.nextMatch(match)) {
            for (var cap : match.getCaptures()) {
                var node = cap.getNode();
                if (node == null || node.isNull()) continue;

                var construct = obsoleteConstruct(query.getCaptureNameForId(cap.getIndex()), node, content);
                if (construct != null) {
                    return Optional.of(construct + " at line " + (node.getStartPoint().getRow() + 1));
                }
            }
        }
        return Optional.empty();
    }

    private static @Nullable String obsoleteConstruct(String capture, TSNode node, SourceContent content) {
        return switch (capture) {
            case LEGACY_PRINT -> "print statement";
            case LEGACY_EXEC -> "exec statement";
            case LEGACY_STRING -> OBSOLETE_STRING_PREFIX.matcher(extractNodeText(node, content)).find()
                    ? "backtick or ur-prefixed string"
                    : null;
            case LEGACY_INTEGER -> OBSOLETE_INTEGER.matcher(extractNodeText(node, content)).matches()
                    ? "old-style integer literal"
                    : null;
            case LEGACY_COMPARISON -> hasChildOfType(node, "<>") ? "<> operator" : null;
            case LEGACY_EXCEPT -> hasChildOfType(node, ",") ? "comma form of except" : null;
            case LEGACY_RAISE -> children(node).stream().anyMatch(c -> EXPRESSION_LIST.equals(c.getType()))
                    ? "comma form of raise"
                    : null;
            default -> null;
        };
    }

    @Override
    protected String rewriteLegacySyntax(String source) {
        var result = source.replace("<>", "!=");
        result = BACKTICK_REPR.matcher(result).replaceAll("repr($1)");
        result = EXCEPT_COMMA.matcher(result).replaceAll("$1 as $2:");
        result = RAISE_COMMA.matcher(result).replaceAll("$1($2)");
        result = EXEC_STATEMENT.matcher(result).replaceAll("$1exec($2)");
        result = UNICODE_RAW_STRING.matcher(result).replaceAll("r$1");
        result = OLD_OCTAL.matcher(result).replaceAll("0o$1");
        result = LONG_SUFFIX.matcher(result).replaceAll("$1");
        return result;
    }

    @Override
    protected @Nullable DeclarationKind declarationKind(TSNode node, ScopeKind scope) {
        return switch (node.getType()) {
            case FUNCTION_DEFINITION -> DeclarationKind.FUNCTION;
            case CLASS_DEFINITION -> DeclarationKind.CLASS;
            case DECORATED_DEFINITION -> {
                var definition = field(node, "definition");
                yield definition == null ? null : declarationKind(definition, scope);
            }
            case EXPRESSION_STATEMENT -> scope == ScopeKind.CLASS && classLevelAssignment(node) != null
                    ? DeclarationKind.PROPERTY
                    : null;
            default -> null;
        };
    }

    private static @Nullable TSNode classLevelAssignment(TSNode statement) {
        var named = namedChildren(statement);
        if (named.size() != 1 || !ASSIGNMENT.equals(named.get(0).getType())) {
            return null;
        }
        var left = field(named.get(0), "left");
        return left != null && IDENTIFIER.equals(left.getType()) ? named.get(0) : null;
    }

    private static TSNode unwrap(TSNode node) {
        if (DECORATED_DEFINITION.equals(node.getType())) {
            var definition = field(node, "definition");
            if (definition != null) {
                return definition;
            }
        }
        return node;
    }

    @Override
    protected List<String> declarationNames(TSNode node, DeclarationKind kind, SourceContent content) {
        if (kind == DeclarationKind.PROPERTY) {
            var assignment = classLevelAssignment(node);
            return assignment == null ? List.of() : List.of(compactText(field(assignment, "left"), content));
        }
        return super.declarationNames(unwrap(node), kind, content);
    }

    @Override
    protected @Nullable TSNode declarationBody(TSNode node, DeclarationKind kind) {
        return kind == DeclarationKind.PROPERTY ? null : super.declarationBody(unwrap(node), kind);
    }

    @Override
    protected void describeDeclaration(
            TSNode node, DeclarationKind kind, SourceContent content, NodeFeatures.Builder features) {
        if (kind == DeclarationKind.PROPERTY) {
            var assignment = classLevelAssignment(node);
            if (assignment != null) {
                var type = field(assignment, "type");
                features.returnType(type == null ? null : compactText(type, content));
            }
            return;
        }
        if (DECORATED_DEFINITION.equals(node.getType())) {
            for (var child : namedChildren(node)) {
                if (DECORATOR.equals(child.getType())) {
                    var decorator = stripPrefix(compactText(child, content), "@");
                    features.decorator(decorator);
                    if (decorator.equals("staticmethod")) {
                        features.isStatic(true);
                    }
                }
            }
        }
        var definition = unwrap(node);
        if (kind == DeclarationKind.CLASS) {
            var superclasses = field(definition, "superclasses");
            if (superclasses != null) {
                for (var base : namedChildren(superclasses)) {
                    if (!COMMENT.equals(base.getType())) {
                        features.baseType(compactText(base, content));
                    }
                }
            }
            return;
        }
        features.async(hasChildOfType(definition, "async"));
        var returnType = field(definition, PY_SYNTAX_PROFILE.returnTypeFieldName());
        features.returnType(returnType == null ? null : compactText(returnType, content));
        var parameters = field(definition, PY_SYNTAX_PROFILE.parametersFieldName());
        if (parameters != null) {
            extractParameters(parameters, content).forEach(features::parameter);
        }
    }

    private static List<Parameter> extractParameters(TSNode parameters, SourceContent content) {
        var result = new ArrayList<Parameter>();
        boolean keywordOnly = false;
        for (var param : namedChildren(parameters)) {
            var type = param.getType();
            switch (type) {
                case KEYWORD_SEPARATOR -> keywordOnly = true;
                case POSITIONAL_SEPARATOR, COMMENT -> {}
                case IDENTIFIER -> result.add(new Parameter(
                        compactText(param, content),
                        null,
                        null,
                        keywordOnly ? Parameter.Kind.KEYWORD_ONLY : Parameter.Kind.POSITIONAL));
                case LIST_SPLAT_PATTERN -> {
                    keywordOnly = true;
                    result.add(new Parameter(splatName(param, content), null, null, Parameter.Kind.VARIADIC));
                }
                case DICTIONARY_SPLAT_PATTERN -> result.add(
                        new Parameter(splatName(param, content), null, null, Parameter.Kind.VARIADIC_KEYWORD));
                default -> {
                    var nameNode = field(param, "name");
                    var kind = keywordOnly ? Parameter.Kind.KEYWORD_ONLY : Parameter.Kind.POSITIONAL;
                    if (nameNode == null) {
                        // typed_parameter keeps its name as the first named child
                        var named = namedChildren(param);
                        nameNode = named.isEmpty() ? null : named.get(0);
                    }
                    if (nameNode == null) {
                        continue;
                    }
                    String name = compactText(nameNode, content);
                    if (LIST_SPLAT_PATTERN.equals(nameNode.getType())) {
                        kind = Parameter.Kind.VARIADIC;
                        name = splatName(nameNode, content);
                        keywordOnly = true;
                    } else if (DICTIONARY_SPLAT_PATTERN.equals(nameNode.getType())) {
                        kind = Parameter.Kind.VARIADIC_KEYWORD;
                        name = splatName(nameNode, content);
                    }
                    var annotation = field(param, "type");
                    var value = field(param, "value");
                    result.add(new Parameter(
                            name,
                            value == null ? null : compactText(value, content),
                            annotation == null ? null : compactText(annotation, content),
                            kind));
                }
            }
        }
        return result;
    }

    private static String splatName(TSNode splat, SourceContent content) {
        var text = compactText(splat, content);
        return text.replaceFirst("^\\*+", "");
    }

    @Override
    protected boolean isImport(TSNode node, SourceContent content) {
        var type = node.getType();
        return IMPORT_STATEMENT.equals(type) || IMPORT_FROM_STATEMENT.equals(type) || FUTURE_IMPORT_STATEMENT.equals(type);
    }

    @Override
    protected List<String> importedModules(TSNode node, SourceContent content) {
        return switch (node.getType()) {
            case FUTURE_IMPORT_STATEMENT -> List.of("__future__");
            case IMPORT_FROM_STATEMENT -> {
                var module = field(node, "module_name");
                yield module == null ? List.of() : List.of(compactText(module, content));
            }
            default -> {
                var modules = new ArrayList<String>();
                for (var child : namedChildren(node)) {
                    if (DOTTED_NAME.equals(child.getType())) {
                        modules.add(compactText(child, content));
                    } else if (ALIASED_IMPORT.equals(child.getType())) {
                        var name = field(child, "name");
                        if (name != null) {
                            modules.add(compactText(name, content));
                        }
                    }
                }
                yield modules;
            }
        };
    }

    @Override
    protected boolean isDecorator(TSNode node) {
        return DECORATOR.equals(node.getType());
    }

    @Override
    protected List<String> caughtTypes(TSNode catchNode, SourceContent content) {
        TSNode caught = null;
        for (var child : namedChildren(catchNode)) {
            var type = child.getType();
            if (!BLOCK.equals(type) && !COMMENT.equals(type)) {
                caught = child;
                break;
            }
        }
        if (caught == null) {
            return List.of("*");
        }
        if (AS_PATTERN.equals(caught.getType())) {
            var named = namedChildren(caught);
            if (named.isEmpty()) {
                return List.of("*");
            }
            caught = named.get(0);
        }
        if (TUPLE.equals(caught.getType()) || PARENTHESIZED_EXPRESSION.equals(caught.getType())) {
            var types = new ArrayList<String>();
            for (var element : namedChildren(caught)) {
                if (TUPLE.equals(element.getType())) {
                    namedChildren(element).forEach(e -> types.add(compactText(e, content)));
                } else {
                    types.add(compactText(element, content));
                }
            }
            return types;
        }
        return List.of(compactText(caught, content));
    }
}
