package ai.svcs.analyzer;

import static ai.svcs.analyzer.ASTTraversalUtils.compactText;
import static ai.svcs.analyzer.ASTTraversalUtils.field;
import static ai.svcs.analyzer.ASTTraversalUtils.findAllNodesRecursive;
import static ai.svcs.analyzer.ASTTraversalUtils.namedChildren;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TreeSitterJavascript;
import org.treesitter.TreeSitterTypescript;

/** JavaScript and TypeScript share this adapter; only the grammar differs. */
public final class JavascriptAdapter extends TreeSitterAdapter {

    private static final Set<String> FUNCTION_TYPES = Set.of(
            "function_declaration",
            "generator_function_declaration",
            "method_definition",
            "method_signature",
            "abstract_method_signature");
    private static final Set<String> CLASS_TYPES =
            Set.of("class_declaration", "abstract_class_declaration", "interface_declaration");
    private static final Set<String> FIELD_TYPES =
            Set.of("field_definition", "public_field_definition", "property_signature");
    private static final Set<String> FUNCTION_VALUE_TYPES =
            Set.of("arrow_function", "function_expression", "function", "generator_function");
    private static final Set<String> VARIABLE_DECLARATION_TYPES = Set.of("lexical_declaration", "variable_declaration");

    private static final LanguageSyntaxProfile JS_SYNTAX_PROFILE = new LanguageSyntaxProfile(
            Map.ofEntries(
                    Map.entry("comment", BodyConstruct.COMMENT),
                    Map.entry("for_statement", BodyConstruct.LOOP),
                    Map.entry("for_in_statement", BodyConstruct.LOOP),
                    Map.entry("while_statement", BodyConstruct.LOOP),
                    Map.entry("do_statement", BodyConstruct.LOOP),
                    Map.entry("if_statement", BodyConstruct.CONDITIONAL),
                    Map.entry("switch_statement", BodyConstruct.SWITCH),
                    Map.entry("switch_case", BodyConstruct.CASE),
                    Map.entry("ternary_expression", BodyConstruct.TERNARY),
                    Map.entry("try_statement", BodyConstruct.TRY),
                    Map.entry("catch_clause", BodyConstruct.CATCH),
                    Map.entry("call_expression", BodyConstruct.CALL),
                    Map.entry("new_expression", BodyConstruct.CALL),
                    Map.entry("arrow_function", BodyConstruct.LAMBDA),
                    Map.entry("function_expression", BodyConstruct.LAMBDA),
                    Map.entry("function", BodyConstruct.LAMBDA),
                    Map.entry("generator_function", BodyConstruct.LAMBDA),
                    Map.entry("return_statement", BodyConstruct.RETURN),
                    Map.entry("yield_expression", BodyConstruct.YIELD),
                    Map.entry("await_expression", BodyConstruct.AWAIT),
                    Map.entry("throw_statement", BodyConstruct.RAISE),
                    Map.entry("spread_element", BodyConstruct.STARRED),
                    Map.entry("binary_expression", BodyConstruct.BINARY),
                    Map.entry("unary_expression", BodyConstruct.UNARY),
                    Map.entry("update_expression", BodyConstruct.UNARY),
                    Map.entry("string", BodyConstruct.STRING),
                    Map.entry("template_string", BodyConstruct.STRING),
                    Map.entry("number", BodyConstruct.NUMBER),
                    Map.entry("true", BodyConstruct.BOOLEAN),
                    Map.entry("false", BodyConstruct.BOOLEAN),
                    Map.entry("null", BodyConstruct.NONE),
                    Map.entry("undefined", BodyConstruct.NONE),
                    Map.entry("member_expression", BodyConstruct.ATTRIBUTE),
                    Map.entry("subscript_expression", BodyConstruct.SUBSCRIPT),
                    Map.entry("assignment_expression", BodyConstruct.ASSIGNMENT),
                    Map.entry("variable_declarator", BodyConstruct.ASSIGNMENT),
                    Map.entry("augmented_assignment_expression", BodyConstruct.AUGMENTED_ASSIGNMENT)),
            Map.of(),
            Set.of("map", "filter", "reduce", "reduceRight", "forEach", "flatMap", "some", "every", "find"),
            "name", // identifierFieldName
            "body", // bodyFieldName
            "parameters", // parametersFieldName
            "return_type" // returnTypeFieldName
            );

    private static final RegexGrammar JS_REGEX_GRAMMAR = new RegexGrammar(
            RegexGrammar.BlockStyle.BRACES,
            RegexGrammar.ParameterStyle.JAVASCRIPT,
            List.of(
                    Pattern.compile("(?m)^[ \\t]*(?:export[ \\t]+)?(?:default[ \\t]+)?(?<async>async[ \\t]+)?"
                            + "function[ \\t]*\\*?[ \\t]*(?<name>[\\w$]+)[ \\t]*(?:<[^>]*>)?\\((?<params>[^)]*)\\)"),
                    Pattern.compile("(?m)^[ \\t]*(?:export[ \\t]+)?(?:const|let|var)[ \\t]+(?<name>[\\w$]+)"
                            + "[ \\t]*(?::[^=]+)?=[ \\t]*(?<async>async[ \\t]+)?"
                            + "(?:function[ \\t]*\\*?[ \\t]*[\\w$]*[ \\t]*)?\\((?<params>[^)]*)\\)")),
            List.of(Pattern.compile("(?m)^[ \\t]*(?:(?<visibility>public|private|protected)[ \\t]+)?"
                    + "(?<static>static[ \\t]+)?(?:readonly[ \\t]+)?(?<async>async[ \\t]+)?\\*?"
                    + "(?<name>#?[\\w$]+)[ \\t]*\\((?<params>[^)]*)\\)[ \\t]*(?::[^{\\n]+)?\\{")),
            Pattern.compile("(?m)^[ \\t]*(?:export[ \\t]+)?(?:default[ \\t]+)?(?:abstract[ \\t]+)?(?:class|interface)"
                    + "[ \\t]+(?<name>[\\w$]+)(?<bases>[^{]*)\\{"),
            List.of(
                    Pattern.compile("(?m)^[ \\t]*import[ \\t]+(?:[^'\";]*?[ \\t]+from[ \\t]+)?['\"](?<module>[^'\"]+)['\"]"),
                    Pattern.compile("\\brequire[ \\t]*\\([ \\t]*['\"](?<module>[^'\"]+)['\"][ \\t]*\\)")),
            Pattern.compile("(?m)^[ \\t]*@([\\w.$]+(?:\\([^)]*\\))?)[ \\t]*$"),
            Pattern.compile("(?s)/\\*.*?\\*/|(?<![:'\"\\\\])//[^\\n]*"));

    private final boolean typescript;

    public JavascriptAdapter(SourceLanguage language, double maxErrorRatio) {
        super(language, maxErrorRatio, JS_REGEX_GRAMMAR);
        if (language != SourceLanguage.JAVASCRIPT && language != SourceLanguage.TYPESCRIPT) {
            throw new IllegalArgumentException("Not a JavaScript dialect: " + language);
        }
        this.typescript = language == SourceLanguage.TYPESCRIPT;
    }

    @Override
    protected TSLanguage createTSLanguage() {
        return typescript ? new TreeSitterTypescript() : new TreeSitterJavascript();
    }

    @Override
    protected LanguageSyntaxProfile profile() {
        return JS_SYNTAX_PROFILE;
    }

    @Override
    protected @Nullable DeclarationKind declarationKind(TSNode node, ScopeKind scope) {
        var type = node.getType();
        if (FUNCTION_TYPES.contains(type)) {
            return DeclarationKind.FUNCTION;
        }
        if (CLASS_TYPES.contains(type)) {
            return DeclarationKind.CLASS;
        }
        if (scope == ScopeKind.CLASS && FIELD_TYPES.contains(type)) {
            return DeclarationKind.PROPERTY;
        }
        if (scope == ScopeKind.MODULE && functionDeclarator(node) != null) {
            return DeclarationKind.FUNCTION;
        }
        return null;
    }

    /** The declarator of {@code const f = () => ...} style declarations, or null. */
    private static @Nullable TSNode functionDeclarator(TSNode node) {
        if (!VARIABLE_DECLARATION_TYPES.contains(node.getType())) {
            return null;
        }
        var declarators = namedChildren(node);
        if (declarators.size() != 1 || !"variable_declarator".equals(declarators.get(0).getType())) {
            return null;
        }
        var value = field(declarators.get(0), "value");
        return value != null && FUNCTION_VALUE_TYPES.contains(value.getType()) ? declarators.get(0) : null;
    }

    /** The node that owns the parameters and body: the function value for variable-declared functions. */
    private static TSNode functionNode(TSNode node) {
        var declarator = functionDeclarator(node);
        if (declarator != null) {
            var value = field(declarator, "value");
            if (value != null) {
                return value;
            }
        }
        return node;
    }

    @Override
    protected List<String> declarationNames(TSNode node, DeclarationKind kind, SourceContent content) {
        var declarator = functionDeclarator(node);
        if (declarator != null) {
            return super.declarationNames(declarator, kind, content);
        }
        if ("field_definition".equals(node.getType())) {
            var property = field(node, "property");
            return property == null ? List.of() : List.of(compactText(property, content));
        }
        return super.declarationNames(node, kind, content);
    }

    @Override
    protected @Nullable TSNode declarationBody(TSNode node, DeclarationKind kind) {
        if (kind == DeclarationKind.PROPERTY) {
            return null;
        }
        return field(functionNode(node), JS_SYNTAX_PROFILE.bodyFieldName());
    }

    @Override
    protected void describeDeclaration(
            TSNode node, DeclarationKind kind, SourceContent content, NodeFeatures.Builder features) {
        // `@Injectable() export class S {}` hangs the decorator on the export statement
        var parent = node.getParent();
        if (kind == DeclarationKind.CLASS
                && ASTTraversalUtils.isPresent(parent)
                && "export_statement".equals(parent.getType())) {
            for (var child : namedChildren(parent)) {
                if ("decorator".equals(child.getType())) {
                    features.decorator(stripPrefix(compactText(child, content), "@"));
                }
            }
        }
        for (var child : namedChildren(node)) {
            switch (child.getType()) {
                case "decorator" -> features.decorator(stripPrefix(compactText(child, content), "@"));
                case "accessibility_modifier" -> features.visibility(compactText(child, content));
                case "class_heritage", "extends_type_clause" -> bases(child, content).forEach(features::baseType);
                default -> {}
            }
        }
        features.isStatic(hasChildOfType(node, "static"));
        var names = declarationNames(node, kind, content);
        if (!names.isEmpty() && names.get(0).startsWith("#")) {
            features.visibility("private");
        }
        if (kind == DeclarationKind.CLASS) {
            return;
        }
        var function = functionNode(node);
        var typeAnnotation = field(function, kind == DeclarationKind.PROPERTY ? "type" : "return_type");
        features.returnType(typeAnnotation == null ? null : stripPrefix(compactText(typeAnnotation, content), ":"));
        if (kind == DeclarationKind.PROPERTY) {
            return;
        }
        features.async(hasChildOfType(function, "async"));
        var parameters = field(function, JS_SYNTAX_PROFILE.parametersFieldName());
        if (parameters != null) {
            for (var param : namedChildren(parameters)) {
                var parameter = parameter(param, content);
                if (parameter != null) {
                    features.parameter(parameter);
                }
            }
        } else {
            // single-identifier arrow function: x => ...
            var single = field(function, "parameter");
            if (single != null) {
                features.parameter(Parameter.positional(compactText(single, content)));
            }
        }
    }

    private static List<String> bases(TSNode heritage, SourceContent content) {
        var result = new ArrayList<String>();
        for (var child : namedChildren(heritage)) {
            var type = child.getType();
            if ("extends_clause".equals(type) || "implements_clause".equals(type) || "extends_type_clause".equals(type)) {
                for (var base : namedChildren(child)) {
                    if (!"type_arguments".equals(base.getType())) {
                        result.add(compactText(base, content));
                    }
                }
            } else if (!"comment".equals(type)) {
                result.add(compactText(child, content));
            }
        }
        return result;
    }

    private static @Nullable Parameter parameter(TSNode param, SourceContent content) {
        switch (param.getType()) {
            case "comment" -> {
                return null;
            }
            case "identifier" -> {
                return Parameter.positional(compactText(param, content));
            }
            case "assignment_pattern" -> {
                var left = field(param, "left");
                var right = field(param, "right");
                return new Parameter(
                        compactText(left, content),
                        right == null ? null : compactText(right, content),
                        null,
                        Parameter.Kind.POSITIONAL);
            }
            case "rest_pattern" -> {
                return new Parameter(stripPrefix(compactText(param, content), "..."), null, null, Parameter.Kind.VARIADIC);
            }
            case "required_parameter", "optional_parameter" -> {
                var pattern = field(param, "pattern");
                var type = field(param, "type");
                var value = field(param, "value");
                var name = compactText(pattern, content);
                var kind = Parameter.Kind.POSITIONAL;
                if (pattern != null && "rest_pattern".equals(pattern.getType())) {
                    kind = Parameter.Kind.VARIADIC;
                    name = stripPrefix(name, "...");
                }
                return new Parameter(
                        name,
                        value == null ? null : compactText(value, content),
                        type == null ? null : stripPrefix(compactText(type, content), ":"),
                        kind);
            }
            default -> {
                return Parameter.positional(compactText(param, content));
            }
        }
    }

    @Override
    protected boolean isImport(TSNode node, SourceContent content) {
        var type = node.getType();
        if ("import_statement".equals(type)) {
            return true;
        }
        if ("export_statement".equals(type)) {
            return field(node, "source") != null;
        }
        return moduleLoad(node, content) != null;
    }

    /** The module string of a {@code require('x')} or dynamic {@code import('x')} call, or null. */
    private static @Nullable TSNode moduleLoad(TSNode node, SourceContent content) {
        if (!"call_expression".equals(node.getType())) {
            return null;
        }
        var function = field(node, "function");
        if (function == null) {
            return null;
        }
        var callee = function.getType();
        if (!"import".equals(callee)
                && !("identifier".equals(callee) && "require".equals(compactText(function, content)))) {
            return null;
        }
        var arguments = field(node, "arguments");
        if (arguments == null) {
            return null;
        }
        var args = namedChildren(arguments);
        return !args.isEmpty() && "string".equals(args.get(0).getType()) ? args.get(0) : null;
    }

    @Override
    protected List<String> importedModules(TSNode node, SourceContent content) {
        var source = field(node, "source");
        if (source == null) {
            source = moduleLoad(node, content);
        }
        return source == null ? List.of() : List.of(unquote(compactText(source, content)));
    }

    @Override
    protected boolean isDecorator(TSNode node) {
        return "decorator".equals(node.getType());
    }

    @Override
    protected List<String> caughtTypes(TSNode catchNode, SourceContent content) {
        var types = new ArrayList<String>();
        types.add("*");
        var body = field(catchNode, "body");
        if (body != null) {
            var checks = findAllNodesRecursive(body, n -> "binary_expression".equals(n.getType())
                    && "instanceof".equals(compactText(field(n, "operator"), content)));
            for (var check : checks) {
                var right = field(check, "right");
                if (right != null) {
                    types.add(compactText(right, content));
                }
            }
        }
        return types;
    }
}
