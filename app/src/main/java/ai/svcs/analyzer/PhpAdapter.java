package ai.svcs.analyzer;

import static ai.svcs.analyzer.ASTTraversalUtils.compactText;
import static ai.svcs.analyzer.ASTTraversalUtils.field;
import static ai.svcs.analyzer.ASTTraversalUtils.findAllNodesRecursive;
import static ai.svcs.analyzer.ASTTraversalUtils.namedChildren;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TreeSitterPhp;

public final class PhpAdapter extends TreeSitterAdapter {

    private static final Set<String> CLASS_LIKE_TYPES =
            Set.of("class_declaration", "interface_declaration", "trait_declaration", "enum_declaration");
    private static final Set<String> IMPORT_TYPES = Set.of(
            "namespace_use_declaration",
            "include_expression",
            "include_once_expression",
            "require_expression",
            "require_once_expression");
    private static final Set<String> STRING_TYPES = Set.of("string", "encapsed_string", "heredoc", "nowdoc");

    private static final LanguageSyntaxProfile PHP_SYNTAX_PROFILE = new LanguageSyntaxProfile(
            Map.ofEntries(
                    Map.entry("comment", BodyConstruct.COMMENT),
                    Map.entry("for_statement", BodyConstruct.LOOP),
                    Map.entry("foreach_statement", BodyConstruct.LOOP),
                    Map.entry("while_statement", BodyConstruct.LOOP),
                    Map.entry("do_statement", BodyConstruct.LOOP),
                    Map.entry("if_statement", BodyConstruct.CONDITIONAL),
                    Map.entry("else_if_clause", BodyConstruct.BRANCH),
                    Map.entry("switch_statement", BodyConstruct.SWITCH),
                    Map.entry("match_expression", BodyConstruct.SWITCH),
                    Map.entry("case_statement", BodyConstruct.CASE),
                    Map.entry("match_conditional_expression", BodyConstruct.CASE),
                    Map.entry("conditional_expression", BodyConstruct.TERNARY),
                    Map.entry("try_statement", BodyConstruct.TRY),
                    Map.entry("catch_clause", BodyConstruct.CATCH),
                    Map.entry("function_call_expression", BodyConstruct.CALL),
                    Map.entry("member_call_expression", BodyConstruct.CALL),
                    Map.entry("nullsafe_member_call_expression", BodyConstruct.CALL),
                    Map.entry("scoped_call_expression", BodyConstruct.CALL),
                    Map.entry("object_creation_expression", BodyConstruct.CALL),
                    Map.entry("anonymous_function", BodyConstruct.LAMBDA),
                    Map.entry("anonymous_function_creation_expression", BodyConstruct.LAMBDA),
                    Map.entry("arrow_function", BodyConstruct.LAMBDA),
                    Map.entry("return_statement", BodyConstruct.RETURN),
                    Map.entry("yield_expression", BodyConstruct.YIELD),
                    Map.entry("throw_expression", BodyConstruct.RAISE),
                    Map.entry("throw_statement", BodyConstruct.RAISE),
                    Map.entry("global_declaration", BodyConstruct.GLOBAL),
                    Map.entry("variadic_unpacking", BodyConstruct.STARRED),
                    Map.entry("binary_expression", BodyConstruct.BINARY),
                    Map.entry("unary_op_expression", BodyConstruct.UNARY),
                    Map.entry("update_expression", BodyConstruct.UNARY),
                    Map.entry("string", BodyConstruct.STRING),
                    Map.entry("encapsed_string", BodyConstruct.STRING),
                    Map.entry("heredoc", BodyConstruct.STRING),
                    Map.entry("nowdoc", BodyConstruct.STRING),
                    Map.entry("integer", BodyConstruct.NUMBER),
                    Map.entry("float", BodyConstruct.NUMBER),
                    Map.entry("boolean", BodyConstruct.BOOLEAN),
                    Map.entry("null", BodyConstruct.NONE),
                    Map.entry("member_access_expression", BodyConstruct.ATTRIBUTE),
                    Map.entry("nullsafe_member_access_expression", BodyConstruct.ATTRIBUTE),
                    Map.entry("scoped_property_access_expression", BodyConstruct.ATTRIBUTE),
                    Map.entry("subscript_expression", BodyConstruct.SUBSCRIPT),
                    Map.entry("assignment_expression", BodyConstruct.ASSIGNMENT),
                    Map.entry("reference_assignment_expression", BodyConstruct.ASSIGNMENT),
                    Map.entry("augmented_assignment_expression", BodyConstruct.AUGMENTED_ASSIGNMENT)),
            Map.of(),
            Set.of("array_map", "array_filter", "array_reduce", "array_walk", "usort", "uasort", "uksort",
                    "call_user_func", "call_user_func_array"),
            "name", // identifierFieldName
            "body", // bodyFieldName
            "parameters", // parametersFieldName
            "return_type" // returnTypeFieldName
            );

    private static final RegexGrammar PHP_REGEX_GRAMMAR = new RegexGrammar(
            RegexGrammar.BlockStyle.BRACES,
            RegexGrammar.ParameterStyle.PHP,
            List.of(Pattern.compile("(?m)^[ \\t]*(?:(?:abstract|final)[ \\t]+)*"
                    + "(?:(?<visibility>public|private|protected)[ \\t]+)?(?:(?<static>static)[ \\t]+)?"
                    + "(?:(?:public|private|protected|static|abstract|final)[ \\t]+)*"
                    + "function[ \\t]+&?[ \\t]*(?<name>\\w+)[ \\t]*\\((?<params>[^)]*)\\)")),
            List.of(),
            Pattern.compile("(?m)^[ \\t]*(?:(?:abstract|final|readonly)[ \\t]+)*(?:class|interface|trait|enum)[ \\t]+"
                    + "(?<name>\\w+)(?<bases>[^{;]*)\\{"),
            List.of(
                    Pattern.compile("(?m)^[ \\t]*use[ \\t]+(?<module>\\\\?[\\w\\\\]+)"),
                    Pattern.compile("\\b(?:require|include)(?:_once)?[ \\t]*\\(?[ \\t]*['\"](?<module>[^'\"]+)['\"]")),
            Pattern.compile("(?m)^[ \\t]*#\\[(.+)\\][ \\t]*$"),
            Pattern.compile("(?s)/\\*.*?\\*/|//[^\\n]*|#(?!\\[)[^\\n]*"));

    private static final Pattern SHORT_OPEN_TAG = Pattern.compile("<\\?(?![pP][hH][pP]|=|xml)");
    private static final Pattern VAR_PROPERTY = Pattern.compile("(?m)^([ \\t]*)var([ \\t]+\\$)");

    public PhpAdapter(double maxErrorRatio) {
        super(SourceLanguage.PHP, maxErrorRatio, PHP_REGEX_GRAMMAR);
    }

    @Override
    protected TSLanguage createTSLanguage() {
        return new TreeSitterPhp();
    }

    @Override
    protected LanguageSyntaxProfile profile() {
        return PHP_SYNTAX_PROFILE;
    }

    @Override
    protected Optional<String> primaryPrecheck(String source) {
        return source.contains("<?") ? Optional.empty() : Optional.of("no PHP open tag");
    }

    @Override
    protected String rewriteLegacySyntax(String source) {
        var result = SHORT_OPEN_TAG.matcher(source).replaceAll("<?php ");
        if (!result.contains("<?")) {
            // same line, so line numbers are unchanged
            result = "<?php " + result;
        }
        return VAR_PROPERTY.matcher(result).replaceAll("$1public$2");
    }

    @Override
    protected @Nullable DeclarationKind declarationKind(TSNode node, ScopeKind scope) {
        var type = node.getType();
        if ("function_definition".equals(type) || "method_declaration".equals(type)) {
            return DeclarationKind.FUNCTION;
        }
        if (CLASS_LIKE_TYPES.contains(type)) {
            return DeclarationKind.CLASS;
        }
        if (scope == ScopeKind.CLASS && ("property_declaration".equals(type) || "const_declaration".equals(type))) {
            return DeclarationKind.PROPERTY;
        }
        return null;
    }

    @Override
    protected List<String> declarationNames(TSNode node, DeclarationKind kind, SourceContent content) {
        if (kind != DeclarationKind.PROPERTY) {
            return super.declarationNames(node, kind, content);
        }
        var names = new ArrayList<String>();
        for (var element : namedChildren(node)) {
            var type = element.getType();
            if ("property_element".equals(type) || "const_element".equals(type)) {
                var name = field(element, "name");
                if (name == null) {
                    var named = namedChildren(element);
                    name = named.isEmpty() ? null : named.get(0);
                }
                if (name != null) {
                    names.add(stripPrefix(compactText(name, content), "$"));
                }
            }
        }
        return names;
    }

    @Override
    protected void describeDeclaration(
            TSNode node, DeclarationKind kind, SourceContent content, NodeFeatures.Builder features) {
        for (var child : namedChildren(node)) {
            switch (child.getType()) {
                case "visibility_modifier" -> features.visibility(compactText(child, content).toLowerCase(Locale.ROOT));
                case "static_modifier" -> features.isStatic(true);
                case "attribute_list" -> findAllNodesRecursive(child, n -> "attribute".equals(n.getType()))
                        .forEach(a -> features.decorator(compactText(a, content)));
                case "base_clause", "class_interface_clause" -> namedChildren(child)
                        .forEach(base -> features.baseType(stripPrefix(compactText(base, content), "\\")));
                default -> {}
            }
        }
        if (kind == DeclarationKind.PROPERTY) {
            var type = field(node, "type");
            features.returnType(type == null ? null : compactText(type, content));
            return;
        }
        if (kind == DeclarationKind.FUNCTION) {
            var returnType = field(node, PHP_SYNTAX_PROFILE.returnTypeFieldName());
            features.returnType(returnType == null ? null : stripPrefix(compactText(returnType, content), ":"));
            var parameters = field(node, PHP_SYNTAX_PROFILE.parametersFieldName());
            if (parameters != null) {
                for (var param : namedChildren(parameters)) {
                    var parameter = parameter(param, content);
                    if (parameter != null) {
                        features.parameter(parameter);
                    }
                }
            }
        }
    }

    private static @Nullable Parameter parameter(TSNode param, SourceContent content) {
        var type = param.getType();
        if (!"simple_parameter".equals(type)
                && !"variadic_parameter".equals(type)
                && !"property_promotion_parameter".equals(type)) {
            return null;
        }
        var name = field(param, "name");
        if (name == null) {
            return null;
        }
        var annotation = field(param, "type");
        var defaultValue = field(param, "default_value");
        return new Parameter(
                stripPrefix(compactText(name, content), "$"),
                defaultValue == null ? null : compactText(defaultValue, content),
                annotation == null ? null : compactText(annotation, content),
                "variadic_parameter".equals(type) ? Parameter.Kind.VARIADIC : Parameter.Kind.POSITIONAL);
    }

    @Override
    protected boolean isImport(TSNode node, SourceContent content) {
        return IMPORT_TYPES.contains(node.getType());
    }

    @Override
    protected List<String> importedModules(TSNode node, SourceContent content) {
        if ("namespace_use_declaration".equals(node.getType())) {
            var modules = new ArrayList<String>();
            for (var clause : findAllNodesRecursive(node, n -> "namespace_use_clause".equals(n.getType()))) {
                var named = namedChildren(clause);
                if (!named.isEmpty()) {
                    modules.add(stripPrefix(compactText(named.get(0), content), "\\"));
                }
            }
            if (modules.isEmpty()) {
                var text = compactText(node, content).replaceFirst("^use\\s+", "").replaceFirst(";$", "");
                modules.add(stripPrefix(text, "\\"));
            }
            return modules;
        }
        var literals = findAllNodesRecursive(node, n -> STRING_TYPES.contains(n.getType()));
        if (!literals.isEmpty()) {
            return List.of(unquote(compactText(literals.get(0), content)));
        }
        var named = namedChildren(node);
        return named.isEmpty() ? List.of() : List.of(compactText(named.get(0), content));
    }

    @Override
    protected boolean isDecorator(TSNode node) {
        return "attribute".equals(node.getType());
    }

    @Override
    protected List<String> caughtTypes(TSNode catchNode, SourceContent content) {
        var typeNode = field(catchNode, "type");
        var types = new ArrayList<String>();
        if (typeNode != null) {
            var named = namedChildren(typeNode);
            if ("type_list".equals(typeNode.getType()) && !named.isEmpty()) {
                named.forEach(t -> types.add(stripPrefix(compactText(t, content), "\\")));
            } else {
                types.add(stripPrefix(compactText(typeNode, content), "\\"));
            }
            return types;
        }
        for (var child : namedChildren(catchNode)) {
            var type = child.getType();
            if ("type_list".equals(type)) {
                namedChildren(child).forEach(t -> types.add(stripPrefix(compactText(t, content), "\\")));
            } else if ("named_type".equals(type) || "name".equals(type) || "qualified_name".equals(type)) {
                types.add(stripPrefix(compactText(child, content), "\\"));
            }
        }
        return types.isEmpty() ? List.of("*") : types;
    }

    @Override
    protected List<String> declaredNames(TSNode node, SourceContent content) {
        var names = new ArrayList<String>();
        for (var child : namedChildren(node)) {
            if ("variable_name".equals(child.getType())) {
                names.add(stripPrefix(compactText(child, content), "$"));
            }
        }
        return names;
    }
}
