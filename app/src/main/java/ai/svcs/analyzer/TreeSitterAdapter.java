package ai.svcs.analyzer;

import static ai.svcs.analyzer.ASTTraversalUtils.children;
import static ai.svcs.analyzer.ASTTraversalUtils.compactText;
import static ai.svcs.analyzer.ASTTraversalUtils.extractNodeText;
import static ai.svcs.analyzer.ASTTraversalUtils.field;
import static ai.svcs.analyzer.ASTTraversalUtils.namedChildren;

import java.lang.ref.Reference;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;

/**
 * Base class for the grammar-backed adapters. Subclasses supply the grammar, the node-type vocabulary and the
 * language-specific declaration hooks; this class owns the fallback chain, node identity and tree assembly.
 */
public abstract sealed class TreeSitterAdapter implements LanguageAdapter
        permits PythonAdapter, PhpAdapter, JavascriptAdapter {
    protected final Logger log = LogManager.getLogger(getClass());

    /** What a syntax node declares, if anything. */
    public enum DeclarationKind {
        FUNCTION,
        CLASS,
        PROPERTY
    }

    /** The kind of scope a syntax node sits in while declarations are collected. */
    public enum ScopeKind {
        MODULE,
        CLASS,
        FUNCTION
    }

    private record Scope(ScopeKind kind, String qualifiedName, @Nullable String nodeId) {
        static final Scope MODULE = new Scope(ScopeKind.MODULE, "", null);

        String qualify(String name) {
            return qualifiedName.isEmpty() ? name : qualifiedName + "." + name;
        }
    }

    private final SourceLanguage language;
    private final double maxErrorRatio;
    private final ThreadLocal<TSParser> parser;
    private final FallbackChain chain;

    protected TreeSitterAdapter(SourceLanguage language, double maxErrorRatio, RegexGrammar regexGrammar) {
        if (maxErrorRatio < 0.0 || maxErrorRatio > 1.0) {
            throw new IllegalArgumentException("maxErrorRatio must be within [0, 1]: " + maxErrorRatio);
        }
        this.language = language;
        this.maxErrorRatio = maxErrorRatio;
        this.parser = ThreadLocal.withInitial(() -> {
            var p = new TSParser();
            p.setLanguage(createTSLanguage());
            return p;
        });
        this.chain = new FallbackChain(
                language,
                List.of(
                        new GrammarStrategy(ParseStage.PRIMARY),
                        new GrammarStrategy(ParseStage.LEGACY),
                        new RegexStructureExtractor(language, regexGrammar)));
    }

    @Override
    public final SourceLanguage language() {
        return language;
    }

    @Override
    public final NodeTree parse(String path, String sourceText) {
        return chain.parse(path, sourceText);
    }

    FallbackChain chain() {
        return chain;
    }

    protected abstract TSLanguage createTSLanguage();

    protected abstract LanguageSyntaxProfile profile();

    /** A reason to skip the grammar parse entirely, e.g. a PHP file without an open tag. */
    protected Optional<String> primaryPrecheck(String source) {
        return Optional.empty();
    }

    /**
     * A reason to reject a clean primary parse, for grammars that still accept constructs of an older language
     * version. The legacy stage never calls this.
     */
    protected Optional<String> obsoleteSyntax(TSNode root, SourceContent content) {
        return Optional.empty();
    }

    /** Rewrites obsolete syntax the grammar no longer accepts. The default is the identity. */
    protected String rewriteLegacySyntax(String source) {
        return source;
    }

    /** Classifies a syntax node found in the given scope; null when it declares nothing. */
    protected abstract @Nullable DeclarationKind declarationKind(TSNode node, ScopeKind scope);

    /** Names declared by a declaration node. Properties may declare several; functions and classes one. */
    protected List<String> declarationNames(TSNode node, DeclarationKind kind, SourceContent content) {
        var name = field(node, profile().identifierFieldName());
        var text = extractNodeText(name, content);
        return text.isEmpty() ? List.of() : List.of(text);
    }

    protected @Nullable TSNode declarationBody(TSNode node, DeclarationKind kind) {
        return field(node, profile().bodyFieldName());
    }

    /** Records parameters, decorators, bases and modifiers of a declaration. */
    protected abstract void describeDeclaration(
            TSNode node, DeclarationKind kind, SourceContent content, NodeFeatures.Builder features);

    protected abstract boolean isImport(TSNode node, SourceContent content);

    protected abstract List<String> importedModules(TSNode node, SourceContent content);

    protected abstract boolean isDecorator(TSNode node);

    protected abstract List<String> caughtTypes(TSNode catchNode, SourceContent content);

    protected String callTarget(TSNode call, SourceContent content) {
        var function = field(call, "function");
        if (function == null) {
            function = field(call, "constructor");
        }
        if (function != null) {
            return compactText(function, content);
        }
        var name = field(call, "name");
        var receiver = field(call, "object");
        if (receiver == null) {
            receiver = field(call, "scope");
        }
        if (name == null) {
            var first = namedChildren(call);
            return first.isEmpty() ? "" : compactText(first.get(0), content);
        }
        return receiver == null
                ? compactText(name, content)
                : compactText(receiver, content) + "." + compactText(name, content);
    }

    protected String attributeName(TSNode node, SourceContent content) {
        for (var fieldName : List.of("attribute", "property", "name")) {
            var child = field(node, fieldName);
            if (child != null) {
                return compactText(child, content);
            }
        }
        return "";
    }

    protected String subscriptTarget(TSNode node, SourceContent content) {
        for (var fieldName : List.of("value", "object")) {
            var child = field(node, fieldName);
            if (child != null) {
                return compactText(child, content);
            }
        }
        var named = namedChildren(node);
        return named.isEmpty() ? "" : compactText(named.get(0), content);
    }

    protected String assignmentTarget(TSNode node, SourceContent content) {
        var left = field(node, "left");
        if (left == null) {
            left = field(node, "name");
        }
        return left == null ? "" : compactText(left, content);
    }

    /** Operator tokens of an operator node: the {@code operator} field, else any child that is a known operator. */
    protected List<String> operators(TSNode node, SourceContent content) {
        var operator = field(node, "operator");
        if (operator != null) {
            return List.of(compactText(operator, content));
        }
        var result = new ArrayList<String>();
        for (var child : children(node)) {
            var type = child.getType();
            if (BodyFeatureCollector.COMPARISON_OPERATORS.contains(type)
                    || BodyFeatureCollector.LOGICAL_OPERATORS.contains(type)
                    || BodyFeatureCollector.UNARY_OPERATORS.contains(type)
                    || BodyFeatureCollector.BINARY_OPERATORS.contains(type)
                    || type.endsWith("=") && type.length() <= 4 && !type.equals("=")) {
                result.add(type);
            }
        }
        return result;
    }

    /** Names listed by a global/nonlocal declaration. */
    protected List<String> declaredNames(TSNode node, SourceContent content) {
        var result = new ArrayList<String>();
        for (var child : namedChildren(node)) {
            if (!profile().isComment(child.getType())) {
                result.add(extractNodeText(child, content));
            }
        }
        return result;
    }

    private final class GrammarStrategy implements ParseStrategy {
        private final ParseStage stage;

        GrammarStrategy(ParseStage stage) {
            this.stage = stage;
        }

        @Override
        public ParseStage stage() {
            return stage;
        }

        @Override
        public ParseOutcome attempt(String path, SourceContent source) {
            var text = source.text();
            if (stage == ParseStage.PRIMARY) {
                var veto = primaryPrecheck(text);
                if (veto.isPresent()) {
                    return ParseOutcome.rejected(stage, ParseError.Reason.NOT_APPLICABLE, veto.get());
                }
            } else {
                text = rewriteLegacySyntax(text);
            }
            var content = SourceContent.of(text);
            var tree = parser.get().parseString(null, content.text());
            try {
                var root = tree.getRootNode();
                int errorBytes = ASTTraversalUtils.errorBytes(root);
                if (stage == ParseStage.PRIMARY && errorBytes > 0) {
                    return ParseOutcome.rejected(
                            stage, ParseError.Reason.SYNTAX_ERRORS, "syntax errors covering " + errorBytes + " bytes");
                }
                if (stage == ParseStage.PRIMARY) {
                    var obsolete = obsoleteSyntax(root, content);
                    if (obsolete.isPresent()) {
                        return ParseOutcome.rejected(stage, ParseError.Reason.SYNTAX_ERRORS, obsolete.get());
                    }
                }
                double ratio = content.byteLength() == 0 ? 0.0 : (double) errorBytes / content.byteLength();
                if (ratio > maxErrorRatio) {
                    return ParseOutcome.rejected(
                            stage,
                            ParseError.Reason.TOO_MANY_ERRORS,
                            String.format("error nodes cover %.2f of the source", ratio));
                }
                return ParseOutcome.parsed(buildTree(path, source, content, root, stage));
            } finally {
                Reference.reachabilityFence(tree);
            }
        }
    }

    private NodeTree buildTree(
            String path, SourceContent original, SourceContent content, TSNode root, ParseStage stage) {
        var nodes = new LinkedHashMap<String, SemanticNode>();
        collectDeclarations(root, Scope.MODULE, content, nodes);

        var dependencies = new TreeSet<String>();
        var counts = new int[2];
        scanFileFacts(root, content, dependencies, counts);

        var text = TokenText.of(root, content, profile());
        return new NodeTree(
                path,
                language,
                stage,
                nodes,
                dependencies,
                counts[0],
                counts[1],
                original.lineCount(),
                original.byteLength(),
                original.text(),
                text.canonical(),
                text.shape(),
                List.of());
    }

    private void scanFileFacts(TSNode node, SourceContent content, SortedSet<String> dependencies, int[] counts) {
        for (var child : children(node)) {
            if (isImport(child, content)) {
                counts[0]++;
                dependencies.addAll(importedModules(child, content));
                continue;
            }
            if (isDecorator(child)) {
                counts[1]++;
            }
            scanFileFacts(child, content, dependencies, counts);
        }
    }

    private void collectDeclarations(
            TSNode container, Scope scope, SourceContent content, Map<String, SemanticNode> nodes) {
        for (var child : namedChildren(container)) {
            if (ASTTraversalUtils.ERROR_NODE.equals(child.getType())) {
                continue;
            }
            var kind = declarationKind(child, scope.kind());
            if (kind == null) {
                collectDeclarations(child, scope, content, nodes);
                continue;
            }
            switch (kind) {
                case FUNCTION -> addFunction(child, scope, content, nodes);
                case CLASS -> addClass(child, scope, content, nodes);
                case PROPERTY -> addProperties(child, scope, content, nodes);
            }
        }
    }

    private void addFunction(TSNode node, Scope scope, SourceContent content, Map<String, SemanticNode> nodes) {
        var names = declarationNames(node, DeclarationKind.FUNCTION, content);
        if (names.isEmpty()) {
            return;
        }
        var name = names.get(0);
        var kind = scope.kind() == ScopeKind.CLASS ? NodeKind.METHOD : NodeKind.FUNCTION;
        var qualified = scope.qualify(name);
        var features = NodeFeatures.builder();
        describeDeclaration(node, DeclarationKind.FUNCTION, content, features);
        var body = declarationBody(node, DeclarationKind.FUNCTION);
        if (body != null) {
            new BodyFeatureCollector(this, content, ScopeKind.FUNCTION, features).collect(body);
        }
        var id = kind.idFor(qualified);
        put(nodes, new SemanticNode(
                id,
                kind,
                name,
                TokenText.of(node, content, profile()).canonical(),
                ASTTraversalUtils.span(node),
                scope.nodeId(),
                features.build()));
        if (body != null) {
            collectDeclarations(body, new Scope(ScopeKind.FUNCTION, qualified, id), content, nodes);
        }
    }

    private void addClass(TSNode node, Scope scope, SourceContent content, Map<String, SemanticNode> nodes) {
        var names = declarationNames(node, DeclarationKind.CLASS, content);
        if (names.isEmpty()) {
            return;
        }
        var name = names.get(0);
        var qualified = scope.qualify(name);
        var id = NodeKind.CLASS.idFor(qualified);
        var features = NodeFeatures.builder();
        describeDeclaration(node, DeclarationKind.CLASS, content, features);
        var body = declarationBody(node, DeclarationKind.CLASS);
        if (body != null) {
            for (var member : namedChildren(body)) {
                var memberKind = declarationKind(member, ScopeKind.CLASS);
                if (memberKind == DeclarationKind.FUNCTION) {
                    declarationNames(member, memberKind, content).forEach(features::classMethod);
                } else if (memberKind == DeclarationKind.PROPERTY) {
                    declarationNames(member, memberKind, content).forEach(features::classAttribute);
                }
            }
            instanceAttributes(body, content).forEach(features::classAttribute);
            new BodyFeatureCollector(this, content, ScopeKind.CLASS, features).collect(body);
        }
        put(nodes, new SemanticNode(
                id,
                NodeKind.CLASS,
                name,
                TokenText.of(node, content, profile()).canonical(),
                ASTTraversalUtils.span(node),
                scope.nodeId(),
                features.build()));
        if (body != null) {
            collectDeclarations(body, new Scope(ScopeKind.CLASS, qualified, id), content, nodes);
        }
    }

    private void addProperties(TSNode node, Scope scope, SourceContent content, Map<String, SemanticNode> nodes) {
        if (scope.kind() != ScopeKind.CLASS) {
            return;
        }
        var canonical = TokenText.of(node, content, profile()).canonical();
        for (var name : declarationNames(node, DeclarationKind.PROPERTY, content)) {
            var features = NodeFeatures.builder();
            describeDeclaration(node, DeclarationKind.PROPERTY, content, features);
            var id = NodeKind.PROPERTY.idFor(scope.qualify(name));
            put(nodes, new SemanticNode(
                    id,
                    NodeKind.PROPERTY,
                    name,
                    canonical,
                    ASTTraversalUtils.span(node),
                    scope.nodeId(),
                    features.build()));
        }
    }

    /** Attribute names assigned through the instance receiver ({@code self.x}, {@code this.x}, {@code $this->x}). */
    private List<String> instanceAttributes(TSNode classBody, SourceContent content) {
        var result = new ArrayList<String>();
        var assignments = ASTTraversalUtils.findAllNodesRecursive(
                classBody, n -> profile().construct(n.getType()) == BodyConstruct.ASSIGNMENT);
        for (var assignment : assignments) {
            var target = assignmentTarget(assignment, content);
            for (var receiver : List.of("self.", "this.", "$this->")) {
                if (target.startsWith(receiver)) {
                    var attribute = target.substring(receiver.length());
                    if (attribute.matches("[A-Za-z_$][\\w$]*")) {
                        result.add(attribute);
                    }
                }
            }
        }
        return result;
    }

    private void put(Map<String, SemanticNode> nodes, SemanticNode node) {
        var previous = nodes.put(node.id(), node);
        if (previous != null) {
            // redefinition: the later declaration wins
            log.trace("Node {} redefined at line {}", node.id(), node.span().startLine());
        }
    }

    /** Text after a leading marker such as {@code @} or {@code :}, compacted. */
    protected static String stripPrefix(String text, String prefix) {
        var trimmed = text.strip();
        return trimmed.startsWith(prefix) ? trimmed.substring(prefix.length()).strip() : trimmed;
    }

    /** Removes surrounding quotes from a string literal. */
    protected static String unquote(String literal) {
        var s = literal.strip();
        if (s.length() >= 2) {
            char first = s.charAt(0);
            char last = s.charAt(s.length() - 1);
            if ((first == '"' || first == '\'' || first == '`') && first == last) {
                return s.substring(1, s.length() - 1);
            }
        }
        return s;
    }

    protected static boolean hasChildOfType(TSNode node, String type) {
        for (var child : children(node)) {
            if (type.equals(child.getType())) {
                return true;
            }
        }
        return false;
    }
}
